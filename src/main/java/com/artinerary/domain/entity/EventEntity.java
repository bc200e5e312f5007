package com.artinerary.domain.entity;

import com.artinerary.domain.enums.EventVisibility;
import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_event")
public class EventEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** URL identity: slugified title plus a random suffix; immutable once created. */
    private String slug;

    private String title;

    private String description;

    private Long hostId;

    /** Visibility tier: see {@link EventVisibility} (stored as a number). */
    private EventVisibility visibility;

    private LocalDateTime startTime;

    /** Start location id in the art-location catalog. */
    private Long startLocationId;

    /** Soft-delete flag; deleted events are hidden from every read path. */
    @TableField("is_deleted")
    private Boolean deleted;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return !Boolean.TRUE.equals(deleted);
    }
}
