package com.artinerary.domain.entity;

import com.artinerary.domain.enums.EventRole;
import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One row per (event, user); a role change is an update, never a second insert.
 */
@Data
@TableName("t_event_member")
public class EventMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long eventId;

    private Long userId;

    /** Member role: see {@link EventRole} (stored as a number). */
    private EventRole role;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime joinedAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
