package com.artinerary.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A waypoint after the start location. {@code stopOrder} is 1-based and unique per event,
 * and a location appears at most once per event.
 */
@Data
@TableName("t_event_stop")
public class EventStopEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long eventId;

    private Long locationId;

    private Integer stopOrder;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
