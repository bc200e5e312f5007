package com.artinerary.domain.entity;

import com.artinerary.domain.enums.InviteStatus;
import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_event_invite")
public class EventInviteEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long eventId;

    private Long inviterId;

    private Long inviteeId;

    private InviteStatus status;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    /** Null while PENDING; stamped by the first accept/decline. */
    private LocalDateTime respondedAt;
}
