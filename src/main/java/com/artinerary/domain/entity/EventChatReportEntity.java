package com.artinerary.domain.entity;

import com.artinerary.domain.enums.ReportReason;
import com.artinerary.domain.enums.ReportStatus;
import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_event_chat_report")
public class EventChatReportEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private Long reporterId;

    private ReportReason reason;

    private String description;

    private ReportStatus status;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    private LocalDateTime reviewedAt;
}
