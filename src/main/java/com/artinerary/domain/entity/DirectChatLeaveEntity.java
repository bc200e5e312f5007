package com.artinerary.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Presence means the user hid / left the chat. The chat and its messages are kept;
 * the row is removed again when the other participant sends a message.
 */
@Data
@TableName("t_direct_chat_leave")
public class DirectChatLeaveEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long chatId;

    private Long userId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime leftAt;
}
