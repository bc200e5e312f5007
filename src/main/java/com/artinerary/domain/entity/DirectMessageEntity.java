package com.artinerary.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_direct_message")
public class DirectMessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long chatId;

    private Long senderId;

    private String content;

    @TableField("is_read")
    private Boolean read;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
