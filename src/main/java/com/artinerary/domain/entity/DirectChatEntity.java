package com.artinerary.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 1:1 chat inside an event. The pair is stored normalized: {@code user1Id < user2Id}.
 */
@Data
@TableName("t_direct_chat")
public class DirectChatEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long eventId;

    private Long user1Id;

    private Long user2Id;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    /** Bumped on every message; drives "most recently active" ordering. */
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean hasParticipant(long userId) {
        return (user1Id != null && user1Id == userId) || (user2Id != null && user2Id == userId);
    }

    public Long otherParticipant(long userId) {
        return user1Id != null && user1Id == userId ? user2Id : user1Id;
    }
}
