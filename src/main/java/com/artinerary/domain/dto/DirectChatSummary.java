package com.artinerary.domain.dto;

import com.artinerary.domain.entity.DirectMessageEntity;

import java.time.LocalDateTime;

/**
 * One row of a user's direct chat list.
 */
public record DirectChatSummary(
        Long chatId,
        Long eventId,
        Long otherUserId,
        long unreadCount,
        DirectMessageEntity lastMessage,
        LocalDateTime updatedAt
) {
}
