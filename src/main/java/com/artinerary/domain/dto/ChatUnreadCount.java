package com.artinerary.domain.dto;

import lombok.Data;

/**
 * Row of {@code DirectMessageMapper#countUnreadByChat}.
 */
@Data
public class ChatUnreadCount {

    private Long chatId;

    private Long unreadCount;
}
