package com.artinerary.domain.service;

import com.artinerary.domain.dto.DirectChatSummary;
import com.artinerary.domain.entity.DirectChatEntity;
import com.artinerary.domain.entity.DirectMessageEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

/**
 * Per-event 1:1 chats. Leaving hides a chat for one participant; it is never deleted.
 */
public interface DirectChatService extends IService<DirectChatEntity> {

    /**
     * Returns the chat of the unordered pair inside the event, creating it on first use.
     * Both users must have joined the event.
     */
    DirectChatEntity getOrCreateChat(long requesterId, long eventId, long otherUserId);

    /**
     * Appends a message and clears the recipient's leave marker.
     */
    DirectMessageEntity send(long senderId, long chatId, String text);

    void leave(long userId, long chatId);

    /**
     * Participants without a leave marker, lower id first.
     */
    List<Long> activeParticipants(long chatId);

    /**
     * All messages, oldest first; marks the other participant's messages as read.
     */
    List<DirectMessageEntity> listMessages(long userId, long chatId);

    /**
     * Chats the user has not left, most recently active first.
     */
    List<DirectChatSummary> listChats(long userId);
}
