package com.artinerary.domain.service;

import com.artinerary.domain.entity.EventChatMessageEntity;
import com.artinerary.domain.entity.EventChatReportEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

/**
 * Per-event chat log with a hard retention cap.
 */
public interface EventChatService extends IService<EventChatMessageEntity> {

    /**
     * Appends a message, then trims everything beyond the newest {@code chatRetention} messages.
     */
    EventChatMessageEntity post(long authorId, long eventId, String text);

    /**
     * The newest {@code limit} messages in chronological order.
     */
    List<EventChatMessageEntity> listMessages(long viewerId, long eventId, int limit);

    EventChatReportEntity report(long reporterId, long messageId, String reason, String description);
}
