package com.artinerary.domain.service.impl;

import com.artinerary.domain.config.EngageProperties;
import com.artinerary.domain.entity.EventChatMessageEntity;
import com.artinerary.domain.entity.EventChatReportEntity;
import com.artinerary.domain.enums.ReportReason;
import com.artinerary.domain.enums.ReportStatus;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventChatMessageMapper;
import com.artinerary.domain.mapper.EventChatReportMapper;
import com.artinerary.domain.service.EventChatService;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventChatServiceImpl extends ServiceImpl<EventChatMessageMapper, EventChatMessageEntity>
        implements EventChatService {

    private static final int MAX_REPORT_DESCRIPTION = 500;

    private final EventChatReportMapper reportMapper;
    private final EventLookupService eventLookup;
    private final EventMemberService memberService;
    private final EngageProperties props;

    @Transactional
    @Override
    public EventChatMessageEntity post(long authorId, long eventId, String text) {
        eventLookup.requireActive(eventId);
        if (!memberService.userHasJoined(eventId, authorId)) {
            throw EngagementException.of(EngagementError.NOT_A_MEMBER);
        }
        String content = text == null ? "" : text.trim();
        if (content.isEmpty() || content.length() > props.getChatMaxLength()) {
            throw EngagementException.of(EngagementError.INVALID_MESSAGE);
        }

        EventChatMessageEntity msg = new EventChatMessageEntity();
        msg.setId(IdWorker.getId());
        msg.setEventId(eventId);
        msg.setAuthorId(authorId);
        msg.setContent(content);
        this.save(msg);

        trim(eventId);
        return msg;
    }

    /**
     * Not serialized against concurrent posts: the log may briefly hold more than the cap
     * until the next post trims it again.
     */
    private void trim(long eventId) {
        int keep = Math.max(1, props.getChatRetention());
        List<Long> ids = baseMapper.selectIdsNewestFirst(eventId);
        if (ids.size() <= keep) {
            return;
        }
        List<Long> stale = new ArrayList<>(ids.subList(keep, ids.size()));
        baseMapper.deleteBatchIds(stale);
        log.debug("event chat trimmed: eventId={}, removed={}", eventId, stale.size());
    }

    @Override
    public List<EventChatMessageEntity> listMessages(long viewerId, long eventId, int limit) {
        eventLookup.requireActive(eventId);
        if (!memberService.userHasJoined(eventId, viewerId)) {
            throw EngagementException.of(EngagementError.NOT_A_MEMBER);
        }
        int safeLimit = Math.max(1, Math.min(Math.max(1, props.getChatRetention()), limit));
        List<EventChatMessageEntity> newest = this.list(new LambdaQueryWrapper<EventChatMessageEntity>()
                .eq(EventChatMessageEntity::getEventId, eventId)
                .orderByDesc(EventChatMessageEntity::getCreatedAt)
                .orderByDesc(EventChatMessageEntity::getId)
                .last("limit " + safeLimit));
        List<EventChatMessageEntity> out = new ArrayList<>(newest);
        Collections.reverse(out);
        return out;
    }

    @Transactional
    @Override
    public EventChatReportEntity report(long reporterId, long messageId, String reason, String description) {
        EventChatMessageEntity msg = messageId <= 0 ? null : this.getById(messageId);
        if (msg == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "message");
        }
        ReportReason r = ReportReason.fromString(reason);
        if (r == null) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "bad_reason");
        }
        String desc = description == null ? null : description.trim();
        if (desc != null && desc.length() > MAX_REPORT_DESCRIPTION) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "description_too_long");
        }

        EventChatReportEntity report = new EventChatReportEntity();
        report.setId(IdWorker.getId());
        report.setMessageId(messageId);
        report.setReporterId(reporterId);
        report.setReason(r);
        report.setDescription(desc == null || desc.isEmpty() ? null : desc);
        report.setStatus(ReportStatus.OPEN);
        try {
            reportMapper.insert(report);
        } catch (DuplicateKeyException e) {
            throw EngagementException.of(EngagementError.ALREADY_REPORTED);
        }
        log.info("chat message reported: messageId={}, reporterId={}, reason={}", messageId, reporterId, r.getDesc());
        return report;
    }
}
