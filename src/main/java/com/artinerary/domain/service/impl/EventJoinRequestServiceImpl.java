package com.artinerary.domain.service.impl;

import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.enums.JoinRequestStatus;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventJoinRequestMapper;
import com.artinerary.domain.service.EventInviteService;
import com.artinerary.domain.service.EventJoinRequestService;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventJoinRequestServiceImpl extends ServiceImpl<EventJoinRequestMapper, EventJoinRequestEntity>
        implements EventJoinRequestService {

    private final EventLookupService eventLookup;
    private final EventMemberService memberService;
    private final EventInviteService inviteService;

    @Transactional
    @Override
    public EventJoinRequestEntity requestJoin(long userId, long eventId) {
        if (userId <= 0) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "user");
        }
        EventEntity event = eventLookup.requireActive(eventId);
        if (event.getVisibility() != EventVisibility.PUBLIC_INVITE) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "join_requests_not_accepted");
        }
        if ((event.getHostId() != null && event.getHostId() == userId)
                || memberService.userHasJoined(eventId, userId)) {
            throw EngagementException.of(EngagementError.ALREADY_MEMBER);
        }
        if (inviteService.findPending(eventId, userId) != null) {
            throw EngagementException.of(EngagementError.ALREADY_INVITED);
        }

        EventJoinRequestEntity existed = findByRequester(eventId, userId, false);
        if (existed != null) {
            if (existed.getStatus() == JoinRequestStatus.PENDING) {
                return existed;
            }
            reopen(existed);
            return this.getById(existed.getId());
        }

        EventJoinRequestEntity req = new EventJoinRequestEntity();
        req.setId(IdWorker.getId());
        req.setEventId(eventId);
        req.setRequesterId(userId);
        req.setStatus(JoinRequestStatus.PENDING);
        try {
            this.save(req);
        } catch (DuplicateKeyException e) {
            // a concurrent request from the same user won; a locking read sees its committed row
            EventJoinRequestEntity winner = findByRequester(eventId, userId, true);
            if (winner == null) {
                throw e;
            }
            return winner;
        }
        log.info("join requested: eventId={}, userId={}, requestId={}", eventId, userId, req.getId());
        return req;
    }

    @Transactional
    @Override
    public EventJoinRequestEntity approve(long hostId, long requestId) {
        EventJoinRequestEntity req = requireDecidable(hostId, requestId);
        decide(req, hostId, JoinRequestStatus.APPROVED);
        memberService.grant(req.getEventId(), req.getRequesterId(), EventRole.ATTENDEE);
        log.info("join request approved: requestId={}, eventId={}, userId={}",
                requestId, req.getEventId(), req.getRequesterId());
        return this.getById(requestId);
    }

    @Transactional
    @Override
    public EventJoinRequestEntity decline(long hostId, long requestId) {
        EventJoinRequestEntity req = requireDecidable(hostId, requestId);
        decide(req, hostId, JoinRequestStatus.DECLINED);
        log.info("join request declined: requestId={}, eventId={}", requestId, req.getEventId());
        return this.getById(requestId);
    }

    @Override
    public List<EventJoinRequestEntity> listPending(long hostId, long eventId) {
        EventEntity event = eventLookup.requireActive(eventId);
        if (event.getHostId() == null || event.getHostId() != hostId) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }
        return this.list(new LambdaQueryWrapper<EventJoinRequestEntity>()
                .eq(EventJoinRequestEntity::getEventId, eventId)
                .eq(EventJoinRequestEntity::getStatus, JoinRequestStatus.PENDING)
                .orderByAsc(EventJoinRequestEntity::getCreatedAt)
                .orderByAsc(EventJoinRequestEntity::getId));
    }

    @Override
    public EventJoinRequestEntity findPending(long eventId, long userId) {
        if (eventId <= 0 || userId <= 0) {
            return null;
        }
        return this.getOne(new LambdaQueryWrapper<EventJoinRequestEntity>()
                .eq(EventJoinRequestEntity::getEventId, eventId)
                .eq(EventJoinRequestEntity::getRequesterId, userId)
                .eq(EventJoinRequestEntity::getStatus, JoinRequestStatus.PENDING)
                .last("limit 1"));
    }

    private EventJoinRequestEntity findByRequester(long eventId, long userId, boolean forUpdate) {
        return this.getOne(new LambdaQueryWrapper<EventJoinRequestEntity>()
                .eq(EventJoinRequestEntity::getEventId, eventId)
                .eq(EventJoinRequestEntity::getRequesterId, userId)
                .last(forUpdate ? "limit 1 for update" : "limit 1"));
    }

    private void reopen(EventJoinRequestEntity req) {
        this.update(new LambdaUpdateWrapper<EventJoinRequestEntity>()
                .eq(EventJoinRequestEntity::getId, req.getId())
                .set(EventJoinRequestEntity::getStatus, JoinRequestStatus.PENDING)
                .set(EventJoinRequestEntity::getCreatedAt, LocalDateTime.now())
                .setSql("decided_at = null, decided_by = null"));
        log.info("join request reopened: requestId={}, previous={}", req.getId(), req.getStatus());
    }

    private EventJoinRequestEntity requireDecidable(long hostId, long requestId) {
        EventJoinRequestEntity req = requestId <= 0 ? null : this.getById(requestId);
        if (req == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "join_request");
        }
        EventEntity event = eventLookup.requireActive(req.getEventId());
        if (event.getHostId() == null || event.getHostId() != hostId) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }
        if (req.getStatus() != JoinRequestStatus.PENDING) {
            throw EngagementException.of(EngagementError.NOT_PENDING);
        }
        return req;
    }

    private void decide(EventJoinRequestEntity req, long hostId, JoinRequestStatus status) {
        boolean updated = this.update(new LambdaUpdateWrapper<EventJoinRequestEntity>()
                .eq(EventJoinRequestEntity::getId, req.getId())
                .eq(EventJoinRequestEntity::getStatus, JoinRequestStatus.PENDING)
                .set(EventJoinRequestEntity::getStatus, status)
                .set(EventJoinRequestEntity::getDecidedAt, LocalDateTime.now())
                .set(EventJoinRequestEntity::getDecidedBy, hostId));
        if (!updated) {
            throw EngagementException.of(EngagementError.NOT_PENDING);
        }
    }
}
