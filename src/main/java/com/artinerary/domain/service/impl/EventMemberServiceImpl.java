package com.artinerary.domain.service.impl;

import com.artinerary.domain.dto.EventAccess;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventInviteEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.InviteStatus;
import com.artinerary.domain.enums.ViewerRole;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventInviteMapper;
import com.artinerary.domain.mapper.EventMemberMapper;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.artinerary.domain.service.EventVisibilityPolicy;
import com.artinerary.domain.service.UserDirectory;
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
import java.util.Collection;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventMemberServiceImpl extends ServiceImpl<EventMemberMapper, EventMemberEntity>
        implements EventMemberService {

    private final EventInviteMapper inviteMapper;
    private final EventLookupService eventLookup;
    private final EventVisibilityPolicy visibilityPolicy;
    private final UserDirectory userDirectory;

    @Transactional
    @Override
    public void grant(long eventId, long userId, EventRole role) {
        if (eventId <= 0 || userId <= 0 || role == null) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "bad_member");
        }
        if (changeRole(eventId, userId, role)) {
            return;
        }
        try {
            this.save(newMember(eventId, userId, role));
        } catch (DuplicateKeyException e) {
            // someone inserted the row between our update and insert
            changeRole(eventId, userId, role);
        }
    }

    @Override
    public boolean hasRole(long eventId, long userId, Collection<EventRole> roles) {
        if (eventId <= 0 || userId <= 0 || roles == null || roles.isEmpty()) {
            return false;
        }
        return this.count(new LambdaQueryWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .in(EventMemberEntity::getRole, roles)) > 0;
    }

    @Override
    public boolean userHasJoined(long eventId, long userId) {
        return hasRole(eventId, userId, EventRole.JOINED);
    }

    @Transactional
    @Override
    public void revoke(long eventId, long userId, EventRole role) {
        boolean removed = this.remove(new LambdaQueryWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .eq(EventMemberEntity::getRole, role));
        if (!removed) {
            throw EngagementException.of(EngagementError.NOT_A_MEMBER);
        }
    }

    @Override
    public EventRole roleOf(long eventId, long userId) {
        if (eventId <= 0 || userId <= 0) {
            return null;
        }
        EventMemberEntity m = this.getOne(new LambdaQueryWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .last("limit 1"));
        return m == null ? null : m.getRole();
    }

    @Override
    public ViewerRole viewerRole(EventEntity event, long userId) {
        if (event == null || userId <= 0) {
            return ViewerRole.VISITOR;
        }
        if (event.getHostId() != null && event.getHostId() == userId) {
            return ViewerRole.HOST;
        }
        EventRole role = roleOf(event.getId(), userId);
        if (role == EventRole.HOST) {
            return ViewerRole.HOST;
        }
        return role == EventRole.ATTENDEE ? ViewerRole.ATTENDEE : ViewerRole.VISITOR;
    }

    @Override
    public EventAccess accessOf(EventEntity event, long userId) {
        if (event == null || userId <= 0) {
            return EventAccess.anonymous();
        }
        boolean host = event.getHostId() != null && event.getHostId() == userId;
        EventRole role = roleOf(event.getId(), userId);
        EventInviteEntity invite = inviteMapper.selectOne(new LambdaQueryWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getEventId, event.getId())
                .eq(EventInviteEntity::getInviteeId, userId)
                .last("limit 1"));
        boolean pending = invite != null && invite.getStatus() == InviteStatus.PENDING;
        return new EventAccess(userId, host, role, invite != null, pending);
    }

    @Transactional
    @Override
    public void join(long userId, long eventId) {
        if (!userDirectory.exists(userId)) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "user");
        }
        EventEntity event = eventLookup.requireActive(eventId);
        EngagementError denied = visibilityPolicy.checkJoin(event, accessOf(event, userId));
        if (denied != null) {
            throw EngagementException.of(denied);
        }

        // invited users are promoted in place; the invite row itself stays as it is
        boolean promoted = this.update(new LambdaUpdateWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .eq(EventMemberEntity::getRole, EventRole.INVITED)
                .set(EventMemberEntity::getRole, EventRole.ATTENDEE)
                .set(EventMemberEntity::getUpdatedAt, LocalDateTime.now()));
        if (!promoted) {
            try {
                this.save(newMember(eventId, userId, EventRole.ATTENDEE));
            } catch (DuplicateKeyException e) {
                log.debug("concurrent join lost: eventId={}, userId={}", eventId, userId);
                throw EngagementException.of(EngagementError.ALREADY_JOINED);
            }
        }
        log.info("event joined: eventId={}, userId={}, promoted={}", eventId, userId, promoted);
    }

    @Transactional
    @Override
    public void leave(long userId, long eventId) {
        EventEntity event = eventLookup.requireActive(eventId);
        if (event.getHostId() != null && event.getHostId() == userId) {
            throw EngagementException.of(EngagementError.HOST_CANNOT_LEAVE);
        }
        if (!hasRole(eventId, userId, List.of(EventRole.ATTENDEE))) {
            throw EngagementException.of(EngagementError.NOT_REGISTERED);
        }
        revoke(eventId, userId, EventRole.ATTENDEE);
        log.info("event left: eventId={}, userId={}", eventId, userId);
    }

    @Override
    public List<EventMemberEntity> listAttendees(long eventId) {
        return this.list(new LambdaQueryWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .in(EventMemberEntity::getRole, EventRole.JOINED)
                .orderByAsc(EventMemberEntity::getJoinedAt)
                .orderByAsc(EventMemberEntity::getId));
    }

    @Override
    public List<Long> listAttendingEventIds(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        return this.list(new LambdaQueryWrapper<EventMemberEntity>()
                        .select(EventMemberEntity::getEventId)
                        .eq(EventMemberEntity::getUserId, userId)
                        .eq(EventMemberEntity::getRole, EventRole.ATTENDEE))
                .stream()
                .map(EventMemberEntity::getEventId)
                .toList();
    }

    private boolean changeRole(long eventId, long userId, EventRole role) {
        LambdaUpdateWrapper<EventMemberEntity> w = new LambdaUpdateWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .set(EventMemberEntity::getRole, role)
                .set(EventMemberEntity::getUpdatedAt, LocalDateTime.now());
        Set<EventRole> higher = role.higherRoles();
        if (!higher.isEmpty()) {
            w.notIn(EventMemberEntity::getRole, higher);
        }
        if (this.update(w)) {
            return true;
        }
        // a higher-ranked row that was left alone still counts as present
        return !higher.isEmpty() && hasRole(eventId, userId, higher);
    }

    private static EventMemberEntity newMember(long eventId, long userId, EventRole role) {
        EventMemberEntity m = new EventMemberEntity();
        m.setId(IdWorker.getId());
        m.setEventId(eventId);
        m.setUserId(userId);
        m.setRole(role);
        return m;
    }
}
