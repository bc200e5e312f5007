package com.artinerary.domain.service.impl;

import com.artinerary.domain.dto.InvitationView;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventInviteEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.InviteStatus;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventInviteMapper;
import com.artinerary.domain.mapper.EventMapper;
import com.artinerary.domain.mapper.EventMemberMapper;
import com.artinerary.domain.service.EventInviteService;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventInviteServiceImpl extends ServiceImpl<EventInviteMapper, EventInviteEntity>
        implements EventInviteService {

    private final EventMapper eventMapper;
    private final EventMemberMapper memberMapper;
    private final EventLookupService eventLookup;
    private final EventMemberService memberService;
    private final UserDirectory userDirectory;

    @Transactional
    @Override
    public List<Long> createInvites(long hostId, long eventId, Collection<Long> inviteeIds) {
        EventEntity event = eventLookup.requireActive(eventId);
        if (event.getHostId() == null || event.getHostId() != hostId) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }
        return inviteUsers(event, inviteeIds);
    }

    @Transactional
    @Override
    public List<Long> inviteUsers(EventEntity event, Collection<Long> inviteeIds) {
        if (inviteeIds == null || inviteeIds.isEmpty()) {
            return List.of();
        }
        Set<Long> wanted = new LinkedHashSet<>();
        for (Long id : inviteeIds) {
            if (id != null && !id.equals(event.getHostId())) {
                wanted.add(id);
            }
        }
        if (wanted.isEmpty()) {
            return List.of();
        }
        Set<Long> known = userDirectory.existingIds(wanted);
        if (known.size() != wanted.size()) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "unknown_invitee");
        }

        Set<Long> skip = new HashSet<>();
        this.list(new LambdaQueryWrapper<EventInviteEntity>()
                        .select(EventInviteEntity::getInviteeId)
                        .eq(EventInviteEntity::getEventId, event.getId())
                        .in(EventInviteEntity::getInviteeId, wanted))
                .forEach(i -> skip.add(i.getInviteeId()));
        memberMapper.selectList(new LambdaQueryWrapper<EventMemberEntity>()
                        .select(EventMemberEntity::getUserId)
                        .eq(EventMemberEntity::getEventId, event.getId())
                        .in(EventMemberEntity::getUserId, wanted))
                .forEach(m -> skip.add(m.getUserId()));

        List<Long> invited = new ArrayList<>();
        for (Long inviteeId : wanted) {
            if (skip.contains(inviteeId)) {
                continue;
            }
            if (inviteOne(event, inviteeId)) {
                invited.add(inviteeId);
            }
        }
        if (!invited.isEmpty()) {
            log.info("invites created: eventId={}, count={}", event.getId(), invited.size());
        }
        return invited;
    }

    private boolean inviteOne(EventEntity event, long inviteeId) {
        EventInviteEntity invite = new EventInviteEntity();
        invite.setId(IdWorker.getId());
        invite.setEventId(event.getId());
        invite.setInviterId(event.getHostId());
        invite.setInviteeId(inviteeId);
        invite.setStatus(InviteStatus.PENDING);
        try {
            this.save(invite);
        } catch (DuplicateKeyException e) {
            log.debug("invite already exists: eventId={}, inviteeId={}", event.getId(), inviteeId);
            return false;
        }

        EventMemberEntity m = new EventMemberEntity();
        m.setId(IdWorker.getId());
        m.setEventId(event.getId());
        m.setUserId(inviteeId);
        m.setRole(EventRole.INVITED);
        try {
            memberMapper.insert(m);
        } catch (DuplicateKeyException e) {
            // joined concurrently; an invite next to a real membership would be noise
            this.removeById(invite.getId());
            return false;
        }
        return true;
    }

    @Transactional
    @Override
    public void accept(long userId, long eventId) {
        eventLookup.requireActive(eventId);
        EventInviteEntity invite = requirePending(eventId, userId);
        respond(invite, InviteStatus.ACCEPTED);
        memberService.grant(eventId, userId, EventRole.ATTENDEE);
        log.info("invite accepted: eventId={}, userId={}", eventId, userId);
    }

    @Transactional
    @Override
    public void decline(long userId, long eventId) {
        eventLookup.requireActive(eventId);
        EventInviteEntity invite = requirePending(eventId, userId);
        respond(invite, InviteStatus.DECLINED);
        memberMapper.delete(new LambdaQueryWrapper<EventMemberEntity>()
                .eq(EventMemberEntity::getEventId, eventId)
                .eq(EventMemberEntity::getUserId, userId)
                .eq(EventMemberEntity::getRole, EventRole.INVITED));
        log.info("invite declined: eventId={}, userId={}", eventId, userId);
    }

    @Override
    public EventInviteEntity findPending(long eventId, long userId) {
        if (eventId <= 0 || userId <= 0) {
            return null;
        }
        return this.getOne(new LambdaQueryWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getEventId, eventId)
                .eq(EventInviteEntity::getInviteeId, userId)
                .eq(EventInviteEntity::getStatus, InviteStatus.PENDING)
                .last("limit 1"));
    }

    @Override
    public List<InvitationView> listPendingForUser(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        List<EventInviteEntity> invites = this.list(new LambdaQueryWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getInviteeId, userId)
                .eq(EventInviteEntity::getStatus, InviteStatus.PENDING)
                .orderByAsc(EventInviteEntity::getCreatedAt)
                .orderByAsc(EventInviteEntity::getId));
        if (invites.isEmpty()) {
            return List.of();
        }
        Set<Long> eventIds = invites.stream().map(EventInviteEntity::getEventId).collect(Collectors.toSet());
        Map<Long, EventEntity> events = eventMapper.selectBatchIds(eventIds).stream()
                .filter(EventEntity::isActive)
                .collect(Collectors.toMap(EventEntity::getId, Function.identity()));

        List<InvitationView> out = new ArrayList<>(invites.size());
        for (EventInviteEntity i : invites) {
            EventEntity e = events.get(i.getEventId());
            if (e == null) {
                continue;
            }
            out.add(new InvitationView(i.getId(), e.getId(), e.getSlug(), e.getTitle(), e.getHostId(),
                    i.getInviterId(), e.getStartTime(), i.getCreatedAt()));
        }
        return out;
    }

    @Override
    public List<Long> listInviteeIds(long eventId) {
        return this.list(new LambdaQueryWrapper<EventInviteEntity>()
                        .select(EventInviteEntity::getInviteeId)
                        .eq(EventInviteEntity::getEventId, eventId)
                        .orderByAsc(EventInviteEntity::getId))
                .stream()
                .map(EventInviteEntity::getInviteeId)
                .toList();
    }

    private EventInviteEntity requirePending(long eventId, long userId) {
        EventInviteEntity invite = findPending(eventId, userId);
        if (invite == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "invite");
        }
        return invite;
    }

    private void respond(EventInviteEntity invite, InviteStatus status) {
        boolean updated = this.update(new LambdaUpdateWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getId, invite.getId())
                .eq(EventInviteEntity::getStatus, InviteStatus.PENDING)
                .set(EventInviteEntity::getStatus, status)
                .set(EventInviteEntity::getRespondedAt, LocalDateTime.now()));
        if (!updated) {
            throw EngagementException.of(EngagementError.NOT_PENDING);
        }
    }
}
