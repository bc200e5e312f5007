package com.artinerary.domain.service.impl;

import com.artinerary.domain.cache.EventSlugCache;
import com.artinerary.domain.config.EngageProperties;
import com.artinerary.domain.dto.EventAccess;
import com.artinerary.domain.dto.EventDetail;
import com.artinerary.domain.dto.EventDraft;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.artinerary.domain.entity.EventStopEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.enums.ViewerRole;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventMapper;
import com.artinerary.domain.mapper.EventStopMapper;
import com.artinerary.domain.service.EventFavoriteService;
import com.artinerary.domain.service.EventInviteService;
import com.artinerary.domain.service.EventJoinRequestService;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.artinerary.domain.service.EventService;
import com.artinerary.domain.service.EventVisibilityPolicy;
import com.artinerary.domain.service.LocationDirectory;
import com.artinerary.domain.service.SlugGenerator;
import com.artinerary.domain.service.UserDirectory;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventServiceImpl extends ServiceImpl<EventMapper, EventEntity> implements EventService {

    private static final int MAX_TITLE = 80;
    private static final int MAX_DESCRIPTION = 300;
    private static final int SLUG_ATTEMPTS = 3;
    private static final List<EventVisibility> PUBLIC_TIERS = Arrays.stream(EventVisibility.values())
            .filter(EventVisibility::isPublic)
            .toList();

    private final EventStopMapper stopMapper;
    private final EventLookupService eventLookup;
    private final EventVisibilityPolicy visibilityPolicy;
    private final EventMemberService memberService;
    private final EventInviteService inviteService;
    private final EventJoinRequestService joinRequestService;
    private final EventFavoriteService favoriteService;
    private final UserDirectory userDirectory;
    private final LocationDirectory locationDirectory;
    private final SlugGenerator slugGenerator;
    private final EventSlugCache slugCache;
    private final EngageProperties props;

    @Transactional
    @Override
    public EventEntity create(long hostId, EventDraft draft, List<Long> stopLocationIds, Collection<Long> inviteeIds) {
        if (!userDirectory.exists(hostId)) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "user");
        }
        EventDraft d = validateDraft(draft);
        List<Long> stops = validateStops(stopLocationIds);

        EventEntity event = new EventEntity();
        event.setHostId(hostId);
        event.setTitle(d.title());
        event.setDescription(d.description());
        event.setVisibility(d.visibility());
        event.setStartTime(d.startTime());
        event.setStartLocationId(d.startLocationId());
        event.setDeleted(false);
        insertWithSlug(event);

        memberService.grant(event.getId(), hostId, EventRole.HOST);
        insertStops(event.getId(), stops);
        List<Long> invited = inviteService.inviteUsers(event, inviteeIds);

        slugCache.put(event.getSlug(), event.getId());
        log.info("event created: eventId={}, slug={}, hostId={}, visibility={}, stops={}, invites={}",
                event.getId(), event.getSlug(), hostId, d.visibility(), stops.size(), invited.size());
        return event;
    }

    private void insertWithSlug(EventEntity event) {
        for (int attempt = 1; ; attempt++) {
            event.setId(IdWorker.getId());
            event.setSlug(slugGenerator.generate(event.getTitle()));
            try {
                this.save(event);
                return;
            } catch (DuplicateKeyException e) {
                if (attempt >= SLUG_ATTEMPTS) {
                    throw e;
                }
                log.warn("event slug collision, retrying: slug={}, attempt={}", event.getSlug(), attempt);
            }
        }
    }

    @Transactional
    @Override
    public EventEntity update(long hostId, long eventId, EventDraft draft, List<Long> stopLocationIds,
                              Collection<Long> inviteeIds) {
        EventEntity event = requireHostedEvent(hostId, eventId);
        EventDraft d = validateDraft(draft);
        List<Long> stops = validateStops(stopLocationIds);

        this.update(new LambdaUpdateWrapper<EventEntity>()
                .eq(EventEntity::getId, eventId)
                .set(EventEntity::getTitle, d.title())
                .set(EventEntity::getDescription, d.description())
                .set(EventEntity::getVisibility, d.visibility())
                .set(EventEntity::getStartTime, d.startTime())
                .set(EventEntity::getStartLocationId, d.startLocationId())
                .set(EventEntity::getUpdatedAt, LocalDateTime.now()));

        // full replace, never a diff
        stopMapper.delete(new LambdaQueryWrapper<EventStopEntity>().eq(EventStopEntity::getEventId, eventId));
        insertStops(eventId, stops);

        EventEntity updated = this.getById(eventId);
        List<Long> invited = inviteService.inviteUsers(updated, inviteeIds);
        log.info("event updated: eventId={}, stops={}, newInvites={}", eventId, stops.size(), invited.size());
        return updated;
    }

    @Transactional
    @Override
    public void delete(long hostId, long eventId) {
        requireHostedEvent(hostId, eventId);
        this.update(new LambdaUpdateWrapper<EventEntity>()
                .eq(EventEntity::getId, eventId)
                .set(EventEntity::getDeleted, true)
                .set(EventEntity::getUpdatedAt, LocalDateTime.now()));
        log.info("event deleted: eventId={}, hostId={}", eventId, hostId);
    }

    @Override
    public EventDetail detail(long viewerId, long eventId) {
        EventEntity event = eventLookup.requireActive(eventId);
        EventAccess access = memberService.accessOf(event, viewerId);
        if (!visibilityPolicy.canView(event, access)) {
            throw EngagementException.of(EngagementError.PRIVATE_EVENT);
        }

        ViewerRole viewerRole = memberService.viewerRole(event, viewerId);
        boolean joined = access.hasJoined();
        EventJoinRequestEntity ownRequest = viewerId > 0 ? joinRequestService.findPending(eventId, viewerId) : null;
        List<EventJoinRequestEntity> awaiting = viewerRole == ViewerRole.HOST
                ? joinRequestService.listPending(viewerId, eventId)
                : List.of();
        boolean canJoin = viewerId > 0 && visibilityPolicy.canJoin(event, access);
        boolean canRequestJoin = viewerId > 0
                && event.getVisibility() == EventVisibility.PUBLIC_INVITE
                && !joined && !access.pendingInvite() && ownRequest == null;

        return new EventDetail(
                event,
                listStopLocationIds(eventId),
                memberService.listAttendees(eventId),
                viewerRole,
                joined,
                favoriteService.isFavorited(viewerId, eventId),
                access.pendingInvite(),
                canJoin,
                canRequestJoin,
                ownRequest,
                awaiting);
    }

    @Override
    public IPage<EventEntity> listPublic(String query, String filter, String order, long pageNo, long pageSize) {
        long safePage = Math.max(1, pageNo);
        long safeSize = Math.max(1, Math.min(100, pageSize));

        LambdaQueryWrapper<EventEntity> w = new LambdaQueryWrapper<EventEntity>()
                .eq(EventEntity::getDeleted, false);
        EventVisibility only = EventVisibility.fromFilter(filter);
        if (only != null) {
            w.eq(EventEntity::getVisibility, only);
        } else {
            w.in(EventEntity::getVisibility, PUBLIC_TIERS);
        }

        String q = query == null ? "" : query.trim().toLowerCase();
        if (!q.isEmpty()) {
            String like = "%" + q + "%";
            w.and(x -> x.apply("lower(title) like {0}", like)
                    .or().apply("host_id in (select u.id from t_user u where lower(u.username) like {0})", like)
                    .or().apply("start_location_id in (select l.id from t_art_location l where lower(l.title) like {0})", like));
        }

        if ("-start_time".equals(order)) {
            w.orderByDesc(EventEntity::getStartTime).orderByDesc(EventEntity::getId);
        } else {
            w.orderByAsc(EventEntity::getStartTime).orderByAsc(EventEntity::getId);
        }
        return this.page(new Page<>(safePage, safeSize), w);
    }

    @Override
    public List<EventEntity> listHosted(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        return this.list(new LambdaQueryWrapper<EventEntity>()
                .eq(EventEntity::getHostId, userId)
                .eq(EventEntity::getDeleted, false)
                .orderByDesc(EventEntity::getStartTime)
                .orderByDesc(EventEntity::getId));
    }

    @Override
    public List<EventEntity> listJoined(long userId) {
        List<Long> ids = memberService.listAttendingEventIds(userId);
        if (ids.isEmpty()) {
            return List.of();
        }
        return this.list(new LambdaQueryWrapper<EventEntity>()
                .in(EventEntity::getId, ids)
                .eq(EventEntity::getDeleted, false)
                .orderByAsc(EventEntity::getStartTime)
                .orderByAsc(EventEntity::getId));
    }

    @Override
    public List<Long> listStopLocationIds(long eventId) {
        return stopMapper.selectList(new LambdaQueryWrapper<EventStopEntity>()
                        .eq(EventStopEntity::getEventId, eventId)
                        .orderByAsc(EventStopEntity::getStopOrder))
                .stream()
                .map(EventStopEntity::getLocationId)
                .toList();
    }

    private EventEntity requireHostedEvent(long hostId, long eventId) {
        EventEntity event = eventLookup.requireActive(eventId);
        if (event.getHostId() == null || event.getHostId() != hostId) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }
        return event;
    }

    private EventDraft validateDraft(EventDraft draft) {
        if (draft == null) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "missing_event");
        }
        String title = draft.title() == null ? "" : draft.title().trim();
        if (title.isEmpty() || title.length() > MAX_TITLE) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "bad_title");
        }
        String description = draft.description() == null ? null : draft.description().trim();
        if (description != null && description.length() > MAX_DESCRIPTION) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "description_too_long");
        }
        if (draft.visibility() == null) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "missing_visibility");
        }
        if (draft.startTime() == null || !draft.startTime().isAfter(LocalDateTime.now())) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "start_time_not_in_future");
        }
        if (draft.startLocationId() == null || !locationDirectory.exists(draft.startLocationId())) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "unknown_start_location");
        }
        return new EventDraft(title, description == null || description.isEmpty() ? null : description,
                draft.visibility(), draft.startTime(), draft.startLocationId());
    }

    /**
     * The cap applies to the raw list; duplicates are then dropped keeping first occurrence.
     */
    private List<Long> validateStops(List<Long> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        if (raw.size() > props.getMaxStops()) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "too_many_stops");
        }
        Set<Long> unique = new LinkedHashSet<>();
        for (Long id : raw) {
            if (id == null) {
                throw EngagementException.of(EngagementError.VALIDATION_ERROR, "unknown_location");
            }
            unique.add(id);
        }
        if (locationDirectory.existingIds(unique).size() != unique.size()) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "unknown_location");
        }
        return new ArrayList<>(unique);
    }

    private void insertStops(long eventId, List<Long> locationIds) {
        int order = 1;
        for (Long locationId : locationIds) {
            EventStopEntity stop = new EventStopEntity();
            stop.setId(IdWorker.getId());
            stop.setEventId(eventId);
            stop.setLocationId(locationId);
            stop.setStopOrder(order++);
            stopMapper.insert(stop);
        }
    }
}
