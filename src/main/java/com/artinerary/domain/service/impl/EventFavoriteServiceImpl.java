package com.artinerary.domain.service.impl;

import com.artinerary.domain.dto.FavoriteEventView;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventFavoriteEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventFavoriteMapper;
import com.artinerary.domain.mapper.EventMapper;
import com.artinerary.domain.mapper.EventMemberMapper;
import com.artinerary.domain.service.EventFavoriteService;
import com.artinerary.domain.service.EventLookupService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventFavoriteServiceImpl extends ServiceImpl<EventFavoriteMapper, EventFavoriteEntity>
        implements EventFavoriteService {

    private final EventMapper eventMapper;
    private final EventMemberMapper memberMapper;
    private final EventLookupService eventLookup;

    @Transactional
    @Override
    public boolean favorite(long userId, long eventId) {
        EventEntity event = eventLookup.requireExisting(eventId);
        if (!event.isActive()) {
            throw EngagementException.of(EngagementError.CANNOT_FAVORITE_DELETED);
        }
        if (isFavorited(userId, eventId)) {
            return false;
        }
        EventFavoriteEntity fav = new EventFavoriteEntity();
        fav.setId(IdWorker.getId());
        fav.setEventId(eventId);
        fav.setUserId(userId);
        try {
            this.save(fav);
        } catch (DuplicateKeyException e) {
            // concurrent favorite of the same pair; the row exists either way
            return false;
        }
        log.debug("event favorited: eventId={}, userId={}", eventId, userId);
        return true;
    }

    @Transactional
    @Override
    public boolean unfavorite(long userId, long eventId) {
        return this.remove(new LambdaQueryWrapper<EventFavoriteEntity>()
                .eq(EventFavoriteEntity::getEventId, eventId)
                .eq(EventFavoriteEntity::getUserId, userId));
    }

    @Override
    public boolean isFavorited(long userId, long eventId) {
        if (userId <= 0 || eventId <= 0) {
            return false;
        }
        return this.count(new LambdaQueryWrapper<EventFavoriteEntity>()
                .eq(EventFavoriteEntity::getEventId, eventId)
                .eq(EventFavoriteEntity::getUserId, userId)) > 0;
    }

    @Override
    public List<FavoriteEventView> listFavorites(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        List<EventFavoriteEntity> favs = this.list(new LambdaQueryWrapper<EventFavoriteEntity>()
                .eq(EventFavoriteEntity::getUserId, userId)
                .orderByDesc(EventFavoriteEntity::getCreatedAt)
                .orderByDesc(EventFavoriteEntity::getId));
        if (favs.isEmpty()) {
            return List.of();
        }
        Set<Long> eventIds = favs.stream().map(EventFavoriteEntity::getEventId).collect(Collectors.toSet());
        Map<Long, EventEntity> events = eventMapper.selectBatchIds(eventIds).stream()
                .filter(EventEntity::isActive)
                .collect(Collectors.toMap(EventEntity::getId, Function.identity()));
        if (events.isEmpty()) {
            return List.of();
        }
        Set<Long> joined = memberMapper.selectList(new LambdaQueryWrapper<EventMemberEntity>()
                        .select(EventMemberEntity::getEventId)
                        .eq(EventMemberEntity::getUserId, userId)
                        .in(EventMemberEntity::getEventId, events.keySet())
                        .in(EventMemberEntity::getRole, EventRole.JOINED))
                .stream()
                .map(EventMemberEntity::getEventId)
                .collect(Collectors.toSet());

        List<FavoriteEventView> out = new ArrayList<>(favs.size());
        for (EventFavoriteEntity f : favs) {
            EventEntity e = events.get(f.getEventId());
            if (e == null) {
                continue;
            }
            out.add(new FavoriteEventView(e.getId(), e.getSlug(), e.getTitle(), e.getVisibility(),
                    e.getStartTime(), joined.contains(e.getId()), f.getCreatedAt()));
        }
        return out;
    }
}
