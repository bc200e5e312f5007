package com.artinerary.domain.service;

import com.artinerary.domain.cache.EventSlugCache;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.EventMapper;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads event rows for the other services; soft-deleted events read as missing.
 */
@Slf4j
@Component
public class EventLookupService {

    private final EventMapper eventMapper;
    private final EventSlugCache slugCache;

    public EventLookupService(EventMapper eventMapper, EventSlugCache slugCache) {
        this.eventMapper = eventMapper;
        this.slugCache = slugCache;
    }

    public EventEntity requireActive(long eventId) {
        EventEntity event = eventId <= 0 ? null : eventMapper.selectById(eventId);
        if (event == null || !event.isActive()) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "event");
        }
        return event;
    }

    /**
     * Like {@link #requireActive(long)} but returns soft-deleted rows too.
     */
    public EventEntity requireExisting(long eventId) {
        EventEntity event = eventId <= 0 ? null : eventMapper.selectById(eventId);
        if (event == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "event");
        }
        return event;
    }

    /**
     * Resolves a slug to the id of an active event.
     */
    public long resolveId(String slug) {
        EventEntity event = findBySlug(slug);
        if (event == null || !event.isActive()) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "event");
        }
        return event.getId();
    }

    /**
     * Like {@link #resolveId(String)} but also resolves soft-deleted events.
     */
    public long resolveAnyId(String slug) {
        EventEntity event = findBySlug(slug);
        if (event == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "event");
        }
        return event.getId();
    }

    private EventEntity findBySlug(String slug) {
        String s = slug == null ? "" : slug.trim();
        if (s.isEmpty()) {
            return null;
        }
        Long cached = slugCache.get(s);
        if (cached != null) {
            EventEntity event = eventMapper.selectById(cached);
            if (event != null && s.equals(event.getSlug())) {
                return event;
            }
            log.debug("event slug cache stale: slug={}, id={}", s, cached);
            slugCache.evict(s);
        }
        EventEntity event = eventMapper.selectOne(new LambdaQueryWrapper<EventEntity>()
                .eq(EventEntity::getSlug, s)
                .last("limit 1"));
        if (event != null) {
            slugCache.put(s, event.getId());
        }
        return event;
    }
}
