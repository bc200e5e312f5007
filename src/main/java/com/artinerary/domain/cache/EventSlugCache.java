package com.artinerary.domain.cache;

import com.artinerary.common.cache.CacheProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Local slug -> event id cache.
 *
 * <p>Slugs never change after creation, so entries need no invalidation on update or
 * soft delete; the event row itself is always re-read.</p>
 */
@Component
public class EventSlugCache {

    private final CacheProperties props;
    private final Cache<String, Long> local;

    public EventSlugCache(CacheProperties props) {
        this.props = props;
        this.local = Caffeine.newBuilder()
                .maximumSize(Math.max(1, props.getEventSlugMaxSize()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getEventSlugTtlSeconds())))
                .build();
    }

    public Long get(String slug) {
        if (!props.isEnabled() || slug == null || slug.isBlank()) {
            return null;
        }
        return local.getIfPresent(slug);
    }

    public void put(String slug, long eventId) {
        if (!props.isEnabled() || slug == null || slug.isBlank() || eventId <= 0) {
            return;
        }
        local.put(slug, eventId);
    }

    public void evict(String slug) {
        if (slug == null) {
            return;
        }
        local.invalidate(slug);
    }
}
