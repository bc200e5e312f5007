package com.artinerary.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "artinerary.cache")
public class CacheProperties {

    private boolean enabled = true;

    private long eventSlugTtlSeconds = 3600;

    private long eventSlugMaxSize = 100_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getEventSlugTtlSeconds() {
        return eventSlugTtlSeconds;
    }

    public void setEventSlugTtlSeconds(long eventSlugTtlSeconds) {
        this.eventSlugTtlSeconds = eventSlugTtlSeconds;
    }

    public long getEventSlugMaxSize() {
        return eventSlugMaxSize;
    }

    public void setEventSlugMaxSize(long eventSlugMaxSize) {
        this.eventSlugMaxSize = eventSlugMaxSize;
    }
}
