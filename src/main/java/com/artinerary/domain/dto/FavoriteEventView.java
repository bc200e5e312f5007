package com.artinerary.domain.dto;

import com.artinerary.domain.enums.EventVisibility;

import java.time.LocalDateTime;

public record FavoriteEventView(
        Long eventId,
        String slug,
        String title,
        EventVisibility visibility,
        LocalDateTime startTime,
        boolean joined,
        LocalDateTime favoritedAt
) {
}
