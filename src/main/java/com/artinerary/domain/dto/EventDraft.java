package com.artinerary.domain.dto;

import com.artinerary.domain.enums.EventVisibility;

import java.time.LocalDateTime;

/**
 * Editable fields of an event, as submitted by its host.
 */
public record EventDraft(
        String title,
        String description,
        EventVisibility visibility,
        LocalDateTime startTime,
        Long startLocationId
) {
}
