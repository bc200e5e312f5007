package com.artinerary.domain.exception;

import lombok.Getter;

/**
 * Raised by services for an expected business failure. Thrown out of a
 * {@code @Transactional} method it also rolls the unit of work back.
 */
@Getter
public class EngagementException extends RuntimeException {

    private final EngagementError error;

    public EngagementException(EngagementError error) {
        this(error, null);
    }

    public EngagementException(EngagementError error, String detail) {
        super(detail == null || detail.isBlank() ? error.getKey() : error.getKey() + ": " + detail);
        this.error = error;
    }

    public static EngagementException of(EngagementError error) {
        return new EngagementException(error);
    }

    public static EngagementException of(EngagementError error, String detail) {
        return new EngagementException(error, detail);
    }
}
