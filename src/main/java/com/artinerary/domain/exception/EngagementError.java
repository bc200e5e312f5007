package com.artinerary.domain.exception;

import com.artinerary.common.api.ApiCodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every expected failure of the engagement engine.
 *
 * <p>{@link #getKey()} is the snake_case message returned to clients; the category
 * decides the HTTP status and {@link ApiCodes} value.</p>
 */
@Getter
@RequiredArgsConstructor
public enum EngagementError {

    VALIDATION_ERROR("validation_error", Category.VALIDATION),
    INVALID_MESSAGE("invalid_message", Category.VALIDATION),

    ALREADY_JOINED("already_joined", Category.IDEMPOTENCY),
    ALREADY_INVITED("already_invited", Category.IDEMPOTENCY),
    ALREADY_MEMBER("already_member", Category.IDEMPOTENCY),
    ALREADY_LEFT("already_left", Category.IDEMPOTENCY),
    ALREADY_REPORTED("already_reported", Category.IDEMPOTENCY),
    NOT_PENDING("not_pending", Category.IDEMPOTENCY),

    PRIVATE_EVENT("private_event", Category.POLICY),
    INVITE_REQUIRED("invite_required", Category.POLICY),
    FORBIDDEN("forbidden", Category.POLICY),
    NOT_A_MEMBER("not_a_member", Category.POLICY),
    NOT_REGISTERED("not_registered", Category.POLICY),
    HOST_CANNOT_LEAVE("host_cannot_leave", Category.POLICY),
    CANNOT_FAVORITE_DELETED("cannot_favorite_deleted", Category.POLICY),

    NOT_FOUND("not_found", Category.NOT_FOUND);

    private final String key;

    private final Category category;

    public HttpStatus httpStatus() {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case IDEMPOTENCY -> HttpStatus.CONFLICT;
            case POLICY -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    public int apiCode() {
        return switch (category) {
            case VALIDATION -> ApiCodes.BAD_REQUEST;
            case IDEMPOTENCY -> ApiCodes.CONFLICT;
            case POLICY -> ApiCodes.FORBIDDEN;
            case NOT_FOUND -> ApiCodes.NOT_FOUND;
        };
    }

    public enum Category {
        /** Malformed input. */
        VALIDATION,
        /** Already applied; informational, never fatal. */
        IDEMPOTENCY,
        /** Authorization / visibility denial. */
        POLICY,
        NOT_FOUND
    }
}
