package com.artinerary.common.api;

/**
 * Business error codes carried in {@link Result#code()}.
 *
 * <p>Ranges follow the HTTP status the failure maps to, so callers can branch on
 * either value.</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** Malformed input or a failed business validation. */
    public static final int BAD_REQUEST = 40000;

    /** No authenticated user on the request. */
    public static final int UNAUTHORIZED = 40100;

    /** Authenticated, but the policy denies the operation. */
    public static final int FORBIDDEN = 40300;

    /** Referenced event / invite / request / chat / message does not exist. */
    public static final int NOT_FOUND = 40400;

    /** The operation was already applied (already joined, already left, ...). */
    public static final int CONFLICT = 40900;

    public static final int INTERNAL_ERROR = 50000;
}
