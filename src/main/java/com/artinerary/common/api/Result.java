package com.artinerary.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform HTTP response envelope.
 *
 * <ul>
 *   <li>ok: whether the business operation succeeded (not the HTTP status).</li>
 *   <li>code: 0 on success, one of {@link ApiCodes} otherwise.</li>
 *   <li>message: short snake_case reason, safe to show or log.</li>
 *   <li>data: payload on success, usually null on failure.</li>
 *   <li>ts: server time in epoch millis.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, System.currentTimeMillis());
    }

    /**
     * Success without payload.
     *
     * <p>Cannot be named ok(): the record already generates a boolean ok() accessor.</p>
     */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }
}
