package com.artinerary.auth.web;

/**
 * Request-scoped "current user".
 *
 * <p>Authentication happens in the fronting gateway; {@link GatewayIdentityInterceptor}
 * copies the resolved user id here so controllers can read it without touching the request.</p>
 *
 * <p>The ThreadLocal must be cleared when the request completes, otherwise a pooled thread
 * would carry the previous user into the next request. The interceptor clears it in
 * afterCompletion.</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static void clear() {
        USER_ID.remove();
    }
}
