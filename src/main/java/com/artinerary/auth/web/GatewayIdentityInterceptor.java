package com.artinerary.auth.web;

import com.artinerary.auth.config.AuthProperties;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Picks up the user id the auth gateway resolved for this request.
 *
 * <ul>
 *   <li>No header: pass through anonymously; controllers answer 401 where a user is required.</li>
 *   <li>Numeric positive id: stored in the request attribute and {@link AuthContext}.</li>
 *   <li>Anything else: 401 with the uniform Result JSON.</li>
 * </ul>
 */
@Component
public class GatewayIdentityInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private static final Logger log = LoggerFactory.getLogger(GatewayIdentityInterceptor.class);

    private final AuthProperties authProperties;
    private final ObjectMapper objectMapper;

    public GatewayIdentityInterceptor(AuthProperties authProperties, ObjectMapper objectMapper) {
        this.authProperties = authProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String raw = request.getHeader(authProperties.userIdHeader());
        if (raw == null || raw.isBlank()) {
            return true;
        }
        long userId;
        try {
            userId = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            userId = -1;
        }
        if (userId <= 0) {
            writeUnauthorized(request, response);
            return false;
        }
        request.setAttribute(REQ_ATTR_USER_ID, userId);
        AuthContext.setUserId(userId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
