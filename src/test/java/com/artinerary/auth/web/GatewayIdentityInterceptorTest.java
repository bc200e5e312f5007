package com.artinerary.auth.web;

import com.artinerary.auth.config.AuthProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayIdentityInterceptorTest {

    private final GatewayIdentityInterceptor interceptor =
            new GatewayIdentityInterceptor(new AuthProperties(null), new ObjectMapper());

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void preHandle_ShouldBindUserId_WhenHeaderPresent() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/event/hosted");
        req.addHeader("X-User-Id", " 42 ");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isTrue();
        assertThat(AuthContext.getUserId()).isEqualTo(42L);
        assertThat(req.getAttribute(GatewayIdentityInterceptor.REQ_ATTR_USER_ID)).isEqualTo(42L);

        interceptor.afterCompletion(req, resp, new Object(), null);
        assertThat(AuthContext.getUserId()).isNull();
    }

    @Test
    void preHandle_ShouldPassAnonymousThrough_WhenHeaderMissing() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/event/public");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isTrue();
        assertThat(AuthContext.getUserId()).isNull();
    }

    @Test
    void preHandle_ShouldReject_WhenHeaderIsNotAPositiveId() throws Exception {
        for (String bad : new String[]{"abc", "0", "-5"}) {
            MockHttpServletRequest req = new MockHttpServletRequest("GET", "/event/hosted");
            req.addHeader("X-User-Id", bad);
            MockHttpServletResponse resp = new MockHttpServletResponse();

            assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
            assertThat(resp.getStatus()).isEqualTo(401);
            assertThat(resp.getContentAsString()).contains("\"unauthorized\"");
        }
    }
}
