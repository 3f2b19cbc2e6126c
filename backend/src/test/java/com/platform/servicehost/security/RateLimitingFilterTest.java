package com.platform.servicehost.security;

import com.platform.servicehost.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitingFilterTest {

    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RateLimitingFilter(new SecurityAuditLogger(new CommandGuard()), JacksonConfig.standardObjectMapper());
        ReflectionTestUtils.setField(filter, "enabled", true);
        ReflectionTestUtils.setField(filter, "mutationRequestsPerMinute", 2);
    }

    private MockHttpServletResponse post(String remoteAddr, String forwardedFor) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/services/abc/start");
        request.setRemoteAddr(remoteAddr);
        if (forwardedFor != null) {
            request.addHeader("X-Forwarded-For", forwardedFor);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    void doFilter_overLimit_shouldReturn429() throws Exception {
        assertEquals(200, post("10.0.0.5", null).getStatus());
        assertEquals(200, post("10.0.0.5", null).getStatus());

        MockHttpServletResponse blocked = post("10.0.0.5", null);

        assertEquals(429, blocked.getStatus());
        assertTrue(blocked.getContentAsString().contains("SH-429"));
    }

    @Test
    void doFilter_rotatingForwardedForFromUntrustedPeer_shouldShareOneBucket() throws Exception {
        assertEquals(200, post("10.0.0.5", "1.1.1.1").getStatus());
        assertEquals(200, post("10.0.0.5", "2.2.2.2").getStatus());

        assertEquals(429, post("10.0.0.5", "3.3.3.3").getStatus());
    }

    @Test
    void doFilter_forwardedForFromTrustedProxy_shouldKeyOnClient() throws Exception {
        ReflectionTestUtils.setField(filter, "trustedProxies", List.of("10.0.0.1"));

        assertEquals(200, post("10.0.0.1", "1.1.1.1").getStatus());
        assertEquals(200, post("10.0.0.1", "1.1.1.1").getStatus());
        assertEquals(429, post("10.0.0.1", "1.1.1.1").getStatus());

        assertEquals(200, post("10.0.0.1", "2.2.2.2, 10.0.0.1").getStatus());
    }

    @Test
    void doFilter_readRequest_shouldNotBeLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/services");
            MockHttpServletResponse response = new MockHttpServletResponse();
            filter.doFilter(request, response, new MockFilterChain());
            assertEquals(200, response.getStatus());
        }
    }
}
