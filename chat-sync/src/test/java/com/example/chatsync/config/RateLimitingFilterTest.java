package com.example.chatsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitingFilterTest {

    private ChatSecurityProperties properties;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new ChatSecurityProperties();
        properties.getWrites().setCapacity(2);
        properties.getWrites().setRefillPeriod(Duration.ofHours(1));
        properties.getReads().setCapacity(5);
        filter = new RateLimitingFilter(properties, new ObjectMapper());
    }

    @Test
    void writesBeyondBudgetAreRejected() throws Exception {
        assertEquals(200, call("POST", "/api/chats/42/messages", "1").getStatus());
        assertEquals(200, call("POST", "/api/chats/42/messages", "1").getStatus());

        MockHttpServletResponse rejected = call("POST", "/api/chats/42/messages", "1");

        assertEquals(429, rejected.getStatus());
        assertNotNull(rejected.getHeader("Retry-After"));
        assertTrue(rejected.getContentAsString().contains("\"code\":\"too_many_requests\""));
    }

    @Test
    void readsUseTheirOwnBudget() throws Exception {
        call("POST", "/api/chats", "1");
        call("POST", "/api/chats", "1");
        assertEquals(429, call("PATCH", "/api/messages/7", "1").getStatus());

        MockHttpServletResponse read = call("GET", "/api/chats", "1");

        assertEquals(200, read.getStatus());
        assertEquals("4", read.getHeader("X-RateLimit-Remaining"));
    }

    @Test
    void callersAreLimitedIndependently() throws Exception {
        call("DELETE", "/api/messages/7", "1");
        call("DELETE", "/api/messages/8", "1");

        assertEquals(429, call("DELETE", "/api/messages/9", "1").getStatus());
        assertEquals(200, call("DELETE", "/api/messages/9", "2").getStatus());
    }

    @Test
    void nonApiPathsAndDisabledLimiterPassThrough() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertNull(call("POST", "/actuator/health", "1").getHeader("X-RateLimit-Remaining"));
        }

        properties.setRateLimitingEnabled(false);
        for (int i = 0; i < 5; i++) {
            assertEquals(200, call("POST", "/api/chats", "3").getStatus());
        }
    }

    private MockHttpServletResponse call(String method, String uri, String userId) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.addHeader(RateLimitingFilter.USER_HEADER, userId);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
