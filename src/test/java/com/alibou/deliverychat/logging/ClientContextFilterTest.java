package com.alibou.deliverychat.logging;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClientContextFilterTest {

    private final ClientContextFilter filter = new ClientContextFilter();

    @Test
    void requestRunsWithCallerAndBookingInTheMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/bookings/42/messages");
        request.addHeader("X-Client-Id", "c-1");
        request.addHeader("X-Client-Role", "customer");
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(MDC.getCopyOfContextMap());

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen).containsEntry("userId", "c-1")
                .containsEntry("role", "customer")
                .containsEntry("bookingId", "42");
        assertThat(MDC.get("userId")).isNull();
        assertThat(MDC.get("bookingId")).isNull();
    }

    @Test
    void bookingIdIsTakenFromKnownPathsOnly() {
        assertThat(ClientContextFilter.bookingIdOf("/api/bookings/42")).isEqualTo("42");
        assertThat(ClientContextFilter.bookingIdOf("/ws/chat/7/")).isEqualTo("7");
        assertThat(ClientContextFilter.bookingIdOf("/admin/channels/3/count")).isEqualTo("3");
        assertThat(ClientContextFilter.bookingIdOf("/api/bookings")).isNull();
        assertThat(ClientContextFilter.bookingIdOf("/other/42")).isNull();
    }
}
