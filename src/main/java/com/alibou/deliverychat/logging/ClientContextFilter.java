package com.alibou.deliverychat.logging;

import com.alibou.deliverychat.user.HeaderIdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Кладёт в MDC участника и бронь HTTP-запроса. Срабатывает и на upgrade
 * WebSocket, поэтому у логов рукопожатия те же ключи.
 */
@Component
public class ClientContextFilter extends OncePerRequestFilter {

    private static final Pattern BOOKING_PATH = Pattern.compile("^/(?:api/bookings|ws/chat|admin/channels)/(\\d+)(?:/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest req,
                                    HttpServletResponse res,
                                    FilterChain chain)
            throws ServletException, IOException {

        try {
            String userId = req.getHeader(HeaderIdentityResolver.CLIENT_ID);
            String role   = req.getHeader(HeaderIdentityResolver.CLIENT_ROLE);
            String bookingId = bookingIdOf(req.getRequestURI());

            if (userId != null)    MDC.put("userId", userId);
            if (role != null)      MDC.put("role", role);
            if (bookingId != null) MDC.put("bookingId", bookingId);

            chain.doFilter(req, res);
        } finally {
            MDC.clear();
        }
    }

    static String bookingIdOf(String path) {
        if (path == null) {
            return null;
        }
        Matcher m = BOOKING_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }
}
