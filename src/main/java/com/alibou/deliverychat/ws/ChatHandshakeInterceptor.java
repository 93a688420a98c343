package com.alibou.deliverychat.ws;

import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * До upgrade определяет id брони, участника и точку возобновления.
 * Права на саму бронь проверяются при входе в канал.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_BOOKING_ID   = "chat.bookingId";
    public static final String ATTR_IDENTITY     = "chat.identity";
    public static final String ATTR_RESUME_AFTER = "chat.resumeAfter";

    private final IdentityResolver identityResolver;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {

        Optional<Long> bookingId = bookingIdFrom(request.getURI().getPath());
        if (bookingId.isEmpty()) {
            log.warn("🚫 Рукопожатие отклонено: в {} нет id брони", request.getURI().getPath());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        Optional<Identity> identity = identityResolver.resolve(request.getHeaders());
        if (identity.isEmpty()) {
            log.warn("🚫 Рукопожатие для брони {} отклонено: участник не опознан", bookingId.get());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        attributes.put(ATTR_BOOKING_ID, bookingId.get());
        attributes.put(ATTR_IDENTITY, identity.get());
        resumeAfterFrom(request).ifPresent(after -> attributes.put(ATTR_RESUME_AFTER, after));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("❌ Рукопожатие для {} не удалось: {}", request.getURI().getPath(), exception.getMessage());
        }
    }

    /** Последний числовой сегмент пути; завершающий слэш допустим. */
    static Optional<Long> bookingIdFrom(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        String last = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        try {
            return Optional.of(Long.parseLong(last));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private Optional<Long> resumeAfterFrom(ServerHttpRequest request) {
        String after = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst("after");
        if (after == null || after.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(after));
        } catch (NumberFormatException ex) {
            log.debug("Некорректная точка возобновления '{}' пропущена", after);
            return Optional.empty();
        }
    }
}
