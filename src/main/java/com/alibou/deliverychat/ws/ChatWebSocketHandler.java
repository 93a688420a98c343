package com.alibou.deliverychat.ws;

import com.alibou.deliverychat.channel.ChatConnection;
import com.alibou.deliverychat.channel.ChatGateway;
import com.alibou.deliverychat.chat.InboundChatMessage;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;
import com.alibou.deliverychat.exception.JoinRejectedException;
import com.alibou.deliverychat.user.Identity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Колбэки сокета {@code /ws/chat/{bookingId}}. Каждый колбэк выполняется в
 * потоке контейнера своего соединения и передаёт работу в {@link ChatGateway}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION = "chat.connection";

    private final ChatGateway  gateway;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Long bookingId     = (Long) session.getAttributes().get(ChatHandshakeInterceptor.ATTR_BOOKING_ID);
        Identity identity  = (Identity) session.getAttributes().get(ChatHandshakeInterceptor.ATTR_IDENTITY);
        Long resumeAfter   = (Long) session.getAttributes().get(ChatHandshakeInterceptor.ATTR_RESUME_AFTER);
        if (bookingId == null || identity == null) {
            log.warn("⚠️ Сессия {} открыта без атрибутов рукопожатия", session.getId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        withContext(bookingId, identity, () -> {
            try {
                ChatConnection connection = gateway.join(bookingId, identity, session, resumeAfter);
                session.getAttributes().put(ATTR_CONNECTION, connection);
            } catch (JoinRejectedException ex) {
                log.info("🚫 Вход отклонён ({}): {}", ex.getError(), ex.getMessage());
                closeQuietly(session, ex.getError().closeStatus());
            } catch (ChatException ex) {
                log.warn("❌ Вход не удался ({}): {}", ex.getError(), ex.getMessage());
                closeQuietly(session, CloseStatus.SERVER_ERROR);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChatConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        withContext(connection.getBookingId(), connection.getIdentity(), () -> {
            InboundChatMessage inbound;
            try {
                inbound = objectMapper.readValue(message.getPayload(), InboundChatMessage.class);
            } catch (JsonProcessingException ex) {
                gateway.reject(connection, new ChatException(ChatError.VALIDATION_ERROR, "Malformed message frame"));
                return;
            }
            try {
                gateway.send(connection, inbound.getMessage());
            } catch (ChatException ex) {
                log.info("Отправка не удалась ({}): {}", ex.getError(), ex.getMessage());
                gateway.reject(connection, ex);
            } catch (DataAccessException ex) {
                log.error("❌ Хранилище недоступно при отправке: {}", ex.getMessage());
                gateway.reject(connection, new ChatException(ChatError.PERSISTENCE_FAILURE,
                        "Message could not be stored", ex));
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ChatConnection connection = connectionOf(session);
        log.warn("⚠️ Ошибка транспорта в сессии {}: {}", session.getId(), exception.getMessage());
        if (connection != null) {
            gateway.leave(connection);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            gateway.leave(connection);
            log.debug("Сессия {} закрыта: {}", session.getId(), status);
        }
    }

    /* ===== вспомогательное ===== */

    private ChatConnection connectionOf(WebSocketSession session) {
        return (ChatConnection) session.getAttributes().get(ATTR_CONNECTION);
    }

    private void withContext(long bookingId, Identity identity, Runnable action) {
        MDC.put("bookingId", String.valueOf(bookingId));
        MDC.put("userId", identity.id());
        MDC.put("role", identity.role().wireName());
        try {
            action.run();
        } finally {
            MDC.remove("bookingId");
            MDC.remove("userId");
            MDC.remove("role");
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException ex) {
            log.debug("Не удалось закрыть сессию {}: {}", session.getId(), ex.getMessage());
        }
    }
}
