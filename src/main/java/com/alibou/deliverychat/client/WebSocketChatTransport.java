package com.alibou.deliverychat.client;

import com.alibou.deliverychat.chat.ChatFrame;
import com.alibou.deliverychat.chat.InboundChatMessage;
import com.alibou.deliverychat.user.HeaderIdentityResolver;
import com.alibou.deliverychat.user.Identity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChatTransport} over Spring's {@link WebSocketClient}, e.g.
 * {@code StandardWebSocketClient}. Sends the identity headers the server's
 * handshake expects.
 */
@Slf4j
@RequiredArgsConstructor
public class WebSocketChatTransport implements ChatTransport {

    private final WebSocketClient client;
    /** e.g. {@code ws://localhost:8080} */
    private final URI             serverUri;
    private final Identity        identity;
    private final ObjectMapper    objectMapper;

    @Override
    public void connect(long bookingId, Long resumeAfter, ChatTransportListener listener) {
        URI uri = chatUri(bookingId, resumeAfter);

        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(HeaderIdentityResolver.CLIENT_ID, identity.id());
        headers.add(HeaderIdentityResolver.CLIENT_ROLE, identity.role().wireName());
        headers.add(HeaderIdentityResolver.CLIENT_NAME, identity.displayName());

        FrameHandler handler = new FrameHandler(listener);
        client.execute(handler, headers, uri).whenComplete((session, ex) -> {
            if (ex != null) {
                log.warn("❌ Подключение к {} не удалось: {}", uri, ex.getMessage());
                handler.closedOnce(CloseStatus.NO_CLOSE_FRAME.getCode(), ex.getMessage());
            }
        });
    }

    URI chatUri(long bookingId, Long resumeAfter) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUri(serverUri)
                .path("/ws/chat/{bookingId}");
        if (resumeAfter != null) {
            builder.queryParam("after", resumeAfter);
        }
        return builder.buildAndExpand(bookingId).toUri();
    }

    private class FrameHandler extends TextWebSocketHandler {

        private final ChatTransportListener listener;
        private final AtomicBoolean         closed = new AtomicBoolean();

        FrameHandler(ChatTransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen(new SessionLink(session));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            ChatFrame frame;
            try {
                frame = objectMapper.readValue(message.getPayload(), ChatFrame.class);
            } catch (JsonProcessingException ex) {
                log.warn("❌ Нечитаемый кадр от сервера в {}: {}", session.getId(), ex.getOriginalMessage());
                return;
            }
            listener.onFrame(frame);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closedOnce(status.getCode(), status.getReason());
        }

        void closedOnce(int code, String reason) {
            if (closed.compareAndSet(false, true)) {
                listener.onClose(code, reason);
            }
        }
    }

    private class SessionLink implements ChatLink {

        private final WebSocketSession session;

        SessionLink(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String text) throws IOException {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(new InboundChatMessage(text))));
        }

        @Override
        public void close() {
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException ex) {
                log.debug("Не удалось закрыть {}: {}", session.getId(), ex.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
