package com.alibou.deliverychat.client;

import com.alibou.deliverychat.chat.ChatFrame;
import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketChatTransportTest {

    private final WebSocketClient client = mock(WebSocketClient.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebSocketChatTransport transport = new WebSocketChatTransport(client,
            URI.create("ws://localhost:8080"), new Identity("c-1", Role.CUSTOMER, "Carla"), objectMapper);
    private final RecordingListener listener = new RecordingListener();

    @Test
    void chatUriCarriesBookingAndResumePoint() {
        assertThat(transport.chatUri(42L, null)).isEqualTo(URI.create("ws://localhost:8080/ws/chat/42"));
        assertThat(transport.chatUri(42L, 17L)).isEqualTo(URI.create("ws://localhost:8080/ws/chat/42?after=17"));
    }

    @Test
    void handshakeSendsTheIdentityHeaders() {
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(new CompletableFuture<>());

        transport.connect(42L, null, listener);

        ArgumentCaptor<WebSocketHttpHeaders> headers = ArgumentCaptor.forClass(WebSocketHttpHeaders.class);
        verify(client).execute(any(WebSocketHandler.class), headers.capture(), any(URI.class));
        assertThat(headers.getValue().getFirst("X-Client-Id")).isEqualTo("c-1");
        assertThat(headers.getValue().getFirst("X-Client-Role")).isEqualTo("customer");
        assertThat(headers.getValue().getFirst("X-Client-Name")).isEqualTo("Carla");
    }

    @Test
    void failedHandshakeIsReportedAsAConnectionLoss() {
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.failedFuture(new ConnectException("refused")));

        transport.connect(42L, null, listener);

        assertThat(listener.closeCodes).containsExactly(1006);
    }

    @Test
    void socketEventsReachTheListener() throws Exception {
        ArgumentCaptor<WebSocketHandler> handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        when(client.execute(handler.capture(), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(new CompletableFuture<>());
        transport.connect(42L, 5L, listener);
        WebSocketSession session = mock(WebSocketSession.class);

        handler.getValue().afterConnectionEstablished(session);
        handler.getValue().handleMessage(session, new TextMessage(
                "{\"type\":\"message\",\"message_id\":6,\"sender_id\":\"p-1\",\"message\":\"hi\"}"));
        listener.links.get(0).send("hello");
        handler.getValue().afterConnectionClosed(session, new CloseStatus(4000, "chat_closed"));

        assertThat(listener.frames).singleElement().satisfies(frame -> {
            assertThat(frame.getMessageId()).isEqualTo(6L);
            assertThat(frame.getSenderId()).isEqualTo("p-1");
        });
        verify(session).sendMessage(new TextMessage("{\"message\":\"hello\"}"));
        assertThat(listener.closeCodes).containsExactly(4000);
    }

    private static class RecordingListener implements ChatTransportListener {

        final List<ChatLink> links = new ArrayList<>();
        final List<ChatFrame> frames = new ArrayList<>();
        final List<Integer> closeCodes = new ArrayList<>();

        @Override
        public void onOpen(ChatLink link) {
            links.add(link);
        }

        @Override
        public void onFrame(ChatFrame frame) {
            frames.add(frame);
        }

        @Override
        public void onClose(int code, String reason) {
            closeCodes.add(code);
        }
    }
}
