package com.alibou.deliverychat.client;

import com.alibou.deliverychat.channel.ConnectionState;
import com.alibou.deliverychat.chat.ChatFrame;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.user.Identity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Клиентская сторона чата одной брони: держит сокет, показывает пришедшее и
 * после каждого закрытия решает, пробовать ли снова.
 * <p>
 * Исход решает код закрытия. Обычный обрыв сети повторяется с постоянной
 * задержкой и ограниченным числом попыток; прикладной код закрытия
 * окончателен. Переподключение продолжает после последнего показанного
 * сообщения, и ничего не рисуется дважды.
 */
@Slf4j
public class ChatSessionController {

    private final long                     bookingId;
    private final Identity                 localParticipant;
    private final ChatTransport            transport;
    private final ChatView                 view;
    private final ReconnectPolicy          policy;
    private final ScheduledExecutorService scheduler;

    private ConnectionState    state = ConnectionState.CLOSED;
    private ChatLink           link;
    private int                attempts;
    private Long               lastSeenMessageId;
    private boolean            terminal;
    private ScheduledFuture<?> pendingReconnect;

    /** растёт с каждой попыткой; колбэки старых попыток игнорируются */
    private int generation;

    public ChatSessionController(long bookingId,
                                 Identity localParticipant,
                                 ChatTransport transport,
                                 ChatView view,
                                 ReconnectPolicy policy,
                                 ScheduledExecutorService scheduler) {
        this.bookingId        = bookingId;
        this.localParticipant = localParticipant;
        this.transport        = transport;
        this.view             = view;
        this.policy           = policy;
        this.scheduler        = scheduler;
    }

    /* =======================================================================
                                  USER ACTIONS
       ======================================================================= */

    public synchronized void start() {
        if (state != ConnectionState.CLOSED || terminal) {
            return;
        }
        connect();
    }

    /**
     * @return {@code true}, если текст ушёл; пустой текст и закрытое
     *         соединение отклоняются на месте
     */
    public synchronized boolean send(String text) {
        if (text == null || text.trim().isEmpty()) {
            return false;
        }
        // сокет мог умереть раньше, чем пришёл onClose
        if (state != ConnectionState.OPEN || link == null || !link.isOpen()) {
            view.showSendFailure(ChatError.CONNECTION_LOST.code(), "Not connected");
            return false;
        }
        try {
            link.send(text);
        } catch (IOException ex) {
            log.warn("❌ Отправка в чат брони {} не удалась: {}", bookingId, ex.getMessage());
            view.showSendFailure(ChatError.CONNECTION_LOST.code(), ex.getMessage());
            return false;
        }
        view.clearInput();
        return true;
    }

    /** Ручной повтор после того, как контроллер сдался или получил отказ. */
    public synchronized void reload() {
        cancelPendingReconnect();
        attempts = 0;
        terminal = false;
        if (state == ConnectionState.CLOSED) {
            connect();
        }
    }

    /** Уход со страницы; переподключения не будет. */
    public synchronized void close() {
        terminal = true;
        cancelPendingReconnect();
        if (link != null) {
            state = ConnectionState.CLOSING;
            link.close();
        } else {
            state = ConnectionState.CLOSED;
            generation++;
        }
        view.showIndicator(IndicatorState.DISCONNECTED);
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized Long getLastSeenMessageId() {
        return lastSeenMessageId;
    }

    /* =======================================================================
                               TRANSPORT CALLBACKS
       ======================================================================= */

    synchronized void opened(int attempt, ChatLink openedLink) {
        if (attempt != generation || state != ConnectionState.CONNECTING) {
            openedLink.close();
            return;
        }
        link = openedLink;
        state = ConnectionState.OPEN;
        attempts = 0;
        view.showIndicator(IndicatorState.CONNECTED);
        view.scrollToLatest();
        log.info("ONLINE  ⇢ чат брони {}", bookingId);
    }

    synchronized void received(int attempt, ChatFrame frame) {
        if (attempt != generation) {
            return;
        }
        if (frame.isError()) {
            view.showSendFailure(frame.getCode(), frame.getDetail());
            return;
        }
        Long id = frame.getMessageId();
        if (id != null) {
            if (lastSeenMessageId != null && id <= lastSeenMessageId) {
                return;
            }
            lastSeenMessageId = id;
        }
        view.render(frame);
        view.scrollToLatest();
        if (!localParticipant.id().equals(frame.getSenderId())) {
            view.notifyIncoming(frame);
        }
    }

    synchronized void closed(int attempt, int code, String reason) {
        if (attempt != generation) {
            return;
        }
        link = null;
        ConnectionState previous = state;
        state = ConnectionState.CLOSED;
        if (previous == ConnectionState.CLOSING || terminal) {
            return;
        }

        ChatError cause = ChatError.fromCloseCode(code);
        log.info("OFFLINE ⇢ чат брони {} закрыт с кодом {} ({}): {}", bookingId, code, cause, reason);
        switch (cause) {
            case CONNECTION_LOST -> scheduleReconnect();
            case CHAT_CLOSED -> {
                terminal = true;
                view.showIndicator(IndicatorState.CHAT_CLOSED);
            }
            default -> {
                terminal = true;
                view.showIndicator(IndicatorState.DISCONNECTED);
            }
        }
    }

    /* =======================================================================
                                    HELPERS
       ======================================================================= */

    private void connect() {
        state = ConnectionState.CONNECTING;
        view.showIndicator(attempts == 0 ? IndicatorState.CONNECTING : IndicatorState.RECONNECTING);
        int attempt = ++generation;
        transport.connect(bookingId, lastSeenMessageId, new ChatTransportListener() {
            @Override
            public void onOpen(ChatLink openedLink) {
                opened(attempt, openedLink);
            }

            @Override
            public void onFrame(ChatFrame frame) {
                received(attempt, frame);
            }

            @Override
            public void onClose(int code, String reason) {
                closed(attempt, code, reason);
            }
        });
    }

    private void scheduleReconnect() {
        if (!policy.allowsAnother(attempts)) {
            log.warn("⚠️ Чат брони {}: сдались после {} попыток переподключения", bookingId, attempts);
            view.showIndicator(IndicatorState.DISCONNECTED);
            view.showReloadPrompt();
            return;
        }
        attempts++;
        view.showIndicator(IndicatorState.RECONNECTING);
        pendingReconnect = scheduler.schedule(this::reconnect, policy.delay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        pendingReconnect = null;
        if (terminal || state != ConnectionState.CLOSED) {
            return;
        }
        connect();
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }
}
