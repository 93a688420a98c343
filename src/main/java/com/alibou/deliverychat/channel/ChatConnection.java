package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.user.Identity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Один зарегистрированный сокет участника в канале брони. У одного участника
 * их может быть несколько (по одному на вкладку).
 * <p>
 * Исходящие кадры не пишутся в сокет вызывающим потоком: они встают в
 * собственную очередь соединения, которую разгребает общий пул. В сокет
 * одновременно пишет не больше одного потока, порядок кадров сохраняется.
 */
@Slf4j
public class ChatConnection {

    @Getter private final String   id;
    @Getter private final long     bookingId;
    @Getter private final Identity identity;
    @Getter private final Instant  openedAt;

    private final WebSocketSession session;

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.CONNECTING);

    /* ===== исходящая очередь ===== */

    private final Executor                 outboundExecutor;
    private final Consumer<ChatConnection> onDeliveryFailure;
    private final long                     sendTimeLimitNanos;
    private final int                      bufferSizeLimit;

    private final Queue<TextMessage> outbound    = new ConcurrentLinkedQueue<>();
    private final AtomicLong         queuedBytes = new AtomicLong();
    private final AtomicBoolean      draining    = new AtomicBoolean();

    /** System.nanoTime() начала текущей записи в сокет, 0 если запись не идёт */
    private volatile long sendStartedAt;

    ChatConnection(long bookingId, Identity identity, WebSocketSession session, Instant openedAt,
                   Executor outboundExecutor, Duration sendTimeLimit, int bufferSizeLimit,
                   Consumer<ChatConnection> onDeliveryFailure) {
        this.id                 = session.getId();
        this.bookingId          = bookingId;
        this.identity           = identity;
        this.session            = session;
        this.openedAt           = openedAt;
        this.outboundExecutor   = outboundExecutor;
        this.sendTimeLimitNanos = sendTimeLimit.toNanos();
        this.bufferSizeLimit    = bufferSizeLimit;
        this.onDeliveryFailure  = onDeliveryFailure;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    void markOpen() {
        state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    /** Пир уже ушёл, отправлять нечего. */
    void markClosed() {
        state.set(ConnectionState.CLOSED);
        discardOutbound();
    }

    /**
     * Ставит кадр в очередь и сразу возвращается.
     *
     * @param bounded проверять ли лимит буфера (для живой рассылки да, для
     *                догоняющей истории нет)
     * @return {@code false}, если соединение закрыто, зависло на записи дольше
     *         {@code chat.send-time-limit} или переполнило буфер; такое
     *         соединение вызывающий должен выбросить
     */
    boolean enqueue(TextMessage message, boolean bounded) {
        if (!isOpen() || isStalled()) {
            return false;
        }
        long size = message.getPayloadLength();
        if (bounded && queuedBytes.get() + size > bufferSizeLimit) {
            return false;
        }
        queuedBytes.addAndGet(size);
        outbound.add(message);
        scheduleDrain();
        return true;
    }

    /** Запись в сокет идёт дольше лимита. */
    boolean isStalled() {
        long started = sendStartedAt;
        return started != 0 && System.nanoTime() - started > sendTimeLimitNanos;
    }

    /**
     * Закрытие по инициативе сервера; до сокета доходит только первый вызов.
     * Если в сокет сейчас идёт запись, контейнер ждёт её окончания, поэтому
     * такое закрытие уходит в пул отправки.
     */
    void close(CloseStatus status) {
        ConnectionState previous = state.getAndUpdate(s ->
                s == ConnectionState.CLOSING || s == ConnectionState.CLOSED ? s : ConnectionState.CLOSING);
        if (previous == ConnectionState.CLOSING || previous == ConnectionState.CLOSED) {
            return;
        }
        discardOutbound();
        if (sendStartedAt != 0) {
            try {
                outboundExecutor.execute(() -> closeSession(status));
                return;
            } catch (RejectedExecutionException ex) {
                log.debug("Пул отправки отклонил закрытие {}, закрываем на месте", id);
            }
        }
        closeSession(status);
    }

    private void closeSession(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException | IllegalStateException ex) {
            log.debug("Не удалось закрыть соединение {}: {}", id, ex.getMessage());
        } finally {
            state.set(ConnectionState.CLOSED);
        }
    }

    /* ===== разгребание очереди ===== */

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;                     // очередь уже разгребается
        }
        try {
            outboundExecutor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.warn("⚠️ Пул отправки отклонил задачу для {}: {}", this, ex.getMessage());
            onDeliveryFailure.accept(this);
        }
    }

    private void drain() {
        try {
            TextMessage next;
            while ((next = outbound.poll()) != null) {
                queuedBytes.addAndGet(-next.getPayloadLength());
                if (!isOpen()) {
                    discardOutbound();
                    return;
                }
                if (!send(next)) {
                    discardOutbound();
                    onDeliveryFailure.accept(this);
                    return;
                }
            }
        } finally {
            draining.set(false);
            // кадр мог встать в очередь между poll() и сбросом флага
            if (!outbound.isEmpty() && isOpen()) {
                scheduleDrain();
            }
        }
    }

    private boolean send(TextMessage message) {
        sendStartedAt = System.nanoTime();
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("❌ Доставка в {} не удалась: {}", this, ex.getMessage());
            return false;
        } finally {
            sendStartedAt = 0;
        }
    }

    private void discardOutbound() {
        outbound.clear();
        queuedBytes.set(0);
    }

    @Override
    public String toString() {
        return "ChatConnection[" + id + " booking=" + bookingId + " " + identity.role().wireName()
                + ":" + identity.id() + " " + state.get() + "]";
    }
}
