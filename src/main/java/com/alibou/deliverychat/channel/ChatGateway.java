package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.booking.BookingLookup;
import com.alibou.deliverychat.booking.BookingNotFoundException;
import com.alibou.deliverychat.booking.BookingRecord;
import com.alibou.deliverychat.booking.BookingStateMachine;
import com.alibou.deliverychat.booking.BookingStatus;
import com.alibou.deliverychat.chat.ChatFrame;
import com.alibou.deliverychat.chat.ChatMessage;
import com.alibou.deliverychat.chat.ChatMessageService;
import com.alibou.deliverychat.config.ChatProperties;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;
import com.alibou.deliverychat.exception.JoinRejectedException;
import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Реестр соединений всех чатов броней.
 * <p>
 * У каждой брони свой {@link BookingChannel} и своя блокировка: вход, выход,
 * запись с рассылкой и выселение одной брони идут строго по очереди, а разные
 * брони друг друга не ждут. Сообщение рассылается только после того, как
 * хранилище его зафиксировало. Под блокировкой кадры лишь ставятся в очереди
 * соединений, в сокеты их пишет пул {@code chatOutboundExecutor}.
 */
@Slf4j
@Service
public class ChatGateway {

    /** потокобезопасная карта «bookingId → канал»; пустые каналы удаляются */
    private final Map<Long, BookingChannel> channels = new ConcurrentHashMap<>();

    private final BookingLookup      bookings;
    private final ChatMessageService messageService;
    private final ChatAccessPolicy   accessPolicy;
    private final ChatProperties     properties;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;
    private final Executor           outboundExecutor;

    public ChatGateway(BookingLookup bookings,
                       ChatMessageService messageService,
                       ChatAccessPolicy accessPolicy,
                       ChatProperties properties,
                       ObjectMapper objectMapper,
                       Clock clock,
                       @Qualifier("chatOutboundExecutor") Executor outboundExecutor) {
        this.bookings         = bookings;
        this.messageService   = messageService;
        this.accessPolicy     = accessPolicy;
        this.properties       = properties;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
        this.outboundExecutor = outboundExecutor;
    }

    /* =======================================================================
                                   PUBLIC API
       ======================================================================= */

    /**
     * Впускает сокет в канал брони и проигрывает ему историю.
     *
     * @param resumeAfter id последнего сообщения, которое у клиента уже есть;
     *                    null означает последние {@code chat.replay-limit} сообщений
     * @throws JoinRejectedException {@code BOOKING_NOT_FOUND}, {@code NOT_A_PARTICIPANT}
     *                               или {@code CHAT_NOT_ACTIVE}
     * @throws ChatException         {@code PERSISTENCE_FAILURE}, если бронь не прочиталась
     */
    public ChatConnection join(long bookingId, Identity identity, WebSocketSession session, Long resumeAfter) {
        return withChannel(bookingId, true, channel -> {
            BookingRecord booking = readBooking(bookingId)
                    .orElseThrow(() -> new JoinRejectedException(ChatError.BOOKING_NOT_FOUND,
                            "Booking " + bookingId + " not found"));
            accessPolicy.checkJoin(booking, identity);

            ChatConnection connection = new ChatConnection(bookingId, identity, session, clock.instant(),
                    outboundExecutor, properties.getSendTimeLimit(), properties.getSendBufferSizeLimit(),
                    this::dropUnreliable);
            channel.add(connection);
            connection.markOpen();
            log.info("JOIN  ⇢ {} (на брони {} соединений: {})", connection, bookingId, channel.size());

            replay(channel, connection, resumeAfter);
            return connection;
        });
    }

    /**
     * Сохраняет текст и рассылает его всем соединениям брони, включая
     * соединение отправителя.
     */
    public ChatMessage send(ChatConnection connection, String text) {
        long bookingId = connection.getBookingId();
        return withChannel(bookingId, false, channel -> {
            if (channel == null || !channel.contains(connection)) {
                throw new ChatException(ChatError.CHAT_CLOSED,
                        "Connection " + connection.getId() + " is no longer registered on booking " + bookingId);
            }
            Identity sender = connection.getIdentity();
            try {
                BookingRecord booking = readBooking(bookingId)
                        .orElseThrow(() -> new BookingNotFoundException(bookingId));
                accessPolicy.checkSend(booking, sender);

                ChatMessage stored = messageService.append(bookingId, sender, text);
                broadcast(channel, ChatFrame.of(stored));
                return stored;
            } catch (ChatException ex) {
                dropIfRevoked(channel, connection, ex.getError());
                throw ex;
            }
        });
    }

    /** Убирает соединение; повторные вызовы безопасны. */
    public void leave(ChatConnection connection) {
        withChannel(connection.getBookingId(), false, channel -> {
            if (channel != null && channel.remove(connection)) {
                log.info("LEAVE ⇢ {} (на брони {} осталось: {})", connection, connection.getBookingId(), channel.size());
            }
            return null;
        });
        connection.markClosed();
    }

    /**
     * Вызывается после фиксации смены статуса брони. Когда чат перестаёт быть
     * активным, весь канал закрывается с {@code CHAT_CLOSED}.
     *
     * @return сколько соединений выселено
     */
    public int onStatusTransition(long bookingId, BookingStatus newStatus) {
        if (BookingStateMachine.isChatActive(newStatus)) {
            log.debug("Бронь {} перешла в {}, чат остаётся открытым", bookingId, newStatus.wireName());
            return 0;
        }
        int evicted = evict(bookingId, c -> true, ChatError.CHAT_CLOSED);
        log.info("🔒 Бронь {} перешла в {}: чат закрыт, выселено соединений: {}",
                bookingId, newStatus.wireName(), evicted);
        return evicted;
    }

    /**
     * Выселяет соединения прежнего курьера; клиент и администраторы остаются.
     *
     * @return сколько соединений выселено
     */
    public int onPartnerReassigned(long bookingId, String previousPartnerId, String newPartnerId) {
        if (previousPartnerId == null) {
            return 0;
        }
        int evicted = evict(bookingId,
                c -> c.getIdentity().role() == Role.DELIVERY_PARTNER
                        && previousPartnerId.equals(c.getIdentity().id()),
                ChatError.REASSIGNED);
        log.info("🔁 Бронь {} передана {} ↔ {}: выселено соединений: {}",
                bookingId, previousPartnerId, newPartnerId, evicted);
        return evicted;
    }

    /** Отправляет кадр ошибки только этому соединению. */
    public void reject(ChatConnection connection, ChatException error) {
        if (!connection.isOpen()) {
            return;
        }
        if (!connection.enqueue(toText(ChatFrame.error(error.getError(), error.getMessage())), true)) {
            log.warn("⚠️ Не удалось сообщить {} соединению {}", error.getError(), connection);
            dropUnreliable(connection);
        }
    }

    public int connectionCount(long bookingId) {
        return withChannel(bookingId, false, channel -> channel == null ? 0 : channel.size());
    }

    /** Живые каналы для обзора администратора. */
    public List<ChannelSnapshot> snapshot() {
        List<ChannelSnapshot> out = new ArrayList<>();
        for (Long bookingId : channels.keySet()) {
            ChannelSnapshot s = withChannel(bookingId, false, channel -> channel == null ? null
                    : new ChannelSnapshot(bookingId, channel.snapshot().stream()
                            .map(ChannelSnapshot.Member::of)
                            .toList()));
            if (s != null) {
                out.add(s);
            }
        }
        return out;
    }

    /* =======================================================================
                                    INTERNALS
       ======================================================================= */

    /**
     * Выполняет {@code action} под блокировкой брони. При {@code create=false}
     * action получает {@code null}, если канала у брони нет.
     */
    private <T> T withChannel(long bookingId, boolean create, Function<BookingChannel, T> action) {
        while (true) {
            BookingChannel channel = create
                    ? channels.computeIfAbsent(bookingId, BookingChannel::new)
                    : channels.get(bookingId);
            if (channel == null) {
                return action.apply(null);
            }
            channel.lock();
            try {
                if (channel.isRetired()) {
                    continue;           // проиграли гонку с удалением, берём актуальный канал
                }
                return action.apply(channel);
            } finally {
                if (!channel.isRetired() && channel.isEmpty()) {
                    channel.retire();
                    channels.remove(bookingId, channel);
                }
                channel.unlock();
            }
        }
    }

    /**
     * Догоняющая история. При возобновлении листает страницами по
     * {@code chat.history-page-limit}, пока не дойдёт до конца.
     */
    private void replay(BookingChannel channel, ChatConnection connection, Long resumeAfter) {
        long bookingId = connection.getBookingId();
        int replayed = 0;
        if (resumeAfter == null) {
            List<ChatMessage> recent = messageService.listRecent(bookingId, properties.getReplayLimit());
            if (!replayAll(channel, connection, recent)) {
                return;
            }
            replayed = recent.size();
        } else {
            int pageLimit = properties.getHistoryPageLimit();
            long after = resumeAfter;
            List<ChatMessage> page;
            do {
                page = messageService.listSince(bookingId, after, pageLimit);
                if (!replayAll(channel, connection, page)) {
                    return;
                }
                replayed += page.size();
                if (!page.isEmpty()) {
                    after = page.get(page.size() - 1).getId();
                }
            } while (page.size() == pageLimit);
        }
        log.debug("Проиграно сообщений для {}: {}", connection, replayed);
    }

    private boolean replayAll(BookingChannel channel, ChatConnection connection, List<ChatMessage> history) {
        for (ChatMessage m : history) {
            if (!connection.enqueue(toText(ChatFrame.of(m)), false)) {
                log.warn("❌ История для {} не доставлена", connection);
                channel.remove(connection);
                connection.close(CloseStatus.SESSION_NOT_RELIABLE);
                return false;
            }
        }
        return true;
    }

    /**
     * Только ставит кадр в очереди соединений. Соединение, которое зависло на
     * записи или переполнило буфер, выбрасывается, остальные этого не замечают.
     */
    private void broadcast(BookingChannel channel, ChatFrame frame) {
        TextMessage text = toText(frame);
        for (ChatConnection c : channel.snapshot()) {
            if (!c.enqueue(text, true)) {
                log.warn("🐌 Выбрасываем {}: не успевает принимать сообщения", c);
                channel.remove(c);
                c.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        }
    }

    /** Запись в сокет не удалась или пул отправки отказал. */
    private void dropUnreliable(ChatConnection connection) {
        withChannel(connection.getBookingId(), false, channel -> {
            if (channel != null) {
                channel.remove(connection);
            }
            return null;
        });
        connection.close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    /** Бронь на чтение; сбой хранилища становится {@code PERSISTENCE_FAILURE}. */
    private Optional<BookingRecord> readBooking(long bookingId) {
        try {
            return bookings.findRecord(bookingId);
        } catch (DataAccessException ex) {
            log.error("❌ Бронь {} не прочиталась: {}", bookingId, ex.getMessage());
            throw new ChatException(ChatError.PERSISTENCE_FAILURE, "Booking " + bookingId + " is unavailable", ex);
        }
    }

    private int evict(long bookingId, Predicate<ChatConnection> filter, ChatError reason) {
        return withChannel(bookingId, false, channel -> {
            if (channel == null) {
                return 0;
            }
            List<ChatConnection> victims = channel.snapshot().stream().filter(filter).toList();
            for (ChatConnection c : victims) {
                channel.remove(c);
                c.close(reason.closeStatus());
            }
            return victims.size();
        });
    }

    /** Ошибки отправки, после которых соединению здесь больше не место. */
    private void dropIfRevoked(BookingChannel channel, ChatConnection connection, ChatError error) {
        ChatError closeWith = switch (error) {
            case REASSIGNED, NOT_A_PARTICIPANT, BOOKING_NOT_FOUND -> error;
            case CHAT_NOT_ACTIVE -> connection.getIdentity().isAdministrator() ? null : ChatError.CHAT_CLOSED;
            default -> null;
        };
        if (closeWith != null) {
            channel.remove(connection);
            connection.close(closeWith.closeStatus());
            log.info("Соединение {} закрыто при отправке: {}", connection, closeWith);
        }
    }

    private TextMessage toText(ChatFrame frame) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize chat frame", ex);
        }
    }
}
