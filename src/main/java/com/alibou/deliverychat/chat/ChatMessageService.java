package com.alibou.deliverychat.chat;

import com.alibou.deliverychat.booking.BookingLookup;
import com.alibou.deliverychat.booking.BookingNotFoundException;
import com.alibou.deliverychat.booking.BookingRecord;
import com.alibou.deliverychat.booking.BookingStateMachine;
import com.alibou.deliverychat.config.ChatProperties;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;
import com.alibou.deliverychat.user.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Хранилище сообщений, только дозапись.
 *
 *  • записи одной брони идут по очереди, поэтому порядок id совпадает с порядком вставки
 *  • активность чата проверяется по свежей брони при каждой записи
 *  • ничего не меняется и не удаляется; прочитанность хранится в {@link ChatReadMarker}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatMessageService {

    private static final int LOCK_STRIPES = 64;

    private final ChatMessageRepository    messages;
    private final ChatReadMarkerRepository readMarkers;
    private final BookingLookup            bookings;
    private final ChatProperties           properties;
    private final Clock                    clock;

    /** id брони → полоса; число блокировок ограничено */
    private final ReentrantLock[] appendLocks = newStripes();

    /* =======================================================================
                                   WRITE
       ======================================================================= */

    /**
     * Проверяет сообщение и надёжно его сохраняет.
     *
     * @throws ChatException {@code VALIDATION_ERROR}, {@code BOOKING_NOT_FOUND},
     *                       {@code CHAT_NOT_ACTIVE} или {@code PERSISTENCE_FAILURE}
     */
    public ChatMessage append(long bookingId, Identity sender, String text) {
        String content = validate(text);

        ReentrantLock lock = appendLocks[Math.floorMod(Long.hashCode(bookingId), LOCK_STRIPES)];
        lock.lock();
        try {
            BookingRecord booking = bookings.findRecord(bookingId)
                    .orElseThrow(() -> new BookingNotFoundException(bookingId));
            if (!BookingStateMachine.isChatActive(booking.status())) {
                throw new ChatException(ChatError.CHAT_NOT_ACTIVE,
                        "Chat for booking " + bookingId + " is closed (status " + booking.status().wireName() + ")");
            }

            ChatMessage saved = messages.save(ChatMessage.builder()
                    .bookingId(bookingId)
                    .senderId(sender.id())
                    .senderRole(sender.role())
                    .senderName(sender.displayName())
                    .recipientId(booking.counterpartOf(sender))
                    .content(content)
                    .createdAt(nextTimestamp(bookingId))
                    .build());

            log.info("💾 Сообщение {} сохранено в брони {} ({} → {})",
                    saved.getId(), bookingId, sender.id(), saved.getRecipientId());
            return saved;
        } catch (DataAccessException ex) {
            throw new ChatException(ChatError.PERSISTENCE_FAILURE,
                    "Message for booking " + bookingId + " was not stored", ex);
        } finally {
            lock.unlock();
        }
    }

    /* =======================================================================
                                   READ
       ======================================================================= */

    /** Сообщения с id больше {@code afterMessageId}, старые сверху. */
    public List<ChatMessage> listSince(long bookingId, long afterMessageId, int limit) {
        return read(() -> messages.findByBookingIdAndIdGreaterThanOrderByIdAsc(
                bookingId, afterMessageId, PageRequest.of(0, clamp(limit))));
    }

    /** Сообщения, созданные строго после {@code after}, старые сверху. */
    public List<ChatMessage> listSince(long bookingId, Instant after, int limit) {
        return read(() -> messages.findByBookingIdAndCreatedAtAfterOrderByIdAsc(
                bookingId, after, PageRequest.of(0, clamp(limit))));
    }

    /** Последние {@code limit} сообщений, старые сверху. */
    public List<ChatMessage> listRecent(long bookingId, int limit) {
        List<ChatMessage> newestFirst = read(() -> messages.findByBookingIdOrderByIdDesc(
                bookingId, PageRequest.of(0, clamp(limit))));
        List<ChatMessage> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    /* =======================================================================
                                READ MARKERS
       ======================================================================= */

    /** Отмечает всё, что сейчас есть в чате брони, прочитанным для {@code readerId}. */
    @Transactional
    public long markRead(long bookingId, String readerId) {
        long latest = messages.findFirstByBookingIdOrderByIdDesc(bookingId)
                .map(ChatMessage::getId)
                .orElse(0L);

        ChatReadMarker marker = readMarkers.findByBookingIdAndParticipantId(bookingId, readerId)
                .orElseGet(() -> ChatReadMarker.builder()
                        .bookingId(bookingId)
                        .participantId(readerId)
                        .lastReadMessageId(0L)
                        .build());
        if (latest > marker.getLastReadMessageId()) {
            marker.setLastReadMessageId(latest);
            marker.setUpdatedAt(clock.instant());
            readMarkers.save(marker);
            log.debug("Бронь {}: {} прочитал до сообщения {}", bookingId, readerId, latest);
        }
        return marker.getLastReadMessageId();
    }

    /** Чужие сообщения после отметки читателя. */
    @Transactional(readOnly = true)
    public long countUnread(long bookingId, String readerId) {
        long lastRead = readMarkers.findByBookingIdAndParticipantId(bookingId, readerId)
                .map(ChatReadMarker::getLastReadMessageId)
                .orElse(0L);
        return messages.countByBookingIdAndIdGreaterThanAndSenderIdNot(bookingId, lastRead, readerId);
    }

    /* =======================================================================
                                  HELPERS
       ======================================================================= */

    private String validate(String text) {
        if (text == null || text.isBlank()) {
            throw new ChatException(ChatError.VALIDATION_ERROR, "Message must not be empty");
        }
        String content = text.strip();
        if (content.length() > properties.getMaxMessageLength()) {
            throw new ChatException(ChatError.VALIDATION_ERROR,
                    "Message exceeds " + properties.getMaxMessageLength() + " characters");
        }
        return content;
    }

    /** Время сервера, сдвинутое вперёд, чтобы внутри брони оно не шло назад. */
    private Instant nextTimestamp(long bookingId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return messages.findFirstByBookingIdOrderByIdDesc(bookingId)
                .map(ChatMessage::getCreatedAt)
                .filter(last -> !now.isAfter(last))
                .map(last -> last.plus(1, ChronoUnit.MICROS))
                .orElse(now);
    }

    private int clamp(int limit) {
        return Math.max(1, Math.min(limit, properties.getHistoryPageLimit()));
    }

    private List<ChatMessage> read(Supplier<List<ChatMessage>> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new ChatException(ChatError.PERSISTENCE_FAILURE, "Chat history unavailable", ex);
        }
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
