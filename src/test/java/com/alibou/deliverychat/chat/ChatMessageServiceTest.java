package com.alibou.deliverychat.chat;

import com.alibou.deliverychat.booking.BookingLookup;
import com.alibou.deliverychat.booking.BookingRecord;
import com.alibou.deliverychat.booking.BookingStatus;
import com.alibou.deliverychat.config.ChatProperties;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;
import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
class ChatMessageServiceTest {

    private static final long BOOKING = 42L;
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static final Identity CUSTOMER = new Identity("c-1", Role.CUSTOMER, "Carla");
    private static final Identity PARTNER  = new Identity("p-1", Role.DELIVERY_PARTNER, "Pavel");
    private static final Identity ADMIN    = Identity.of("ops", Role.ADMINISTRATOR);

    @Autowired
    private ChatMessageRepository messages;

    @Autowired
    private ChatReadMarkerRepository readMarkers;

    private final BookingLookup bookings = mock(BookingLookup.class);
    private final ChatProperties properties = new ChatProperties();

    private ChatMessageService service;

    @BeforeEach
    void setUp() {
        properties.setMaxMessageLength(20);
        service = new ChatMessageService(messages, readMarkers, bookings, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        withStatus(BookingStatus.STARTED);
    }

    @Test
    void appendStoresStrippedTextWithServerSideSender() {
        ChatMessage stored = service.append(BOOKING, CUSTOMER, "  where are you?  ");

        assertThat(stored.getId()).isNotNull();
        assertThat(stored.getContent()).isEqualTo("where are you?");
        assertThat(stored.getSenderId()).isEqualTo("c-1");
        assertThat(stored.getSenderRole()).isEqualTo(Role.CUSTOMER);
        assertThat(stored.getSenderName()).isEqualTo("Carla");
        assertThat(stored.getRecipientId()).isEqualTo("p-1");
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void idsAndTimestampsFollowAppendOrder() {
        ChatMessage first  = service.append(BOOKING, CUSTOMER, "one");
        ChatMessage second = service.append(BOOKING, PARTNER, "two");
        ChatMessage third  = service.append(BOOKING, CUSTOMER, "three");

        assertThat(first.getId()).isLessThan(second.getId());
        assertThat(second.getId()).isLessThan(third.getId());
        // same clock reading: later messages are nudged forward, never backwards
        assertThat(second.getCreatedAt()).isAfter(first.getCreatedAt());
        assertThat(third.getCreatedAt()).isAfter(second.getCreatedAt());
    }

    @Test
    void administratorMessagesHaveNoRecipient() {
        ChatMessage stored = service.append(BOOKING, ADMIN, "ops here");

        assertThat(stored.getRecipientId()).isNull();
        assertThat(stored.getSenderName()).isEqualTo("ops");
    }

    @Test
    void blankAndOversizedTextIsRejectedAndNotStored() {
        assertThatThrownBy(() -> service.append(BOOKING, CUSTOMER, "   "))
                .isInstanceOf(ChatException.class)
                .extracting(ex -> ((ChatException) ex).getError())
                .isEqualTo(ChatError.VALIDATION_ERROR);
        assertThatThrownBy(() -> service.append(BOOKING, CUSTOMER, null))
                .extracting(ex -> ((ChatException) ex).getError())
                .isEqualTo(ChatError.VALIDATION_ERROR);
        assertThatThrownBy(() -> service.append(BOOKING, CUSTOMER, "x".repeat(21)))
                .extracting(ex -> ((ChatException) ex).getError())
                .isEqualTo(ChatError.VALIDATION_ERROR);

        assertThat(service.listRecent(BOOKING, 10)).isEmpty();
    }

    @Test
    void textAtTheLimitIsAccepted() {
        assertThat(service.append(BOOKING, CUSTOMER, "x".repeat(20)).getContent()).hasSize(20);
    }

    @Test
    void appendOutsideChatActiveStatusesIsRejected() {
        for (BookingStatus status : List.of(BookingStatus.PENDING, BookingStatus.DELIVERED, BookingStatus.CANCELLED)) {
            withStatus(status);
            assertThatThrownBy(() -> service.append(BOOKING, ADMIN, "hello"))
                    .extracting(ex -> ((ChatException) ex).getError())
                    .isEqualTo(ChatError.CHAT_NOT_ACTIVE);
        }
        assertThat(messages.count()).isZero();
    }

    @Test
    void appendToUnknownBookingIsRejected() {
        when(bookings.findRecord(anyLong())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.append(BOOKING, CUSTOMER, "hello"))
                .extracting(ex -> ((ChatException) ex).getError())
                .isEqualTo(ChatError.BOOKING_NOT_FOUND);
    }

    @Test
    void listSinceReturnsExactlyTheTail() {
        ChatMessage m1 = service.append(BOOKING, CUSTOMER, "m1");
        ChatMessage m2 = service.append(BOOKING, PARTNER, "m2");
        ChatMessage m3 = service.append(BOOKING, CUSTOMER, "m3");

        assertThat(service.listSince(BOOKING, m1.getId(), 50))
                .extracting(ChatMessage::getContent)
                .containsExactly("m2", "m3");
        assertThat(service.listSince(BOOKING, m3.getId(), 50)).isEmpty();
        assertThat(service.listSince(BOOKING, 0L, 2))
                .extracting(ChatMessage::getId)
                .containsExactly(m1.getId(), m2.getId());
    }

    @Test
    void listSinceByTimestampIsExclusive() {
        ChatMessage m1 = service.append(BOOKING, CUSTOMER, "m1");
        service.append(BOOKING, PARTNER, "m2");

        assertThat(service.listSince(BOOKING, m1.getCreatedAt(), 50))
                .extracting(ChatMessage::getContent)
                .containsExactly("m2");
    }

    @Test
    void listRecentReturnsNewestPageInAscendingOrder() {
        for (int i = 1; i <= 5; i++) {
            service.append(BOOKING, CUSTOMER, "m" + i);
        }

        assertThat(service.listRecent(BOOKING, 3))
                .extracting(ChatMessage::getContent)
                .containsExactly("m3", "m4", "m5");
    }

    @Test
    void bookingsDoNotSeeEachOthersMessages() {
        service.append(BOOKING, CUSTOMER, "mine");
        when(bookings.findRecord(7L)).thenReturn(Optional.of(
                new BookingRecord(7L, "c-2", "p-2", BookingStatus.ASSIGNED, NOW)));
        service.append(7L, new Identity("c-2", Role.CUSTOMER, null), "theirs");

        assertThat(service.listRecent(BOOKING, 10)).extracting(ChatMessage::getContent).containsExactly("mine");
        assertThat(service.listRecent(7L, 10)).extracting(ChatMessage::getContent).containsExactly("theirs");
    }

    @Test
    void unreadCountsOnlyOtherPeoplesMessagesAfterTheMarker() {
        service.append(BOOKING, CUSTOMER, "hi");
        service.append(BOOKING, PARTNER, "on my way");
        service.append(BOOKING, PARTNER, "at pickup");

        assertThat(service.countUnread(BOOKING, "c-1")).isEqualTo(2);
        assertThat(service.countUnread(BOOKING, "p-1")).isEqualTo(1);

        long marker = service.markRead(BOOKING, "c-1");
        assertThat(service.countUnread(BOOKING, "c-1")).isZero();

        ChatMessage later = service.append(BOOKING, PARTNER, "collected");
        assertThat(later.getId()).isGreaterThan(marker);
        assertThat(service.countUnread(BOOKING, "c-1")).isEqualTo(1);
    }

    @Test
    void markReadOnEmptyChatLeavesMarkerAtZero() {
        assertThat(service.markRead(BOOKING, "c-1")).isZero();
        assertThat(readMarkers.findByBookingIdAndParticipantId(BOOKING, "c-1")).isEmpty();
    }

    private void withStatus(BookingStatus status) {
        when(bookings.findRecord(BOOKING)).thenReturn(Optional.of(
                new BookingRecord(BOOKING, "c-1", "p-1", status, NOW)));
    }
}
