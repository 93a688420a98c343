package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.booking.BookingStatusChangedEvent;
import com.alibou.deliverychat.booking.PartnerReassignedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Передаёт зафиксированные изменения броней в {@link ChatGateway}. Работает
 * после коммита, чтобы переподключившийся уже видел новый статус.
 */
@Component
@RequiredArgsConstructor
public class BookingChannelEvents {

    private final ChatGateway gateway;

    @TransactionalEventListener(fallbackExecution = true)
    public void onStatusChanged(BookingStatusChangedEvent event) {
        gateway.onStatusTransition(event.bookingId(), event.to());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onPartnerReassigned(PartnerReassignedEvent event) {
        gateway.onPartnerReassigned(event.bookingId(), event.previousPartnerId(), event.newPartnerId());
    }
}
