package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.booking.BookingRecord;
import com.alibou.deliverychat.booking.BookingStateMachine;
import com.alibou.deliverychat.config.ChatProperties;
import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;
import com.alibou.deliverychat.exception.JoinRejectedException;
import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Кто может войти в чат брони, писать в него и читать его. Решение всегда
 * принимается по только что прочитанному {@link BookingRecord}.
 */
@Component
@RequiredArgsConstructor
public class ChatAccessPolicy {

    private final ChatProperties properties;

    /**
     * Клиент или текущий курьер, пока чат активен; администратор при любом
     * статусе.
     */
    public void checkJoin(BookingRecord booking, Identity identity) {
        if (identity.isAdministrator()) {
            return;
        }
        if (!booking.isParticipant(identity)) {
            throw new JoinRejectedException(ChatError.NOT_A_PARTICIPANT,
                    identity.id() + " is not a participant of booking " + booking.id());
        }
        if (!BookingStateMachine.isChatActive(booking.status())) {
            throw new JoinRejectedException(ChatError.CHAT_NOT_ACTIVE,
                    "Chat for booking " + booking.id() + " is not active (status " + booking.status().wireName() + ")");
        }
    }

    /** Активность чата проверяет хранилище в момент записи, не здесь. */
    public void checkSend(BookingRecord booking, Identity identity) {
        if (identity.isAdministrator()) {
            if (properties.getAdminMode() != ChatProperties.AdminMode.PARTICIPATE) {
                throw new ChatException(ChatError.FORBIDDEN, "Administrators observe this chat read-only");
            }
            return;
        }
        if (booking.isParticipant(identity)) {
            return;
        }
        if (identity.role() == Role.DELIVERY_PARTNER) {
            throw new ChatException(ChatError.REASSIGNED,
                    "Booking " + booking.id() + " is now assigned to another partner");
        }
        throw new ChatException(ChatError.NOT_A_PARTICIPANT,
                identity.id() + " is not a participant of booking " + booking.id());
    }

    public void checkRead(BookingRecord booking, Identity identity) {
        if (!booking.isVisibleTo(identity)) {
            throw new SecurityException("Chat of booking " + booking.id() + " is not accessible");
        }
    }
}
