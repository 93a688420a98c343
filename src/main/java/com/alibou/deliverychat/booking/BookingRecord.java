package com.alibou.deliverychat.booking;

import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;

import java.time.Instant;

/**
 * Бронь глазами ядра чата, только для чтения.
 */
public record BookingRecord(long id,
                            String customerId,
                            String partnerId,
                            BookingStatus status,
                            Instant createdAt) {

    public boolean isCustomer(Identity identity) {
        return identity.role() == Role.CUSTOMER && identity.id().equals(customerId);
    }

    public boolean isAssignedPartner(Identity identity) {
        return identity.role() == Role.DELIVERY_PARTNER && partnerId != null && identity.id().equals(partnerId);
    }

    /** Клиент или назначенный сейчас курьер. */
    public boolean isParticipant(Identity identity) {
        return isCustomer(identity) || isAssignedPartner(identity);
    }

    public boolean isVisibleTo(Identity identity) {
        return identity.isAdministrator() || isParticipant(identity);
    }

    /** Собеседник в паре клиент/курьер; null для администратора. */
    public String counterpartOf(Identity identity) {
        if (isCustomer(identity)) {
            return partnerId;
        }
        if (isAssignedPartner(identity)) {
            return customerId;
        }
        return null;
    }
}
