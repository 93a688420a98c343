package com.alibou.deliverychat.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Статусы жизненного цикла брони.
 *
 * <pre>
 * PENDING → ASSIGNED → STARTED → REACHED → COLLECTED → DELIVERED
 * PENDING → CANCELLED, ASSIGNED → CANCELLED
 * </pre>
 */
public enum BookingStatus {
    /** Создана клиентом, курьера ещё нет */
    PENDING("pending"),
    /** Курьера назначил администратор */
    ASSIGNED("assigned"),
    /** Курьер едет к адресу забора */
    STARTED("started"),
    /** Курьер на адресе забора */
    REACHED("reached"),
    /** Посылка забрана */
    COLLECTED("collected"),
    /** Конечный: вручено получателю */
    DELIVERED("delivered"),
    /** Конечный: отменено до начала забора */
    CANCELLED("cancelled");

    private final String wireName;

    BookingStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static BookingStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking status: " + value));
    }

    /** Из этого статуса переходов больше нет. */
    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }
}
