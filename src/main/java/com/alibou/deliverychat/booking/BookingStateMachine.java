package com.alibou.deliverychat.booking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Правила жизненного цикла брони: какие переходы допустимы и в каких
 * статусах разрешены чат и отмена.
 * <p>
 * Без состояния: текущий статус передаётся при каждом вызове, и ни одно
 * решение не переживает статус, для которого принято.
 */
public final class BookingStateMachine {

    private static final Set<BookingStatus> CHAT_ACTIVE = Collections.unmodifiableSet(EnumSet.of(
            BookingStatus.ASSIGNED, BookingStatus.STARTED, BookingStatus.REACHED, BookingStatus.COLLECTED));

    private static final Set<BookingStatus> CANCELLABLE = Collections.unmodifiableSet(EnumSet.of(
            BookingStatus.PENDING, BookingStatus.ASSIGNED));

    private static final Map<BookingStatus, Set<BookingStatus>> NEXT = new EnumMap<>(BookingStatus.class);

    static {
        NEXT.put(BookingStatus.PENDING, EnumSet.of(BookingStatus.ASSIGNED, BookingStatus.CANCELLED));
        NEXT.put(BookingStatus.ASSIGNED, EnumSet.of(BookingStatus.STARTED, BookingStatus.CANCELLED));
        NEXT.put(BookingStatus.STARTED, EnumSet.of(BookingStatus.REACHED));
        NEXT.put(BookingStatus.REACHED, EnumSet.of(BookingStatus.COLLECTED));
        NEXT.put(BookingStatus.COLLECTED, EnumSet.of(BookingStatus.DELIVERED));
        NEXT.put(BookingStatus.DELIVERED, EnumSet.noneOf(BookingStatus.class));
        NEXT.put(BookingStatus.CANCELLED, EnumSet.noneOf(BookingStatus.class));
    }

    private BookingStateMachine() {
    }

    public static boolean isChatActive(BookingStatus status) {
        return CHAT_ACTIVE.contains(status);
    }

    public static boolean isCancellable(BookingStatus status) {
        return CANCELLABLE.contains(status);
    }

    /** Статусы, достижимые за один шаг; для конечных пусто. */
    public static Set<BookingStatus> nextValidStatuses(BookingStatus status) {
        return Collections.unmodifiableSet(NEXT.get(status));
    }

    /**
     * Проверяет запрошенный переход.
     *
     * @return {@code true}, если статус меняется; {@code false}, если бронь
     *         уже в {@code to} (повторный запрос)
     * @throws InvalidTransitionException если {@code to} недостижим из {@code from}
     */
    public static boolean transition(BookingStatus from, BookingStatus to) {
        if (from == to) {
            return false;
        }
        if (!NEXT.get(from).contains(to)) {
            throw new InvalidTransitionException(from, to);
        }
        return true;
    }
}
