package com.alibou.deliverychat.booking;

import java.util.Optional;

/** Текущее состояние брони, читается заново при каждом вызове. */
public interface BookingLookup {

    Optional<BookingRecord> findRecord(long bookingId);
}
