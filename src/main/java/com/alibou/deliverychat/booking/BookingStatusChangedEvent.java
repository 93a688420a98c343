package com.alibou.deliverychat.booking;

public record BookingStatusChangedEvent(long bookingId,
                                        BookingStatus from,
                                        BookingStatus to,
                                        String actorId) {
}
