package com.alibou.deliverychat.booking;

import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.exception.ChatException;

public class BookingNotFoundException extends ChatException {

    public BookingNotFoundException(long bookingId) {
        super(ChatError.BOOKING_NOT_FOUND, "Booking " + bookingId + " not found");
    }
}
