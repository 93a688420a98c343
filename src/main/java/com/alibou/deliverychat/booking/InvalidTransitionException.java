package com.alibou.deliverychat.booking;

import lombok.Getter;

@Getter
public class InvalidTransitionException extends RuntimeException {

    private final BookingStatus from;
    private final BookingStatus to;

    public InvalidTransitionException(BookingStatus from, BookingStatus to) {
        super("Invalid booking transition " + from.wireName() + " -> " + to.wireName());
        this.from = from;
        this.to = to;
    }
}
