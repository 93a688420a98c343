package com.alibou.deliverychat.booking.dto;

import com.alibou.deliverychat.booking.BookingStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record StatusUpdateRequest(@NotNull BookingStatus status, @Size(max = 2000) String note) {
}
