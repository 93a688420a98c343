package com.alibou.deliverychat.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBookingRequest(
        @NotBlank @Size(max = 1000) String pickupAddress,
        @NotBlank @Size(max = 1000) String deliveryAddress,
        @Size(max = 2000) String notes) {
}
