package com.alibou.deliverychat.booking.dto;

import jakarta.validation.constraints.NotBlank;

public record AssignPartnerRequest(@NotBlank String partnerId) {
}
