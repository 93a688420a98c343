package com.alibou.deliverychat.exception;

import java.time.LocalDateTime;

public record ErrorResponse(
        int status,
        String code,
        String message,
        String timestamp) {
    public ErrorResponse(int status, String code, String message) {
        this(status, code, message, LocalDateTime.now().toString());
    }
}
