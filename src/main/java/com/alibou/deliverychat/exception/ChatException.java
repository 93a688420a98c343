package com.alibou.deliverychat.exception;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatError error;

    public ChatException(ChatError error, String message) {
        super(message);
        this.error = error;
    }

    public ChatException(ChatError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
