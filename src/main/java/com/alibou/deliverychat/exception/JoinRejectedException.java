package com.alibou.deliverychat.exception;

/** Вход отклонён; окончательно, пока бронь не изменится. */
public class JoinRejectedException extends ChatException {

    public JoinRejectedException(ChatError error, String message) {
        super(error, message);
    }
}
