package com.alibou.deliverychat.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.socket.CloseStatus;

import java.util.Arrays;

/**
 * Классификация отказов ядра чата. Коды 4000-4099 это прикладные коды
 * закрытия, по которым клиент отличает закрытие по правилам от обрыва сети.
 */
public enum ChatError {
    CHAT_CLOSED("chat_closed", 4000, HttpStatus.CONFLICT),
    REASSIGNED("reassigned", 4001, HttpStatus.FORBIDDEN),
    NOT_A_PARTICIPANT("not_a_participant", 4003, HttpStatus.FORBIDDEN),
    BOOKING_NOT_FOUND("booking_not_found", 4004, HttpStatus.NOT_FOUND),
    CHAT_NOT_ACTIVE("chat_not_active", 4009, HttpStatus.CONFLICT),
    FORBIDDEN("forbidden", 4013, HttpStatus.FORBIDDEN),
    VALIDATION_ERROR("validation_error", 0, HttpStatus.BAD_REQUEST),
    PERSISTENCE_FAILURE("persistence_failure", 0, HttpStatus.SERVICE_UNAVAILABLE),
    CONNECTION_LOST("connection_lost", 0, HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final int closeCode;
    private final HttpStatus httpStatus;

    ChatError(String code, int closeCode, HttpStatus httpStatus) {
        this.code = code;
        this.closeCode = closeCode;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int closeCode() {
        return closeCode;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    /** Статус закрытия, с которым сервер обрывает соединение по этой причине. */
    public CloseStatus closeStatus() {
        return closeCode == 0 ? CloseStatus.SERVER_ERROR : new CloseStatus(closeCode, code);
    }

    /** Всё, что не наш прикладной код закрытия, считается обрывом связи. */
    public static ChatError fromCloseCode(int closeCode) {
        return Arrays.stream(values())
                .filter(e -> e.closeCode != 0 && e.closeCode == closeCode)
                .findFirst()
                .orElse(CONNECTION_LOST);
    }
}
