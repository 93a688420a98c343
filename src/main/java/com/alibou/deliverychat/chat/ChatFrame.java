package com.alibou.deliverychat.chat;

import com.alibou.deliverychat.exception.ChatError;
import com.alibou.deliverychat.user.Role;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Кадр сервер → клиент: сообщение чата или ошибка, адресованная только
 * тому соединению, которое её вызвало.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatFrame {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_ERROR   = "error";

    private String type;

    @JsonProperty("message_id")
    private Long messageId;

    @JsonProperty("booking_id")
    private Long bookingId;

    @JsonProperty("sender_id")
    private String senderId;

    @JsonProperty("sender_name")
    private String senderName;

    @JsonProperty("sender_role")
    private Role senderRole;

    private String message;

    /** ISO-8601 */
    private String timestamp;

    private String code;

    private String detail;

    public static ChatFrame of(ChatMessage m) {
        return ChatFrame.builder()
                .type(TYPE_MESSAGE)
                .messageId(m.getId())
                .bookingId(m.getBookingId())
                .senderId(m.getSenderId())
                .senderName(m.getSenderName())
                .senderRole(m.getSenderRole())
                .message(m.getContent())
                .timestamp(m.getCreatedAt().toString())
                .build();
    }

    public static ChatFrame error(ChatError error, String detail) {
        return ChatFrame.builder()
                .type(TYPE_ERROR)
                .code(error.code())
                .detail(detail)
                .build();
    }

    @JsonIgnore
    public boolean isError() {
        return TYPE_ERROR.equals(type);
    }
}
