package com.alibou.deliverychat.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Кадр клиент → сервер. Поля отправителя, если клиент их прислал, игнорируются. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundChatMessage {
    private String message;
}
