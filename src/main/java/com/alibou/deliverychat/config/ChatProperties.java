package com.alibou.deliverychat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /** Самое длинное допустимое сообщение, в символах */
    private int maxMessageLength = 2000;

    /** Сколько сообщений проигрывается новому соединению */
    private int replayLimit = 50;

    /** Предел одной страницы истории (REST и догоняющее проигрывание) */
    private int historyPageLimit = 200;

    private AdminMode adminMode = AdminMode.PARTICIPATE;

    /** Соединение, чья запись в сокет висит дольше, выбрасывается */
    private Duration sendTimeLimit = Duration.ofSeconds(5);

    /** Байты в исходящей очереди одного соединения, сверх которых оно выбрасывается */
    private int sendBufferSizeLimit = 512 * 1024;

    /** Потоки пула, который пишет кадры в сокеты */
    private int outboundThreads = 4;

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private Client client = new Client();

    /** Что администратору можно в канале, пока чат активен. */
    public enum AdminMode {
        /** только наблюдает */
        OBSERVE,
        /** те же права, что у участников брони */
        PARTICIPATE
    }

    @Data
    public static class Client {
        private Duration reconnectDelay = Duration.ofSeconds(3);
        private int maxReconnectAttempts = 5;
    }
}
