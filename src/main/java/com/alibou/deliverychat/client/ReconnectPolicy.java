package com.alibou.deliverychat.client;

import com.alibou.deliverychat.config.ChatProperties;

import java.time.Duration;

/** Бюджет повторов с постоянной задержкой для неожиданных обрывов. */
public record ReconnectPolicy(Duration delay, int maxAttempts) {

    public ReconnectPolicy {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
    }

    public static ReconnectPolicy from(ChatProperties.Client client) {
        return new ReconnectPolicy(client.getReconnectDelay(), client.getMaxReconnectAttempts());
    }

    public static ReconnectPolicy defaults() {
        return from(new ChatProperties.Client());
    }

    /** Можно ли ещё одну попытку после {@code attemptsSoFar}. */
    public boolean allowsAnother(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }
}
