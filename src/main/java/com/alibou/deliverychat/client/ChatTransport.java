package com.alibou.deliverychat.client;

public interface ChatTransport {

    /**
     * Запускает асинхронную попытку подключения.
     *
     * @param resumeAfter id последнего показанного сообщения или null для новой страницы
     */
    void connect(long bookingId, Long resumeAfter, ChatTransportListener listener);
}
