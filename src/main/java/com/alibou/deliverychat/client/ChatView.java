package com.alibou.deliverychat.client;

import com.alibou.deliverychat.chat.ChatFrame;

/**
 * Что должна уметь показать страница чата. Вызывается под блокировкой
 * контроллера, поэтому реализация передаёт работу своему UI-потоку.
 */
public interface ChatView {

    void render(ChatFrame message);

    /** Пришло сообщение от собеседника. */
    void notifyIncoming(ChatFrame message);

    void showIndicator(IndicatorState state);

    void clearInput();

    void scrollToLatest();

    void showReloadPrompt();

    void showSendFailure(String code, String detail);
}
