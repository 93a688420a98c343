package com.alibou.deliverychat.client;

import com.alibou.deliverychat.chat.ChatFrame;

/**
 * Колбэки одной попытки подключения. {@link #onClose} вызывается ровно один
 * раз на попытку, даже если соединение так и не открылось.
 */
public interface ChatTransportListener {

    void onOpen(ChatLink link);

    void onFrame(ChatFrame frame);

    void onClose(int code, String reason);
}
