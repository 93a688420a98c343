package com.alibou.deliverychat.client;

import java.io.IOException;

/** Открытый сокет к чату одной брони. */
public interface ChatLink {

    void send(String text) throws IOException;

    /** Обычное закрытие по инициативе этой стороны. */
    void close();

    /** {@code false}, как только сокет закрыт, даже если onClose ещё не пришёл. */
    boolean isOpen();
}
