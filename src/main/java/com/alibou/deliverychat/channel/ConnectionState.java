package com.alibou.deliverychat.channel;

/** Жизненный цикл одного соединения участника; отслеживается на обоих концах сокета. */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
