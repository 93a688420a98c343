package com.alibou.deliverychat.client;

/** Индикатор соединения рядом с чатом. */
public enum IndicatorState {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    /** сдались или получили отказ; нужна перезагрузка */
    DISCONNECTED,
    /** доставка завершена или отменена; окончательно */
    CHAT_CLOSED
}
