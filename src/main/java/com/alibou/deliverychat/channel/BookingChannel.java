package com.alibou.deliverychat.channel;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Соединения одной брони. Все методы, кроме {@link #lock()}, вызываются под
 * блокировкой. Списанный канал уже удалён из реестра и новых соединений не
 * принимает.
 */
final class BookingChannel {

    @Getter
    private final long bookingId;

    /** реентерабельная: закрытие сокета может вернуться в leave() в том же потоке */
    private final ReentrantLock lock = new ReentrantLock();

    private final Set<ChatConnection> connections = new LinkedHashSet<>();

    private boolean retired;

    BookingChannel(long bookingId) {
        this.bookingId = bookingId;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    void add(ChatConnection connection) {
        connections.add(connection);
    }

    boolean remove(ChatConnection connection) {
        return connections.remove(connection);
    }

    boolean contains(ChatConnection connection) {
        return connections.contains(connection);
    }

    boolean isEmpty() {
        return connections.isEmpty();
    }

    int size() {
        return connections.size();
    }

    List<ChatConnection> snapshot() {
        return new ArrayList<>(connections);
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
