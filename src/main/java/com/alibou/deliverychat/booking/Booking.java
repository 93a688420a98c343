package com.alibou.deliverychat.booking;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "booking")
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String customerId;

    /** null до назначения; так и остаётся null, если бронь отменили в PENDING */
    private String partnerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(length = 1000)
    private String pickupAddress;

    @Column(length = 1000)
    private String deliveryAddress;

    @Column(length = 2000)
    private String customerNotes;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;
    private Instant assignedAt;
    private Instant startedAt;
    private Instant reachedAt;
    private Instant collectedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;

    @Column(length = 2000)
    private String cancellationReason;

    /** оптимистическая блокировка: параллельные смены статуса не затирают друг друга */
    @Version
    @Column(name = "version")
    private Long version;

    public BookingRecord toRecord() {
        return new BookingRecord(id, customerId, partnerId, status, createdAt);
    }
}
