package com.alibou.deliverychat.booking;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Одна принятая смена статуса (или смена курьера, тогда from == to). */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "booking_status_log", indexes = @Index(name = "idx_status_log_booking", columnList = "booking_id"))
public class BookingStatusLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private BookingStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus toStatus;

    private String actorId;

    @Column(length = 2000)
    private String note;

    @Column(nullable = false)
    private Instant createdAt;
}
