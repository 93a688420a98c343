package com.alibou.deliverychat.chat;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/** До какого места участник прочитал чат брони. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "chat_read_marker",
        uniqueConstraints = @UniqueConstraint(columnNames = {"booking_id", "participant_id"}))
public class ChatReadMarker {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "participant_id", nullable = false)
    private String participantId;

    @Column(nullable = false)
    private Long lastReadMessageId;

    private Instant updatedAt;
}
