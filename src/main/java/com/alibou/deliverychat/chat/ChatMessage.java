package com.alibou.deliverychat.chat;

import com.alibou.deliverychat.user.Role;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Сохранённое сообщение. Пишется один раз через {@link ChatMessageService} и
 * больше не меняется; {@code id} задаёт порядок внутри брони.
 */
@Getter
@Builder
@ToString(exclude = "content")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Table(name = "chat_message",
        indexes = @Index(name = "idx_chat_message_booking", columnList = "booking_id, id"))
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private Long bookingId;

    @Column(nullable = false, updatable = false)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Role senderRole;

    @Column(updatable = false)
    private String senderName;

    /** собеседник отправителя; null, если пишет администратор */
    @Column(updatable = false)
    private String recipientId;

    @Column(nullable = false, updatable = false, length = 4000)
    private String content;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
