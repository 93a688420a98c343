package com.alibou.deliverychat.chat;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    List<ChatMessage> findByBookingIdAndIdGreaterThanOrderByIdAsc(Long bookingId, Long afterId, Pageable page);

    List<ChatMessage> findByBookingIdAndCreatedAtAfterOrderByIdAsc(Long bookingId, Instant after, Pageable page);

    List<ChatMessage> findByBookingIdOrderByIdDesc(Long bookingId, Pageable page);

    Optional<ChatMessage> findFirstByBookingIdOrderByIdDesc(Long bookingId);

    long countByBookingIdAndIdGreaterThanAndSenderIdNot(Long bookingId, Long afterId, String senderId);
}
