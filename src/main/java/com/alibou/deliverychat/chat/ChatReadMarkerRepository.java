package com.alibou.deliverychat.chat;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ChatReadMarkerRepository extends JpaRepository<ChatReadMarker, Long> {

    Optional<ChatReadMarker> findByBookingIdAndParticipantId(Long bookingId, String participantId);
}
