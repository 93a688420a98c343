package com.alibou.deliverychat.booking;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BookingStatusLogRepository extends JpaRepository<BookingStatusLog, Long> {

    List<BookingStatusLog> findAllByBookingIdOrderByIdAsc(Long bookingId);
}
