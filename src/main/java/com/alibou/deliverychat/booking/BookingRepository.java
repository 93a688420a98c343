package com.alibou.deliverychat.booking;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findAllByCustomerIdOrderByCreatedAtDesc(String customerId);

    List<Booking> findAllByPartnerIdOrderByCreatedAtDesc(String partnerId);
}
