package com.alibou.deliverychat.booking;

public record PartnerReassignedEvent(long bookingId,
                                     String previousPartnerId,
                                     String newPartnerId) {
}
