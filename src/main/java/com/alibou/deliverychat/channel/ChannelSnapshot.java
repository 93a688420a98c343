package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.user.Role;

import java.time.Instant;
import java.util.List;

public record ChannelSnapshot(long bookingId, List<Member> connections) {

    public record Member(String connectionId, String participantId, Role role, Instant openedAt) {

        static Member of(ChatConnection c) {
            return new Member(c.getId(), c.getIdentity().id(), c.getIdentity().role(), c.getOpenedAt());
        }
    }
}
