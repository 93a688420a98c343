package com.alibou.deliverychat.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Role {
    CUSTOMER("customer"),
    DELIVERY_PARTNER("delivery_partner"),
    ADMINISTRATOR("administrator");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Принимает имена из протокола, имена констант и старый псевдоним {@code admin}. */
    public static Optional<Role> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        if ("admin".equalsIgnoreCase(v)) {
            return Optional.of(ADMINISTRATOR);
        }
        for (Role role : values()) {
            if (role.wireName.equalsIgnoreCase(v) || role.name().equalsIgnoreCase(v)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Role fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
