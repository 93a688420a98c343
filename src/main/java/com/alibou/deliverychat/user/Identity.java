package com.alibou.deliverychat.user;

import java.util.Objects;

/**
 * Аутентифицированный участник, как его передала внешняя система входа.
 * Не меняется, пока живо соединение.
 */
public record Identity(String id, Role role, String displayName) {

    public Identity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    public static Identity of(String id, Role role) {
        return new Identity(id, role, id);
    }

    public boolean isAdministrator() {
        return role == Role.ADMINISTRATOR;
    }
}
