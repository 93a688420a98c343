package com.alibou.deliverychat.user;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Читает участника из заголовков, которые auth-прокси ставит на каждый запрос.
 */
@Slf4j
@Component
public class HeaderIdentityResolver implements IdentityResolver {

    public static final String CLIENT_ID   = "X-Client-Id";
    public static final String CLIENT_ROLE = "X-Client-Role";
    public static final String CLIENT_NAME = "X-Client-Name";

    @Override
    public Optional<Identity> resolve(HttpHeaders headers) {
        String id = headers.getFirst(CLIENT_ID);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Optional<Role> role = Role.parse(headers.getFirst(CLIENT_ROLE));
        if (role.isEmpty()) {
            log.warn("🚫 Отклоняем {}: роль отсутствует или неизвестна '{}'", id, headers.getFirst(CLIENT_ROLE));
            return Optional.empty();
        }
        return Optional.of(new Identity(id.trim(), role.get(), headers.getFirst(CLIENT_NAME)));
    }
}
