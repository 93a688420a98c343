package com.alibou.deliverychat.user;

import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * Шов к внешней аутентификации: заголовки уже проверенного запроса
 * превращаются в {@link Identity}.
 */
public interface IdentityResolver {

    Optional<Identity> resolve(HttpHeaders headers);

    default Identity require(HttpHeaders headers) {
        return resolve(headers).orElseThrow(() -> new SecurityException("No authenticated identity on request"));
    }
}
