package com.micronote.backend.global.security;

import org.springframework.security.core.AuthenticationException;

/**
 * Bearer token rejected by {@link JwtAuthenticationFilter}; {@code code} ends up in the 401 envelope.
 */
public class JwtAuthenticationException extends AuthenticationException {

    private final String code;

    public JwtAuthenticationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public JwtAuthenticationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
