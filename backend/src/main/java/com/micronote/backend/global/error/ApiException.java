package com.micronote.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business failure carrying an upper-snake-case code and a human readable message.
 * The code doubles as the {@link ResponseStatusException} reason so plain
 * {@code ResponseStatusException(status, "CODE")} throws are rendered the same way.
 */
public class ApiException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ApiException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ApiException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ApiException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
