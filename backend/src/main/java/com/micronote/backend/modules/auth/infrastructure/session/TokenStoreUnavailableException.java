package com.micronote.backend.modules.auth.infrastructure.session;

/**
 * The session store could not answer a question a security decision depends on.
 */
public class TokenStoreUnavailableException extends RuntimeException {

    public static final String CODE = "TOKEN_STORE_UNAVAILABLE";

    public TokenStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
