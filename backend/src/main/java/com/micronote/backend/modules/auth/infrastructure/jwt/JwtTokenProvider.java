package com.micronote.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key for signing access and refresh tokens. A Base64 secret is decoded when it yields at
 * least 256 bits; anything else is used as raw UTF-8 bytes.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;
    private static final Pattern BASE64 = Pattern.compile("^(?:[A-Za-z0-9+/]{4})+(?:[A-Za-z0-9+/]{2}==|[A-Za-z0-9+/]{3}=)?$");

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        this.secretKey = new SecretKeySpec(resolveKeyBytes(secretString), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] resolveKeyBytes(String secretString) {
        if (BASE64.matcher(secretString).matches()) {
            byte[] decoded = Base64.getDecoder().decode(secretString);
            if (decoded.length >= MIN_KEY_BYTES) {
                return decoded;
            }
        }
        return secretString.getBytes(StandardCharsets.UTF_8);
    }
}
