package com.micronote.backend.global.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.UUID;

import org.springframework.stereotype.Component;

/**
 * Builds cache keys of the form {@code cache:{accountId}:{path}:{queryHash}}.
 * Anonymous keys have no identity segment; since paths start with {@code /} they never collide
 * with an identity scoped key or pattern.
 */
@Component
public class CacheKeyGenerator {

    private static final int QUERY_HASH_LENGTH = 22;

    private final String prefix;

    public CacheKeyGenerator(CacheProperties properties) {
        this.prefix = properties.getKeyPrefix();
    }

    public String generate(String path, UUID identity, Map<String, String[]> parameters) {
        StringBuilder key = new StringBuilder(prefix);
        if (identity != null) {
            key.append(identity).append(':');
        }
        key.append(path).append(':').append(hashQuery(parameters));
        return key.toString();
    }

    public String identityPattern(UUID identity, String resourceRoot) {
        return prefix + identity + ":" + resourceRoot + "*";
    }

    public String identityPattern(UUID identity) {
        return prefix + identity + ":*";
    }

    static String canonicalQuery(Map<String, String[]> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(parameters).forEach((name, values) -> {
            if (values == null || values.length == 0) {
                joiner.add(name + "=");
                return;
            }
            for (String value : values) {
                joiner.add(name + "=" + (value == null ? "" : value));
            }
        });
        return joiner.toString();
    }

    private static String hashQuery(Map<String, String[]> parameters) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalQuery(parameters).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, QUERY_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
