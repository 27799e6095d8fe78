package com.micronote.backend.global.cache;

public record CachedResponse(int status, String contentType, String body) {
}
