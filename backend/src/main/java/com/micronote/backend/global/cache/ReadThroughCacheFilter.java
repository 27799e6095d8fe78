package com.micronote.backend.global.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.global.security.SecurityUtils;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Serves GET requests below the cacheable roots from the response cache, and stores successful
 * responses on a miss. Runs inside the security chain after authorization so the caller's
 * identity is part of the key.
 */
@Component
public class ReadThroughCacheFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ReadThroughCacheFilter.class);

    public static final String CACHE_HEADER = "X-Cache";
    public static final String HIT = "HIT";
    public static final String MISS = "MISS";

    private final ResponseCache responseCache;
    private final CacheKeyGenerator keyGenerator;
    private final CacheableRoots cacheableRoots;
    private final CacheProperties properties;

    public ReadThroughCacheFilter(
            ResponseCache responseCache,
            CacheKeyGenerator keyGenerator,
            CacheableRoots cacheableRoots,
            CacheProperties properties
    ) {
        this.responseCache = responseCache;
        this.keyGenerator = keyGenerator;
        this.cacheableRoots = cacheableRoots;
        this.properties = properties;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        UUID identity = SecurityUtils.findCurrentAccountId().orElse(null);
        String key = keyGenerator.generate(CacheableRoots.pathOf(request), identity, request.getParameterMap());

        Optional<CachedResponse> cached = responseCache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            writeCached(cached.get(), response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
            if (HttpStatusCode.valueOf(wrapper.getStatus()).is2xxSuccessful()) {
                String body = new String(wrapper.getContentAsByteArray(), StandardCharsets.UTF_8);
                responseCache.put(key, new CachedResponse(wrapper.getStatus(), wrapper.getContentType(), body),
                        properties.getTtl());
                wrapper.setHeader(CACHE_HEADER, MISS);
            }
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        if (!HttpMethod.GET.matches(request.getMethod())) {
            return true;
        }
        return cacheableRoots.match(CacheableRoots.pathOf(request)).isEmpty();
    }

    private void writeCached(CachedResponse cached, HttpServletResponse response) throws IOException {
        byte[] body = cached.body() == null ? new byte[0] : cached.body().getBytes(StandardCharsets.UTF_8);
        response.setStatus(cached.status());
        if (cached.contentType() != null) {
            response.setContentType(cached.contentType());
        }
        response.setHeader(CACHE_HEADER, HIT);
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }
}
