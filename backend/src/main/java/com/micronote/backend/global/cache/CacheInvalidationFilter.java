package com.micronote.backend.global.cache;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.micronote.backend.global.security.SecurityUtils;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatusCode;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Drops the caller's cached reads after a successful write below a cacheable root. The response
 * body is held back until eviction finishes, so a client that sees the write's response can no
 * longer read a value cached before it. Writes to notes or todos also drop the caller's cached
 * aggregates, such as account stats, that are computed from them.
 */
@Component
public class CacheInvalidationFilter extends OncePerRequestFilter {

    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final ResponseCache responseCache;
    private final CacheKeyGenerator keyGenerator;
    private final CacheableRoots cacheableRoots;
    private final CacheProperties properties;

    public CacheInvalidationFilter(
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
        Optional<String> root = cacheableRoots.match(CacheableRoots.pathOf(request));
        // resolved up front: account deletion runs inside the chain
        Optional<UUID> identity = SecurityUtils.findCurrentAccountId();
        if (root.isEmpty() || identity.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
            if (HttpStatusCode.valueOf(wrapper.getStatus()).is2xxSuccessful()) {
                if (cacheableRoots.isAccountRoot(root.get())) {
                    responseCache.evict(keyGenerator.identityPattern(identity.get()));
                } else {
                    responseCache.evict(keyGenerator.identityPattern(identity.get(), root.get()));
                    for (String aggregatePath : properties.getAggregatePaths()) {
                        responseCache.evict(keyGenerator.identityPattern(identity.get(), aggregatePath));
                    }
                }
            }
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !properties.isEnabled() || !WRITE_METHODS.contains(request.getMethod().toUpperCase());
    }
}
