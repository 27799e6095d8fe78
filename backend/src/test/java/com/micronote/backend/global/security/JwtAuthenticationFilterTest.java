package com.micronote.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.micronote.backend.global.web.JsonResponseWriter;
import com.micronote.backend.modules.auth.application.JwtTokenService;
import com.micronote.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.micronote.backend.modules.auth.infrastructure.session.SessionTokenStore;
import com.micronote.backend.modules.auth.infrastructure.session.TokenHasher;
import com.micronote.backend.modules.auth.infrastructure.session.TokenStoreUnavailableException;
import com.micronote.backend.support.InMemoryKeyValueStore;
import com.micronote.backend.support.MutableClock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class JwtAuthenticationFilterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
    private final JwtTokenService jwtTokenService = new JwtTokenService(
            new JwtTokenProvider("filter-test-secret-that-is-long-enough-for-hs256"),
            Duration.ofMinutes(15).toMillis(),
            Duration.ofDays(7).toMillis(),
            clock
    );
    private final JsonResponseWriter responseWriter = new JsonResponseWriter(new ObjectMapper());
    private final UUID accountId = UUID.randomUUID();
    private final String accessToken = jwtTokenService.issueTokenPair(accountId).accessToken();

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validTokenAuthenticatesRequest() throws Exception {
        SessionTokenStore store = new SessionTokenStore(new InMemoryKeyValueStore(clock), new TokenHasher(), clock);
        MockFilterChain chain = new MockFilterChain();

        filter(store, false).doFilter(bearerRequest(), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityUtils.findCurrentAccountId()).contains(accountId);
        assertThat(SecurityUtils.getCurrentAccessToken()).isEqualTo(accessToken);
    }

    @Test
    void blacklistedTokenIsRejected() throws Exception {
        SessionTokenStore store = new SessionTokenStore(new InMemoryKeyValueStore(clock), new TokenHasher(), clock);
        store.blacklistAccessToken(accessToken, clock.instant().plusSeconds(600));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(store, false).doFilter(bearerRequest(), response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"code\":\"TOKEN_REVOKED\"");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void unavailableBlacklistFailsClosedByDefault() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(brokenStore(), false).doFilter(bearerRequest(), response, chain);

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getContentAsString()).contains("\"code\":\"TOKEN_STORE_UNAVAILABLE\"");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void unavailableBlacklistCanFailOpen() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(brokenStore(), true).doFilter(bearerRequest(), response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityUtils.findCurrentAccountId()).contains(accountId);
    }

    @Test
    void publicAuthRoutesSkipTokenParsing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");
        request.addHeader("Authorization", "Bearer garbage");
        MockFilterChain chain = new MockFilterChain();

        filter(brokenStore(), false).doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityUtils.findCurrentAccountId()).isEmpty();
    }

    private JwtAuthenticationFilter filter(SessionTokenStore store, boolean failOpen) {
        return new JwtAuthenticationFilter(
                jwtTokenService,
                store,
                new RestAuthenticationEntryPoint(responseWriter),
                responseWriter,
                failOpen
        );
    }

    private MockHttpServletRequest bearerRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/notes");
        request.addHeader("Authorization", "Bearer " + accessToken);
        return request;
    }

    private static SessionTokenStore brokenStore() {
        SessionTokenStore store = mock(SessionTokenStore.class);
        when(store.isBlacklisted(anyString()))
                .thenThrow(new TokenStoreUnavailableException("Session store failed", new IllegalStateException("down")));
        return store;
    }
}
