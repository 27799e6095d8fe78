package com.micronote.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.micronote.backend.global.web.JsonResponseWriter;
import com.micronote.backend.modules.auth.application.JwtTokenService;
import com.micronote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.micronote.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.micronote.backend.modules.auth.infrastructure.session.SessionTokenStore;
import com.micronote.backend.modules.auth.infrastructure.session.TokenStoreUnavailableException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));
    private static final Set<String> PUBLIC_AUTH_PATHS = Set.of(
            "/api/auth/register",
            "/api/auth/login",
            "/api/auth/demo",
            "/api/auth/refresh"
    );

    private final JwtTokenService jwtTokenService;
    private final SessionTokenStore sessionTokenStore;
    private final AuthenticationEntryPoint authenticationEntryPoint;
    private final JsonResponseWriter responseWriter;
    private final boolean blacklistFailOpen;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            SessionTokenStore sessionTokenStore,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            JsonResponseWriter responseWriter,
            @Value("${micronote.session.blacklist-fail-open:false}") boolean blacklistFailOpen
    ) {
        this.jwtTokenService = jwtTokenService;
        this.sessionTokenStore = sessionTokenStore;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.responseWriter = responseWriter;
        this.blacklistFailOpen = blacklistFailOpen;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseAccessToken(token);
        } catch (InvalidTokenException ex) {
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response,
                    new JwtAuthenticationException("INVALID_ACCESS_TOKEN", "Invalid or expired access token", ex));
            return;
        }

        boolean revoked;
        try {
            revoked = isRevoked(token);
        } catch (TokenStoreUnavailableException ex) {
            log.error("Token blacklist check failed, rejecting request: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            responseWriter.writeError(response, HttpStatus.SERVICE_UNAVAILABLE,
                    "Token store unavailable", TokenStoreUnavailableException.CODE);
            return;
        }
        if (revoked) {
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response,
                    new JwtAuthenticationException("TOKEN_REVOKED", "Access token has been revoked"));
            return;
        }

        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                parsed.accountId(),
                parsed.tokenId(),
                parsed.expiresAt()
        );
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, USER_AUTHORITIES);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private boolean isRevoked(String token) {
        try {
            return sessionTokenStore.isBlacklisted(token);
        } catch (TokenStoreUnavailableException ex) {
            if (!blacklistFailOpen) {
                throw ex;
            }
            log.warn("Token blacklist unavailable, accepting token without revocation check: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return PUBLIC_AUTH_PATHS.contains(path) || path.startsWith("/health") || path.startsWith("/readyz");
    }
}
