package com.micronote.backend.global.security;

import java.io.IOException;

import com.micronote.backend.global.web.JsonResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final JsonResponseWriter responseWriter;

    public RestAuthenticationEntryPoint(JsonResponseWriter responseWriter) {
        this.responseWriter = responseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (authException instanceof JwtAuthenticationException jwtException) {
            responseWriter.writeError(response, HttpStatus.UNAUTHORIZED, jwtException.getMessage(), jwtException.getCode());
            return;
        }
        responseWriter.writeError(response, HttpStatus.UNAUTHORIZED, "Access token required", "UNAUTHORIZED");
    }
}
