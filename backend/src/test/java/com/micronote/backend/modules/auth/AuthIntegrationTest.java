package com.micronote.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.micronote.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

class AuthIntegrationTest extends AbstractIntegrationTest {

    @Test
    void registeredAccountCanFetchItself() throws Exception {
        TestSession session = registerAccount();

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(session)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.user.id").value(session.accountId().toString()))
                .andExpect(jsonPath("$.data.user.username").value(session.username()))
                .andExpect(jsonPath("$.data.user.passwordHash").doesNotExist());
    }

    @Test
    void duplicateEmailIsRejected() throws Exception {
        TestSession session = registerAccount();

        mockMvc.perform(
                        post("/api/auth/register")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"name":"Other","email":"%s@example.com","username":"other_%s","password":"secret123"}
                                        """.formatted(session.username(), session.accountId().toString().substring(0, 6)))
                )
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_EXISTS"));
    }

    @Test
    void invalidRegistrationListsFieldErrors() throws Exception {
        mockMvc.perform(
                        post("/api/auth/register")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"name":"","email":"not-an-email","username":"a!","password":"123"}
                                        """)
                )
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors.length()").value(4));
    }

    @Test
    void loginAcceptsUsernameOrEmail() throws Exception {
        TestSession session = registerAccount();

        login(session.username(), DEFAULT_PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Login successful"))
                .andExpect(jsonPath("$.data.tokens.tokenType").value("Bearer"));
        login(session.username() + "@example.com", DEFAULT_PASSWORD)
                .andExpect(status().isOk());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        TestSession session = registerAccount();

        login(session.username(), "wrong-password")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        login("nobody_here", DEFAULT_PASSWORD)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void newLoginSupersedesEarlierRefreshToken() throws Exception {
        TestSession session = registerAccount();
        login(session.username(), DEFAULT_PASSWORD).andExpect(status().isOk());

        refresh(session.refreshToken())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void refreshRotatesTokenPair() throws Exception {
        TestSession session = registerAccount();

        MvcResult result = refresh(session.refreshToken())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Token refreshed successfully"))
                .andReturn();
        JsonNode tokens = readBody(result).path("data").path("tokens");
        String rotatedRefresh = tokens.path("refreshToken").asText();

        assertThat(rotatedRefresh).isNotBlank().isNotEqualTo(session.refreshToken());
        refresh(session.refreshToken()).andExpect(status().isUnauthorized());
        refresh(rotatedRefresh).andExpect(status().isOk());

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + tokens.path("accessToken").asText()))
                .andExpect(status().isOk());
    }

    @Test
    void accessTokenIsNotAcceptedAsRefreshToken() throws Exception {
        TestSession session = registerAccount();

        refresh(session.accessToken())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void logoutRevokesBothTokens() throws Exception {
        TestSession session = registerAccount();

        mockMvc.perform(post("/api/auth/logout").header("Authorization", bearer(session)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logout successful"));

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(session)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_REVOKED"));
        refresh(session.refreshToken()).andExpect(status().isUnauthorized());
    }

    @Test
    void protectedRoutesNeedAValidToken() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mockMvc.perform(get("/api/notes").header("Authorization", "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    @Test
    void demoLoginReusesTheDemoAccount() throws Exception {
        MvcResult first = mockMvc.perform(post("/api/auth/demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.user.username").value("demo"))
                .andReturn();
        MvcResult second = mockMvc.perform(post("/api/auth/demo"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(readBody(second).path("data").path("user").path("id"))
                .isEqualTo(readBody(first).path("data").path("user").path("id"));
    }

    private ResultActions login(String username, String password) throws Exception {
        return mockMvc.perform(
                post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"%s","password":"%s"}
                                """.formatted(username, password))
        );
    }

    private ResultActions refresh(String refreshToken) throws Exception {
        return mockMvc.perform(
                post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken":"%s"}
                                """.formatted(refreshToken))
        );
    }
}
