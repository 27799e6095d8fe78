package com.micronote.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Full application context on H2 (PostgreSQL mode, same Flyway migrations) with the in-memory
 * key-value store. Every test registers its own accounts, so no table cleanup is needed.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestKeyValueStoreConfig.class)
public abstract class AbstractIntegrationTest {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    protected static final String DEFAULT_PASSWORD = "secret123";

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected InMemoryKeyValueStore keyValueStore;

    @BeforeEach
    void clearKeyValueStore() {
        keyValueStore.clear();
    }

    protected TestSession registerAccount() throws Exception {
        String username = "user_" + SEQUENCE.incrementAndGet() + "_" + UUID.randomUUID().toString().substring(0, 6);
        MvcResult result = mockMvc.perform(
                        post("/api/auth/register")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "name": "Test User",
                                          "email": "%s@example.com",
                                          "username": "%s",
                                          "password": "%s"
                                        }
                                        """.formatted(username, username, DEFAULT_PASSWORD))
                )
                .andExpect(status().isCreated())
                .andReturn();
        return TestSession.from(readBody(result), username);
    }

    protected JsonNode readBody(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    protected static String bearer(TestSession session) {
        return "Bearer " + session.accessToken();
    }

    public record TestSession(UUID accountId, String username, String accessToken, String refreshToken) {

        public static TestSession from(JsonNode envelope, String username) {
            JsonNode data = envelope.path("data");
            return new TestSession(
                    UUID.fromString(data.path("user").path("id").asText()),
                    username,
                    data.path("tokens").path("accessToken").asText(),
                    data.path("tokens").path("refreshToken").asText()
            );
        }
    }
}
