package com.micronote.backend.health;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.micronote.backend.support.AbstractIntegrationTest;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

class HealthControllerTest extends AbstractIntegrationTest {

    @Test
    void probesArePublic() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.timestamp").value(Matchers.notNullValue()));
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/readyz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void requestIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/healthz").header("X-Request-Id", "abc-123"))
                .andExpect(header().string("X-Request-Id", "abc-123"));
        mockMvc.perform(get("/healthz").header("X-Request-Id", "bad id\nwith newline"))
                .andExpect(header().string("X-Request-Id", Matchers.not("bad id\nwith newline")));
    }

    @Test
    void unknownRouteReturnsNotFoundEnvelope() throws Exception {
        TestSession session = registerAccount();

        mockMvc.perform(get("/api/unknown"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/unknown").header("Authorization", bearer(session)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
