package com.chainbills.ledger.security;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full filter chain: the API key is required on /api/** and nowhere else.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApiKeyFilterTest {

    @Autowired private MockMvc mvc;

    @Test
    void missingKey_should401() throws Exception {
        mvc.perform(get("/api/v1/chain-stats"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_API_KEY"))
                .andExpect(jsonPath("$.message").value(containsString("API key")))
                .andExpect(jsonPath("$.path").value("/api/v1/chain-stats"));
    }

    @Test
    void wrongKey_should401() throws Exception {
        mvc.perform(get("/api/v1/chain-stats").header("Authorization", "ApiKey nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_API_KEY"));
        mvc.perform(get("/api/v1/chain-stats").header("Authorization", "ApiKey test-key-and-more"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void validKey_reachesController() throws Exception {
        mvc.perform(get("/api/v1/chain-stats").header("Authorization", "ApiKey test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chainId").value(10002));
    }
}
