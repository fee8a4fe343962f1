package com.chronicle.api;

import com.chronicle.generation.Generator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SessionApiTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean Generator generator;

    private String sessionId;

    @BeforeEach
    void setUp() throws Exception {
        when(generator.generate(any(), any())).thenReturn("{}");
        String body = mvc.perform(post("/v1/sessions"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.session_id").exists())
            .andReturn().getResponse().getContentAsString();
        JsonNode created = objectMapper.readTree(body);
        sessionId = created.get("session_id").asText();
    }

    @Test
    void projectionOfNewSession_isEmpty() throws Exception {
        mvc.perform(get("/v1/sessions/{id}/projection", sessionId).param("messageId", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.messageId").value(3))
            .andExpect(jsonPath("$.eventsApplied").value(0))
            .andExpect(jsonPath("$.state.elapsedMinutes").value(0));
    }

    @Test
    void unknownSession_is404() throws Exception {
        mvc.perform(get("/v1/sessions/{id}/projection", "missing").param("messageId", "0"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void malformedSwipes_is400() throws Exception {
        mvc.perform(get("/v1/sessions/{id}/events", sessionId).param("swipes", "3-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void negativeMessageId_is400() throws Exception {
        mvc.perform(post("/v1/sessions/{id}/turns", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messageId\": -1, \"swipeId\": 0, \"messages\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void cancelWithoutRunningTurn_reportsFalse() throws Exception {
        mvc.perform(post("/v1/sessions/{id}/turns/cancel", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void metrics_areExposed() throws Exception {
        mvc.perform(get("/v1/metrics/extraction"))
            .andExpect(status().isOk());
    }

    @Test
    void nameMappingWithoutName_is400() throws Exception {
        mvc.perform(post("/v1/sessions/{id}/name-mappings", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"unresolvedName\": \"the tall man\", \"resolvedTo\": \"Bob\"},"
                    + " {\"resolvedTo\": \"Bob\"}]"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void nameMappings_areRegistered() throws Exception {
        mvc.perform(post("/v1/sessions/{id}/name-mappings", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"unresolvedName\": \"the tall man\", \"resolvedTo\": \"Bob\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.registered").value(1));
    }
}
