package com.penny.ledger.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.penny.ledger.config.PennyProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccountsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void createThenAdjustBalance() throws Exception {
        String id = createAccount("{\"name\":\"Wallet\",\"balance\":12.5}");

        mockMvc.perform(get("/accounts/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Wallet"))
                .andExpect(jsonPath("$.currency").value("USD"));

        mockMvc.perform(post("/accounts/{id}/balance/adjust", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetBalance\":20.00,\"description\":\"Recount\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountId").value(id));

        mockMvc.perform(get("/accounts/{id}/operations/count", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void missingAccountIsNotFoundWithTraceId() throws Exception {
        mockMvc.perform(get("/accounts/{id}", "nope").header(PennyProperties.Trace.DEFAULT_HEADER, "trace-404"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(PennyProperties.Trace.DEFAULT_HEADER, "trace-404"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.entity").value("Account"))
                .andExpect(jsonPath("$.details.id").value("nope"))
                .andExpect(jsonPath("$.path").value("/accounts/nope"))
                .andExpect(jsonPath("$.traceId").value("trace-404"));
    }

    @Test
    void deletingReferencedAccountIsConflictWithCount() throws Exception {
        String id = createAccount("{\"name\":\"Busy\",\"balance\":100}");
        mockMvc.perform(post("/accounts/{id}/balance/adjust", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetBalance\":90}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/accounts/{id}", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INTEGRITY_VIOLATION"))
                .andExpect(jsonPath("$.details.count").value(1));
    }

    @Test
    void invalidBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Account name is required"));

        mockMvc.perform(post("/accounts/{id}/balance/delta", "any")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    private String createAccount(String body) throws Exception {
        String response = mockMvc.perform(post("/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(response);
        assertThat(node.get("id").asText()).isNotBlank();
        return node.get("id").asText();
    }
}
