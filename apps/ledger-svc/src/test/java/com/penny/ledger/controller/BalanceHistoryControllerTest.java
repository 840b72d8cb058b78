package com.penny.ledger.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
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
class BalanceHistoryControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void burndownForPastMonthIsComplete() throws Exception {
        String response = mockMvc.perform(post("/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Burndown\",\"balance\":58.00}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(response).get("id").asText();

        mockMvc.perform(get("/balance-history/{accountId}/burndown", id)
                        .param("month", "2024-02")
                        .param("meanMonths", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.month").value("2024-02"))
                .andExpect(jsonPath("$.daysInMonth").value(29))
                .andExpect(jsonPath("$.currentMonth").value(false))
                .andExpect(jsonPath("$.currentDay").value(29))
                .andExpect(jsonPath("$.currentMonthData.length()").value(29))
                .andExpect(jsonPath("$.previousMonthData.length()").value(31))
                .andExpect(jsonPath("$.previous.length()").value(29))
                .andExpect(jsonPath("$.mean[0]").value(58.0))
                .andExpect(jsonPath("$.planned[28]").value(0.0));
    }

    @Test
    void burndownRejectsMalformedMonthAndUnknownAccount() throws Exception {
        mockMvc.perform(get("/balance-history/{accountId}/burndown", "whatever").param("month", "02/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/balance-history/{accountId}/burndown", "nope").param("month", "2024-02"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.entity").value("Account"));
    }
}
