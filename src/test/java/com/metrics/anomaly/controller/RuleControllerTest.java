package com.metrics.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metrics.anomaly.exception.InvalidRuleException;
import com.metrics.anomaly.exception.UnknownRuleException;
import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.AlertRuleUpdate;
import com.metrics.anomaly.service.RuleService;
import com.metrics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RuleService ruleService;

    @Test
    void listRules_success() throws Exception {
        when(ruleService.getAllRules()).thenReturn(List.of(TestDataFactory.createErrorRateRule("R1")));

        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].id").value("R1"))
                .andExpect(jsonPath("$[0].condition.operator").value(">"))
                .andExpect(jsonPath("$[0].condition.aggregation").value("avg"))
                .andExpect(jsonPath("$[0].severity").value("high"));
    }

    @Test
    void getRule_found() throws Exception {
        when(ruleService.getRule("R1")).thenReturn(TestDataFactory.createErrorRateRule("R1"));

        mockMvc.perform(get("/api/v1/rules/R1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("R1"))
                .andExpect(jsonPath("$.channels[0].type").value("webhook"));
    }

    @Test
    void getRule_notFound() throws Exception {
        when(ruleService.getRule("MISSING")).thenThrow(new UnknownRuleException("MISSING"));

        mockMvc.perform(get("/api/v1/rules/MISSING"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("rule.unknown"))
                .andExpect(jsonPath("$.ruleId").value("MISSING"));
    }

    @Test
    void createRule_success() throws Exception {
        AlertRule rule = TestDataFactory.createErrorRateRule("R-NEW");
        when(ruleService.createRule(any(AlertRule.class))).thenReturn(rule);

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("R-NEW"));
    }

    @Test
    void createRule_acceptsWireFormat() throws Exception {
        String body = "{"
                + "\"id\": \"R-CPU\", \"name\": \"CPU hot\","
                + "\"condition\": {\"metric\": \"cpu\", \"operator\": \">=\", \"threshold\": 0.9,"
                + " \"windowMinutes\": 10, \"aggregation\": \"max\"},"
                + "\"severity\": \"critical\","
                + "\"channels\": [{\"type\": \"slack\", \"settings\": {\"webhookUrl\": \"https://hooks.slack.test/x\"}}],"
                + "\"throttle\": {\"durationMinutes\": 30, \"maxAlerts\": 2}"
                + "}";
        when(ruleService.createRule(any(AlertRule.class))).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.condition.operator").value(">="))
                .andExpect(jsonPath("$.condition.aggregation").value("max"))
                .andExpect(jsonPath("$.severity").value("critical"))
                .andExpect(jsonPath("$.channels[0].settings.webhookUrl").value("https://hooks.slack.test/x"))
                .andExpect(jsonPath("$.throttle.maxAlerts").value(2))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void createRule_badRequest_invalidCondition() throws Exception {
        AlertRule rule = AlertRule.builder().id("R-BAD").build();
        when(ruleService.createRule(any(AlertRule.class)))
                .thenThrow(new InvalidRuleException("Rule R-BAD has no condition"));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("rule.invalid"))
                .andExpect(jsonPath("$.detail").value("Rule R-BAD has no condition"));
    }

    @Test
    void updateRule_success() throws Exception {
        AlertRule updated = TestDataFactory.createErrorRateRule("R1");
        updated.setEnabled(false);
        when(ruleService.updateRule(eq("R1"), any(AlertRuleUpdate.class))).thenReturn(updated);

        mockMvc.perform(put("/api/v1/rules/R1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void updateRule_omittedEnabled_passedThroughAsNull() throws Exception {
        when(ruleService.updateRule(eq("R1"), argThat(u -> u.getEnabled() == null && "renamed".equals(u.getName()))))
                .thenReturn(TestDataFactory.createErrorRateRule("R1"));

        mockMvc.perform(put("/api/v1/rules/R1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"renamed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("R1"));
    }

    @Test
    void updateRule_notFound() throws Exception {
        when(ruleService.updateRule(eq("MISSING"), any(AlertRuleUpdate.class)))
                .thenThrow(new UnknownRuleException("MISSING"));

        mockMvc.perform(put("/api/v1/rules/MISSING")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteRule_success() throws Exception {
        when(ruleService.deleteRule("R1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/rules/R1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void deleteRule_notFound() throws Exception {
        when(ruleService.deleteRule("MISSING")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/rules/MISSING"))
                .andExpect(status().isNotFound());
    }
}
