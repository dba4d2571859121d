package com.tasktracker.guard.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasktracker.guard.model.IpListRequest;
import com.tasktracker.guard.model.IpReputation;
import com.tasktracker.guard.model.RecommendedAction;
import com.tasktracker.guard.model.ThreatReport;
import com.tasktracker.guard.model.ThreatSeverity;
import com.tasktracker.guard.service.ThreatIntelligenceService;
import com.tasktracker.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ThreatIntelligenceController.class)
class ThreatIntelligenceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ThreatIntelligenceService threatService;

    @Test
    void reputation_blacklisted() throws Exception {
        when(threatService.checkIpReputation("198.51.100.23")).thenReturn(IpReputation.builder()
                .ipAddress("198.51.100.23")
                .threat(true)
                .severity(ThreatSeverity.CRITICAL)
                .confidenceScore(100)
                .recommendedAction(RecommendedAction.BLOCK)
                .blacklisted(true)
                .build());

        mockMvc.perform(get("/api/v1/threats/reputation/198.51.100.23"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andExpect(jsonPath("$.recommendedAction").value("BLOCK"))
                .andExpect(jsonPath("$.blacklisted").value(true));
    }

    @Test
    void reportThreat_defaultsSeverityToMedium() throws Exception {
        ThreatReport report = ThreatReport.builder()
                .ipAddress("198.51.100.23")
                .threatType("Scanning")
                .threatSource("IDS")
                .build();
        when(threatService.addThreatIntelligence("198.51.100.23", "Scanning", ThreatSeverity.MEDIUM, "IDS", null, 0))
                .thenReturn(true);

        mockMvc.perform(post("/api/v1/threats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(report)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored").value(true));
    }

    @Test
    void reportThreat_missingType_badRequest() throws Exception {
        ThreatReport report = ThreatReport.builder().ipAddress("198.51.100.23").build();

        mockMvc.perform(post("/api/v1/threats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(report)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("threatType"));
    }

    @Test
    void blacklist_success() throws Exception {
        when(threatService.blacklistIp("198.51.100.23", "credential stuffing")).thenReturn(true);

        mockMvc.perform(post("/api/v1/threats/blacklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new IpListRequest("198.51.100.23", "credential stuffing"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ipAddress").value("198.51.100.23"))
                .andExpect(jsonPath("$.stored").value(true));
    }

    @Test
    void whitelist_missingIp_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/threats/whitelist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new IpListRequest(null, "office"))))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(threatService);
    }

    @Test
    void bySeverity_caseInsensitive() throws Exception {
        when(threatService.getThreatsBySeverity(ThreatSeverity.HIGH)).thenReturn(List.of(
                TestDataFactory.createThreatRecord("198.51.100.1", "Botnet", ThreatSeverity.HIGH, 85, 1_000L)));

        mockMvc.perform(get("/api/v1/threats/severity/high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].threatType").value("Botnet"));
    }

    @Test
    void bySeverity_unknown_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/threats/severity/extreme"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("severity"));
    }

    @Test
    void updateStatus_notFound() throws Exception {
        when(threatService.updateThreatStatus("missing", false)).thenReturn(false);

        mockMvc.perform(put("/api/v1/threats/missing/status").param("active", "false"))
                .andExpect(status().isNotFound());
    }

    @Test
    void updateStatus_success() throws Exception {
        when(threatService.updateThreatStatus("t-1", false)).thenReturn(true);

        mockMvc.perform(put("/api/v1/threats/t-1/status").param("active", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    void types_listed() throws Exception {
        when(threatService.getThreatTypes()).thenReturn(List.of("Botnet", "Spam"));

        mockMvc.perform(get("/api/v1/threats/types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("Botnet"));
    }

    @Test
    void cleanup_defaultsToNinetyDays() throws Exception {
        when(threatService.cleanupOldThreats(90)).thenReturn(3);

        mockMvc.perform(delete("/api/v1/threats/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));
    }
}
