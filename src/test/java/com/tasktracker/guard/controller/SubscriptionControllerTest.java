package com.tasktracker.guard.controller;

import com.tasktracker.guard.model.RateLimit;
import com.tasktracker.guard.model.RemainingQuota;
import com.tasktracker.guard.service.QuotaService;
import com.tasktracker.guard.service.SubscriptionConfigurationException;
import com.tasktracker.guard.service.SubscriptionService;
import com.tasktracker.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SubscriptionController.class)
class SubscriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private SubscriptionService subscriptionService;
    @MockBean private QuotaService quotaService;

    @Test
    void listTiers() throws Exception {
        when(subscriptionService.listTiers()).thenReturn(List.of(
                TestDataFactory.createTier(1, "Free", false, 1000, 60),
                TestDataFactory.createTier(99, "System", true, Integer.MAX_VALUE, Integer.MAX_VALUE)));

        mockMvc.perform(get("/api/v1/subscriptions/tiers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Free"))
                .andExpect(jsonPath("$[1].systemTier").value(true));
    }

    @Test
    void rules_unknownTier_notFound() throws Exception {
        when(subscriptionService.getTier(7L)).thenReturn(null);

        mockMvc.perform(get("/api/v1/subscriptions/tiers/7/rules"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rateLimit_resolved() throws Exception {
        when(subscriptionService.getRateLimit(42L, "/api/v1/auth/login")).thenReturn(new RateLimit(2, 60));

        mockMvc.perform(get("/api/v1/subscriptions/users/42/rate-limit").param("endpoint", "/api/v1/auth/login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(2))
                .andExpect(jsonPath("$.timeWindowSeconds").value(60));
    }

    @Test
    void userTier_missingFreeTier_isServerError() throws Exception {
        when(subscriptionService.getSubscriptionTier(42L))
                .thenThrow(new SubscriptionConfigurationException("Default subscription tier not configured correctly"));

        mockMvc.perform(get("/api/v1/subscriptions/users/42/tier"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Default subscription tier not configured correctly"));
    }

    @Test
    void remainingQuota() throws Exception {
        when(quotaService.getRemainingQuota(42L))
                .thenReturn(new RemainingQuota(800, Instant.parse("2024-03-06T00:00:00Z")));

        mockMvc.perform(get("/api/v1/subscriptions/users/42/quota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remainingCalls").value(800));
    }

    @Test
    void exceeded() throws Exception {
        when(quotaService.hasExceededDailyQuota(42L)).thenReturn(true);

        mockMvc.perform(get("/api/v1/subscriptions/users/42/quota/exceeded"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exceeded").value(true));
    }

    @Test
    void usage_incrementsAndReturnsRemaining() throws Exception {
        when(quotaService.getRemainingQuota(42L))
                .thenReturn(new RemainingQuota(997, Instant.parse("2024-03-06T00:00:00Z")));

        mockMvc.perform(post("/api/v1/subscriptions/users/42/usage").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remainingCalls").value(997));

        verify(quotaService).incrementUsage(42L, 3);
    }

    @Test
    void usage_nonPositiveCount_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/users/42/usage").param("count", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(quotaService);
    }

    @Test
    void resetQuota_unknownUser_notFound() throws Exception {
        when(quotaService.resetQuota(42L)).thenReturn(false);

        mockMvc.perform(post("/api/v1/subscriptions/users/42/quota/reset"))
                .andExpect(status().isNotFound());
    }

    @Test
    void resetQuota_noContent() throws Exception {
        when(quotaService.resetQuota(42L)).thenReturn(true);

        mockMvc.perform(post("/api/v1/subscriptions/users/42/quota/reset"))
                .andExpect(status().isNoContent());
    }
}
