package com.tasktracker.guard.controller;

import com.tasktracker.guard.model.RateLimit;
import com.tasktracker.guard.model.RateLimitRule;
import com.tasktracker.guard.model.RemainingQuota;
import com.tasktracker.guard.model.SubscriptionTier;
import com.tasktracker.guard.model.UserQuota;
import com.tasktracker.guard.service.QuotaService;
import com.tasktracker.guard.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/subscriptions")
@Tag(name = "Subscriptions", description = "Tier resolution, rate-limit lookup and daily API quotas")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final QuotaService quotaService;

    public SubscriptionController(SubscriptionService subscriptionService, QuotaService quotaService) {
        this.subscriptionService = subscriptionService;
        this.quotaService = quotaService;
    }

    @GetMapping("/tiers")
    @Operation(summary = "List subscription tiers")
    public ResponseEntity<List<SubscriptionTier>> listTiers() {
        return ResponseEntity.ok(subscriptionService.listTiers());
    }

    @GetMapping("/tiers/{tierId}/rules")
    @Operation(summary = "Rate-limit rules of a tier", description = "Highest match priority first")
    public ResponseEntity<List<RateLimitRule>> listRules(
            @Parameter(description = "Tier ID", example = "1") @PathVariable long tierId) {
        if (subscriptionService.getTier(tierId) == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(subscriptionService.listRules(tierId));
    }

    @GetMapping("/users/{userId}/tier")
    @Operation(summary = "Resolve a user's subscription tier")
    public ResponseEntity<SubscriptionTier> getUserTier(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        return ResponseEntity.ok(subscriptionService.getSubscriptionTier(userId));
    }

    @GetMapping("/users/{userId}/rate-limit")
    @Operation(summary = "Rate limit for a user and endpoint",
               description = "The highest-priority matching rule of the user's tier, else the tier default")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = RateLimit.class)))
    public ResponseEntity<?> getRateLimit(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId,
            @Parameter(description = "Request path", example = "/api/v1/boards")
            @RequestParam String endpoint) {
        if (endpoint.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "endpoint is required", "field", "endpoint"));
        }
        RateLimit limit = subscriptionService.getRateLimit(userId, endpoint);
        return ResponseEntity.ok(limit);
    }

    @GetMapping("/users/{userId}/quota")
    @Operation(summary = "Remaining daily quota", description = "Unlimited accounts report Integer.MAX_VALUE")
    public ResponseEntity<RemainingQuota> getRemainingQuota(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        return ResponseEntity.ok(quotaService.getRemainingQuota(userId));
    }

    @GetMapping("/users/{userId}/quota/exceeded")
    @Operation(summary = "Whether the user has used up today's quota")
    public ResponseEntity<Map<String, Object>> hasExceeded(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("userId", userId);
        response.put("exceeded", quotaService.hasExceededDailyQuota(userId));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/users/{userId}/usage")
    @Operation(summary = "Count API calls against today's quota")
    public ResponseEntity<?> incrementUsage(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId,
            @Parameter(description = "Number of calls", example = "1")
            @RequestParam(defaultValue = "1") int count) {
        if (count <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "count must be > 0", "field", "count"));
        }
        quotaService.incrementUsage(userId, count);
        return ResponseEntity.ok(quotaService.getRemainingQuota(userId));
    }

    @PostMapping("/users/{userId}/quota/reset")
    @Operation(summary = "Reset today's usage for a user")
    public ResponseEntity<Void> resetQuota(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        if (!quotaService.resetQuota(userId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/quotas")
    @Operation(summary = "List all user quotas")
    public ResponseEntity<List<UserQuota>> listQuotas() {
        return ResponseEntity.ok(quotaService.listQuotas());
    }
}
