package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-endpoint rate limit for a subscription tier")
public class RateLimitRule {

    @Schema(description = "Rule identifier", example = "free-api-wildcard")
    private String ruleId;

    @Schema(description = "Tier the rule belongs to", example = "1")
    private long subscriptionTierId;

    @Schema(description = "Endpoint pattern; '*' matches any run of characters, case-insensitive",
            example = "/api/boards/*")
    private String endpointPattern;

    @Schema(description = "Requests allowed per window", example = "30")
    private int rateLimit;

    @Schema(description = "Window length in seconds", example = "60")
    private int timeWindowSeconds;

    @Schema(description = "Higher priority rules are matched first", example = "10")
    private int matchPriority;
}
