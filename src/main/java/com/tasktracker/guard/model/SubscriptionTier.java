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
@Schema(description = "Subscription tier master data")
public class SubscriptionTier {

    @Schema(description = "Tier identifier", example = "1")
    private long id;

    @Schema(description = "Tier name", example = "Free")
    private String name;

    @Schema(description = "System tiers are reserved for internal accounts")
    private boolean systemTier;

    @Schema(description = "System tiers with this flag skip rate limiting entirely")
    private boolean bypassStandardRateLimits;

    @Schema(description = "API calls allowed per UTC day", example = "1000")
    private int dailyApiQuota;

    @Schema(description = "Requests per window when no endpoint rule matches", example = "60")
    private int defaultRateLimit;

    @Schema(description = "Window length in seconds for the default limit", example = "60")
    private int defaultTimeWindowSeconds;

    private String description;
}
