package com.tasktracker.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "subscriptions")
public class SubscriptionConfig {

    private long defaultFreeTierId = 1;
    private long systemTierId = 99;

    // User ids that always resolve to the system tier and never consume quota.
    private List<Long> trustedSystemAccounts = new ArrayList<>();

    private int tierCacheTtlMinutes = 15;
    private int rateLimitCacheTtlMinutes = 30;
    private long cacheMaximumSize = 100_000;

    private int quotaWarningThresholdPercent = 80;

    // Seed "Free" and "System" tiers on startup when they are missing.
    private boolean bootstrapDefaultTiers = true;

    private TierDefaults free = new TierDefaults(1000, 60, 60);
    private TierDefaults system = new TierDefaults(Integer.MAX_VALUE, Integer.MAX_VALUE, 60);

    @Data
    public static class TierDefaults {
        private int dailyApiQuota;
        private int defaultRateLimit;
        private int defaultTimeWindowSeconds;

        public TierDefaults() {
        }

        public TierDefaults(int dailyApiQuota, int defaultRateLimit, int defaultTimeWindowSeconds) {
            this.dailyApiQuota = dailyApiQuota;
            this.defaultRateLimit = defaultRateLimit;
            this.defaultTimeWindowSeconds = defaultTimeWindowSeconds;
        }
    }
}
