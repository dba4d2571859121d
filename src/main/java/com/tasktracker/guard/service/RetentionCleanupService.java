package com.tasktracker.guard.service;

import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.config.ThreatIntelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Periodically trims the behavior ledger and the threat store to their retention windows.
 */
@Service
public class RetentionCleanupService {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleanupService.class);

    private final BehaviorAnalyticsService analyticsService;
    private final ThreatIntelligenceService threatService;
    private final AnalyticsConfig analyticsConfig;
    private final ThreatIntelConfig threatConfig;

    public RetentionCleanupService(BehaviorAnalyticsService analyticsService,
                                   ThreatIntelligenceService threatService,
                                   AnalyticsConfig analyticsConfig,
                                   ThreatIntelConfig threatConfig) {
        this.analyticsService = analyticsService;
        this.threatService = threatService;
        this.analyticsConfig = analyticsConfig;
        this.threatConfig = threatConfig;
    }

    @Scheduled(fixedRateString = "${analytics.retention.cleanup-interval-hours:24}",
               timeUnit = TimeUnit.HOURS,
               initialDelayString = "1")
    public void runScheduledCleanup() {
        if (!analyticsConfig.getRetention().isCleanupEnabled()) {
            return;
        }
        int behaviorRemoved = analyticsService.cleanupOldBehaviorData(analyticsConfig.getRetention().getBehaviorDays());
        int threatsRemoved = threatService.cleanupOldThreats(threatConfig.getRetentionDays());
        log.info("Retention cleanup finished: behaviorRecords={}, threats={}", behaviorRemoved, threatsRemoved);
    }
}
