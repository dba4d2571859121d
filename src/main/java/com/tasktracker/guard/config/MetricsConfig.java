package com.tasktracker.guard.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordActivityLogged(String riskLevel, double anomalyScore) {
        Counter.builder("behavior.activity.count")
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();

        DistributionSummary.builder("behavior.anomaly_score")
                .tag("risk_level", riskLevel)
                .register(registry)
                .record(anomalyScore);
    }

    public void recordActivityLogFailure() {
        Counter.builder("behavior.activity.failed.count")
                .register(registry)
                .increment();
    }

    public void recordReputationCheck(String severity, String action) {
        Counter.builder("threat.reputation.check.count")
                .tag("severity", severity)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordRateLimitResolution(String source) {
        Counter.builder("subscription.rate_limit.resolved.count")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordQuotaWarning() {
        Counter.builder("subscription.quota.warning.count")
                .register(registry)
                .increment();
    }

    public void recordCleanup(String store, int removed) {
        Counter.builder("retention.cleanup.removed.count")
                .tag("store", store)
                .register(registry)
                .increment(removed);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
