package com.tasktracker.guard.service;

import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.config.SubscriptionConfig;
import com.tasktracker.guard.event.QuotaWarningEvent;
import com.tasktracker.guard.model.RemainingQuota;
import com.tasktracker.guard.model.SubscriptionTier;
import com.tasktracker.guard.model.UserQuota;
import com.tasktracker.guard.repository.UserQuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Daily API quotas. Every read and write first rolls the counter over when it still
 * belongs to an earlier UTC day. Trusted system accounts and exempt quotas are never
 * limited and never counted.
 */
@Service
public class QuotaService {

    private static final Logger log = LoggerFactory.getLogger(QuotaService.class);

    private final UserQuotaRepository quotaRepo;
    private final SubscriptionService subscriptionService;
    private final SubscriptionConfig config;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public QuotaService(UserQuotaRepository quotaRepo,
                        SubscriptionService subscriptionService,
                        SubscriptionConfig config,
                        MetricsConfig metricsConfig,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock) {
        this.quotaRepo = quotaRepo;
        this.subscriptionService = subscriptionService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean hasExceededDailyQuota(long userId) {
        if (subscriptionService.isTrustedSystemAccount(userId)) {
            return false;
        }
        UserQuota quota = currentQuota(userId);
        if (quota.isExemptFromQuota()) {
            return false;
        }
        return quota.getApiCallsUsedToday() >= quota.getMaxDailyApiCalls();
    }

    public void incrementUsage(long userId) {
        incrementUsage(userId, 1);
    }

    /**
     * Counts {@code count} calls against today's quota. On the first call of a day the
     * counter ends up at exactly {@code count}.
     */
    public void incrementUsage(long userId, int count) {
        if (count <= 0) {
            log.debug("Ignoring non-positive usage increment {} for user={}", count, userId);
            return;
        }
        if (subscriptionService.isTrustedSystemAccount(userId)) {
            return;
        }
        UserQuota quota = currentQuota(userId);
        if (quota.isExemptFromQuota()) {
            return;
        }

        long now = clock.millis();
        long used = quotaRepo.addUsage(userId, count, now);
        quota.setApiCallsUsedToday(used);

        if (crossedWarningThreshold(quota) && quotaRepo.markQuotaWarning(userId, now)) {
            metricsConfig.recordQuotaWarning();
            log.warn("Quota warning: user={} has used {} of {} daily API calls ({}% threshold)",
                    userId, used, quota.getMaxDailyApiCalls(), quota.getQuotaWarningThresholdPercent());
            eventPublisher.publishEvent(new QuotaWarningEvent(userId, used,
                    quota.getMaxDailyApiCalls(), quota.getQuotaWarningThresholdPercent()));
        }
    }

    public RemainingQuota getRemainingQuota(long userId) {
        if (subscriptionService.isTrustedSystemAccount(userId)) {
            return new RemainingQuota(Integer.MAX_VALUE, Instant.MAX);
        }
        UserQuota quota = currentQuota(userId);
        if (quota.isExemptFromQuota()) {
            return new RemainingQuota(Integer.MAX_VALUE, Instant.MAX);
        }
        long remaining = Math.max(0, quota.getMaxDailyApiCalls() - quota.getApiCallsUsedToday());
        Instant resetTime = Instant.ofEpochMilli(quota.getLastResetTime()).plus(Duration.ofDays(1));
        return new RemainingQuota((int) Math.min(remaining, Integer.MAX_VALUE), resetTime);
    }

    /**
     * Operator reset of today's counter and warning flag. Returns false when the user has no quota.
     */
    public boolean resetQuota(long userId) {
        UserQuota quota = quotaRepo.findByUserId(userId);
        if (quota == null) {
            return false;
        }
        quotaRepo.resetUsage(userId, todayStart(), clock.millis());
        log.info("Quota reset for user={}", userId);
        return true;
    }

    public UserQuota getQuota(long userId) {
        return currentQuota(userId);
    }

    public List<UserQuota> listQuotas() {
        return quotaRepo.findAll();
    }

    /**
     * Loads the quota, creating it from the user's tier when missing. System tiers
     * produce exempt quotas.
     */
    public UserQuota getOrCreateQuota(long userId) {
        UserQuota quota = quotaRepo.findByUserId(userId);
        if (quota != null) {
            return quota;
        }

        SubscriptionTier tier = subscriptionService.getSubscriptionTier(userId);
        long now = clock.millis();
        UserQuota created = UserQuota.builder()
                .userId(userId)
                .subscriptionTierId(tier.getId())
                .apiCallsUsedToday(0)
                .maxDailyApiCalls(tier.getDailyApiQuota())
                .lastResetTime(todayStart())
                .lastUpdatedTime(now)
                .exemptFromQuota(tier.isSystemTier())
                .hasReceivedQuotaWarning(false)
                .quotaWarningThresholdPercent(config.getQuotaWarningThresholdPercent())
                .build();

        if (quotaRepo.createIfAbsent(created)) {
            log.info("Created quota for user={} on tier={} ({} calls/day)", userId, tier.getName(),
                    tier.getDailyApiQuota());
            return created;
        }
        return quotaRepo.findByUserId(userId);
    }

    private UserQuota currentQuota(long userId) {
        UserQuota quota = getOrCreateQuota(userId);
        long todayStart = todayStart();
        if (!quota.needsReset(todayStart)) {
            return quota;
        }
        if (quotaRepo.resetIfStale(userId, todayStart, clock.millis())) {
            quota.setApiCallsUsedToday(0);
            quota.setHasReceivedQuotaWarning(false);
            quota.setLastResetTime(todayStart);
            return quota;
        }
        // Another request rolled it over first.
        return quotaRepo.findByUserId(userId);
    }

    private boolean crossedWarningThreshold(UserQuota quota) {
        double threshold = quota.getMaxDailyApiCalls() * quota.getQuotaWarningThresholdPercent() / 100.0;
        return quota.getApiCallsUsedToday() >= threshold;
    }

    long todayStart() {
        return LocalDate.now(clock).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
}
