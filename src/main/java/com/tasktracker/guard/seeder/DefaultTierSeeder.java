package com.tasktracker.guard.seeder;

import com.tasktracker.guard.config.SubscriptionConfig;
import com.tasktracker.guard.model.RateLimitRule;
import com.tasktracker.guard.model.SubscriptionTier;
import com.tasktracker.guard.repository.RateLimitRuleRepository;
import com.tasktracker.guard.repository.SubscriptionTierRepository;
import com.tasktracker.guard.service.SubscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Makes sure the Free and System tiers exist on startup, so tier resolution always has
 * a fallback. Existing tiers and rules are never overwritten.
 *
 * Disable with {@code subscriptions.bootstrap-default-tiers=false}.
 */
@Component
@Order(1)
public class DefaultTierSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultTierSeeder.class);

    static final String FREE_AUTH_RULE_ID = "free-auth";
    static final String FREE_API_RULE_ID = "free-api";

    private final SubscriptionTierRepository tierRepository;
    private final RateLimitRuleRepository ruleRepository;
    private final SubscriptionConfig config;

    public DefaultTierSeeder(SubscriptionTierRepository tierRepository,
                             RateLimitRuleRepository ruleRepository,
                             SubscriptionConfig config) {
        this.tierRepository = tierRepository;
        this.ruleRepository = ruleRepository;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        if (!config.isBootstrapDefaultTiers()) {
            log.info("Default tier bootstrap disabled");
            return;
        }
        try {
            seedTiers();
            seedFreeTierRules();
        } catch (Exception e) {
            log.error("Failed to seed default subscription tiers: {}", e.getMessage(), e);
        }
    }

    void seedTiers() {
        SubscriptionConfig.TierDefaults free = config.getFree();
        seedTier(SubscriptionTier.builder()
                .id(config.getDefaultFreeTierId())
                .name(SubscriptionService.FREE_TIER_NAME)
                .systemTier(false)
                .bypassStandardRateLimits(false)
                .dailyApiQuota(free.getDailyApiQuota())
                .defaultRateLimit(free.getDefaultRateLimit())
                .defaultTimeWindowSeconds(free.getDefaultTimeWindowSeconds())
                .description("Default tier for users without a subscription")
                .build());

        SubscriptionConfig.TierDefaults system = config.getSystem();
        seedTier(SubscriptionTier.builder()
                .id(config.getSystemTierId())
                .name(SubscriptionService.SYSTEM_TIER_NAME)
                .systemTier(true)
                .bypassStandardRateLimits(true)
                .dailyApiQuota(system.getDailyApiQuota())
                .defaultRateLimit(system.getDefaultRateLimit())
                .defaultTimeWindowSeconds(system.getDefaultTimeWindowSeconds())
                .description("Internal service accounts")
                .build());
    }

    void seedFreeTierRules() {
        long freeTierId = config.getDefaultFreeTierId();
        if (!ruleRepository.findByTierIdOrderByPriorityDesc(freeTierId).isEmpty()) {
            return;
        }
        // Login and token endpoints get a tighter budget than the rest of the API.
        ruleRepository.save(RateLimitRule.builder()
                .ruleId(FREE_AUTH_RULE_ID)
                .subscriptionTierId(freeTierId)
                .endpointPattern("/api/*/auth/*")
                .rateLimit(10)
                .timeWindowSeconds(60)
                .matchPriority(10)
                .build());
        ruleRepository.save(RateLimitRule.builder()
                .ruleId(FREE_API_RULE_ID)
                .subscriptionTierId(freeTierId)
                .endpointPattern("/api/*")
                .rateLimit(config.getFree().getDefaultRateLimit())
                .timeWindowSeconds(config.getFree().getDefaultTimeWindowSeconds())
                .matchPriority(1)
                .build());
        log.info("Seeded default rate-limit rules for tier={}", freeTierId);
    }

    private void seedTier(SubscriptionTier tier) {
        if (tierRepository.findById(tier.getId()) != null) {
            log.debug("Tier {} ({}) already present", tier.getId(), tier.getName());
            return;
        }
        tierRepository.save(tier);
        log.info("Seeded subscription tier {} ({})", tier.getId(), tier.getName());
    }
}
