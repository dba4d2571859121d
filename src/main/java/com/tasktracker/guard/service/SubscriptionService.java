package com.tasktracker.guard.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.config.SubscriptionConfig;
import com.tasktracker.guard.model.RateLimit;
import com.tasktracker.guard.model.RateLimitRule;
import com.tasktracker.guard.model.SubscriptionTier;
import com.tasktracker.guard.model.UserQuota;
import com.tasktracker.guard.repository.RateLimitRuleRepository;
import com.tasktracker.guard.repository.SubscriptionTierRepository;
import com.tasktracker.guard.repository.UserQuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves a user's subscription tier and the rate limit that applies to an endpoint.
 *
 * <p>Both lookups are cached with fixed TTLs and no invalidation, so tier or rule edits
 * take effect once the cached entry expires. Only matched rules are cached for the
 * rate limit; a tier default is recomputed on every call.
 */
@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    public static final String SYSTEM_TIER_NAME = "System";
    public static final String FREE_TIER_NAME = "Free";

    static final RateLimit UNLIMITED = new RateLimit(Integer.MAX_VALUE, 60);

    private final SubscriptionTierRepository tierRepo;
    private final RateLimitRuleRepository ruleRepo;
    private final UserQuotaRepository quotaRepo;
    private final SubscriptionConfig config;
    private final MetricsConfig metricsConfig;
    private final Set<Long> trustedSystemAccounts;

    private final Cache<Long, SubscriptionTier> tierCache;
    private final Cache<RateLimitCacheKey, RateLimitRule> rateLimitCache;
    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    record RateLimitCacheKey(long tierId, String endpoint) {}

    @Autowired
    public SubscriptionService(SubscriptionTierRepository tierRepo,
                               RateLimitRuleRepository ruleRepo,
                               UserQuotaRepository quotaRepo,
                               SubscriptionConfig config,
                               MetricsConfig metricsConfig,
                               Ticker cacheTicker) {
        this(tierRepo, ruleRepo, quotaRepo, config, metricsConfig,
                Set.copyOf(config.getTrustedSystemAccounts()), cacheTicker);
    }

    public SubscriptionService(SubscriptionTierRepository tierRepo,
                               RateLimitRuleRepository ruleRepo,
                               UserQuotaRepository quotaRepo,
                               SubscriptionConfig config,
                               MetricsConfig metricsConfig,
                               Set<Long> trustedSystemAccounts,
                               Ticker cacheTicker) {
        this.tierRepo = tierRepo;
        this.ruleRepo = ruleRepo;
        this.quotaRepo = quotaRepo;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.trustedSystemAccounts = Set.copyOf(trustedSystemAccounts);
        this.tierCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(config.getTierCacheTtlMinutes()))
                .maximumSize(config.getCacheMaximumSize())
                .ticker(cacheTicker)
                .build();
        this.rateLimitCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(config.getRateLimitCacheTtlMinutes()))
                .maximumSize(config.getCacheMaximumSize())
                .ticker(cacheTicker)
                .build();
        log.info("Subscription resolver ready: {} trusted system accounts, tier TTL={}m, rate-limit TTL={}m",
                this.trustedSystemAccounts.size(), config.getTierCacheTtlMinutes(),
                config.getRateLimitCacheTtlMinutes());
    }

    /**
     * Trusted accounts get the system tier, other users the tier of their quota, and
     * everyone else the Free tier.
     *
     * @throws SubscriptionConfigurationException when no Free tier can be found
     */
    public SubscriptionTier getSubscriptionTier(long userId) {
        SubscriptionTier cached = tierCache.getIfPresent(userId);
        if (cached != null) {
            return cached;
        }
        SubscriptionTier tier = resolveTier(userId);
        tierCache.put(userId, tier);
        return tier;
    }

    public RateLimit getRateLimit(long userId, String endpoint) {
        SubscriptionTier tier = getSubscriptionTier(userId);
        if (tier.isSystemTier() && tier.isBypassStandardRateLimits()) {
            metricsConfig.recordRateLimitResolution("bypass");
            return UNLIMITED;
        }

        RateLimitCacheKey cacheKey = new RateLimitCacheKey(tier.getId(), endpoint);
        RateLimitRule cachedRule = rateLimitCache.getIfPresent(cacheKey);
        if (cachedRule != null) {
            metricsConfig.recordRateLimitResolution("cache");
            return new RateLimit(cachedRule.getRateLimit(), cachedRule.getTimeWindowSeconds());
        }

        List<RateLimitRule> rules = ruleRepo.findByTierIdOrderByPriorityDesc(tier.getId());
        for (RateLimitRule rule : rules) {
            if (matches(rule.getEndpointPattern(), endpoint)) {
                rateLimitCache.put(cacheKey, rule);
                metricsConfig.recordRateLimitResolution("rule");
                log.debug("Rate limit for user={}, endpoint={} resolved by rule={} ({} per {}s)",
                        userId, endpoint, rule.getRuleId(), rule.getRateLimit(), rule.getTimeWindowSeconds());
                return new RateLimit(rule.getRateLimit(), rule.getTimeWindowSeconds());
            }
        }

        metricsConfig.recordRateLimitResolution("default");
        return new RateLimit(tier.getDefaultRateLimit(), tier.getDefaultTimeWindowSeconds());
    }

    /**
     * True for configured trusted accounts, and for users whose quota is linked to a system tier.
     */
    public boolean isTrustedSystemAccount(long userId) {
        if (trustedSystemAccounts.contains(userId)) {
            return true;
        }
        UserQuota quota = quotaRepo.findByUserId(userId);
        if (quota == null) {
            return false;
        }
        SubscriptionTier tier = tierRepo.findById(quota.getSubscriptionTierId());
        return tier != null && tier.isSystemTier();
    }

    public List<SubscriptionTier> listTiers() {
        return tierRepo.findAll();
    }

    public SubscriptionTier getTier(long tierId) {
        return tierRepo.findById(tierId);
    }

    public List<RateLimitRule> listRules(long tierId) {
        return ruleRepo.findByTierIdOrderByPriorityDesc(tierId);
    }

    /**
     * Case-insensitive full match where {@code *} stands for any run of characters and
     * everything else is literal.
     */
    boolean matches(String endpointPattern, String endpoint) {
        if (endpointPattern == null || endpoint == null) {
            return false;
        }
        return compiledPatterns.computeIfAbsent(endpointPattern, SubscriptionService::compile)
                .matcher(endpoint)
                .matches();
    }

    static Pattern compile(String endpointPattern) {
        String regex = Arrays.stream(endpointPattern.split("\\*", -1))
                .map(part -> part.isEmpty() ? "" : Pattern.quote(part))
                .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private SubscriptionTier resolveTier(long userId) {
        if (trustedSystemAccounts.contains(userId)) {
            SubscriptionTier systemTier = findSystemTier();
            if (systemTier != null) {
                return systemTier;
            }
            log.warn("User={} is a trusted system account but no system tier is configured", userId);
        }

        UserQuota quota = quotaRepo.findByUserId(userId);
        if (quota != null) {
            SubscriptionTier tier = tierRepo.findById(quota.getSubscriptionTierId());
            if (tier != null) {
                return tier;
            }
            log.warn("Quota of user={} references missing tier={}", userId, quota.getSubscriptionTierId());
        }

        SubscriptionTier free = findFreeTier();
        if (free == null) {
            throw new SubscriptionConfigurationException("Default subscription tier not configured correctly");
        }
        return free;
    }

    private SubscriptionTier findSystemTier() {
        SubscriptionTier tier = tierRepo.findById(config.getSystemTierId());
        if (tier != null) {
            return tier;
        }
        tier = tierRepo.findByName(SYSTEM_TIER_NAME);
        return tier != null && tier.isSystemTier() ? tier : null;
    }

    private SubscriptionTier findFreeTier() {
        SubscriptionTier tier = tierRepo.findById(config.getDefaultFreeTierId());
        if (tier != null) {
            return tier;
        }
        tier = tierRepo.findByName(FREE_TIER_NAME);
        return tier != null && !tier.isSystemTier() ? tier : null;
    }
}
