package com.tasktracker.guard.service;

import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.model.BehaviorAnalyticsSummary;
import com.tasktracker.guard.model.BehaviorPattern;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import com.tasktracker.guard.model.UserBehaviorSummary;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Read-side views over the behavior ledger: fleet patterns, summaries and listings,
 * plus retention cleanup.
 */
@Service
public class BehaviorAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(BehaviorAnalyticsService.class);

    public static final String PATTERN_OFF_HOURS = "Off-Hours Access";
    public static final String PATTERN_NEW_LOCATION = "New Location Access";
    public static final String PATTERN_HIGH_VELOCITY = "High Velocity Activity";

    static final int MAX_AFFECTED_USERS = 5;
    static final int MAX_LISTING = 50;
    static final int MAX_HISTORY = 100;
    static final int DEFAULT_ANOMALY_COUNT = 20;
    private static final int SUMMARY_TOP_USERS = 10;
    private static final int SUMMARY_TOP_REASONS = 5;
    private static final int RECENT_ANOMALIES = 10;

    private final BehaviorRecordRepository behaviorRepo;
    private final BaselineService baselineService;
    private final AnalyticsConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BehaviorAnalyticsService(BehaviorRecordRepository behaviorRepo,
                                    BaselineService baselineService,
                                    AnalyticsConfig config,
                                    MetricsConfig metricsConfig,
                                    Clock clock) {
        this.behaviorRepo = behaviorRepo;
        this.baselineService = baselineService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Named patterns over the trailing pattern window, highest risk first. Patterns with
     * no occurrences are left out.
     */
    public List<BehaviorPattern> getCommonPatterns() {
        try {
            return buildPatterns(recentWindow());
        } catch (Exception e) {
            log.error("Error computing behavior patterns", e);
            return new ArrayList<>();
        }
    }

    public BehaviorAnalyticsSummary getAnalyticsSummary() {
        long now = clock.millis();
        long from = now - Duration.ofDays(config.getPatternWindowDays()).toMillis();
        try {
            List<BehaviorRecord> records = behaviorRepo.findBetween(from, now + 1);
            List<BehaviorRecord> anomalies = records.stream().filter(BehaviorRecord::isAnomalous).toList();

            return BehaviorAnalyticsSummary.builder()
                    .windowStart(from)
                    .windowEnd(now)
                    .totalActivities(records.size())
                    .anomalousActivities(anomalies.size())
                    .criticalRiskActivities(countLevel(records, RiskLevel.CRITICAL))
                    .highRiskActivities(countLevel(records, RiskLevel.HIGH))
                    .mediumRiskActivities(countLevel(records, RiskLevel.MEDIUM))
                    .lowRiskActivities(countLevel(records, RiskLevel.LOW))
                    .offHoursActivities(count(records, BehaviorRecord::isOffHours))
                    .newLocationActivities(count(records, BehaviorRecord::isNewLocation))
                    .newDeviceActivities(count(records, BehaviorRecord::isNewDevice))
                    .highVelocityActivities(count(records, BehaviorRecord::isHighVelocity))
                    .averageAnomalyScore(records.stream().mapToDouble(BehaviorRecord::getAnomalyScore).average().orElse(0))
                    .topAnomalousUsers(Frequencies.topEntries(
                            Frequencies.count(anomalies, BehaviorRecord::getUsername), SUMMARY_TOP_USERS))
                    .topAnomalyReasons(Frequencies.topEntries(reasonCounts(anomalies), SUMMARY_TOP_REASONS))
                    .recentAnomalies(anomalies.stream().limit(RECENT_ANOMALIES).toList())
                    .patterns(buildPatterns(records))
                    .build();
        } catch (Exception e) {
            log.error("Error building behavior analytics summary", e);
            return BehaviorAnalyticsSummary.builder().windowStart(from).windowEnd(now).build();
        }
    }

    public UserBehaviorSummary getUserBehaviorSummary(long userId) {
        long now = clock.millis();
        long from = now - Duration.ofDays(config.getBaselineWindowDays()).toMillis();
        try {
            List<BehaviorRecord> records = behaviorRepo.findByUserIdBetween(userId, from, now + 1);
            if (records.isEmpty()) {
                return UserBehaviorSummary.builder()
                        .userId(userId)
                        .username("Unknown")
                        .highestRiskLevel(RiskLevel.LOW)
                        .baseline(baselineService.getUserBaseline(userId))
                        .build();
            }

            BehaviorRecord latest = records.get(records.size() - 1);
            List<BehaviorRecord> anomalies = records.stream().filter(BehaviorRecord::isAnomalous).toList();

            return UserBehaviorSummary.builder()
                    .userId(userId)
                    .username(latest.getUsername())
                    .totalActivities(records.size())
                    .anomalousActivities(anomalies.size())
                    .averageAnomalyScore(records.stream().mapToDouble(BehaviorRecord::getAnomalyScore).average().orElse(0))
                    .highestRiskLevel(records.stream()
                            .map(BehaviorRecord::getRiskLevel)
                            .filter(Objects::nonNull)
                            .max(Comparator.naturalOrder())
                            .orElse(RiskLevel.LOW))
                    .distinctIpAddresses(Frequencies.count(records, BehaviorRecord::getIpAddress).size())
                    .distinctLocations(Frequencies.count(records, r -> r.getCountry() + ", " + r.getCity()).size())
                    .distinctDevices(Frequencies.count(records, r -> r.getDeviceType() + " - " + r.getBrowser()).size())
                    .offHoursActivities(count(records, BehaviorRecord::isOffHours))
                    .lastActivity(latest.getTimestamp())
                    .baseline(baselineService.getUserBaseline(userId))
                    .recentAnomalies(anomalies.stream()
                            .sorted(Comparator.comparingLong(BehaviorRecord::getTimestamp).reversed())
                            .limit(RECENT_ANOMALIES)
                            .toList())
                    .build();
        } catch (Exception e) {
            log.error("Error building behavior summary for user={}", userId, e);
            return UserBehaviorSummary.builder().userId(userId).highestRiskLevel(RiskLevel.LOW).build();
        }
    }

    /**
     * A user's records, newest first, optionally bounded by {@code from}/{@code to}
     * (both inclusive). At most 100 are returned.
     */
    public List<BehaviorRecord> getUserBehaviorHistory(long userId, Long from, Long to) {
        try {
            long start = from != null ? from : 0L;
            long end = to != null ? to + 1 : Long.MAX_VALUE;
            List<BehaviorRecord> records = new ArrayList<>(behaviorRepo.findByUserIdBetween(userId, start, end));
            records.sort(Comparator.comparingLong(BehaviorRecord::getTimestamp).reversed());
            return records.stream().limit(MAX_HISTORY).toList();
        } catch (Exception e) {
            log.error("Error loading behavior history for user={}", userId, e);
            return new ArrayList<>();
        }
    }

    /**
     * Anomalous records, highest score first, then newest first.
     */
    public List<BehaviorRecord> getAnomalousActivities(int count) {
        try {
            int limit = count > 0 ? count : DEFAULT_ANOMALY_COUNT;
            return behaviorRepo.findAll().stream()
                    .filter(BehaviorRecord::isAnomalous)
                    .sorted(Comparator.comparingDouble(BehaviorRecord::getAnomalyScore).reversed()
                            .thenComparing(Comparator.comparingLong(BehaviorRecord::getTimestamp).reversed()))
                    .limit(limit)
                    .toList();
        } catch (Exception e) {
            log.error("Error loading anomalous activities", e);
            return new ArrayList<>();
        }
    }

    public List<BehaviorRecord> getHighRiskActivities() {
        return listNewestFirst("high-risk", r -> r.getRiskLevel() != null && r.getRiskLevel().isAtLeast(RiskLevel.HIGH));
    }

    public List<BehaviorRecord> getOffHoursActivities() {
        return listNewestFirst("off-hours", BehaviorRecord::isOffHours);
    }

    public List<BehaviorRecord> getNewLocationAccess() {
        return listNewestFirst("new-location", BehaviorRecord::isNewLocation);
    }

    public List<BehaviorRecord> getNewDeviceAccess() {
        return listNewestFirst("new-device", BehaviorRecord::isNewDevice);
    }

    /**
     * Removes ledger records older than {@code daysOld} days. Returns the number removed,
     * or 0 when the cleanup failed.
     */
    public int cleanupOldBehaviorData(int daysOld) {
        try {
            long cutoff = clock.millis() - Duration.ofDays(daysOld).toMillis();
            int removed = behaviorRepo.deleteOlderThan(cutoff);
            metricsConfig.recordCleanup("behavior", removed);
            log.info("Behavior cleanup removed {} records older than {} days", removed, daysOld);
            return removed;
        } catch (Exception e) {
            log.error("Error cleaning up behavior data older than {} days", daysOld, e);
            return 0;
        }
    }

    private List<BehaviorRecord> recentWindow() {
        long now = clock.millis();
        long from = now - Duration.ofDays(config.getPatternWindowDays()).toMillis();
        return behaviorRepo.findBetween(from, now + 1);
    }

    private List<BehaviorPattern> buildPatterns(List<BehaviorRecord> records) {
        List<BehaviorPattern> patterns = new ArrayList<>();
        addPattern(patterns, records, PATTERN_OFF_HOURS,
                "Users accessing the system outside normal business hours", 0.3, BehaviorRecord::isOffHours);
        addPattern(patterns, records, PATTERN_NEW_LOCATION,
                "Users accessing from new geographic locations", 0.4, BehaviorRecord::isNewLocation);
        addPattern(patterns, records, PATTERN_HIGH_VELOCITY,
                "Users performing rapid successive actions", 0.5, BehaviorRecord::isHighVelocity);
        patterns.sort(Comparator.comparingDouble(BehaviorPattern::getRiskScore).reversed());
        return patterns;
    }

    private void addPattern(List<BehaviorPattern> patterns, List<BehaviorRecord> records, String name,
                            String description, double baseWeight, Predicate<BehaviorRecord> matcher) {
        List<BehaviorRecord> matching = records.stream().filter(matcher).toList();
        if (matching.isEmpty()) {
            return;
        }
        patterns.add(BehaviorPattern.builder()
                .patternType(name)
                .description(description)
                .occurrenceCount(matching.size())
                .riskScore(patternRiskScore(matching.size(), records.size(), baseWeight))
                .affectedUsers(matching.stream()
                        .map(BehaviorRecord::getUsername)
                        .filter(Objects::nonNull)
                        .distinct()
                        .limit(MAX_AFFECTED_USERS)
                        .toList())
                .firstDetected(matching.stream().mapToLong(BehaviorRecord::getTimestamp).min().orElse(0))
                .lastDetected(matching.stream().mapToLong(BehaviorRecord::getTimestamp).max().orElse(0))
                .build());
    }

    static double patternRiskScore(int count, int total, double baseWeight) {
        if (total == 0) return 0.0;
        return Math.min((double) count / total * baseWeight * 10, 1.0);
    }

    private List<BehaviorRecord> listNewestFirst(String listing, Predicate<BehaviorRecord> filter) {
        try {
            return behaviorRepo.findAll().stream()
                    .filter(filter)
                    .limit(MAX_LISTING)
                    .toList();
        } catch (Exception e) {
            log.error("Error loading {} activities", listing, e);
            return new ArrayList<>();
        }
    }

    private static Map<String, Integer> reasonCounts(List<BehaviorRecord> records) {
        List<String> reasons = records.stream()
                .map(BehaviorRecord::getAnomalyReason)
                .filter(r -> r != null && !r.isBlank())
                .flatMap(r -> Arrays.stream(r.split(", ")))
                .toList();
        return Frequencies.count(reasons, r -> r);
    }

    private static int countLevel(List<BehaviorRecord> records, RiskLevel level) {
        return count(records, r -> r.getRiskLevel() == level);
    }

    private static int count(List<BehaviorRecord> records, Predicate<BehaviorRecord> predicate) {
        return (int) records.stream().filter(predicate).count();
    }
}
