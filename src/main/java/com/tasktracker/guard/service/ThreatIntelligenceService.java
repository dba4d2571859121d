package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.IpClassifier;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.config.ThreatIntelConfig;
import com.tasktracker.guard.model.IpReputation;
import com.tasktracker.guard.model.RecommendedAction;
import com.tasktracker.guard.model.ThreatRecord;
import com.tasktracker.guard.model.ThreatSeverity;
import com.tasktracker.guard.model.ThreatSummary;
import com.tasktracker.guard.repository.ThreatRecordRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * IP reputation backed by the threat store.
 *
 * <p>Whitelisting and blacklisting act on the primary record of an address (its active
 * record with the highest confidence) and clear the opposite flag on every record of
 * that address, so the two flags are never set together for one IP.
 */
@Service
public class ThreatIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelligenceService.class);

    public static final String PATTERN_MATCH_TYPE = "Pattern Match";
    public static final String PATTERN_ANALYSIS_SOURCE = "Pattern Analysis";
    public static final String MANUAL_SOURCE = "Manual";
    public static final String WHITELIST_TYPE = "Whitelist";
    public static final String BLACKLIST_TYPE = "Blacklist";

    private static final int LISTED_CONFIDENCE = 100;
    private static final int TOP_COUNTRIES = 10;

    private static final Comparator<ThreatRecord> PRIMARY_ORDER =
            Comparator.comparingInt(ThreatRecord::getConfidenceScore)
                    .thenComparingLong(ThreatRecord::getLastSeen);

    private static final Comparator<ThreatRecord> NEWEST_FIRST =
            Comparator.comparingLong(ThreatRecord::getLastSeen).reversed();

    private final ThreatRecordRepository threatRepo;
    private final IpClassifier ipClassifier;
    private final ThreatIntelConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ThreatIntelligenceService(ThreatRecordRepository threatRepo,
                                     IpClassifier ipClassifier,
                                     ThreatIntelConfig config,
                                     MetricsConfig metricsConfig,
                                     Clock clock) {
        this.threatRepo = threatRepo;
        this.ipClassifier = ipClassifier;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Whitelist first, then the primary active record, then pattern analysis of the raw
     * address. A suspicious pattern is written back to the store as a "Pattern Match" report.
     */
    @Observed(name = "threat.reputation", contextualName = "check-ip-reputation")
    public IpReputation checkIpReputation(String ipAddress) {
        long now = clock.millis();
        IpReputation result;
        try {
            List<ThreatRecord> records = threatRepo.findAllByIp(ipAddress);

            if (records.stream().anyMatch(ThreatRecord::isWhitelisted)) {
                result = IpReputation.builder()
                        .ipAddress(ipAddress)
                        .threat(false)
                        .severity(ThreatSeverity.SAFE)
                        .confidenceScore(LISTED_CONFIDENCE)
                        .recommendedAction(RecommendedAction.ALLOW)
                        .reasons(new ArrayList<>(List.of("Address is whitelisted")))
                        .whitelisted(true)
                        .checkedAt(now)
                        .build();
            } else {
                ThreatRecord primary = primaryRecord(records);
                if (primary != null) {
                    result = fromRecord(ipAddress, primary, now);
                } else {
                    result = fromPatternAnalysis(ipAddress, now);
                }
            }
        } catch (Exception e) {
            log.error("Error checking IP reputation for ip={}", ipAddress, e);
            result = IpReputation.builder()
                    .ipAddress(ipAddress)
                    .threat(false)
                    .severity(ThreatSeverity.UNKNOWN)
                    .confidenceScore(0)
                    .recommendedAction(RecommendedAction.MONITOR)
                    .checkedAt(now)
                    .build();
        }
        metricsConfig.recordReputationCheck(result.getSeverity().name(), result.getRecommendedAction().name());
        return result;
    }

    /**
     * Upserts a report keyed by (ip, type). A repeat report refreshes lastSeen, bumps
     * reportCount, keeps the higher confidence and reactivates the record.
     */
    public boolean addThreatIntelligence(String ipAddress, String threatType, ThreatSeverity severity,
                                         String source, String description, int confidenceScore) {
        try {
            long now = clock.millis();
            int confidence = resolveConfidence(threatType, confidenceScore);
            ThreatRecord existing = threatRepo.findByIpAndType(ipAddress, threatType);

            if (existing != null) {
                existing.setLastSeen(now);
                existing.setReportCount(existing.getReportCount() + 1);
                existing.setConfidenceScore(Math.max(existing.getConfidenceScore(), confidence));
                existing.setActive(true);
                existing.setUpdatedAt(now);
                threatRepo.save(existing);
                log.debug("Threat report repeated: ip={}, type={}, reports={}",
                        ipAddress, threatType, existing.getReportCount());
            } else {
                threatRepo.save(ThreatRecord.builder()
                        .threatId(UUID.randomUUID().toString())
                        .ipAddress(ipAddress)
                        .threatType(threatType)
                        .severity(severity != null ? severity : ThreatSeverity.MEDIUM)
                        .threatSource(source)
                        .description(description)
                        .confidenceScore(confidence)
                        .firstSeen(now)
                        .lastSeen(now)
                        .reportCount(1)
                        .active(true)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                log.info("New threat recorded: ip={}, type={}, severity={}, confidence={}",
                        ipAddress, threatType, severity, confidence);
            }
            return true;
        } catch (Exception e) {
            log.error("Error adding threat intelligence for ip={}", ipAddress, e);
            return false;
        }
    }

    public boolean whitelistIp(String ipAddress, String reason) {
        try {
            long now = clock.millis();
            List<ThreatRecord> records = threatRepo.findAllByIp(ipAddress);
            ThreatRecord primary = primaryRecord(records);

            if (primary != null) {
                primary.setWhitelisted(true);
                primary.setBlacklisted(false);
                primary.setDescription("Whitelisted: " + reason);
                primary.setUpdatedAt(now);
                threatRepo.save(primary);
            } else {
                primary = listedRecord(ipAddress, WHITELIST_TYPE, ThreatSeverity.SAFE, "Whitelisted: " + reason, now);
                primary.setWhitelisted(true);
                threatRepo.save(primary);
            }
            clearFlag(records, primary, false, now);
            log.info("IP whitelisted: ip={}, reason={}", ipAddress, reason);
            return true;
        } catch (Exception e) {
            log.error("Error whitelisting ip={}", ipAddress, e);
            return false;
        }
    }

    public boolean blacklistIp(String ipAddress, String reason) {
        try {
            long now = clock.millis();
            List<ThreatRecord> records = threatRepo.findAllByIp(ipAddress);
            ThreatRecord primary = primaryRecord(records);

            if (primary != null) {
                primary.setBlacklisted(true);
                primary.setWhitelisted(false);
                primary.setSeverity(ThreatSeverity.CRITICAL);
                primary.setDescription("Blacklisted: " + reason);
                primary.setUpdatedAt(now);
                threatRepo.save(primary);
            } else {
                primary = listedRecord(ipAddress, BLACKLIST_TYPE, ThreatSeverity.CRITICAL, "Blacklisted: " + reason, now);
                primary.setBlacklisted(true);
                threatRepo.save(primary);
            }
            clearFlag(records, primary, true, now);
            log.warn("IP blacklisted: ip={}, reason={}", ipAddress, reason);
            return true;
        } catch (Exception e) {
            log.error("Error blacklisting ip={}", ipAddress, e);
            return false;
        }
    }

    public boolean isIpBlacklisted(String ipAddress) {
        try {
            return threatRepo.findAllByIp(ipAddress).stream().anyMatch(ThreatRecord::isBlacklisted);
        } catch (Exception e) {
            log.error("Error checking blacklist for ip={}", ipAddress, e);
            return false;
        }
    }

    public boolean isIpWhitelisted(String ipAddress) {
        try {
            return threatRepo.findAllByIp(ipAddress).stream().anyMatch(ThreatRecord::isWhitelisted);
        } catch (Exception e) {
            log.error("Error checking whitelist for ip={}", ipAddress, e);
            return false;
        }
    }

    public ThreatRecord getThreat(String threatId) {
        return threatRepo.findById(threatId);
    }

    public List<ThreatRecord> getThreatsByType(String threatType) {
        try {
            return threatRepo.findActiveByType(threatType).stream().sorted(NEWEST_FIRST).toList();
        } catch (Exception e) {
            log.error("Error loading threats of type={}", threatType, e);
            return new ArrayList<>();
        }
    }

    public List<ThreatRecord> getThreatsBySeverity(ThreatSeverity severity) {
        try {
            return threatRepo.findActiveBySeverity(severity).stream().sorted(NEWEST_FIRST).toList();
        } catch (Exception e) {
            log.error("Error loading threats of severity={}", severity, e);
            return new ArrayList<>();
        }
    }

    public List<ThreatRecord> getRecentThreats(int count) {
        try {
            int limit = count > 0 ? count : config.getRecentThreatsDefault();
            return threatRepo.findActive().stream().sorted(NEWEST_FIRST).limit(limit).toList();
        } catch (Exception e) {
            log.error("Error loading recent threats", e);
            return new ArrayList<>();
        }
    }

    public boolean updateThreatStatus(String threatId, boolean active) {
        try {
            ThreatRecord threat = threatRepo.findById(threatId);
            if (threat == null) {
                return false;
            }
            threat.setActive(active);
            threat.setUpdatedAt(clock.millis());
            threatRepo.save(threat);
            return true;
        } catch (Exception e) {
            log.error("Error updating status of threat={}", threatId, e);
            return false;
        }
    }

    public List<String> getThreatTypes() {
        try {
            return threatRepo.findAll().stream()
                    .map(ThreatRecord::getThreatType)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (Exception e) {
            log.error("Error loading threat types", e);
            return new ArrayList<>();
        }
    }

    public List<String> getThreatSources() {
        try {
            return threatRepo.findAll().stream()
                    .map(ThreatRecord::getThreatSource)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (Exception e) {
            log.error("Error loading threat sources", e);
            return new ArrayList<>();
        }
    }

    public ThreatSummary getThreatSummary() {
        long now = clock.millis();
        try {
            List<ThreatRecord> all = threatRepo.findAll();
            List<ThreatRecord> active = all.stream().filter(ThreatRecord::isActive).toList();

            return ThreatSummary.builder()
                    .totalThreats(all.size())
                    .activeThreats(active.size())
                    .criticalThreats(countSeverity(active, ThreatSeverity.CRITICAL))
                    .highThreats(countSeverity(active, ThreatSeverity.HIGH))
                    .mediumThreats(countSeverity(active, ThreatSeverity.MEDIUM))
                    .lowThreats(countSeverity(active, ThreatSeverity.LOW))
                    .blacklistedIps((int) all.stream().filter(ThreatRecord::isBlacklisted)
                            .map(ThreatRecord::getIpAddress).distinct().count())
                    .whitelistedIps((int) all.stream().filter(ThreatRecord::isWhitelisted)
                            .map(ThreatRecord::getIpAddress).distinct().count())
                    .threatsByType(Frequencies.count(active, ThreatRecord::getThreatType))
                    .topThreatCountries(Frequencies.topEntries(
                            Frequencies.count(active, ThreatRecord::getCountry), TOP_COUNTRIES))
                    .recentThreats(active.stream().sorted(NEWEST_FIRST)
                            .limit(config.getRecentThreatsDefault()).toList())
                    .generatedAt(now)
                    .build();
        } catch (Exception e) {
            log.error("Error building threat summary", e);
            return ThreatSummary.builder().generatedAt(now).build();
        }
    }

    /**
     * Deletes records not seen for {@code daysOld} days. Whitelisted and blacklisted
     * records are kept. Returns the number removed, or 0 when the cleanup failed.
     */
    public int cleanupOldThreats(int daysOld) {
        try {
            long cutoff = clock.millis() - Duration.ofDays(daysOld).toMillis();
            List<String> stale = threatRepo.findLastSeenBefore(cutoff).stream()
                    .filter(t -> !t.isBlacklisted() && !t.isWhitelisted())
                    .map(ThreatRecord::getThreatId)
                    .toList();
            int removed = threatRepo.deleteAll(stale);
            metricsConfig.recordCleanup("threat", removed);
            log.info("Threat cleanup removed {} records not seen for {} days", removed, daysOld);
            return removed;
        } catch (Exception e) {
            log.error("Error cleaning up threats older than {} days", daysOld, e);
            return 0;
        }
    }

    private IpReputation fromRecord(String ipAddress, ThreatRecord record, long now) {
        return IpReputation.builder()
                .ipAddress(ipAddress)
                .threat(record.getSeverity() != ThreatSeverity.SAFE)
                .severity(record.getSeverity())
                .confidenceScore(record.getConfidenceScore())
                .threatTypes(new ArrayList<>(List.of(record.getThreatType())))
                .threatSource(record.getThreatSource())
                .recommendedAction(record.getSeverity().recommendedAction())
                .blacklisted(record.isBlacklisted())
                .checkedAt(now)
                .build();
    }

    private IpReputation fromPatternAnalysis(String ipAddress, long now) {
        List<String> reasons = ipClassifier.suspiciousPatternReasons(ipAddress);
        if (reasons.isEmpty()) {
            return IpReputation.builder()
                    .ipAddress(ipAddress)
                    .threat(false)
                    .severity(ThreatSeverity.LOW)
                    .confidenceScore(config.getBenignConfidence())
                    .recommendedAction(RecommendedAction.ALLOW)
                    .checkedAt(now)
                    .build();
        }

        addThreatIntelligence(ipAddress, PATTERN_MATCH_TYPE, ThreatSeverity.MEDIUM, PATTERN_ANALYSIS_SOURCE,
                String.join("; ", reasons), config.getPatternMatchConfidence());
        return IpReputation.builder()
                .ipAddress(ipAddress)
                .threat(true)
                .severity(ThreatSeverity.MEDIUM)
                .confidenceScore(config.getPatternMatchConfidence())
                .threatTypes(new ArrayList<>(List.of(PATTERN_MATCH_TYPE)))
                .threatSource(PATTERN_ANALYSIS_SOURCE)
                .recommendedAction(RecommendedAction.MONITOR)
                .reasons(new ArrayList<>(reasons))
                .checkedAt(now)
                .build();
    }

    private ThreatRecord primaryRecord(List<ThreatRecord> records) {
        return records.stream()
                .filter(ThreatRecord::isActive)
                .max(PRIMARY_ORDER)
                .orElse(null);
    }

    private ThreatRecord listedRecord(String ipAddress, String type, ThreatSeverity severity,
                                      String description, long now) {
        return ThreatRecord.builder()
                .threatId(UUID.randomUUID().toString())
                .ipAddress(ipAddress)
                .threatType(type)
                .severity(severity)
                .threatSource(MANUAL_SOURCE)
                .description(description)
                .confidenceScore(LISTED_CONFIDENCE)
                .firstSeen(now)
                .lastSeen(now)
                .reportCount(1)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Clears the whitelist flag (when {@code clearWhitelist}) or the blacklist flag on every
     * record of the address other than {@code keep}.
     */
    private void clearFlag(List<ThreatRecord> records, ThreatRecord keep, boolean clearWhitelist, long now) {
        for (ThreatRecord record : records) {
            if (record.getThreatId().equals(keep.getThreatId())) continue;
            boolean flagged = clearWhitelist ? record.isWhitelisted() : record.isBlacklisted();
            if (!flagged) continue;
            if (clearWhitelist) {
                record.setWhitelisted(false);
            } else {
                record.setBlacklisted(false);
            }
            record.setUpdatedAt(now);
            threatRepo.save(record);
        }
    }

    private int resolveConfidence(String threatType, int confidenceScore) {
        if (confidenceScore > 0) {
            return Math.min(confidenceScore, 100);
        }
        return config.getTypeConfidence().getOrDefault(threatType, config.getDefaultConfidence());
    }

    private static int countSeverity(List<ThreatRecord> records, ThreatSeverity severity) {
        return (int) records.stream().filter(t -> t.getSeverity() == severity).count();
    }
}
