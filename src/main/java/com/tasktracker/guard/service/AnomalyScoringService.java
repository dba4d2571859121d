package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.ActivityTimeClassifier;
import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.model.AnomalyDetectionResult;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores a user action against the user's own trailing history.
 *
 * <p>The score and the reason list are computed by two independent checks. They use
 * slightly different bars (a rare action for the score is below 10% of history, while
 * the reason list calls an action unusual unless it is above 10%, and IP novelty is a
 * ratio for the score but a set lookup for the reasons), so the two can disagree.
 * Callers rely on each as it is.
 */
@Service
public class AnomalyScoringService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScoringService.class);

    public static final String REASON_NEW_USER = "New user - no historical behavior";
    public static final String REASON_UNTYPICAL_HOUR = "Access outside typical hours";
    public static final String REASON_NEW_IP = "Access from new IP address";
    public static final String REASON_UNUSUAL_ACTION = "Unusual action type";
    public static final String REASON_HIGH_VELOCITY = "High velocity activity";
    public static final String REASON_OFF_HOURS = "Off-hours access";

    private final BehaviorRecordRepository behaviorRepo;
    private final ActivityTimeClassifier timeClassifier;
    private final AnalyticsConfig config;
    private final Clock clock;

    public AnomalyScoringService(BehaviorRecordRepository behaviorRepo,
                                 ActivityTimeClassifier timeClassifier,
                                 AnalyticsConfig config,
                                 Clock clock) {
        this.behaviorRepo = behaviorRepo;
        this.timeClassifier = timeClassifier;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Additive penalties over the trailing scoring window, capped at 1.0. A user with no
     * history gets the new-user score. Store failures score 0.0.
     */
    public double calculateAnomalyScore(long userId, String ipAddress, String actionType, long timestamp) {
        try {
            List<BehaviorRecord> history = loadHistory(userId, timestamp);
            if (history.isEmpty()) {
                return config.getNewUserScore();
            }

            AnalyticsConfig.Penalties penalties = config.getPenalties();
            double score = 0.0;

            Set<Integer> seenHours = history.stream()
                    .map(r -> timeClassifier.hourOfDay(r.getTimestamp()))
                    .collect(Collectors.toSet());
            if (!seenHours.contains(timeClassifier.hourOfDay(timestamp))) {
                score += penalties.getUnusualHour();
            }

            double total = history.size();
            double actionRatio = Frequencies.countMatching(history, BehaviorRecord::getActionType, actionType) / total;
            if (actionRatio < config.getRareRatio()) {
                score += penalties.getRareAction();
            }

            double ipRatio = Frequencies.countMatching(history, BehaviorRecord::getIpAddress, ipAddress) / total;
            if (ipRatio < config.getRareRatio()) {
                score += penalties.getRareIp();
            }

            if (recentActionCount(userId, timestamp) > config.getVelocityThreshold()) {
                score += penalties.getHighVelocity();
            }

            return Math.min(score, 1.0);
        } catch (Exception e) {
            log.error("Error calculating anomaly score for user={}", userId, e);
            return 0.0;
        }
    }

    /**
     * Human-readable reasons for an action, deduplicated, in check order. A user with no
     * history gets only the new-user reason. Store failures yield an empty list.
     */
    public List<String> getAnomalyReasons(long userId, String ipAddress, String actionType, long timestamp) {
        Set<String> reasons = new LinkedHashSet<>();
        try {
            List<BehaviorRecord> history = loadHistory(userId, timestamp);
            if (history.isEmpty()) {
                reasons.add(REASON_NEW_USER);
                return new ArrayList<>(reasons);
            }

            Set<Integer> seenHours = history.stream()
                    .map(r -> timeClassifier.hourOfDay(r.getTimestamp()))
                    .collect(Collectors.toSet());
            if (!seenHours.contains(timeClassifier.hourOfDay(timestamp))) {
                reasons.add(REASON_UNTYPICAL_HOUR);
            }

            Set<String> knownIps = history.stream()
                    .map(BehaviorRecord::getIpAddress)
                    .collect(Collectors.toSet());
            if (!knownIps.contains(ipAddress)) {
                reasons.add(REASON_NEW_IP);
            }

            double commonBar = history.size() * config.getCommonActionRatio();
            Set<String> commonActions = Frequencies.count(history, BehaviorRecord::getActionType).entrySet().stream()
                    .filter(e -> e.getValue() > commonBar)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toSet());
            if (!commonActions.contains(actionType)) {
                reasons.add(REASON_UNUSUAL_ACTION);
            }

            if (recentActionCount(userId, timestamp) > config.getVelocityThreshold()) {
                reasons.add(REASON_HIGH_VELOCITY);
            }

            if (timeClassifier.isOffHours(timestamp)) {
                reasons.add(REASON_OFF_HOURS);
            }
            return new ArrayList<>(reasons);
        } catch (Exception e) {
            log.error("Error getting anomaly reasons for user={}", userId, e);
            return new ArrayList<>();
        }
    }

    public RiskLevel riskLevelFor(double score) {
        return RiskLevel.fromScore(score, config.getMediumThreshold(),
                config.getHighThreshold(), config.getCriticalThreshold());
    }

    public boolean isAnomalous(double score) {
        return score >= config.getMediumThreshold();
    }

    public boolean isActivityAnomalous(long userId, String ipAddress, String actionType, long timestamp) {
        return isAnomalous(calculateAnomalyScore(userId, ipAddress, actionType, timestamp));
    }

    /**
     * Scores a prospective action at the current time without writing to the ledger.
     */
    @Observed(name = "behavior.analyze", contextualName = "analyze-user-behavior")
    public AnomalyDetectionResult analyzeUserBehavior(long userId, String ipAddress, String actionType) {
        long now = clock.millis();
        try {
            double score = calculateAnomalyScore(userId, ipAddress, actionType, now);
            RiskLevel riskLevel = riskLevelFor(score);
            return AnomalyDetectionResult.builder()
                    .anomalous(isAnomalous(score))
                    .anomalyScore(score)
                    .riskLevel(riskLevel)
                    .anomalyReasons(getAnomalyReasons(userId, ipAddress, actionType, now))
                    .recommendedAction(riskLevel.recommendedAction())
                    .analyzedAt(now)
                    .build();
        } catch (Exception e) {
            log.error("Error analyzing behavior for user={}", userId, e);
            return AnomalyDetectionResult.builder()
                    .anomalous(false)
                    .anomalyScore(0.0)
                    .riskLevel(RiskLevel.LOW)
                    .recommendedAction("Monitor")
                    .analyzedAt(now)
                    .build();
        }
    }

    int recentActionCount(long userId, long timestamp) {
        long windowStart = timestamp - Duration.ofSeconds(config.getVelocityWindowSeconds()).toMillis();
        return behaviorRepo.countByUserIdBetween(userId, windowStart, timestamp);
    }

    private List<BehaviorRecord> loadHistory(long userId, long timestamp) {
        long from = timestamp - Duration.ofDays(config.getScoringWindowDays()).toMillis();
        return behaviorRepo.findByUserIdBetween(userId, from, timestamp);
    }
}
