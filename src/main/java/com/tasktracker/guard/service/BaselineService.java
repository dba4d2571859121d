package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.ActivityTimeClassifier;
import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.UserBaseline;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.List;

/**
 * Builds a user's typical behavior on demand from the non-anomalous part of their
 * trailing history. Nothing is persisted.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    static final double TYPICAL_ACTION_DEVIATION = 0.1;
    static final double UNUSUAL_ACTION_DEVIATION = 0.8;

    private static final int TOP_LOCATIONS = 5;
    private static final int TOP_DEVICES = 3;
    private static final int TOP_ACTION_TYPES = 5;

    private final BehaviorRecordRepository behaviorRepo;
    private final ActivityTimeClassifier timeClassifier;
    private final AnalyticsConfig config;
    private final Clock clock;

    public BaselineService(BehaviorRecordRepository behaviorRepo,
                           ActivityTimeClassifier timeClassifier,
                           AnalyticsConfig config,
                           Clock clock) {
        this.behaviorRepo = behaviorRepo;
        this.timeClassifier = timeClassifier;
        this.config = config;
        this.clock = clock;
    }

    public UserBaseline getUserBaseline(long userId) {
        long now = clock.millis();
        long from = now - Duration.ofDays(config.getBaselineWindowDays()).toMillis();

        List<BehaviorRecord> normal = behaviorRepo.findByUserIdBetween(userId, from, now).stream()
                .filter(r -> !r.isAnomalous())
                .toList();

        if (normal.isEmpty()) {
            return UserBaseline.builder()
                    .userId(userId)
                    .username("Unknown")
                    .baselineWindowDays(config.getBaselineWindowDays())
                    .computedAt(now)
                    .build();
        }

        String username = normal.stream()
                .max(Comparator.comparingLong(BehaviorRecord::getTimestamp))
                .map(BehaviorRecord::getUsername)
                .orElse("Unknown");

        IntSummaryStatistics hours = normal.stream()
                .mapToInt(r -> timeClassifier.hourOfDay(r.getTimestamp()))
                .summaryStatistics();

        return UserBaseline.builder()
                .userId(userId)
                .username(username)
                .typicalLocations(new ArrayList<>(Frequencies.topKeys(normal,
                        r -> r.getCountry() + ", " + r.getCity(), TOP_LOCATIONS)))
                .typicalDevices(new ArrayList<>(Frequencies.topKeys(normal,
                        r -> r.getDeviceType() + " - " + r.getBrowser(), TOP_DEVICES)))
                .typicalSessionDurationSeconds(normal.stream()
                        .mapToLong(BehaviorRecord::getSessionDurationSeconds)
                        .average().orElse(0))
                .typicalActionsPerMinute((int) normal.stream()
                        .mapToInt(BehaviorRecord::getActionsPerMinute)
                        .average().orElse(0))
                .typicalActionTypes(new ArrayList<>(Frequencies.topKeys(normal,
                        BehaviorRecord::getActionType, TOP_ACTION_TYPES)))
                .typicalActiveHours(hours.getMax() - hours.getMin())
                .sampleSize(normal.size())
                .baselineWindowDays(config.getBaselineWindowDays())
                .computedAt(now)
                .build();
    }

    /**
     * Binary deviation: low for one of the user's typical action types, high otherwise.
     * Callers go through this method so a continuous distance can replace it later.
     */
    public double deviationFromBaseline(UserBaseline baseline, String actionType) {
        return baseline.getTypicalActionTypes().contains(actionType)
                ? TYPICAL_ACTION_DEVIATION
                : UNUSUAL_ACTION_DEVIATION;
    }

    /**
     * Recomputes the baseline. Baselines are derived on read, so this only validates
     * that the history can be loaded.
     */
    public boolean refreshUserBaseline(long userId) {
        try {
            UserBaseline baseline = getUserBaseline(userId);
            log.info("Baseline refreshed for user={}: samples={}, actionTypes={}",
                    userId, baseline.getSampleSize(), baseline.getTypicalActionTypes());
            return true;
        } catch (Exception e) {
            log.error("Failed to refresh baseline for user={}", userId, e);
            return false;
        }
    }
}
