package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.ActivityTimeClassifier;
import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.model.AnomalyDetectionResult;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import com.tasktracker.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyScoringServiceTest {

    private static final long USER = 42L;
    private static final long NOW = TestDataFactory.WORKDAY_AFTERNOON.toEpochMilli();

    @Mock private BehaviorRecordRepository behaviorRepo;

    private AnomalyScoringService scoringService;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = new AnalyticsConfig();
        Clock clock = Clock.fixed(TestDataFactory.WORKDAY_AFTERNOON, ZoneOffset.UTC);
        scoringService = new AnomalyScoringService(behaviorRepo, new ActivityTimeClassifier(config), config, clock);
    }

    /** {@code count} records, one per day before NOW, at the same hour of day. */
    private List<BehaviorRecord> history(int count, String ip, String actionType, long hourOffsetMillis) {
        List<BehaviorRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            long ts = NOW - Duration.ofDays(i).toMillis() + hourOffsetMillis;
            records.add(TestDataFactory.createBehaviorRecord(USER, ip, actionType, ts));
        }
        return records;
    }

    @Test
    void newUser_getsNewUserScoreAndSingleReason() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW))).thenReturn(List.of());

        assertThat(scoringService.calculateAnomalyScore(USER, "203.0.113.5", "login", NOW)).isEqualTo(0.5);
        assertThat(scoringService.getAnomalyReasons(USER, "203.0.113.5", "login", NOW))
                .containsExactly(AnomalyScoringService.REASON_NEW_USER);
    }

    @Test
    void familiarActivity_scoresZero() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW)))
                .thenReturn(history(20, "203.0.113.5", "view", 0));

        double score = scoringService.calculateAnomalyScore(USER, "203.0.113.5", "view", NOW);

        assertThat(score).isEqualTo(0.0);
        assertThat(scoringService.riskLevelFor(score)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void newIpAndRareAction_addPenalties() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW)))
                .thenReturn(history(20, "203.0.113.5", "view", 0));

        double score = scoringService.calculateAnomalyScore(USER, "198.51.100.9", "export", NOW);

        assertThat(score).isCloseTo(0.5, within(1e-9));
        assertThat(scoringService.isAnomalous(score)).isTrue();
    }

    @Test
    void everyPenalty_isCappedAtOne() {
        // History only at 03:00, so 14:00 is an unseen hour.
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW)))
                .thenReturn(history(20, "203.0.113.5", "view", -Duration.ofHours(11).toMillis()));
        when(behaviorRepo.countByUserIdBetween(eq(USER), eq(NOW - 60_000), eq(NOW))).thenReturn(11);

        double score = scoringService.calculateAnomalyScore(USER, "198.51.100.9", "export", NOW);

        assertThat(score).isEqualTo(1.0);
        assertThat(scoringService.riskLevelFor(score)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void velocityAtThreshold_isNotPenalised() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW)))
                .thenReturn(history(20, "203.0.113.5", "view", 0));
        when(behaviorRepo.countByUserIdBetween(eq(USER), anyLong(), eq(NOW))).thenReturn(10);

        assertThat(scoringService.calculateAnomalyScore(USER, "203.0.113.5", "view", NOW)).isEqualTo(0.0);
    }

    @Test
    void actionAtExactlyTenPercent_isUnusualButNotPenalised() {
        List<BehaviorRecord> records = history(9, "203.0.113.5", "view", 0);
        records.add(TestDataFactory.createBehaviorRecord(USER, "203.0.113.5", "edit",
                NOW - Duration.ofDays(10).toMillis()));
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW))).thenReturn(records);

        assertThat(scoringService.calculateAnomalyScore(USER, "203.0.113.5", "edit", NOW)).isEqualTo(0.0);
        assertThat(scoringService.getAnomalyReasons(USER, "203.0.113.5", "edit", NOW))
                .containsExactly(AnomalyScoringService.REASON_UNUSUAL_ACTION);
    }

    @Test
    void reasons_includeOffHoursOnWeekend() {
        long saturdayNoon = TestDataFactory.WORKDAY_AFTERNOON.plus(Duration.ofDays(4)).minus(Duration.ofHours(2))
                .toEpochMilli();
        List<BehaviorRecord> records = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            records.add(TestDataFactory.createBehaviorRecord(USER, "203.0.113.5", "view",
                    saturdayNoon - Duration.ofDays(i).toMillis()));
        }
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(saturdayNoon))).thenReturn(records);

        assertThat(scoringService.getAnomalyReasons(USER, "203.0.113.5", "view", saturdayNoon))
                .containsExactly(AnomalyScoringService.REASON_OFF_HOURS);
    }

    @Test
    void storeFailure_scoresZeroAndHasNoReasons() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), anyLong()))
                .thenThrow(new RuntimeException("cluster unavailable"));

        assertThat(scoringService.calculateAnomalyScore(USER, "203.0.113.5", "view", NOW)).isEqualTo(0.0);
        assertThat(scoringService.getAnomalyReasons(USER, "203.0.113.5", "view", NOW)).isEmpty();
    }

    @Test
    void analyzeUserBehavior_newUser_isMediumRisk() {
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW))).thenReturn(List.of());

        AnomalyDetectionResult result = scoringService.analyzeUserBehavior(USER, "203.0.113.5", "login");

        assertThat(result.isAnomalous()).isTrue();
        assertThat(result.getAnomalyScore()).isEqualTo(0.5);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(result.getAnomalyReasons()).containsExactly(AnomalyScoringService.REASON_NEW_USER);
        assertThat(result.getRecommendedAction()).isEqualTo("Monitor and log");
        assertThat(result.getAnalyzedAt()).isEqualTo(NOW);
    }
}
