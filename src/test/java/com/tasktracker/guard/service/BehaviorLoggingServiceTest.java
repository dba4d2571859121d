package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.ActivityTimeClassifier;
import com.tasktracker.guard.classifier.IpClassifier;
import com.tasktracker.guard.classifier.UserAgentParser;
import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.event.RiskElevatedEvent;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import com.tasktracker.guard.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BehaviorLoggingServiceTest {

    private static final long USER = 42L;
    private static final long NOW = TestDataFactory.WORKDAY_AFTERNOON.toEpochMilli();
    private static final String CHROME_ON_WINDOWS =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Mock private BehaviorRecordRepository behaviorRepo;
    @Mock private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry registry;
    private BehaviorLoggingService loggingService;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = new AnalyticsConfig();
        Clock clock = Clock.fixed(TestDataFactory.WORKDAY_AFTERNOON, ZoneOffset.UTC);
        ActivityTimeClassifier timeClassifier = new ActivityTimeClassifier(config);
        registry = new SimpleMeterRegistry();
        loggingService = new BehaviorLoggingService(
                behaviorRepo,
                new AnomalyScoringService(behaviorRepo, timeClassifier, config, clock),
                new BaselineService(behaviorRepo, timeClassifier, config, clock),
                new IpClassifier(),
                new UserAgentParser(),
                timeClassifier,
                config,
                new MetricsConfig(registry),
                eventPublisher,
                clock);
    }

    private BehaviorRecord savedRecord() {
        ArgumentCaptor<BehaviorRecord> captor = ArgumentCaptor.forClass(BehaviorRecord.class);
        verify(behaviorRepo).save(captor.capture());
        return captor.getValue();
    }

    @Test
    void firstLogin_isMediumRiskNewUser() {
        boolean logged = loggingService.logUserActivity(USER, "alice", "203.0.113.5", CHROME_ON_WINDOWS,
                "login", "/auth/login");

        assertThat(logged).isTrue();
        BehaviorRecord record = savedRecord();
        assertThat(record.getRecordId()).isNotBlank();
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        assertThat(record.getAnomalyScore()).isEqualTo(0.5);
        assertThat(record.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(record.isAnomalous()).isTrue();
        assertThat(record.getAnomalyReason()).isEqualTo(AnomalyScoringService.REASON_NEW_USER);
        assertThat(record.getCountry()).isEqualTo("Unknown");
        assertThat(record.getDeviceType()).isEqualTo("Desktop");
        assertThat(record.getBrowser()).isEqualTo("Chrome");
        assertThat(record.getOperatingSystem()).isEqualTo("Windows");
        assertThat(record.isNewLocation()).isTrue();
        assertThat(record.isNewDevice()).isTrue();
        assertThat(record.isOffHours()).isFalse();
        assertThat(record.getSessionDurationSeconds()).isZero();
        assertThat(record.getDeviationFromBaseline()).isEqualTo(BaselineService.UNUSUAL_ACTION_DEVIATION);
        assertThat(record.isOutsideNormalPattern()).isTrue();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        assertThat(registry.get("behavior.activity.count").tag("risk_level", "MEDIUM").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void criticalActivity_publishesRiskElevatedEvent() {
        List<BehaviorRecord> history = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            // 03:00 on previous days, from an internal address
            history.add(TestDataFactory.createBehaviorRecord(USER, "10.0.0.1", "view",
                    NOW - Duration.ofDays(i).toMillis() - Duration.ofHours(11).toMillis()));
        }
        when(behaviorRepo.findByUserIdBetween(eq(USER), anyLong(), eq(NOW))).thenReturn(history);

        loggingService.logUserActivity(USER, "alice", "203.0.113.5", CHROME_ON_WINDOWS, "export", "/boards/7", 4096);

        BehaviorRecord record = savedRecord();
        assertThat(record.getAnomalyScore()).isEqualTo(0.8);
        assertThat(record.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(record.getAnomalyReason())
                .isEqualTo("Access outside typical hours, Access from new IP address, Unusual action type");
        assertThat(record.getDataVolumeAccessed()).isEqualTo(4096);

        ArgumentCaptor<RiskElevatedEvent> event = ArgumentCaptor.forClass(RiskElevatedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().record()).isSameAs(record);
    }

    @Test
    void sessionDuration_isGapSincePreviousAction() {
        BehaviorRecord previous = TestDataFactory.createBehaviorRecord(USER, "203.0.113.5", "view",
                NOW - Duration.ofMinutes(20).toMillis());
        when(behaviorRepo.findLatestByUserIdBefore(USER, NOW)).thenReturn(previous);

        loggingService.logUserActivity(USER, "alice", "203.0.113.5", CHROME_ON_WINDOWS, "view", "/boards/7");

        assertThat(savedRecord().getSessionDurationSeconds()).isEqualTo(1200);
    }

    @Test
    void sessionDuration_resetsAfterLongGap() {
        BehaviorRecord previous = TestDataFactory.createBehaviorRecord(USER, "203.0.113.5", "view",
                NOW - Duration.ofHours(9).toMillis());
        when(behaviorRepo.findLatestByUserIdBefore(USER, NOW)).thenReturn(previous);

        loggingService.logUserActivity(USER, "alice", "203.0.113.5", CHROME_ON_WINDOWS, "view", "/boards/7");

        assertThat(savedRecord().getSessionDurationSeconds()).isZero();
    }

    @Test
    void knownLocationAndDevice_areNotNew() {
        when(behaviorRepo.existsByUserIdAndLocation(USER, "Local", "Local")).thenReturn(true);
        when(behaviorRepo.existsByUserIdAndDevice(USER, "Desktop", "Chrome")).thenReturn(true);

        loggingService.logUserActivity(USER, "alice", "192.168.1.10", CHROME_ON_WINDOWS, "view", "/boards/7");

        BehaviorRecord record = savedRecord();
        assertThat(record.getCountry()).isEqualTo("Local");
        assertThat(record.isNewLocation()).isFalse();
        assertThat(record.isNewDevice()).isFalse();
    }

    @Test
    void enrichmentFailure_degradesInsteadOfFailing() {
        when(behaviorRepo.findLatestByUserIdBefore(anyLong(), anyLong())).thenThrow(new RuntimeException("timeout"));
        when(behaviorRepo.existsByUserIdAndLocation(anyLong(), any(), any())).thenThrow(new RuntimeException("timeout"));

        boolean logged = loggingService.logUserActivity(USER, "alice", "203.0.113.5", null, "view", "/boards/7");

        assertThat(logged).isTrue();
        BehaviorRecord record = savedRecord();
        assertThat(record.getSessionDurationSeconds()).isZero();
        assertThat(record.isNewLocation()).isFalse();
        assertThat(record.getBrowser()).isEqualTo("Unknown");
    }

    @Test
    void ledgerWriteFailure_returnsFalse() {
        doThrow(new RuntimeException("write failed")).when(behaviorRepo).save(any());

        boolean logged = loggingService.logUserActivity(USER, "alice", "203.0.113.5", CHROME_ON_WINDOWS,
                "login", "/auth/login");

        assertThat(logged).isFalse();
        assertThat(registry.get("behavior.activity.failed.count").counter().count()).isEqualTo(1.0);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
