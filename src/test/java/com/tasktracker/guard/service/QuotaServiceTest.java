package com.tasktracker.guard.service;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.config.SubscriptionConfig;
import com.tasktracker.guard.event.QuotaWarningEvent;
import com.tasktracker.guard.model.RemainingQuota;
import com.tasktracker.guard.model.UserQuota;
import com.tasktracker.guard.repository.UserQuotaRepository;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaServiceTest {

    private static final long USER = 42L;
    private static final long TODAY = Instant.parse("2024-03-05T00:00:00Z").toEpochMilli();
    private static final long YESTERDAY = TODAY - Duration.ofDays(1).toMillis();

    @Mock private SubscriptionService subscriptionService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private InMemoryUserQuotaRepository quotaRepo;
    private QuotaService quotaService;

    @BeforeEach
    void setUp() {
        quotaRepo = new InMemoryUserQuotaRepository();
        quotaService = new QuotaService(quotaRepo, subscriptionService, new SubscriptionConfig(),
                new MetricsConfig(new SimpleMeterRegistry()), eventPublisher,
                Clock.fixed(TestDataFactory.WORKDAY_AFTERNOON, ZoneOffset.UTC));
    }

    @Test
    void firstIncrementOfTheDay_resetsCounterBeforeAdding() {
        UserQuota stale = TestDataFactory.createQuota(USER, 1, 900, 1000, YESTERDAY);
        stale.setHasReceivedQuotaWarning(true);
        quotaRepo.store(stale);

        quotaService.incrementUsage(USER, 3);

        UserQuota current = quotaRepo.findByUserId(USER);
        assertThat(current.getApiCallsUsedToday()).isEqualTo(3);
        assertThat(current.isHasReceivedQuotaWarning()).isFalse();
        assertThat(current.getLastResetTime()).isEqualTo(TODAY);
    }

    @Test
    void staleQuota_isNotExceededAfterRollover() {
        quotaRepo.store(TestDataFactory.createQuota(USER, 1, 1000, 1000, YESTERDAY));

        assertThat(quotaService.hasExceededDailyQuota(USER)).isFalse();
    }

    @Test
    void usageAtAllowance_isExceeded() {
        quotaRepo.store(TestDataFactory.createQuota(USER, 1, 1000, 1000, TODAY));

        assertThat(quotaService.hasExceededDailyQuota(USER)).isTrue();
    }

    @Test
    void remainingQuota_resetsAtNextUtcMidnight() {
        quotaRepo.store(TestDataFactory.createQuota(USER, 1, 200, 1000, TODAY));

        RemainingQuota remaining = quotaService.getRemainingQuota(USER);

        assertThat(remaining.remainingCalls()).isEqualTo(800);
        assertThat(remaining.resetTime()).isEqualTo(Instant.parse("2024-03-06T00:00:00Z"));
    }

    @Test
    void remainingQuota_neverNegative() {
        quotaRepo.store(TestDataFactory.createQuota(USER, 1, 1200, 1000, TODAY));

        assertThat(quotaService.getRemainingQuota(USER).remainingCalls()).isZero();
    }

    @Test
    void trustedAccount_isUnlimitedAndNeverTouchesQuotaStore() {
        when(subscriptionService.isTrustedSystemAccount(USER)).thenReturn(true);

        RemainingQuota remaining = quotaService.getRemainingQuota(USER);
        quotaService.incrementUsage(USER, 5);

        assertThat(remaining.remainingCalls()).isEqualTo(Integer.MAX_VALUE);
        assertThat(remaining.resetTime()).isEqualTo(Instant.MAX);
        assertThat(quotaService.hasExceededDailyQuota(USER)).isFalse();
        assertThat(quotaRepo.calls.get()).isZero();
    }

    @Test
    void missingQuota_isCreatedFromResolvedTier() {
        when(subscriptionService.getSubscriptionTier(USER))
                .thenReturn(TestDataFactory.createTier(1, "Free", false, 1000, 60));

        quotaService.incrementUsage(USER);

        UserQuota created = quotaRepo.findByUserId(USER);
        assertThat(created.getSubscriptionTierId()).isEqualTo(1);
        assertThat(created.getMaxDailyApiCalls()).isEqualTo(1000);
        assertThat(created.getApiCallsUsedToday()).isEqualTo(1);
        assertThat(created.getLastResetTime()).isEqualTo(TODAY);
        assertThat(created.isExemptFromQuota()).isFalse();
    }

    @Test
    void systemTierQuota_isExempt() {
        when(subscriptionService.getSubscriptionTier(USER))
                .thenReturn(TestDataFactory.createTier(99, "System", true, 0, 0));

        quotaService.incrementUsage(USER, 10);

        assertThat(quotaService.hasExceededDailyQuota(USER)).isFalse();
        assertThat(quotaRepo.findByUserId(USER).getApiCallsUsedToday()).isZero();
        assertThat(quotaService.getRemainingQuota(USER).remainingCalls()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void warning_firesOncePerDay() {
        quotaRepo.store(TestDataFactory.createQuota(USER, 1, 0, 10, TODAY));

        for (int i = 0; i < 10; i++) {
            quotaService.incrementUsage(USER);
        }

        ArgumentCaptor<QuotaWarningEvent> event = ArgumentCaptor.forClass(QuotaWarningEvent.class);
        verify(eventPublisher, times(1)).publishEvent(event.capture());
        assertThat(event.getValue().apiCallsUsedToday()).isEqualTo(8);
        assertThat(event.getValue().thresholdPercent()).isEqualTo(80);
        assertThat(quotaRepo.findByUserId(USER).isHasReceivedQuotaWarning()).isTrue();
    }

    @Test
    void nonPositiveIncrement_isIgnored() {
        quotaService.incrementUsage(USER, 0);

        assertThat(quotaRepo.calls.get()).isZero();
        verifyNoInteractions(subscriptionService);
    }

    @Test
    void reset_clearsUsageAndWarning() {
        UserQuota quota = TestDataFactory.createQuota(USER, 1, 900, 1000, TODAY);
        quota.setHasReceivedQuotaWarning(true);
        quotaRepo.store(quota);

        assertThat(quotaService.resetQuota(USER)).isTrue();

        UserQuota current = quotaRepo.findByUserId(USER);
        assertThat(current.getApiCallsUsedToday()).isZero();
        assertThat(current.isHasReceivedQuotaWarning()).isFalse();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void reset_unknownUser_returnsFalse() {
        assertThat(quotaService.resetQuota(USER)).isFalse();
    }

    /**
     * Map-backed quota store that mirrors the conditional writes of the Aerospike repository.
     */
    static class InMemoryUserQuotaRepository extends UserQuotaRepository {

        private final Map<Long, UserQuota> quotas = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();

        InMemoryUserQuotaRepository() {
            super(mock(AerospikeClient.class), "test", new WritePolicy(), new Policy());
        }

        void store(UserQuota quota) {
            quotas.put(quota.getUserId(), copy(quota));
        }

        @Override
        public UserQuota findByUserId(long userId) {
            calls.incrementAndGet();
            UserQuota quota = quotas.get(userId);
            return quota == null ? null : copy(quota);
        }

        @Override
        public List<UserQuota> findAll() {
            calls.incrementAndGet();
            return new ArrayList<>(quotas.values().stream().map(InMemoryUserQuotaRepository::copy).toList());
        }

        @Override
        public synchronized boolean createIfAbsent(UserQuota quota) {
            calls.incrementAndGet();
            return quotas.putIfAbsent(quota.getUserId(), copy(quota)) == null;
        }

        @Override
        public synchronized boolean resetIfStale(long userId, long todayStart, long now) {
            calls.incrementAndGet();
            UserQuota quota = quotas.get(userId);
            if (quota == null || quota.getLastResetTime() >= todayStart) {
                return false;
            }
            quota.setApiCallsUsedToday(0);
            quota.setHasReceivedQuotaWarning(false);
            quota.setLastResetTime(todayStart);
            quota.setLastUpdatedTime(now);
            return true;
        }

        @Override
        public synchronized long addUsage(long userId, int count, long now) {
            calls.incrementAndGet();
            UserQuota quota = quotas.get(userId);
            quota.setApiCallsUsedToday(quota.getApiCallsUsedToday() + count);
            quota.setLastUpdatedTime(now);
            return quota.getApiCallsUsedToday();
        }

        @Override
        public synchronized boolean markQuotaWarning(long userId, long now) {
            calls.incrementAndGet();
            UserQuota quota = quotas.get(userId);
            if (quota.isHasReceivedQuotaWarning()) {
                return false;
            }
            quota.setHasReceivedQuotaWarning(true);
            return true;
        }

        @Override
        public synchronized void resetUsage(long userId, long todayStart, long now) {
            calls.incrementAndGet();
            UserQuota quota = quotas.get(userId);
            quota.setApiCallsUsedToday(0);
            quota.setHasReceivedQuotaWarning(false);
            quota.setLastResetTime(todayStart);
            quota.setLastUpdatedTime(now);
        }

        private static UserQuota copy(UserQuota q) {
            return UserQuota.builder()
                    .userId(q.getUserId())
                    .subscriptionTierId(q.getSubscriptionTierId())
                    .apiCallsUsedToday(q.getApiCallsUsedToday())
                    .maxDailyApiCalls(q.getMaxDailyApiCalls())
                    .lastResetTime(q.getLastResetTime())
                    .lastUpdatedTime(q.getLastUpdatedTime())
                    .exemptFromQuota(q.isExemptFromQuota())
                    .hasReceivedQuotaWarning(q.isHasReceivedQuotaWarning())
                    .quotaWarningThresholdPercent(q.getQuotaWarningThresholdPercent())
                    .build();
        }
    }
}
