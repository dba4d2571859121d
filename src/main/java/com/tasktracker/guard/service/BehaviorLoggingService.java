package com.tasktracker.guard.service;

import com.tasktracker.guard.classifier.ActivityTimeClassifier;
import com.tasktracker.guard.classifier.IpClassifier;
import com.tasktracker.guard.classifier.UserAgentParser;
import com.tasktracker.guard.config.AnalyticsConfig;
import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.event.RiskElevatedEvent;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.DeviceInfo;
import com.tasktracker.guard.model.GeoLocation;
import com.tasktracker.guard.model.RiskLevel;
import com.tasktracker.guard.repository.BehaviorRecordRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Enriches a user action and appends it to the behavior ledger.
 *
 * <p>Logging is an audit side path: it never throws. Each enrichment step falls back to
 * a neutral value on its own, and a failed write is reported as {@code false}.
 */
@Service
public class BehaviorLoggingService {

    private static final Logger log = LoggerFactory.getLogger(BehaviorLoggingService.class);

    private static final double FALLBACK_DEVIATION = 0.5;
    private static final double OUTSIDE_PATTERN_DEVIATION = 0.7;

    private final BehaviorRecordRepository behaviorRepo;
    private final AnomalyScoringService scoringService;
    private final BaselineService baselineService;
    private final IpClassifier ipClassifier;
    private final UserAgentParser userAgentParser;
    private final ActivityTimeClassifier timeClassifier;
    private final AnalyticsConfig config;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BehaviorLoggingService(BehaviorRecordRepository behaviorRepo,
                                  AnomalyScoringService scoringService,
                                  BaselineService baselineService,
                                  IpClassifier ipClassifier,
                                  UserAgentParser userAgentParser,
                                  ActivityTimeClassifier timeClassifier,
                                  AnalyticsConfig config,
                                  MetricsConfig metricsConfig,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock) {
        this.behaviorRepo = behaviorRepo;
        this.scoringService = scoringService;
        this.baselineService = baselineService;
        this.ipClassifier = ipClassifier;
        this.userAgentParser = userAgentParser;
        this.timeClassifier = timeClassifier;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean logUserActivity(long userId, String username, String ipAddress, String userAgent,
                                   String actionType, String resourceAccessed) {
        return logUserActivity(userId, username, ipAddress, userAgent, actionType, resourceAccessed, 0L);
    }

    @Observed(name = "behavior.log", contextualName = "log-user-activity")
    public boolean logUserActivity(long userId, String username, String ipAddress, String userAgent,
                                   String actionType, String resourceAccessed, long dataVolumeAccessed) {
        try {
            long timestamp = clock.millis();

            GeoLocation location = locate(ipAddress);
            DeviceInfo device = userAgentParser.parse(userAgent);
            long sessionSeconds = sessionDurationSeconds(userId, timestamp);
            int actionsPerMinute = actionsPerMinute(userId, timestamp);

            double score = scoringService.calculateAnomalyScore(userId, ipAddress, actionType, timestamp);
            RiskLevel riskLevel = scoringService.riskLevelFor(score);
            List<String> reasons = scoringService.getAnomalyReasons(userId, ipAddress, actionType, timestamp);

            double deviation = deviationFromBaseline(userId, actionType);

            BehaviorRecord record = BehaviorRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .userId(userId)
                    .username(username)
                    .ipAddress(ipAddress)
                    .userAgent(userAgent)
                    .actionType(actionType)
                    .resourceAccessed(resourceAccessed)
                    .timestamp(timestamp)
                    .sessionDurationSeconds(sessionSeconds)
                    .actionsPerMinute(actionsPerMinute)
                    .dataVolumeAccessed(dataVolumeAccessed)
                    .country(location.country())
                    .city(location.city())
                    .deviceType(device.deviceType())
                    .browser(device.browser())
                    .operatingSystem(device.operatingSystem())
                    .anomalous(scoringService.isAnomalous(score))
                    .anomalyScore(score)
                    .riskLevel(riskLevel)
                    .anomalyReason(String.join(", ", reasons))
                    .newLocation(isNewLocation(userId, location))
                    .newDevice(isNewDevice(userId, device))
                    .offHours(timeClassifier.isOffHours(timestamp))
                    .highVelocity(actionsPerMinute > config.getHighVelocityActionsPerMinute())
                    .deviationFromBaseline(deviation)
                    .outsideNormalPattern(deviation > OUTSIDE_PATTERN_DEVIATION)
                    .createdAt(timestamp)
                    .build();

            behaviorRepo.save(record);
            metricsConfig.recordActivityLogged(riskLevel.name(), score);

            if (riskLevel.isAtLeast(RiskLevel.HIGH)) {
                log.warn("Elevated risk activity: user={}, action={}, ip={}, score={}, level={}, reasons=[{}]",
                        userId, actionType, ipAddress, score, riskLevel, record.getAnomalyReason());
                eventPublisher.publishEvent(new RiskElevatedEvent(record));
            } else {
                log.debug("Activity logged: user={}, action={}, score={}, level={}",
                        userId, actionType, score, riskLevel);
            }
            return true;
        } catch (Exception e) {
            metricsConfig.recordActivityLogFailure();
            log.error("Error logging user activity for user={}", userId, e);
            return false;
        }
    }

    private GeoLocation locate(String ipAddress) {
        try {
            return ipClassifier.locate(ipAddress);
        } catch (Exception e) {
            log.error("Error locating ip={}", ipAddress, e);
            return GeoLocation.UNKNOWN;
        }
    }

    private long sessionDurationSeconds(long userId, long timestamp) {
        try {
            BehaviorRecord previous = behaviorRepo.findLatestByUserIdBefore(userId, timestamp);
            if (previous == null) return 0;
            Duration gap = Duration.ofMillis(timestamp - previous.getTimestamp());
            return gap.compareTo(Duration.ofHours(config.getSessionResetHours())) > 0 ? 0 : gap.getSeconds();
        } catch (Exception e) {
            log.warn("Session duration unavailable for user={}: {}", userId, e.getMessage());
            return 0;
        }
    }

    private int actionsPerMinute(long userId, long timestamp) {
        try {
            return behaviorRepo.countByUserIdBetween(userId, timestamp - Duration.ofMinutes(1).toMillis(), timestamp);
        } catch (Exception e) {
            log.warn("Action rate unavailable for user={}: {}", userId, e.getMessage());
            return 0;
        }
    }

    private boolean isNewLocation(long userId, GeoLocation location) {
        try {
            return !behaviorRepo.existsByUserIdAndLocation(userId, location.country(), location.city());
        } catch (Exception e) {
            log.warn("Location history unavailable for user={}: {}", userId, e.getMessage());
            return false;
        }
    }

    private boolean isNewDevice(long userId, DeviceInfo device) {
        try {
            return !behaviorRepo.existsByUserIdAndDevice(userId, device.deviceType(), device.browser());
        } catch (Exception e) {
            log.warn("Device history unavailable for user={}: {}", userId, e.getMessage());
            return false;
        }
    }

    private double deviationFromBaseline(long userId, String actionType) {
        try {
            return baselineService.deviationFromBaseline(baselineService.getUserBaseline(userId), actionType);
        } catch (Exception e) {
            log.warn("Baseline unavailable for user={}: {}", userId, e.getMessage());
            return FALLBACK_DEVIATION;
        }
    }
}
