package com.tasktracker.guard.service;

import com.tasktracker.guard.config.MetricsConfig;
import com.tasktracker.guard.config.TwilioNotificationConfig;
import com.tasktracker.guard.event.QuotaWarningEvent;
import com.tasktracker.guard.event.RiskElevatedEvent;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
public class RiskAlertNotificationService {

    private static final Logger log = LoggerFactory.getLogger(RiskAlertNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public RiskAlertNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Risk alert notifications initialized. Channel: {}, minimum level: {}",
                    config.getChannel(), config.getMinimumRiskLevel());
        } else {
            log.info("Risk alert notifications are DISABLED.");
        }
    }

    @Async
    @EventListener
    @Observed(name = "notification.send", contextualName = "send-risk-alert")
    public void onRiskElevated(RiskElevatedEvent event) {
        BehaviorRecord record = event.record();
        if (!config.isEnabled() || !shouldAlert(record.getRiskLevel())) {
            return;
        }

        try {
            Message message = send(buildMessageBody(record));
            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Risk alert sent for user={}, record={}, sid={}",
                    record.getUserId(), record.getRecordId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send risk alert for user={}: {}", record.getUserId(), e.getMessage(), e);
        }
    }

    @EventListener
    public void onQuotaWarning(QuotaWarningEvent event) {
        log.info("User={} reached {}% of daily quota ({} of {} calls)",
                event.userId(), event.thresholdPercent(), event.apiCallsUsedToday(), event.maxDailyApiCalls());
    }

    boolean shouldAlert(RiskLevel level) {
        if (level == null) {
            return false;
        }
        RiskLevel minimum;
        try {
            minimum = RiskLevel.valueOf(config.getMinimumRiskLevel().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Invalid twilio.minimum-risk-level '{}', using HIGH", config.getMinimumRiskLevel());
            minimum = RiskLevel.HIGH;
        }
        return level.isAtLeast(minimum);
    }

    String buildMessageBody(BehaviorRecord record) {
        return String.format(
                "[RISK ALERT] %s activity detected\n" +
                "User: %s (%d)\n" +
                "Action: %s\n" +
                "IP: %s\n" +
                "Anomaly Score: %.2f\n" +
                "Reasons: %s\n" +
                "Recommended: %s",
                record.getRiskLevel(),
                record.getUsername() != null ? record.getUsername() : "unknown",
                record.getUserId(),
                record.getActionType(),
                record.getIpAddress(),
                record.getAnomalyScore(),
                record.getAnomalyReason() != null ? record.getAnomalyReason() : "N/A",
                record.getRiskLevel().recommendedAction()
        );
    }

    private Message send(String body) {
        return Message.creator(
                new PhoneNumber(resolveNumber(config.getToNumber())),
                new PhoneNumber(resolveNumber(config.getFromNumber())),
                body
        ).create();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
