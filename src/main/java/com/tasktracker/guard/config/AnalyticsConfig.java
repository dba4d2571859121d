package com.tasktracker.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsConfig {

    // Score bands: MEDIUM from mediumThreshold, HIGH from highThreshold, CRITICAL from criticalThreshold.
    private double mediumThreshold = 0.4;
    private double highThreshold = 0.6;
    private double criticalThreshold = 0.8;

    // Score returned when the user has no history in the scoring window.
    private double newUserScore = 0.5;

    // Action type / IP address seen in less than this share of history counts as rare.
    private double rareRatio = 0.1;

    // Used only by the reasons path: an action type above this share is "common".
    private double commonActionRatio = 0.1;

    // More than velocityThreshold actions in the trailing velocityWindowSeconds adds the velocity penalty.
    private int velocityThreshold = 10;
    private int velocityWindowSeconds = 60;

    // Ledger flag: actions in the last minute above this value mark the record high-velocity.
    private int highVelocityActionsPerMinute = 30;

    private int scoringWindowDays = 30;
    private int baselineWindowDays = 30;

    // A gap longer than this starts a new session (duration 0).
    private int sessionResetHours = 8;

    private int patternWindowDays = 7;

    private Penalties penalties = new Penalties();
    private OffHours offHours = new OffHours();
    private Retention retention = new Retention();

    @Data
    public static class Penalties {
        private double unusualHour = 0.3;
        private double rareAction = 0.2;
        private double rareIp = 0.3;
        private double highVelocity = 0.4;
    }

    @Data
    public static class OffHours {
        // Working day is [startHour, endHour] inclusive, UTC, Monday to Friday.
        private int startHour = 8;
        private int endHour = 18;
    }

    @Data
    public static class Retention {
        private boolean cleanupEnabled = true;
        private int behaviorDays = 30;
        private int cleanupIntervalHours = 24;
    }
}
