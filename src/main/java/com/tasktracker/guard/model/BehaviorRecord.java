package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One enriched user action stored in the behavior ledger")
public class BehaviorRecord {

    @Schema(description = "Unique record identifier", example = "6f1c2a4e-2f0b-4c53-9b5e-0a8f7b1d9c11")
    private String recordId;

    @Schema(description = "User identifier", example = "42")
    private long userId;

    @Schema(description = "Username at the time of the action", example = "alice")
    private String username;

    @Schema(description = "Client IP address", example = "203.0.113.5")
    private String ipAddress;

    @Schema(description = "Raw User-Agent header")
    private String userAgent;

    @Schema(description = "Action performed", example = "login")
    private String actionType;

    @Schema(description = "Resource touched by the action", example = "/boards/7")
    private String resourceAccessed;

    @Schema(description = "Action time in epoch milliseconds (UTC)", example = "1760443200000")
    private long timestamp;

    @Schema(description = "Seconds since the previous action of the same session; 0 after an 8 hour gap")
    private long sessionDurationSeconds;

    @Schema(description = "User actions recorded in the minute before this one")
    private int actionsPerMinute;

    @Schema(description = "Data volume accessed by the action", example = "0")
    private long dataVolumeAccessed;

    @Schema(description = "Coarse country tag derived from the IP", example = "Unknown")
    private String country;

    @Schema(description = "Coarse city tag derived from the IP", example = "Unknown")
    private String city;

    @Schema(description = "Device class derived from the User-Agent", example = "Desktop")
    private String deviceType;

    @Schema(description = "Browser derived from the User-Agent", example = "Chrome")
    private String browser;

    @Schema(description = "Operating system derived from the User-Agent", example = "Windows")
    private String operatingSystem;

    @Schema(description = "True when the anomaly score reached the MEDIUM band")
    private boolean anomalous;

    @Schema(description = "Anomaly score in [0, 1]", example = "0.5")
    private double anomalyScore;

    @Schema(description = "Risk band of the anomaly score", example = "MEDIUM")
    private RiskLevel riskLevel;

    @Schema(description = "Comma separated reasons behind the score", example = "New user - no historical behavior")
    private String anomalyReason;

    @Schema(description = "First time this user was seen at this country/city pair")
    private boolean newLocation;

    @Schema(description = "First time this user was seen on this device/browser pair")
    private boolean newDevice;

    @Schema(description = "Action happened before 08:00, after 18:59 or on a weekend (UTC)")
    private boolean offHours;

    @Schema(description = "More than 30 actions in the preceding minute")
    private boolean highVelocity;

    @Schema(description = "Deviation of the action from the user's baseline, 0.1 or 0.8")
    private double deviationFromBaseline;

    @Schema(description = "Deviation above 0.7")
    private boolean outsideNormalPattern;

    @Schema(description = "Ledger insertion time in epoch milliseconds")
    private long createdAt;
}
