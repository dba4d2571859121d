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
@Schema(description = "Threat intelligence about one IP address and threat type")
public class ThreatRecord {

    @Schema(description = "Unique threat identifier")
    private String threatId;

    @Schema(description = "IP address the record is about", example = "198.51.100.23")
    private String ipAddress;

    @Schema(description = "Threat type; unique per IP address", example = "Brute Force")
    private String threatType;

    @Schema(description = "Threat severity", example = "HIGH")
    private ThreatSeverity severity;

    @Schema(description = "Who reported the threat", example = "Manual")
    private String threatSource;

    @Schema(description = "Free-form description")
    private String description;

    @Schema(description = "Confidence 0-100; never decreases across reports", example = "80")
    private int confidenceScore;

    @Schema(description = "First report in epoch milliseconds")
    private long firstSeen;

    @Schema(description = "Latest report in epoch milliseconds")
    private long lastSeen;

    @Schema(description = "Number of reports received", example = "1")
    private int reportCount;

    @Schema(description = "Inactive records are ignored by reputation checks")
    private boolean active;

    @Schema(description = "Whitelisted addresses are always allowed")
    private boolean whitelisted;

    @Schema(description = "Blacklisted records are kept forever and forced to CRITICAL")
    private boolean blacklisted;

    @Schema(description = "Country of origin when known")
    private String country;

    private long createdAt;
    private long updatedAt;
}
