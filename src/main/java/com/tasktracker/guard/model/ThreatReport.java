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
@Schema(description = "A threat report to upsert into the threat store")
public class ThreatReport {

    @Schema(description = "IP address", example = "198.51.100.23")
    private String ipAddress;

    @Schema(description = "Threat type", example = "Brute Force")
    private String threatType;

    @Schema(description = "Severity", example = "HIGH")
    private ThreatSeverity severity;

    @Schema(description = "Reporter", example = "Manual")
    private String threatSource;

    private String description;

    @Schema(description = "Confidence 0-100", example = "80")
    private int confidenceScore;
}
