package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Reputation verdict for an IP address")
public class IpReputation {

    @Schema(description = "IP address checked", example = "198.51.100.23")
    private String ipAddress;

    @Schema(description = "True when the address should be treated as a threat")
    private boolean threat;

    @Schema(description = "Severity of the verdict", example = "HIGH")
    private ThreatSeverity severity;

    @Schema(description = "Confidence 0-100", example = "95")
    private int confidenceScore;

    @Builder.Default
    @Schema(description = "Threat types behind the verdict")
    private List<String> threatTypes = new ArrayList<>();

    @Schema(description = "Source of the deciding record")
    private String threatSource;

    @Schema(description = "Suggested handling", example = "ALLOW")
    private RecommendedAction recommendedAction;

    @Builder.Default
    @Schema(description = "Why the verdict was reached")
    private List<String> reasons = new ArrayList<>();

    private boolean whitelisted;
    private boolean blacklisted;

    @Schema(description = "Check time in epoch milliseconds")
    private long checkedAt;
}
