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
@Schema(description = "Outcome of analyzing a prospective user action without recording it")
public class AnomalyDetectionResult {

    @Schema(description = "True when the score reached the MEDIUM band")
    private boolean anomalous;

    @Schema(description = "Anomaly score in [0, 1]", example = "0.5")
    private double anomalyScore;

    @Schema(description = "Risk band", example = "MEDIUM")
    private RiskLevel riskLevel;

    @Builder.Default
    @Schema(description = "Reasons behind the score")
    private List<String> anomalyReasons = new ArrayList<>();

    @Schema(description = "Operator guidance for the risk band", example = "Monitor and log")
    private String recommendedAction;

    @Schema(description = "Analysis time in epoch milliseconds")
    private long analyzedAt;
}
