package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fleet-wide behavior overview for a time window")
public class BehaviorAnalyticsSummary {

    private long windowStart;
    private long windowEnd;

    private int totalActivities;
    private int anomalousActivities;
    private int criticalRiskActivities;
    private int highRiskActivities;
    private int mediumRiskActivities;
    private int lowRiskActivities;

    private int offHoursActivities;
    private int newLocationActivities;
    private int newDeviceActivities;
    private int highVelocityActivities;

    @Schema(description = "Mean anomaly score over the window")
    private double averageAnomalyScore;

    @Builder.Default
    @Schema(description = "Usernames with the most anomalous records (up to 10) mapped to their counts")
    private Map<String, Integer> topAnomalousUsers = new LinkedHashMap<>();

    @Builder.Default
    @Schema(description = "Most frequent anomaly reasons (up to 5) mapped to their counts")
    private Map<String, Integer> topAnomalyReasons = new LinkedHashMap<>();

    @Builder.Default
    @Schema(description = "The 10 most recent anomalous records")
    private List<BehaviorRecord> recentAnomalies = new ArrayList<>();

    @Builder.Default
    private List<BehaviorPattern> patterns = new ArrayList<>();
}
