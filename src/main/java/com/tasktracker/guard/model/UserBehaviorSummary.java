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
@Schema(description = "Behavior overview for a single user over the trailing 30 days")
public class UserBehaviorSummary {

    private long userId;
    private String username;

    private int totalActivities;
    private int anomalousActivities;
    private double averageAnomalyScore;
    private RiskLevel highestRiskLevel;

    private int distinctIpAddresses;
    private int distinctLocations;
    private int distinctDevices;
    private int offHoursActivities;

    @Schema(description = "Epoch milliseconds of the latest activity, 0 when none")
    private long lastActivity;

    private UserBaseline baseline;

    @Builder.Default
    @Schema(description = "The 10 most recent anomalous records of the user")
    private List<BehaviorRecord> recentAnomalies = new ArrayList<>();
}
