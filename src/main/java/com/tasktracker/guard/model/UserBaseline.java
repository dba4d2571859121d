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
@Schema(description = "Typical behavior of a user, derived from non-anomalous ledger records")
public class UserBaseline {

    @Schema(description = "User identifier", example = "42")
    private long userId;

    @Schema(description = "Most recent username, or Unknown when there is no history", example = "alice")
    private String username;

    @Builder.Default
    @Schema(description = "Up to 5 most frequent \"country, city\" pairs")
    private List<String> typicalLocations = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Up to 3 most frequent \"deviceType - browser\" pairs")
    private List<String> typicalDevices = new ArrayList<>();

    @Schema(description = "Mean session duration in seconds")
    private double typicalSessionDurationSeconds;

    @Schema(description = "Mean actions per minute, truncated")
    private int typicalActionsPerMinute;

    @Builder.Default
    @Schema(description = "Up to 5 most frequent action types")
    private List<String> typicalActionTypes = new ArrayList<>();

    @Schema(description = "Span between the earliest and latest active hour of day")
    private int typicalActiveHours;

    @Schema(description = "Number of records the baseline was built from")
    private int sampleSize;

    @Schema(description = "Trailing window in days", example = "30")
    private int baselineWindowDays;

    @Schema(description = "Computation time in epoch milliseconds")
    private long computedAt;
}
