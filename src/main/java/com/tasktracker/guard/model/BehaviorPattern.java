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
@Schema(description = "A fleet-wide behavior pattern observed over the trailing week")
public class BehaviorPattern {

    @Schema(description = "Pattern name", example = "Off-Hours Access")
    private String patternType;

    @Schema(description = "Human readable description")
    private String description;

    @Schema(description = "Records matching the pattern")
    private int occurrenceCount;

    @Schema(description = "min(count / total * weight * 10, 1.0)", example = "0.45")
    private double riskScore;

    @Builder.Default
    @Schema(description = "Up to 5 distinct usernames showing the pattern")
    private List<String> affectedUsers = new ArrayList<>();

    @Schema(description = "Oldest matching record in epoch milliseconds")
    private long firstDetected;

    @Schema(description = "Newest matching record in epoch milliseconds")
    private long lastDetected;
}
