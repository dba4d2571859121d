package com.tasktracker.guard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatSummary {

    private int totalThreats;
    private int activeThreats;
    private int criticalThreats;
    private int highThreats;
    private int mediumThreats;
    private int lowThreats;
    private int blacklistedIps;
    private int whitelistedIps;

    @Builder.Default
    private Map<String, Integer> threatsByType = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> topThreatCountries = new LinkedHashMap<>();

    @Builder.Default
    private List<ThreatRecord> recentThreats = new ArrayList<>();

    private long generatedAt;
}
