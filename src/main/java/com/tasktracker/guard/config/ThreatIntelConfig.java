package com.tasktracker.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "threat-intel")
public class ThreatIntelConfig {

    // Stale, non-listed threat records older than this (by lastSeen) are purged.
    private int retentionDays = 90;

    // Confidence attached to reputation answers produced by pattern analysis.
    private int patternMatchConfidence = 60;

    // Confidence attached to a "no threat" answer.
    private int benignConfidence = 95;

    private int recentThreatsDefault = 10;

    // Confidence used for a report that arrives without one, keyed by threat type.
    private Map<String, Integer> typeConfidence = new LinkedHashMap<>(Map.of(
            "Malware", 90,
            "Botnet", 85,
            "DDoS", 85,
            "Phishing", 80,
            "Brute Force", 75,
            "Scanning", 70,
            "Spam", 60,
            "Suspicious", 50));

    private int defaultConfidence = 50;
}
