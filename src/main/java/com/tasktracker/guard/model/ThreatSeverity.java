package com.tasktracker.guard.model;

/**
 * Severity of a threat record. UNKNOWN is only produced for reputation answers
 * that could not be computed; it is never stored.
 */
public enum ThreatSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    SAFE,
    UNKNOWN;

    public RecommendedAction recommendedAction() {
        return switch (this) {
            case CRITICAL, HIGH -> RecommendedAction.BLOCK;
            case LOW, SAFE -> RecommendedAction.ALLOW;
            case MEDIUM, UNKNOWN -> RecommendedAction.MONITOR;
        };
    }

    /**
     * Case-insensitive lookup; returns null for unrecognized names.
     */
    public static ThreatSeverity fromName(String name) {
        if (name == null) return null;
        for (ThreatSeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(name.trim())) {
                return severity;
            }
        }
        return null;
    }
}
