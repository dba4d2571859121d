package com.tasktracker.guard.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        return fromScore(score, 0.4, 0.6, 0.8);
    }

    public static RiskLevel fromScore(double score, double mediumThreshold,
                                      double highThreshold, double criticalThreshold) {
        if (score >= criticalThreshold) return CRITICAL;
        if (score >= highThreshold) return HIGH;
        if (score >= mediumThreshold) return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Operator guidance shown alongside an analysis result.
     */
    public String recommendedAction() {
        return switch (this) {
            case CRITICAL -> "Immediate investigation required";
            case HIGH -> "Review and monitor closely";
            case MEDIUM -> "Monitor and log";
            case LOW -> "Continue monitoring";
        };
    }
}
