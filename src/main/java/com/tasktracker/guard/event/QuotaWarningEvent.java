package com.tasktracker.guard.event;

/**
 * Published once per user per UTC day, when usage first crosses the warning threshold.
 */
public record QuotaWarningEvent(long userId, long apiCallsUsedToday, int maxDailyApiCalls, int thresholdPercent) {}
