package com.tasktracker.guard.classifier;

import com.tasktracker.guard.config.AnalyticsConfig;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Time-of-day helpers. All evaluation is in UTC.
 */
@Component
public class ActivityTimeClassifier {

    private final AnalyticsConfig config;

    public ActivityTimeClassifier(AnalyticsConfig config) {
        this.config = config;
    }

    public int hourOfDay(long timestampMillis) {
        return toUtc(timestampMillis).getHour();
    }

    public boolean isWeekend(long timestampMillis) {
        DayOfWeek day = toUtc(timestampMillis).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public boolean isOffHours(long timestampMillis) {
        int hour = hourOfDay(timestampMillis);
        AnalyticsConfig.OffHours offHours = config.getOffHours();
        return hour < offHours.getStartHour() || hour > offHours.getEndHour() || isWeekend(timestampMillis);
    }

    private ZonedDateTime toUtc(long timestampMillis) {
        return Instant.ofEpochMilli(timestampMillis).atZone(ZoneOffset.UTC);
    }
}
