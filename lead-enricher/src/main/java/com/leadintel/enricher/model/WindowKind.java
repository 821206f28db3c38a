package com.leadintel.enricher.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Budget window granularity. Boundaries are wall-clock aligned in the configured zone:
 * midnight, Monday midnight (ISO week) and the first of the month.
 */
public enum WindowKind {
    DAY, WEEK, MONTH;

    public Instant startOf(Instant instant, ZoneId zone) {
        ZonedDateTime day = instant.atZone(zone).truncatedTo(ChronoUnit.DAYS);
        return switch (this) {
            case DAY -> day.toInstant();
            case WEEK -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case MONTH -> day.withDayOfMonth(1).toInstant();
        };
    }
}
