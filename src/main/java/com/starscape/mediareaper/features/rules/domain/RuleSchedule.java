package com.starscape.mediareaper.features.rules.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Recurrence of automatic proposal runs for a rule.
 * {@code time} is a local HH:mm time-of-day, {@code unit} is only read for CUSTOM.
 */
public record RuleSchedule(
    boolean enabled,
    ScheduleFrequency frequency,
    Integer interval,
    ScheduleUnit unit,
    String time
) {
    
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    
    public RuleSchedule {
        frequency = frequency == null ? ScheduleFrequency.MANUAL : frequency;
        interval = interval == null || interval < 1 ? 1 : interval;
        time = time == null || time.isBlank() ? "00:00" : time.trim();
    }
    
    public static RuleSchedule manual() {
        return new RuleSchedule(false, ScheduleFrequency.MANUAL, 1, null, "00:00");
    }
    
    /**
     * Whether the rule runs on its own at all.
     */
    public boolean recurring() {
        return enabled && frequency != ScheduleFrequency.MANUAL;
    }
    
    public LocalTime timeOfDay() {
        try {
            return LocalTime.parse(time, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Schedule time must be HH:mm: " + time, e);
        }
    }
    
    /**
     * First run strictly after {@code from}: today's slot if it is still ahead,
     * otherwise the slot one period after the day of {@code from}.
     * Empty for manual or disabled schedules.
     */
    public Optional<Instant> nextRunAfter(Instant from, ZoneId zone) {
        if (!recurring()) {
            return Optional.empty();
        }
        ZonedDateTime reference = from.atZone(zone);
        LocalTime at = timeOfDay();
        ZonedDateTime candidate = reference.toLocalDate().atTime(at).atZone(zone);
        if (candidate.isAfter(reference)) {
            return Optional.of(candidate.toInstant());
        }
        LocalDate day = advance(reference.toLocalDate());
        return Optional.of(day.atTime(at).atZone(zone).toInstant());
    }
    
    private LocalDate advance(LocalDate day) {
        return switch (frequency) {
            case DAILY -> day.plusDays(1);
            case WEEKLY -> day.plusWeeks(1);
            case MONTHLY -> day.plusMonths(1);
            case CUSTOM -> switch (effectiveUnit()) {
                case DAYS -> day.plusDays(interval);
                case WEEKS -> day.plusWeeks(interval);
                case MONTHS -> day.plusMonths(interval);
            };
            case MANUAL -> day;
        };
    }
    
    private ScheduleUnit effectiveUnit() {
        return unit == null ? ScheduleUnit.DAYS : unit;
    }
}
