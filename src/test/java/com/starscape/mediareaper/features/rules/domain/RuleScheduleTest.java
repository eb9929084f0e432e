package com.starscape.mediareaper.features.rules.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleScheduleTest {
    
    private static final ZoneId UTC = ZoneOffset.UTC;
    
    @Test
    void dailyRunsLaterTodayWhenSlotIsAhead() {
        RuleSchedule schedule = new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "18:30");
        
        Optional<Instant> next = schedule.nextRunAfter(Instant.parse("2024-03-10T09:00:00Z"), UTC);
        
        assertEquals(Instant.parse("2024-03-10T18:30:00Z"), next.orElseThrow());
    }
    
    @Test
    void dailyMovesToTomorrowWhenSlotHasPassed() {
        RuleSchedule schedule = new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "02:00");
        
        Optional<Instant> next = schedule.nextRunAfter(Instant.parse("2024-03-10T02:00:00Z"), UTC);
        
        assertEquals(Instant.parse("2024-03-11T02:00:00Z"), next.orElseThrow());
    }
    
    @Test
    void weeklyAndMonthlyAdvanceOnePeriod() {
        Instant from = Instant.parse("2024-01-31T10:00:00Z");
        
        assertEquals(Instant.parse("2024-02-07T03:00:00Z"),
            new RuleSchedule(true, ScheduleFrequency.WEEKLY, 1, null, "03:00").nextRunAfter(from, UTC).orElseThrow());
        assertEquals(Instant.parse("2024-02-29T03:00:00Z"),
            new RuleSchedule(true, ScheduleFrequency.MONTHLY, 1, null, "03:00").nextRunAfter(from, UTC).orElseThrow());
    }
    
    @Test
    void customUsesIntervalAndUnit() {
        Instant from = Instant.parse("2024-05-01T12:00:00Z");
        
        assertEquals(Instant.parse("2024-05-15T00:00:00Z"),
            new RuleSchedule(true, ScheduleFrequency.CUSTOM, 2, ScheduleUnit.WEEKS, "00:00").nextRunAfter(from, UTC).orElseThrow());
        assertEquals(Instant.parse("2024-05-04T00:00:00Z"),
            new RuleSchedule(true, ScheduleFrequency.CUSTOM, 3, null, "00:00").nextRunAfter(from, UTC).orElseThrow());
    }
    
    @Test
    void timeOfDayIsInterpretedInTheGivenZone() {
        RuleSchedule schedule = new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "08:00");
        
        Optional<Instant> next = schedule.nextRunAfter(Instant.parse("2024-07-01T00:00:00Z"), ZoneId.of("Europe/Berlin"));
        
        assertEquals(Instant.parse("2024-07-01T06:00:00Z"), next.orElseThrow());
    }
    
    @Test
    void manualOrDisabledSchedulesNeverRun() {
        Instant from = Instant.parse("2024-05-01T12:00:00Z");
        
        assertTrue(RuleSchedule.manual().nextRunAfter(from, UTC).isEmpty());
        assertTrue(new RuleSchedule(false, ScheduleFrequency.DAILY, 1, null, "00:00").nextRunAfter(from, UTC).isEmpty());
    }
    
    @Test
    void invalidTimeIsRejected() {
        RuleSchedule schedule = new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "25:99");
        assertThrows(IllegalArgumentException.class, schedule::timeOfDay);
    }
    
    @Test
    void disabledRuleHasNoNextRun() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        RuleSchedule daily = new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "23:00");
        DeletionRule rule = new DeletionRule("Old movies", null, true, Set.of(), List.of(), null,
            null, daily, now, UTC);
        assertEquals(Instant.parse("2024-05-01T23:00:00Z"), rule.getNextRun());
        
        rule.update("Old movies", null, false, Set.of(), List.of(), null, null, daily, now, UTC);
        
        assertNull(rule.getNextRun());
    }
    
    @Test
    void markRunAdvancesNextRun() {
        Instant created = Instant.parse("2024-05-01T12:00:00Z");
        DeletionRule rule = new DeletionRule("Old movies", null, true, Set.of(), List.of(), null,
            null, new RuleSchedule(true, ScheduleFrequency.DAILY, 1, null, "13:00"), created, UTC);
        
        Instant ranAt = Instant.parse("2024-05-01T13:00:05Z");
        rule.markRun(ranAt, UTC);
        
        assertEquals(ranAt, rule.getLastRun());
        assertEquals(Instant.parse("2024-05-02T13:00:00Z"), rule.getNextRun());
    }
}
