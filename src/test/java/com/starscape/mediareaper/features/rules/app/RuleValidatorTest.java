package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.features.rules.domain.ConditionKind;
import com.starscape.mediareaper.features.rules.domain.ConditionOperator;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSchedule;
import com.starscape.mediareaper.features.rules.domain.ScheduleFrequency;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleValidatorTest {
    
    private final RuleValidator validator = new RuleValidator();
    
    @Test
    void acceptsWellFormedRule() {
        assertDoesNotThrow(() -> validator.validate(List.of(
                RuleCondition.of(ConditionKind.AGE_DAYS, ConditionOperator.AT_LEAST, 30),
                RuleCondition.of(ConditionKind.RATING, ConditionOperator.AT_MOST, 6.5),
                RuleCondition.of(ConditionKind.QUALITY_TIER, ConditionOperator.AT_MOST, "720p"),
                RuleCondition.of(ConditionKind.WATCH_STATUS, ConditionOperator.EQUALS, "in-progress"),
                RuleCondition.of(ConditionKind.MONITORING_STATUS, ConditionOperator.EQUALS, "unmonitored"),
                RuleCondition.of(ConditionKind.TITLE, ConditionOperator.CONTAINS, "any")),
            new RuleSchedule(true, ScheduleFrequency.WEEKLY, 1, null, "04:15")));
    }
    
    @Test
    void rejectsUnsupportedOperator() {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(
            List.of(RuleCondition.of(ConditionKind.TAGS, ConditionOperator.AT_LEAST, "x")), null));
        
        assertTrue(ex.getDetails().containsKey("conditions[0]"));
    }
    
    @Test
    void rejectsBadNumbersAndRanges() {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(List.of(
            RuleCondition.of(ConditionKind.AGE_DAYS, ConditionOperator.AT_LEAST, "soon"),
            RuleCondition.of(ConditionKind.SIZE_GB, ConditionOperator.AT_LEAST, -1),
            RuleCondition.of(ConditionKind.RATING, ConditionOperator.AT_LEAST, 11),
            RuleCondition.of(ConditionKind.WATCH_PERCENTAGE, ConditionOperator.AT_LEAST, 150)), null));
        
        assertEquals(4, ex.getDetails().size());
    }
    
    @Test
    void rejectsUnknownQualityAndWatchStatus() {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(List.of(
            RuleCondition.of(ConditionKind.QUALITY_TIER, ConditionOperator.AT_LEAST, "potato"),
            RuleCondition.of(ConditionKind.WATCH_STATUS, ConditionOperator.EQUALS, "binged")), null));
        
        assertEquals(2, ex.getDetails().size());
    }
    
    @Test
    void rejectsDuplicateConditions() {
        assertThrows(ValidationException.class, () -> validator.validate(List.of(
            RuleCondition.of(ConditionKind.AGE_DAYS, ConditionOperator.AT_LEAST, 10),
            RuleCondition.of(ConditionKind.AGE_DAYS, ConditionOperator.AT_LEAST, 20)), null));
    }
    
    @Test
    void rejectsInconsistentSchedule() {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(List.of(),
            new RuleSchedule(true, ScheduleFrequency.CUSTOM, 2, null, "7pm")));
        
        assertTrue(ex.getDetails().containsKey("schedule.time"));
        assertTrue(ex.getDetails().containsKey("schedule.unit"));
    }
}
