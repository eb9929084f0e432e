package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.features.evaluaterule.domain.EvaluationResult;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.domain.WatchStatus;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;
import com.starscape.mediareaper.features.rules.domain.ConditionKind;
import com.starscape.mediareaper.features.rules.domain.ConditionOperator;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.starscape.mediareaper.TestFixtures.GB;
import static com.starscape.mediareaper.TestFixtures.NOW;
import static com.starscape.mediareaper.TestFixtures.episode;
import static com.starscape.mediareaper.TestFixtures.movie;
import static com.starscape.mediareaper.TestFixtures.rule;
import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluatorTest {
    
    private final RuleEvaluator evaluator = new RuleEvaluator(new ConditionRegistry());
    
    @Test
    void ratingFallbackScenario() {
        // rated 4.5 in metadata only, max rating 5, min age 30 days
        MediaSnapshot media = movie(1)
                .rating(null)
                .metadata(Map.of("rating", 4.5))
                .addedAt(NOW.minus(Duration.ofDays(40)))
                .build();
        RuleSnapshot rule = rule(1L, Set.of(MediaType.MOVIE), List.of(
                RuleCondition.of(ConditionKind.RATING, ConditionOperator.AT_MOST, 5),
                RuleCondition.of(ConditionKind.AGE_DAYS, ConditionOperator.AT_LEAST, 30)),
            ConditionGroup.QUALITY, ConditionGroup.AGE);
        
        assertTrue(evaluator.matches(rule, media, NOW));
    }
    
    @Test
    void protectedMediaNeverMatches() {
        MediaSnapshot media = movie(1).protectedItem(true).build();
        RuleSnapshot matchEverything = rule(1L, Set.of(), List.of());
        
        assertFalse(evaluator.matches(matchEverything, media, NOW));
    }
    
    @Test
    void ruleWithNoEnabledGroupsMatchesEveryUnprotectedItemOfItsTypes() {
        RuleSnapshot rule = rule(1L, Set.of(MediaType.MOVIE), List.of(
            RuleCondition.of(ConditionKind.SIZE_GB, ConditionOperator.AT_LEAST, 100)));
        
        assertTrue(evaluator.matches(rule, movie(1).build(), NOW));
        assertFalse(evaluator.matches(rule, episode(2).build(), NOW));
    }
    
    @Test
    void conditionsOfDisabledGroupsAreIgnored() {
        RuleSnapshot rule = rule(1L, Set.of(), List.of(
                RuleCondition.of(ConditionKind.SIZE_GB, ConditionOperator.AT_LEAST, 100),
                RuleCondition.of(ConditionKind.TITLE, ConditionOperator.CONTAINS, "movie")),
            ConditionGroup.TITLE);
        
        assertTrue(evaluator.matches(rule, movie(1).size(GB).build(), NOW));
    }
    
    @Test
    void allEnabledConditionsMustHold() {
        RuleSnapshot rule = rule(1L, Set.of(), List.of(
                RuleCondition.of(ConditionKind.SIZE_GB, ConditionOperator.AT_LEAST, 3),
                RuleCondition.of(ConditionKind.WATCH_STATUS, ConditionOperator.EQUALS, "watched")),
            ConditionGroup.SIZE, ConditionGroup.STATUS);
        
        assertTrue(evaluator.matches(rule, movie(1).size(4 * GB).watched(true).build(), NOW));
        assertFalse(evaluator.matches(rule, movie(2).size(4 * GB).build(), NOW));
        assertFalse(evaluator.matches(rule, movie(3).size(GB).watched(true).build(), NOW));
    }
    
    @Test
    void blankAndAnyValuesSwitchTheCheckOff() {
        RuleSnapshot rule = rule(1L, Set.of(), List.of(
                RuleCondition.of(ConditionKind.WATCH_STATUS, ConditionOperator.EQUALS, "any"),
                RuleCondition.of(ConditionKind.TITLE, ConditionOperator.CONTAINS, " ")),
            ConditionGroup.STATUS, ConditionGroup.TITLE);
        
        assertTrue(evaluator.matches(rule, movie(1).viewCount(2).build(), NOW));
    }
    
    @Test
    void evaluateCollectsStatisticsAndSortsBySize() {
        List<MediaSnapshot> media = List.of(
            movie(1).size(GB).build(),
            movie(2).size(8 * GB).watched(true).build(),
            movie(3).size(3 * GB).build(),
            movie(4).size(20 * GB).protectedItem(true).build(),
            episode(5).size(GB / 2).build());
        RuleSnapshot rule = rule(1L, Set.of(MediaType.MOVIE, MediaType.EPISODE), List.of(
                RuleCondition.of(ConditionKind.SIZE_GB, ConditionOperator.AT_LEAST, 2)),
            ConditionGroup.SIZE);
        
        EvaluationResult result = evaluator.evaluate(rule, media, NOW);
        
        assertEquals(5, result.evaluatedCount());
        assertEquals(2, result.matchedCount());
        assertEquals(2L, result.matches().get(0).id());
        assertEquals(3L, result.matches().get(1).id());
        assertEquals(11 * GB, result.totalSize());
        assertEquals(2L, result.countsByType().get(MediaType.MOVIE));
        assertEquals(1L, result.countsByWatchStatus().get(WatchStatus.WATCHED));
        assertEquals(1L, result.countsByWatchStatus().get(WatchStatus.UNWATCHED));
        assertEquals(2L, result.excludedByGroup().get(ConditionGroup.SIZE));
    }
}
