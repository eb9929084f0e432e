package com.starscape.mediareaper.features.evaluaterule.domain;

import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.rules.domain.ConditionOperator;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Built-in evaluators, one per condition kind.
 */
public final class ConditionEvaluators {
    
    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;
    
    private ConditionEvaluators() {
    }
    
    public static boolean ageDays(MediaSnapshot media, RuleCondition condition, Instant now) {
        if (media.addedAt() == null) {
            return true;
        }
        return compare(wholeDaysBetween(media.addedAt(), now), condition.operator(), number(condition));
    }
    
    public static boolean rating(MediaSnapshot media, RuleCondition condition, Instant now) {
        return media.effectiveRating()
                .map(rating -> compare(rating, condition.operator(), number(condition)))
                .orElse(true);
    }
    
    public static boolean qualityTier(MediaSnapshot media, RuleCondition condition, Instant now) {
        String label = media.qualityName() != null && !media.qualityName().isBlank()
                ? media.qualityName()
                : media.resolution();
        return compare(QualityTier.of(label), condition.operator(), QualityTier.of(condition.value()));
    }
    
    public static boolean resolution(MediaSnapshot media, RuleCondition condition, Instant now) {
        String wanted = lower(condition.value());
        if ("other".equals(wanted)) {
            return true;
        }
        if (blank(media.resolution()) && blank(media.qualityName()) && blank(media.qualityProfile())) {
            return true;
        }
        return containsIgnoreCase(media.resolution(), wanted)
                || containsIgnoreCase(media.qualityName(), wanted)
                || containsIgnoreCase(media.qualityProfile(), wanted)
                || containsIgnoreCase(media.codec(), wanted);
    }
    
    public static boolean qualityProfile(MediaSnapshot media, RuleCondition condition, Instant now) {
        if (blank(media.qualityProfile()) && blank(media.qualityName())) {
            return true;
        }
        String wanted = lower(condition.value());
        return containsIgnoreCase(media.qualityProfile(), wanted)
                || containsIgnoreCase(media.qualityName(), wanted);
    }
    
    public static boolean sizeGb(MediaSnapshot media, RuleCondition condition, Instant now) {
        double bound = number(condition);
        if (bound <= 0) {
            return true;
        }
        return compare(media.size() / BYTES_PER_GB, condition.operator(), bound);
    }
    
    public static boolean watchStatus(MediaSnapshot media, RuleCondition condition, Instant now) {
        String wanted = condition.value().trim().replace('-', '_');
        return media.watchStatus().name().equalsIgnoreCase(wanted);
    }
    
    public static boolean title(MediaSnapshot media, RuleCondition condition, Instant now) {
        String actual = media.title() == null ? "" : lower(media.title());
        String wanted = lower(condition.value());
        if (condition.operator() == ConditionOperator.EQUALS) {
            return actual.equals(wanted);
        }
        return actual.contains(wanted);
    }
    
    public static boolean seriesStatus(MediaSnapshot media, RuleCondition condition, Instant now) {
        return equalsIgnoreCase(media.seriesStatus(), condition.value());
    }
    
    public static boolean network(MediaSnapshot media, RuleCondition condition, Instant now) {
        return equalsIgnoreCase(media.network(), condition.value());
    }
    
    public static boolean monitoringStatus(MediaSnapshot media, RuleCondition condition, Instant now) {
        if (media.monitored() == null) {
            return false;
        }
        boolean wantMonitored = "monitored".equalsIgnoreCase(condition.value().trim());
        return media.monitored() == wantMonitored;
    }
    
    public static boolean downloadStatus(MediaSnapshot media, RuleCondition condition, Instant now) {
        return equalsIgnoreCase(media.downloadStatus(), condition.value());
    }
    
    public static boolean tags(MediaSnapshot media, RuleCondition condition, Instant now) {
        Set<String> mediaTags = media.tags().stream()
                .filter(tag -> tag != null)
                .map(ConditionEvaluators::lower)
                .collect(Collectors.toSet());
        return Arrays.stream(condition.value().split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .map(ConditionEvaluators::lower)
                .anyMatch(mediaTags::contains);
    }
    
    public static boolean viewCount(MediaSnapshot media, RuleCondition condition, Instant now) {
        return compare(media.viewCount(), condition.operator(), number(condition));
    }
    
    public static boolean daysSinceLastWatched(MediaSnapshot media, RuleCondition condition, Instant now) {
        if (media.lastWatchedAt() == null) {
            return true;
        }
        return compare(wholeDaysBetween(media.lastWatchedAt(), now), condition.operator(), number(condition));
    }
    
    public static boolean watchPercentage(MediaSnapshot media, RuleCondition condition, Instant now) {
        Long duration = media.durationSeconds();
        if (duration == null || duration <= 0) {
            return true;
        }
        double percentage = media.watchTimeSeconds() * 100d / duration;
        return compare(percentage, condition.operator(), number(condition));
    }
    
    static long wholeDaysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toDays();
    }
    
    static boolean compare(double actual, ConditionOperator operator, double bound) {
        return switch (operator) {
            case AT_LEAST -> actual >= bound;
            case AT_MOST -> actual <= bound;
            default -> throw new IllegalArgumentException("Operator " + operator + " is not numeric");
        };
    }
    
    static double number(RuleCondition condition) {
        try {
            return Double.parseDouble(condition.value().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Condition " + condition.kind() + " needs a number, got '" + condition.value() + "'");
        }
    }
    
    private static boolean equalsIgnoreCase(String actual, String wanted) {
        return actual != null && actual.trim().equalsIgnoreCase(wanted.trim());
    }
    
    private static boolean containsIgnoreCase(String actual, String lowerNeedle) {
        return actual != null && lower(actual).contains(lowerNeedle);
    }
    
    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
    
    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
