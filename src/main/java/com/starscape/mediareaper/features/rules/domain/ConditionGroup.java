package com.starscape.mediareaper.features.rules.domain;

/**
 * Named cluster of related conditions that is switched on and off as a unit.
 */
public enum ConditionGroup {
    AGE,
    QUALITY,
    ENHANCED_QUALITY,
    SIZE,
    STATUS,
    TITLE,
    MEDIA_SPECIFIC,
    ARR_INTEGRATION,
    WATCH_HISTORY
}
