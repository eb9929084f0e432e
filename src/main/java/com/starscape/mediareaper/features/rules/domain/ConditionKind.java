package com.starscape.mediareaper.features.rules.domain;

import java.util.EnumSet;
import java.util.Set;

import static com.starscape.mediareaper.features.rules.domain.ConditionOperator.*;

/**
 * The field a condition inspects, the group it belongs to and the operators it accepts.
 */
public enum ConditionKind {
    AGE_DAYS(ConditionGroup.AGE, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST)),
    RATING(ConditionGroup.QUALITY, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST)),
    QUALITY_TIER(ConditionGroup.QUALITY, ValueType.QUALITY_TIER, EnumSet.of(AT_LEAST, AT_MOST)),
    RESOLUTION(ConditionGroup.ENHANCED_QUALITY, ValueType.TEXT, EnumSet.of(CONTAINS)),
    QUALITY_PROFILE(ConditionGroup.ENHANCED_QUALITY, ValueType.TEXT, EnumSet.of(CONTAINS)),
    SIZE_GB(ConditionGroup.SIZE, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST)),
    WATCH_STATUS(ConditionGroup.STATUS, ValueType.WATCH_STATUS, EnumSet.of(EQUALS)),
    TITLE(ConditionGroup.TITLE, ValueType.TEXT, EnumSet.of(CONTAINS, EQUALS)),
    SERIES_STATUS(ConditionGroup.MEDIA_SPECIFIC, ValueType.TEXT, EnumSet.of(EQUALS)),
    NETWORK(ConditionGroup.MEDIA_SPECIFIC, ValueType.TEXT, EnumSet.of(EQUALS)),
    MONITORING_STATUS(ConditionGroup.ARR_INTEGRATION, ValueType.MONITORING, EnumSet.of(EQUALS)),
    DOWNLOAD_STATUS(ConditionGroup.ARR_INTEGRATION, ValueType.TEXT, EnumSet.of(EQUALS)),
    TAGS(ConditionGroup.ARR_INTEGRATION, ValueType.TEXT, EnumSet.of(ANY_OF)),
    VIEW_COUNT(ConditionGroup.WATCH_HISTORY, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST)),
    DAYS_SINCE_LAST_WATCHED(ConditionGroup.WATCH_HISTORY, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST)),
    WATCH_PERCENTAGE(ConditionGroup.WATCH_HISTORY, ValueType.NUMBER, EnumSet.of(AT_LEAST, AT_MOST));
    
    public enum ValueType {
        NUMBER,
        TEXT,
        QUALITY_TIER,
        WATCH_STATUS,
        MONITORING
    }
    
    private final ConditionGroup group;
    private final ValueType valueType;
    private final Set<ConditionOperator> operators;
    
    ConditionKind(ConditionGroup group, ValueType valueType, Set<ConditionOperator> operators) {
        this.group = group;
        this.valueType = valueType;
        this.operators = operators;
    }
    
    public ConditionGroup group() {
        return group;
    }
    
    public ValueType valueType() {
        return valueType;
    }
    
    public boolean supports(ConditionOperator operator) {
        return operators.contains(operator);
    }
    
    public Set<ConditionOperator> operators() {
        return EnumSet.copyOf(operators);
    }
}
