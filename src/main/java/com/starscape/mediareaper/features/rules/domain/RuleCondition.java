package com.starscape.mediareaper.features.rules.domain;

/**
 * One typed comparison of a rule, e.g. {@code AGE_DAYS AT_LEAST 30}.
 * The value is kept as text and interpreted by the evaluator registered for the kind.
 */
public record RuleCondition(
    ConditionKind kind,
    ConditionOperator operator,
    String value
) {
    
    public static RuleCondition of(ConditionKind kind, ConditionOperator operator, Object value) {
        return new RuleCondition(kind, operator, value == null ? null : String.valueOf(value));
    }
    
    /**
     * Blank values and "any" switch the check off.
     */
    public boolean hasValue() {
        return value != null && !value.isBlank() && !"any".equalsIgnoreCase(value.trim());
    }
}
