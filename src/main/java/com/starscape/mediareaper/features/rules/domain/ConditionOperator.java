package com.starscape.mediareaper.features.rules.domain;

public enum ConditionOperator {
    /** Inclusive lower bound. */
    AT_LEAST,
    /** Inclusive upper bound. */
    AT_MOST,
    EQUALS,
    CONTAINS,
    /** Comma-separated list; any element may match. */
    ANY_OF
}
