package com.starscape.mediareaper.features.history.domain;

public enum ExecutionTrigger {
    MANUAL,
    SCHEDULED
}
