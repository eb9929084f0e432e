package com.starscape.mediareaper.features.rules.domain;

public enum ScheduleFrequency {
    MANUAL,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM
}
