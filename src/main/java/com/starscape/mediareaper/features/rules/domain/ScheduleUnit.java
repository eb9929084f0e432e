package com.starscape.mediareaper.features.rules.domain;

public enum ScheduleUnit {
    DAYS,
    WEEKS,
    MONTHS
}
