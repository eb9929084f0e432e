package com.starscape.mediareaper.features.executedeletions.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record StartScheduleRequest(
    @NotNull @Positive Integer intervalMinutes
) {}
