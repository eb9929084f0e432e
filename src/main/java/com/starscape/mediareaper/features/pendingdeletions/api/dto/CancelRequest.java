package com.starscape.mediareaper.features.pendingdeletions.api.dto;

public record CancelRequest(
    String actor,
    String reason
) {}
