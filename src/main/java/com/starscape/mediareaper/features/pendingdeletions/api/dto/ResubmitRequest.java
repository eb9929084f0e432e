package com.starscape.mediareaper.features.pendingdeletions.api.dto;

public record ResubmitRequest(
    String actor
) {}
