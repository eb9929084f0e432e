package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record BulkApproveRequest(
    @NotEmpty(message = "At least one id is required")
    @Size(max = 500, message = "At most 500 ids per request")
    List<Long> ids,
    String actor,
    Instant scheduledDate,
    String reason
) {}
