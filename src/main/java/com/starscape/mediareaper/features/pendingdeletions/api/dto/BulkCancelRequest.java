package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkCancelRequest(
    @NotEmpty(message = "At least one id is required")
    @Size(max = 500, message = "At most 500 ids per request")
    List<Long> ids,
    String actor,
    String reason
) {}
