package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import java.time.Instant;

/**
 * All fields optional. The actor defaults to "system" and the scheduled date to now.
 */
public record ApproveRequest(
    String actor,
    Instant scheduledDate,
    String reason
) {}
