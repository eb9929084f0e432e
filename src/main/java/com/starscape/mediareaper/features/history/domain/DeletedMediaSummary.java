package com.starscape.mediareaper.features.history.domain;

import com.starscape.mediareaper.features.media.domain.MediaType;

/**
 * One attempted item of an execution pass as kept in history.
 */
public record DeletedMediaSummary(
    Long pendingDeletionId,
    Long mediaId,
    Long ruleId,
    String ruleName,
    String title,
    String filename,
    String path,
    MediaType type,
    long size,
    boolean success,
    long bytesFreed,
    String error
) {}
