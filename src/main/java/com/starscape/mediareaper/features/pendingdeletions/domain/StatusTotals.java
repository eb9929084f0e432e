package com.starscape.mediareaper.features.pendingdeletions.domain;

/**
 * Count and total media size of the pending deletions in one status.
 */
public record StatusTotals(PendingDeletionStatus status, Long count, Long totalSize) {
}
