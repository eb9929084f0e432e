package com.starscape.mediareaper.features.evaluaterule.app;

import java.util.List;

/**
 * Outcome of one proposal run. Matches that already had an unresolved pending deletion
 * for the rule are counted in {@code alreadyPending} and not proposed again.
 */
public record ProposalResult(
    Long ruleId,
    String ruleName,
    int evaluatedCount,
    int matchedCount,
    int alreadyPending,
    List<Long> createdIds,
    long createdSize
) {
    
    public int createdCount() {
        return createdIds.size();
    }
}
