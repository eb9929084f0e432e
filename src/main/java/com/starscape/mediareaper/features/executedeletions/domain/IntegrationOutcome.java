package com.starscape.mediareaper.features.executedeletions.domain;

import java.util.List;

/**
 * What an integration did for one item, in order, and how many bytes that freed.
 */
public record IntegrationOutcome(List<String> actions, long bytesFreed) {
    
    public IntegrationOutcome {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
