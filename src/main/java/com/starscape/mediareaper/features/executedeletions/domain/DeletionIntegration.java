package com.starscape.mediareaper.features.executedeletions.domain;

import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;

/**
 * Removes a media item from disk and/or from the catalog that owns it.
 */
public interface DeletionIntegration {
    
    IntegrationKind kind();
    
    IntegrationOutcome delete(MediaSnapshot media, DeletionStrategy strategy) throws IntegrationException;
}
