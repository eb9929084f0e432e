package com.starscape.mediareaper.features.media.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the mirrored media library.
 */
public interface MediaCatalog {
    
    Optional<Media> findById(Long mediaId);
    
    /**
     * Non-protected media of the given types; all types when {@code types} is empty.
     */
    List<Media> findCandidates(Collection<MediaType> types);
}
