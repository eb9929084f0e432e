package com.starscape.mediareaper.features.media.domain;

public enum MediaType {
    MOVIE,
    SHOW,
    EPISODE,
    MUSIC,
    PHOTO,
    OTHER;
    
    /**
     * Shows and individual episodes are both owned by Sonarr.
     */
    public boolean isSeries() {
        return this == SHOW || this == EPISODE;
    }
}
