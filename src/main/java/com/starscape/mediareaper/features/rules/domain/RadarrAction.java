package com.starscape.mediareaper.features.rules.domain;

/**
 * What to do in Radarr for a matched movie.
 */
public enum RadarrAction {
    FILE_ONLY,
    REMOVE_MOVIE
}
