package com.starscape.mediareaper.features.rules.domain;

/**
 * What to do in Sonarr for a matched show or episode.
 */
public enum SonarrAction {
    /** Delete the episode file, keep the series. */
    FILE_ONLY,
    /** Stop monitoring the series; files are removed only when deleteFiles is set. */
    UNMONITOR,
    /** Remove the series from Sonarr. */
    REMOVE_SERIES
}
