package com.starscape.mediareaper.features.rules.domain;

/**
 * Per-integration action plan of a rule. Copied onto every pending deletion the rule proposes.
 */
public record DeletionStrategy(
    SonarrAction sonarr,
    RadarrAction radarr,
    boolean deleteFiles,
    boolean addImportExclusion
) {
    
    public DeletionStrategy {
        sonarr = sonarr == null ? SonarrAction.FILE_ONLY : sonarr;
        radarr = radarr == null ? RadarrAction.FILE_ONLY : radarr;
    }
    
    public static DeletionStrategy defaults() {
        return new DeletionStrategy(SonarrAction.FILE_ONLY, RadarrAction.FILE_ONLY, true, false);
    }
}
