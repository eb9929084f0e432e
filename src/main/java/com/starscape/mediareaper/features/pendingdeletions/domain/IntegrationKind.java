package com.starscape.mediareaper.features.pendingdeletions.domain;

public enum IntegrationKind {
    SONARR,
    RADARR,
    LOCAL_FILE
}
