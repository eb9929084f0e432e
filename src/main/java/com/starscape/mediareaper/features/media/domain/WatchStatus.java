package com.starscape.mediareaper.features.media.domain;

public enum WatchStatus {
    WATCHED,
    UNWATCHED,
    IN_PROGRESS
}
