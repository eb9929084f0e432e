package com.starscape.mediareaper.features.evaluaterule.api.dto;

import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.domain.WatchStatus;

import java.time.Instant;

public record PreviewItem(
    Long mediaId,
    String title,
    String filename,
    String path,
    MediaType type,
    long size,
    WatchStatus watchStatus,
    Instant addedAt,
    Double rating,
    String qualityName,
    String resolution
) {
    
    public static PreviewItem from(MediaSnapshot media) {
        return new PreviewItem(
            media.id(),
            media.displayTitle(),
            media.filename(),
            media.path(),
            media.type(),
            media.size(),
            media.watchStatus(),
            media.addedAt(),
            media.effectiveRating().orElse(null),
            media.qualityName(),
            media.resolution()
        );
    }
}
