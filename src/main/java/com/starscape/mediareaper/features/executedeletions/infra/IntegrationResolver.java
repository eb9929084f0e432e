package com.starscape.mediareaper.features.executedeletions.infra;

import com.starscape.mediareaper.features.executedeletions.domain.DeletionIntegration;
import com.starscape.mediareaper.features.media.domain.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the integration that owns a media type. Shows and episodes belong to Sonarr, movies
 * to Radarr, everything else is removed from disk. An unconfigured Sonarr or Radarr falls
 * back to removing the file from disk.
 */
@Component
public class IntegrationResolver {
    
    private static final Logger log = LoggerFactory.getLogger(IntegrationResolver.class);
    
    private final SonarrIntegration sonarr;
    private final RadarrIntegration radarr;
    private final LocalFileIntegration localFile;
    
    public IntegrationResolver(SonarrIntegration sonarr, RadarrIntegration radarr, LocalFileIntegration localFile) {
        this.sonarr = sonarr;
        this.radarr = radarr;
        this.localFile = localFile;
    }
    
    public DeletionIntegration resolve(MediaType type) {
        if (type != null && type.isSeries()) {
            if (sonarr.isConfigured()) {
                return sonarr;
            }
            log.info("Sonarr not configured, falling back to direct file deletion: type={}", type);
            return localFile;
        }
        if (type == MediaType.MOVIE) {
            if (radarr.isConfigured()) {
                return radarr;
            }
            log.info("Radarr not configured, falling back to direct file deletion");
            return localFile;
        }
        return localFile;
    }
}
