package com.starscape.mediareaper.features.executedeletions.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.mediareaper.common.config.IntegrationProperties;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Deletes movies through Radarr according to the rule's Radarr action.
 */
@Component
public class RadarrIntegration extends ArrIntegrationSupport {
    
    private static final Logger log = LoggerFactory.getLogger(RadarrIntegration.class);
    
    public RadarrIntegration(IntegrationProperties properties, RestClient.Builder integrationRestClientBuilder) {
        super("Radarr", properties.getRadarr(), integrationRestClientBuilder);
    }
    
    @Override
    public IntegrationKind kind() {
        return IntegrationKind.RADARR;
    }
    
    @Override
    public IntegrationOutcome delete(MediaSnapshot media, DeletionStrategy strategy) throws IntegrationException {
        try {
            JsonNode movie = findCatalogEntry("/api/v3/movie", media.radarrId(), media, "Movie");
            long movieId = movie.path("id").asLong();
            String movieTitle = movie.path("title").asText(media.displayTitle());
            
            IntegrationOutcome outcome = switch (strategy.radarr()) {
                case FILE_ONLY -> {
                    long fileId = movieFileId(movie, media);
                    client().delete()
                            .uri("/api/v3/moviefile/{id}", fileId)
                            .retrieve()
                            .toBodilessEntity();
                    yield new IntegrationOutcome(List.of("Deleted movie file: " + media.filename()), media.size());
                }
                case REMOVE_MOVIE -> {
                    client().delete()
                            .uri("/api/v3/movie/{id}?deleteFiles={deleteFiles}&addImportExclusion={exclusion}",
                                movieId, strategy.deleteFiles(), strategy.addImportExclusion())
                            .retrieve()
                            .toBodilessEntity();
                    yield new IntegrationOutcome(List.of("Removed movie: " + movieTitle),
                        strategy.deleteFiles() ? media.size() : 0L);
                }
            };
            
            log.info("Radarr deletion done: mediaId={}, movieId={}, action={}, actions={}",
                media.id(), movieId, strategy.radarr(), outcome.actions());
            return outcome;
        } catch (RestClientException e) {
            throw new IntegrationException("Radarr deletion failed: " + e.getMessage(), e);
        }
    }
    
    private long movieFileId(JsonNode movie, MediaSnapshot media) throws IntegrationException {
        if (media.radarrMovieFileId() != null) {
            return media.radarrMovieFileId();
        }
        JsonNode file = movie.path("movieFile");
        if (file.hasNonNull("id")) {
            return file.path("id").asLong();
        }
        throw new IntegrationException("Movie file not found in Radarr: " + media.path());
    }
}
