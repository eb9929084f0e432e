package com.starscape.mediareaper.features.executedeletions.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starscape.mediareaper.common.config.IntegrationProperties;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Deletes shows and episodes through Sonarr according to the rule's Sonarr action.
 */
@Component
public class SonarrIntegration extends ArrIntegrationSupport {
    
    private static final Logger log = LoggerFactory.getLogger(SonarrIntegration.class);
    
    public SonarrIntegration(IntegrationProperties properties, RestClient.Builder integrationRestClientBuilder) {
        super("Sonarr", properties.getSonarr(), integrationRestClientBuilder);
    }
    
    @Override
    public IntegrationKind kind() {
        return IntegrationKind.SONARR;
    }
    
    @Override
    public IntegrationOutcome delete(MediaSnapshot media, DeletionStrategy strategy) throws IntegrationException {
        try {
            JsonNode series = findCatalogEntry("/api/v3/series", media.sonarrId(), media, "Series");
            long seriesId = series.path("id").asLong();
            String seriesTitle = series.path("title").asText(media.displayTitle());
            List<String> actions = new ArrayList<>();
            long bytesFreed = 0;
            
            switch (strategy.sonarr()) {
                case FILE_ONLY -> {
                    long fileId = media.sonarrEpisodeFileId() != null
                            ? media.sonarrEpisodeFileId()
                            : findEpisodeFileId(seriesId, media);
                    client().delete()
                            .uri("/api/v3/episodefile/{id}", fileId)
                            .retrieve()
                            .toBodilessEntity();
                    actions.add("Deleted episode file: " + media.filename());
                    bytesFreed = media.size();
                }
                case UNMONITOR -> {
                    ObjectNode updated = series.deepCopy();
                    updated.put("monitored", false);
                    client().put()
                            .uri("/api/v3/series/{id}", seriesId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(updated)
                            .retrieve()
                            .toBodilessEntity();
                    actions.add("Unmonitored series: " + seriesTitle);
                    if (strategy.deleteFiles()) {
                        deleteSeries(seriesId, true, strategy.addImportExclusion());
                        actions.add("Deleted series files: " + seriesTitle);
                        bytesFreed = media.size();
                    }
                }
                case REMOVE_SERIES -> {
                    deleteSeries(seriesId, strategy.deleteFiles(), strategy.addImportExclusion());
                    actions.add("Removed series: " + seriesTitle);
                    bytesFreed = strategy.deleteFiles() ? media.size() : 0L;
                }
            }
            
            log.info("Sonarr deletion done: mediaId={}, seriesId={}, action={}, actions={}",
                media.id(), seriesId, strategy.sonarr(), actions);
            return new IntegrationOutcome(actions, bytesFreed);
        } catch (RestClientException e) {
            throw new IntegrationException("Sonarr deletion failed: " + e.getMessage(), e);
        }
    }
    
    private long findEpisodeFileId(long seriesId, MediaSnapshot media) throws IntegrationException {
        JsonNode files = client().get()
                .uri("/api/v3/episodefile?seriesId={seriesId}", seriesId)
                .retrieve()
                .body(JsonNode.class);
        if (files != null && files.isArray()) {
            for (JsonNode file : files) {
                if (media.path().equals(file.path("path").asText(null))) {
                    return file.path("id").asLong();
                }
            }
        }
        throw new IntegrationException("Episode file not found in Sonarr: " + media.path());
    }
    
    private void deleteSeries(long seriesId, boolean deleteFiles, boolean addImportExclusion) throws IntegrationException {
        client().delete()
                .uri("/api/v3/series/{id}?deleteFiles={deleteFiles}&addImportListExclusion={exclusion}",
                    seriesId, deleteFiles, addImportExclusion)
                .retrieve()
                .toBodilessEntity();
    }
}
