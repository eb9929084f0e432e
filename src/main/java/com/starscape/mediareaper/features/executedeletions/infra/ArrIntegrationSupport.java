package com.starscape.mediareaper.features.executedeletions.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.mediareaper.common.config.IntegrationProperties;
import com.starscape.mediareaper.features.executedeletions.domain.DeletionIntegration;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

/**
 * Shared plumbing of the Sonarr and Radarr v3 APIs: authenticated client and catalog lookup.
 */
abstract class ArrIntegrationSupport implements DeletionIntegration {
    
    private static final Logger log = LoggerFactory.getLogger(ArrIntegrationSupport.class);
    
    private final String serviceName;
    private final IntegrationProperties.Endpoint endpoint;
    private final RestClient restClient;
    
    protected ArrIntegrationSupport(String serviceName, IntegrationProperties.Endpoint endpoint,
                                    RestClient.Builder restClientBuilder) {
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.restClient = endpoint.isConfigured()
                ? restClientBuilder.clone()
                    .baseUrl(stripTrailingSlash(endpoint.getUrl()))
                    .defaultHeader("X-Api-Key", endpoint.getApiKey())
                    .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                    .build()
                : null;
    }
    
    public boolean isConfigured() {
        return endpoint.isConfigured();
    }
    
    protected RestClient client() throws IntegrationException {
        if (restClient == null) {
            throw new IntegrationException(serviceName + " is not configured");
        }
        return restClient;
    }
    
    /**
     * Look up the catalog entry for the media: by id when the sync stored one, otherwise
     * the entry whose folder is the file's parent directory or whose title matches.
     * A stored id the service no longer knows falls through to the folder/title scan.
     */
    protected JsonNode findCatalogEntry(String collectionPath, Integer knownId, MediaSnapshot media, String label)
            throws IntegrationException {
        if (knownId != null) {
            try {
                JsonNode entry = client().get()
                        .uri(collectionPath + "/{id}", knownId)
                        .retrieve()
                        .body(JsonNode.class);
                if (entry != null && !entry.isNull()) {
                    return entry;
                }
            } catch (HttpClientErrorException.NotFound e) {
                log.info("{} id {} not found, looking up by folder or title: mediaId={}",
                    serviceName, knownId, media.id());
            }
        }
        
        JsonNode all = client().get()
                .uri(collectionPath)
                .retrieve()
                .body(JsonNode.class);
        String folder = parentDirectory(media.path());
        if (all != null && all.isArray()) {
            for (JsonNode entry : all) {
                String entryPath = entry.path("path").asText(null);
                String entryTitle = entry.path("title").asText(null);
                boolean samePath = folder != null && folder.equals(entryPath);
                boolean sameTitle = media.title() != null && entryTitle != null
                        && entryTitle.equalsIgnoreCase(media.title());
                if (samePath || sameTitle) {
                    return entry;
                }
            }
        }
        throw new IntegrationException(label + " not found in " + serviceName + " for: " + media.displayTitle());
    }
    
    protected String serviceName() {
        return serviceName;
    }
    
    private static String parentDirectory(String path) {
        if (path == null) {
            return null;
        }
        Path parent = Path.of(path).getParent();
        return parent == null ? null : parent.toString();
    }
    
    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
