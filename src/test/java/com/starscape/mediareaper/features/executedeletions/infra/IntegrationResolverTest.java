package com.starscape.mediareaper.features.executedeletions.infra;

import com.starscape.mediareaper.common.config.IntegrationProperties;
import com.starscape.mediareaper.features.media.domain.MediaType;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationResolverTest {
    
    private final LocalFileIntegration localFile = new LocalFileIntegration();
    
    private IntegrationResolver resolver(boolean sonarrConfigured, boolean radarrConfigured) {
        IntegrationProperties properties = new IntegrationProperties();
        if (sonarrConfigured) {
            properties.getSonarr().setUrl("http://sonarr.test");
            properties.getSonarr().setApiKey("a");
        }
        if (radarrConfigured) {
            properties.getRadarr().setUrl("http://radarr.test");
            properties.getRadarr().setApiKey("b");
        }
        RestClient.Builder builder = RestClient.builder();
        return new IntegrationResolver(new SonarrIntegration(properties, builder),
            new RadarrIntegration(properties, builder), localFile);
    }
    
    @Test
    void routesByMediaTypeWhenConfigured() {
        IntegrationResolver resolver = resolver(true, true);
        
        assertInstanceOf(SonarrIntegration.class, resolver.resolve(MediaType.SHOW));
        assertInstanceOf(SonarrIntegration.class, resolver.resolve(MediaType.EPISODE));
        assertInstanceOf(RadarrIntegration.class, resolver.resolve(MediaType.MOVIE));
        assertSame(localFile, resolver.resolve(MediaType.MUSIC));
    }
    
    @Test
    void fallsBackToLocalFileWhenUnconfigured() {
        IntegrationResolver resolver = resolver(false, false);
        
        assertSame(localFile, resolver.resolve(MediaType.EPISODE));
        assertSame(localFile, resolver.resolve(MediaType.MOVIE));
    }
}
