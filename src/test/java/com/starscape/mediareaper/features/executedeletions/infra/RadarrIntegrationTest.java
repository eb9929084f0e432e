package com.starscape.mediareaper.features.executedeletions.infra;

import com.starscape.mediareaper.common.config.IntegrationProperties;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import com.starscape.mediareaper.features.rules.domain.RadarrAction;
import com.starscape.mediareaper.features.rules.domain.SonarrAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static com.starscape.mediareaper.TestFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RadarrIntegrationTest {
    
    private static final String BASE = "http://radarr.test";
    
    private MockRestServiceServer server;
    private RadarrIntegration radarr;
    
    @BeforeEach
    void setUp() {
        IntegrationProperties properties = new IntegrationProperties();
        properties.getRadarr().setUrl(BASE);
        properties.getRadarr().setApiKey("key");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        radarr = new RadarrIntegration(properties, builder);
    }
    
    @Test
    void fileOnlyUsesMovieFileFromCatalog() throws Exception {
        MediaSnapshot media = movie(1).radarrId(40).build();
        server.expect(requestTo(BASE + "/api/v3/movie/40"))
                .andExpect(header("X-Api-Key", "key"))
                .andRespond(withSuccess("{\"id\":40,\"title\":\"Movie 1\",\"movieFile\":{\"id\":900}}",
                    MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v3/moviefile/900"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());
        
        IntegrationOutcome outcome = radarr.delete(media, DeletionStrategy.defaults());
        
        server.verify();
        assertEquals(media.size(), outcome.bytesFreed());
    }
    
    @Test
    void removeMovieFindsMovieByFolderAndPassesFlags() throws Exception {
        MediaSnapshot media = movie(1).title("Different Title").build();
        server.expect(requestTo(BASE + "/api/v3/movie"))
                .andRespond(withSuccess("[{\"id\":3,\"title\":\"Other\",\"path\":\"/elsewhere\"},"
                    + "{\"id\":41,\"title\":\"Movie 1\",\"path\":\"/media/movies/Movie 1\"}]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v3/movie/41?deleteFiles=false&addImportExclusion=true"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());
        
        IntegrationOutcome outcome = radarr.delete(media,
            new DeletionStrategy(SonarrAction.FILE_ONLY, RadarrAction.REMOVE_MOVIE, false, true));
        
        server.verify();
        assertEquals(0L, outcome.bytesFreed());
        assertEquals("Removed movie: Movie 1", outcome.actions().get(0));
    }
    
    @Test
    void staleRadarrIdFallsBackToFolderLookup() throws Exception {
        MediaSnapshot media = movie(1).radarrId(40).build();
        server.expect(requestTo(BASE + "/api/v3/movie/40"))
                .andRespond(withResourceNotFound());
        server.expect(requestTo(BASE + "/api/v3/movie"))
                .andRespond(withSuccess("[{\"id\":41,\"title\":\"Movie 1 (re-added)\",\"path\":\"/media/movies/Movie 1\","
                    + "\"movieFile\":{\"id\":901}}]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v3/moviefile/901"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());
        
        IntegrationOutcome outcome = radarr.delete(media, DeletionStrategy.defaults());
        
        server.verify();
        assertEquals(media.size(), outcome.bytesFreed());
    }
}
