package com.starscape.mediareaper.integration;

import com.starscape.mediareaper.common.outbox.OutboxEvent;
import com.starscape.mediareaper.common.outbox.OutboxEventRepository;
import com.starscape.mediareaper.features.media.domain.Media;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.infra.JpaMediaRepository;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flow: rule → preview → proposal run → approval → execution → history.
 * Sonarr and Radarr are unconfigured in the test profile, so files are removed from disk directly.
 */
public class DeletionFlowIntegrationTest extends BaseIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    @Autowired
    private JpaMediaRepository mediaRepository;
    
    @Autowired
    private OutboxEventRepository outboxRepository;
    
    @TempDir
    Path library;
    
    private String token;
    
    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
        // Titles carry a per-test token so rules only ever see this test's media
        token = "flow-" + UUID.randomUUID();
    }
    
    @Test
    void shouldDeleteApprovedMediaAndRecordHistory() throws Exception {
        Path first = createFile("first.mkv");
        Path second = createFile("second.mkv");
        Media firstMedia = saveMovie(first, false);
        saveMovie(second, false);
        saveMovie(createFile("keeper.mkv"), true);
        
        Long ruleId = createRule();
        
        // 1. Preview changes nothing and skips protected media
        given()
                .get("/queries/rules/{id}/preview", ruleId)
                .then()
                .statusCode(200)
                .body("matchedCount", equalTo(2))
                .body("matches.title", everyItem(containsString(token)));
        
        // 2. Run the rule: two proposals
        List<Integer> createdIds = given()
                .post("/commands/rules/{id}/run", ruleId)
                .then()
                .statusCode(200)
                .body("matchedCount", equalTo(2))
                .body("createdIds", hasSize(2))
                .extract()
                .path("createdIds");
        
        // 3. A second run does not duplicate active proposals
        given()
                .post("/commands/rules/{id}/run", ruleId)
                .then()
                .statusCode(200)
                .body("alreadyPending", equalTo(2))
                .body("createdIds", empty());
        
        // 4. Approve both
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("ids", createdIds, "actor", "alice", "reason", "cleanup"))
                .post("/commands/pending-deletions/bulk-approve")
                .then()
                .statusCode(200)
                .body("requested", equalTo(2))
                .body("applied", equalTo(2));
        
        // 5. Execute
        Integer historyId = given()
                .post("/commands/executions")
                .then()
                .statusCode(200)
                .body("outcome", equalTo("COMPLETED"))
                .body("successful", equalTo(2))
                .body("failed", equalTo(0))
                .body("bytesFreed", equalTo(10))
                .extract()
                .path("historyId");
        assertNotNull(historyId);
        
        assertFalse(Files.exists(first));
        assertFalse(Files.exists(second));
        
        Integer firstId = createdIds.get(0);
        given()
                .get("/queries/pending-deletions/{id}", firstId)
                .then()
                .statusCode(200)
                .body("status", equalTo("COMPLETED"))
                .body("executionResults", hasSize(1))
                .body("executionResults[0].integration", equalTo("LOCAL_FILE"))
                .body("approvedBy", equalTo("alice"));
        
        // 6. History has one row for the pass
        given()
                .get("/queries/history")
                .then()
                .statusCode(200)
                .body("items.find { it.id == " + historyId + " }.itemsAttempted", equalTo(2))
                .body("items.find { it.id == " + historyId + " }.itemsSucceeded", equalTo(2))
                .body("items.find { it.id == " + historyId + " }.ruleId", equalTo(ruleId.intValue()))
                .body("items.find { it.id == " + historyId + " }.trigger", equalTo("MANUAL"));
        
        given()
                .get("/queries/rules/{id}/stats", ruleId)
                .then()
                .statusCode(200);
        
        // Completed items are terminal
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("actor", "bob"))
                .post("/commands/pending-deletions/{id}/cancel", firstId)
                .then()
                .statusCode(409)
                .body("code", equalTo("CONFLICT"));
        
        assertTrue(mediaRepository.findById(firstMedia.getId()).isPresent());
        
        // 7. State changes went to the outbox in the same transactions
        List<String> executed = outboxRepository.findByEventTypeOrderByCreatedAtAsc("DeletionExecuted").stream()
                .map(OutboxEvent::getAggregateId)
                .toList();
        assertTrue(executed.containsAll(createdIds.stream().map(String::valueOf).toList()));
        assertTrue(outboxRepository.findByEventTypeOrderByCreatedAtAsc("DeletionBatchCompleted").stream()
                .anyMatch(event -> event.getAggregateId().equals(String.valueOf(historyId))));
    }
    
    @Test
    void shouldCancelInBulkAndRejectIllegalTransitions() throws Exception {
        saveMovie(createFile("a.mkv"), false);
        saveMovie(createFile("b.mkv"), false);
        Long ruleId = createRule();
        
        List<Integer> createdIds = given()
                .post("/commands/rules/{id}/run", ruleId)
                .then()
                .statusCode(200)
                .extract()
                .path("createdIds");
        assertEquals(2, createdIds.size());
        
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("ids", List.of(createdIds.get(0), createdIds.get(1), createdIds.get(0), 999999),
                    "actor", "alice"))
                .post("/commands/pending-deletions/bulk-cancel")
                .then()
                .statusCode(200)
                .body("requested", equalTo(3))
                .body("applied", equalTo(2))
                .body("results.find { it.id == 999999 }.outcome", equalTo("NOT_FOUND"));
        
        // Cancelled is terminal
        given()
                .post("/commands/pending-deletions/{id}/approve", createdIds.get(0))
                .then()
                .statusCode(409)
                .body("code", equalTo("CONFLICT"));
        
        // Only FAILED items can be resubmitted
        given()
                .post("/commands/pending-deletions/{id}/resubmit", createdIds.get(1))
                .then()
                .statusCode(409);
        
        given()
                .get("/queries/pending-deletions/{id}", 999999)
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
        
        // Cancelled proposals no longer block a new run
        given()
                .post("/commands/rules/{id}/run", ruleId)
                .then()
                .statusCode(200)
                .body("createdIds", hasSize(2));
        
        given()
                .delete("/commands/rules/{id}", ruleId)
                .then()
                .statusCode(204);
        
        given()
                .get("/queries/pending-deletions")
                .then()
                .statusCode(200)
                .body("items.findAll { it.mediaSnapshot.title.contains('" + token + "') && it.status == 'PENDING' }",
                    empty());
    }
    
    @Test
    void shouldRejectInvalidRequests() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("name", ""))
                .post("/commands/rules")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"));
        
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("intervalMinutes", 1))
                .post("/commands/executions/schedule/start")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"));
        
        given()
                .get("/queries/executions/status")
                .then()
                .statusCode(200)
                .body("scheduled", equalTo(false));
    }
    
    private Path createFile(String name) throws IOException {
        return Files.write(library.resolve(token + "-" + name), new byte[5]);
    }
    
    private Media saveMovie(Path file, boolean protectedItem) {
        Media media = new Media(file.toString(), file.getFileName().toString(), 5L, MediaType.MOVIE,
            Instant.now().minus(90, ChronoUnit.DAYS));
        media.setTitle("Movie " + token + " " + file.getFileName());
        media.setProtectedItem(protectedItem);
        return mediaRepository.save(media);
    }
    
    private Long createRule() {
        Map<String, Object> rule = Map.of(
            "name", "Rule " + token,
            "mediaTypes", List.of("MOVIE"),
            "conditions", List.of(Map.of("kind", "TITLE", "operator", "CONTAINS", "value", token)),
            "filtersEnabled", Map.of("TITLE", true)
        );
        Integer id = given()
                .contentType(ContentType.JSON)
                .body(rule)
                .post("/commands/rules")
                .then()
                .statusCode(201)
                .body("name", equalTo("Rule " + token))
                .extract()
                .path("id");
        return id.longValue();
    }
}
