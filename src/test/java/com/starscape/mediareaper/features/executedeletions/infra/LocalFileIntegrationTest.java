package com.starscape.mediareaper.features.executedeletions.infra;

import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileIntegrationTest {
    
    private final LocalFileIntegration integration = new LocalFileIntegration();
    
    @TempDir
    Path dir;
    
    private MediaSnapshot media(Path file) {
        return MediaSnapshot.builder()
                .id(1L)
                .type(MediaType.PHOTO)
                .path(file.toString())
                .filename(file.getFileName().toString())
                .size(11L)
                .build();
    }
    
    @Test
    void deletesExistingFile() throws Exception {
        Path file = Files.writeString(dir.resolve("holiday.jpg"), "hello world");
        
        IntegrationOutcome outcome = integration.delete(media(file), DeletionStrategy.defaults());
        
        assertFalse(Files.exists(file));
        assertEquals(11L, outcome.bytesFreed());
        assertEquals("Deleted file directly: holiday.jpg", outcome.actions().get(0));
    }
    
    @Test
    void missingFileCountsAsAlreadyRemoved() throws Exception {
        IntegrationOutcome outcome = integration.delete(media(dir.resolve("gone.jpg")), DeletionStrategy.defaults());
        
        assertEquals(0L, outcome.bytesFreed());
        assertEquals("File already removed: gone.jpg", outcome.actions().get(0));
    }
    
    @Test
    void nonEmptyDirectoryCannotBeDeleted() throws Exception {
        Path folder = Files.createDirectory(dir.resolve("album"));
        Files.writeString(folder.resolve("inside.jpg"), "x");
        
        assertThrows(IntegrationException.class, () -> integration.delete(media(folder), DeletionStrategy.defaults()));
    }
}
