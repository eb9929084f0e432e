package com.starscape.mediareaper.features.executedeletions.infra;

import com.starscape.mediareaper.features.executedeletions.domain.DeletionIntegration;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Deletes the file itself. A file that is already gone counts as deleted.
 */
@Component
public class LocalFileIntegration implements DeletionIntegration {
    
    private static final Logger log = LoggerFactory.getLogger(LocalFileIntegration.class);
    
    @Override
    public IntegrationKind kind() {
        return IntegrationKind.LOCAL_FILE;
    }
    
    @Override
    public IntegrationOutcome delete(MediaSnapshot media, DeletionStrategy strategy) throws IntegrationException {
        try {
            boolean deleted = Files.deleteIfExists(Path.of(media.path()));
            if (deleted) {
                log.info("Deleted file: mediaId={}, path={}", media.id(), media.path());
                return new IntegrationOutcome(List.of("Deleted file directly: " + media.filename()), media.size());
            }
            log.info("File already removed: mediaId={}, path={}", media.id(), media.path());
            return new IntegrationOutcome(List.of("File already removed: " + media.filename()), 0L);
        } catch (IOException | InvalidPathException e) {
            throw new IntegrationException("Direct file deletion failed: " + e.getMessage(), e);
        }
    }
}
