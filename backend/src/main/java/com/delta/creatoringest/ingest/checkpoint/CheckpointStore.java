package com.delta.creatoringest.ingest.checkpoint;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.model.CheckpointState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable progress cursor kept as a small JSON file next to the input.
 * <p>
 * Writes go to a sibling temp file that is synced and then renamed over the checkpoint, so a
 * reader only ever sees the previous or the new state. Anything unreadable is treated as no
 * checkpoint at all.
 */
@Component
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    @Autowired
    public CheckpointStore(IngestProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getCheckpoint().getPath()), objectMapper);
    }

    public CheckpointStore(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return path;
    }

    public int resume() {
        return load().map(CheckpointState::processedCount).orElse(0);
    }

    public Optional<CheckpointState> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            CheckpointState state = objectMapper.readValue(path.toFile(), CheckpointState.class);
            if (state == null || state.processedCount() < 0) {
                log.warn("Ignoring checkpoint {} with invalid processed_count", path);
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public CheckpointState commit(int processedCount, String lastHandle) {
        CheckpointState state = new CheckpointState(processedCount, lastHandle, Instant.now());
        Path directory = path.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            byte[] payload = objectMapper.writeValueAsBytes(state);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp);
            temp = null;
            return state;
        } catch (IOException e) {
            throw new CheckpointException("Failed to write checkpoint " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    public void reset() {
        try {
            Files.deleteIfExists(path);
            log.info("Checkpoint {} removed", path);
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + path, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp checkpoint {}", temp, e);
        }
    }
}
