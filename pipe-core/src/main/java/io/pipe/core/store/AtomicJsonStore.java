package io.pipe.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pipe.core.lock.FileLock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;

/**
 * Read-modify-write of a JSON document under a {@link FileLock}.
 *
 * <p>This is the only path through which session files, the session index and the cache registry
 * are mutated. The document is never written in place: it is serialized to a temporary file in the
 * target directory and renamed over the target, so readers see either the old or the new document.
 */
public final class AtomicJsonStore {
    private final ObjectMapper mapper;
    private final Duration lockTimeout;
    private final FileMover mover;

    public AtomicJsonStore(ObjectMapper mapper, Duration lockTimeout) {
        this(mapper, lockTimeout, AtomicJsonStore::atomicMove);
    }

    AtomicJsonStore(ObjectMapper mapper, Duration lockTimeout, FileMover mover) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
        this.mover = mover;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    /** Lenient unlocked read: missing, empty or malformed files all yield {@code defaultData}. */
    public JsonNode read(Path path, JsonNode defaultData) throws IOException {
        return parse(path, defaultData, CorruptPolicy.USE_DEFAULT);
    }

    /** Read under the lock so the caller never observes a document mid-swap on platforms without atomic rename. */
    public JsonNode lockedRead(Path path, JsonNode defaultData, CorruptPolicy policy) throws IOException {
        try (FileLock ignored = FileLock.acquire(path, lockTimeout)) {
            return parse(path, defaultData, policy);
        }
    }

    public <T> T readModifyWrite(Path path, JsonModifier<T> modifier, JsonNode defaultData) throws IOException {
        return readModifyWrite(path, path, modifier, defaultData, CorruptPolicy.USE_DEFAULT);
    }

    public <T> T readModifyWrite(
        Path lockResource,
        Path dataPath,
        JsonModifier<T> modifier,
        JsonNode defaultData,
        CorruptPolicy policy
    ) throws IOException {
        Objects.requireNonNull(modifier, "modifier must not be null");
        try (FileLock ignored = FileLock.acquire(lockResource, lockTimeout)) {
            JsonNode current = parse(dataPath, defaultData == null ? null : defaultData.deepCopy(), policy);
            if (current == null) {
                throw new NotFoundException("File not found and no default provided: " + dataPath);
            }
            Modification<T> result = modifier.modify(current);
            if (result == null) {
                write(dataPath, current);
                return null;
            }
            if (result.write()) {
                write(dataPath, result.document() != null ? result.document() : current);
            }
            return result.value();
        }
    }

    private JsonNode parse(Path path, JsonNode defaultData, CorruptPolicy policy) throws IOException {
        if (!Files.exists(path)) {
            return defaultData;
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return defaultData;
        }
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            if (policy == CorruptPolicy.FAIL) {
                throw new CorruptDataException(path, e);
            }
            return defaultData;
        }
    }

    private void write(Path target, JsonNode document) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            Files.writeString(tmp, json + System.lineSeparator(), StandardCharsets.UTF_8);
            mover.move(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }
}
