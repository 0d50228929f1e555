package io.pipe.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pipe.core.store.AtomicJsonStore;
import io.pipe.core.store.CorruptPolicy;
import io.pipe.core.store.JsonMappers;
import io.pipe.core.store.Modification;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The cache registry file, locked independently of sessions. A missing or corrupt registry reads
 * as empty.
 */
public final class CacheRegistryStore {
    public static final String REGISTRY_FILE = ".cache_registry.json";

    private final Path registryPath;
    private final AtomicJsonStore store;
    private final ObjectMapper mapper;
    private final Clock clock;

    public CacheRegistryStore(Path registryPath, Duration lockTimeout, Clock clock) {
        this.registryPath = Objects.requireNonNull(registryPath, "registryPath must not be null");
        this.mapper = JsonMappers.create();
        this.store = new AtomicJsonStore(mapper, lockTimeout);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path registryPath() {
        return registryPath;
    }

    public CacheRegistry load() throws IOException {
        JsonNode document = store.lockedRead(registryPath, mapper.createObjectNode(), CorruptPolicy.USE_DEFAULT);
        return CacheRegistry.fromJson(document, mapper);
    }

    /** The entry for {@code key} if it has not expired yet. */
    public Optional<CacheRegistryEntry> find(String key) throws IOException {
        return load().live(key, now());
    }

    /** The newest live entry recorded for the session, whatever prefix it was created from. */
    public Optional<CacheRegistryEntry> findForSession(String sessionId) throws IOException {
        return load().liveForSession(sessionId, now());
    }

    public void put(String key, CacheRegistryEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry must not be null");
        modify(registry -> {
            registry.put(key, entry);
            return null;
        });
    }

    public boolean remove(String key) throws IOException {
        Boolean removed = modify(registry -> registry.remove(key));
        return Boolean.TRUE.equals(removed);
    }

    /** Removes every entry recorded for the session except {@code keepKey}; returns the removed entries. */
    public List<CacheRegistryEntry> removeForSession(String sessionId, String keepKey) throws IOException {
        return modify(registry -> registry.keysForSession(sessionId).stream()
            .filter(key -> !key.equals(keepKey))
            .map(key -> {
                CacheRegistryEntry entry = registry.get(key).orElseThrow();
                registry.remove(key);
                return entry;
            })
            .toList());
    }

    public int purgeExpired() throws IOException {
        OffsetDateTime now = now();
        Integer purged = modify(registry -> registry.purgeExpired(now));
        return purged == null ? 0 : purged;
    }

    private <T> T modify(Function<CacheRegistry, T> mutation) throws IOException {
        return store.readModifyWrite(registryPath, registryPath, document -> {
            CacheRegistry registry = CacheRegistry.fromJson(document, mapper);
            T value = mutation.apply(registry);
            return Modification.replace(registry.toJson(mapper), value);
        }, mapper.createObjectNode(), CorruptPolicy.USE_DEFAULT);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
