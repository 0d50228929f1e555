package io.pipe.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipe.core.store.Hashes;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** In-memory view of {@code .cache_registry.json}: content hash to provider cache handle. */
public final class CacheRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CacheRegistry.class);

    private final Map<String, CacheRegistryEntry> entries;

    private CacheRegistry(Map<String, CacheRegistryEntry> entries) {
        this.entries = entries;
    }

    public static String keyFor(String content) {
        return Hashes.sha256Hex(content);
    }

    public static CacheRegistry fromJson(JsonNode document, ObjectMapper mapper) {
        Map<String, CacheRegistryEntry> entries = new LinkedHashMap<>();
        if (document != null && document.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                try {
                    entries.put(field.getKey(), mapper.treeToValue(field.getValue(), CacheRegistryEntry.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    LOG.warn("Dropping unreadable cache registry entry {}: {}", field.getKey(), e.getMessage());
                }
            }
        }
        return new CacheRegistry(entries);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        entries.forEach((key, entry) -> root.set(key, mapper.valueToTree(entry)));
        return root;
    }

    public Optional<CacheRegistryEntry> live(String key, OffsetDateTime now) {
        CacheRegistryEntry entry = entries.get(key);
        return entry != null && entry.isLive(now) ? Optional.of(entry) : Optional.empty();
    }

    public void put(String key, CacheRegistryEntry entry) {
        entries.put(key, entry);
    }

    public boolean remove(String key) {
        return entries.remove(key) != null;
    }

    /** Keys of entries recorded for {@code sessionId}, live or not. */
    public List<String> keysForSession(String sessionId) {
        return entries.entrySet().stream()
            .filter(entry -> sessionId.equals(entry.getValue().sessionId()))
            .map(Map.Entry::getKey)
            .toList();
    }

    /** The live entry for {@code sessionId} that expires last, if any. */
    public Optional<CacheRegistryEntry> liveForSession(String sessionId, OffsetDateTime now) {
        return entries.values().stream()
            .filter(entry -> sessionId.equals(entry.sessionId()) && entry.isLive(now))
            .max(Comparator.comparing(CacheRegistryEntry::expireTime));
    }

    public Optional<CacheRegistryEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int purgeExpired(OffsetDateTime now) {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLive(now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
