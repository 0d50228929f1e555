package io.pipe.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metadata for every known session, persisted as {@code sessions/index.json}:
 * {@code {"sessions": {id: {created_at, last_updated_at, purpose}}, "version": "1.0"}}.
 */
public final class SessionIndex {
    private static final Logger LOG = LoggerFactory.getLogger(SessionIndex.class);
    public static final String VERSION = "1.0";

    private final Map<String, SessionIndexEntry> sessions;

    public SessionIndex() {
        this(new LinkedHashMap<>());
    }

    private SessionIndex(Map<String, SessionIndexEntry> sessions) {
        this.sessions = sessions;
    }

    public static ObjectNode emptyDocument(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.putObject("sessions");
        root.put("version", VERSION);
        return root;
    }

    /** Entries that do not bind are skipped: the index is advisory and rebuilt by later saves. */
    public static SessionIndex fromJson(JsonNode document, ObjectMapper mapper) {
        Map<String, SessionIndexEntry> entries = new LinkedHashMap<>();
        JsonNode sessionsNode = document == null ? null : document.get("sessions");
        if (sessionsNode != null && sessionsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = sessionsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                try {
                    entries.put(field.getKey(), mapper.treeToValue(field.getValue(), SessionIndexEntry.class));
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping unreadable index entry {}: {}", field.getKey(), e.getMessage());
                }
            }
        }
        return new SessionIndex(entries);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode root = emptyDocument(mapper);
        ObjectNode sessionsNode = (ObjectNode) root.get("sessions");
        sessions.forEach((id, entry) -> sessionsNode.set(id, mapper.valueToTree(entry)));
        return root;
    }

    public int size() {
        return sessions.size();
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Optional<SessionIndexEntry> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public void put(String sessionId, SessionIndexEntry entry) {
        sessions.put(sessionId, entry);
    }

    public List<String> childrenOf(String parentId) {
        String prefix = parentId + "/";
        return sessions.keySet().stream().filter(id -> id.startsWith(prefix)).toList();
    }

    /** Removes the session and every descendant; returns how many entries went away. */
    public int removeTree(String sessionId) {
        int removed = sessions.remove(sessionId) != null ? 1 : 0;
        for (String child : childrenOf(sessionId)) {
            if (sessions.remove(child) != null) {
                removed++;
            }
        }
        return removed;
    }

    /** Most recently updated first; entries without a timestamp sort last. */
    public List<IndexedSession> sortedByLastUpdated() {
        List<IndexedSession> sorted = new ArrayList<>();
        sessions.forEach((id, entry) -> sorted.add(new IndexedSession(id, entry)));
        Comparator<OffsetDateTime> byInstant = Comparator.comparing(OffsetDateTime::toInstant);
        Comparator<IndexedSession> byLastUpdated = Comparator.comparing(
            item -> item.entry().lastUpdatedAt(),
            Comparator.nullsFirst(byInstant)
        );
        sorted.sort(byLastUpdated.reversed());
        return sorted;
    }
}
