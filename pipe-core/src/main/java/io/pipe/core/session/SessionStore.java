package io.pipe.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipe.core.lock.FileLock;
import io.pipe.core.store.AtomicJsonStore;
import io.pipe.core.store.CorruptDataException;
import io.pipe.core.store.CorruptPolicy;
import io.pipe.core.store.Hashes;
import io.pipe.core.store.JsonMappers;
import io.pipe.core.store.Modification;
import io.pipe.core.store.NotFoundException;
import io.pipe.core.turn.CompressedHistoryTurn;
import io.pipe.core.turn.Turn;
import io.pipe.core.turn.TurnCollection;
import io.pipe.core.turn.TurnEdit;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Session files plus the session index, shared by every process working on the same project.
 *
 * <p>Each mutating call is a single locked read-modify-write of one session file, followed by a
 * separate locked update of {@code index.json}. The two files are never updated atomically together:
 * a crash in between leaves an index entry that is stale or missing, which the next save repairs.
 */
public final class SessionStore {
    public static final String INDEX_FILE = "index.json";
    public static final int DEFAULT_REFERENCE_TTL = 3;

    private final Path sessionsDir;
    private final Path indexPath;
    private final AtomicJsonStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int referenceTtl;

    public SessionStore(Path sessionsDir, Duration lockTimeout, Clock clock) {
        this(sessionsDir, lockTimeout, clock, DEFAULT_REFERENCE_TTL);
    }

    public SessionStore(Path sessionsDir, Duration lockTimeout, Clock clock, int referenceTtl) {
        this.sessionsDir = Objects.requireNonNull(sessionsDir, "sessionsDir must not be null");
        this.indexPath = sessionsDir.resolve(INDEX_FILE);
        this.mapper = JsonMappers.create();
        this.store = new AtomicJsonStore(mapper, lockTimeout);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.referenceTtl = referenceTtl;
    }

    public Path sessionsDir() {
        return sessionsDir;
    }

    public Path indexPath() {
        return indexPath;
    }

    public Path sessionPath(String sessionId) {
        return SessionIds.fileFor(sessionsDir, sessionId);
    }

    public Session create(
        String purpose,
        String background,
        List<String> roles,
        boolean multiStepReasoningEnabled,
        String parentId
    ) throws IOException {
        if (parentId != null && !parentId.isBlank() && find(parentId).isEmpty()) {
            throw new NotFoundException("Parent session '" + parentId + "' not found.");
        }
        OffsetDateTime now = now();
        Map<String, Object> identity = new TreeMap<>();
        identity.put("purpose", purpose);
        identity.put("background", background);
        identity.put("roles", roles == null ? List.of() : roles);
        identity.put("multi_step_reasoning_enabled", multiStepReasoningEnabled);
        identity.put("timestamp", now.toString());
        String hash = Hashes.sha256Hex(mapper.writeValueAsString(identity));
        String sessionId = parentId == null || parentId.isBlank() ? hash : parentId + "/" + hash;

        Session session = new Session(sessionId, now);
        session.setPurpose(purpose);
        session.setBackground(background);
        session.setRoles(roles);
        session.setMultiStepReasoningEnabled(multiStepReasoningEnabled);
        writeSession(session);
        addToIndex(sessionId, now, purpose);
        return session;
    }

    public Optional<Session> find(String sessionId) throws IOException {
        Path path = sessionPath(sessionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        JsonNode document = store.lockedRead(path, null, CorruptPolicy.FAIL);
        if (document == null) {
            return Optional.empty();
        }
        return Optional.of(fromJson(path, document));
    }

    public Session load(String sessionId) throws IOException {
        return find(sessionId).orElseThrow(() -> notFound(sessionId));
    }

    /** Overwrites the session file with {@code session} and refreshes its index entry. */
    public void save(Session session) throws IOException {
        writeSession(session);
        touchIndex(session.sessionId(), session.createdAt(), session.purpose());
    }

    /**
     * Deletes the session file, prunes directories it leaves empty, then drops the session and its
     * children from the index.
     */
    public boolean delete(String sessionId) throws IOException {
        Path path = sessionPath(sessionId);
        boolean fileDeleted;
        try (FileLock ignored = FileLock.acquire(path, store.lockTimeout())) {
            fileDeleted = Files.deleteIfExists(path);
        }
        pruneEmptyDirectories(path.getParent());
        int removed = removeFromIndex(sessionId);
        return fileDeleted || removed > 0;
    }

    /** Copies turns {@code [0, forkIndex]} into a new sibling session. */
    public Session fork(String sessionId, int forkIndex) throws IOException {
        Session source = load(sessionId);
        TurnCollection forkedTurns = source.turns().prefix(forkIndex);

        OffsetDateTime now = now();
        String purpose = "Fork of: " + source.purpose();
        Map<String, Object> identity = new TreeMap<>();
        identity.put("purpose", purpose);
        identity.put("original_id", sessionId);
        identity.put("fork_at_turn", forkIndex);
        identity.put("timestamp", now.toString());
        String hash = Hashes.sha256Hex(mapper.writeValueAsString(identity));
        String parent = SessionIds.parentOf(sessionId);
        String forkId = parent == null ? hash : parent + "/" + hash;

        Session fork = new Session(forkId, now);
        fork.setPurpose(purpose);
        fork.setBackground(source.background());
        fork.setRoles(source.roles());
        fork.setMultiStepReasoningEnabled(source.multiStepReasoningEnabled());
        fork.setHyperparameters(source.hyperparameters());
        fork.setReferences(source.references());
        fork.setArtifacts(source.artifacts());
        fork.setProcedure(source.procedure());
        fork.replaceTurns(forkedTurns);
        writeSession(fork);
        addToIndex(forkId, now, purpose);
        return fork;
    }

    public void editMeta(String sessionId, SessionMetaUpdate update) throws IOException {
        Objects.requireNonNull(update, "update must not be null");
        mutate(sessionId, session -> {
            update.applyTo(session);
            return null;
        });
    }

    public void updateTodos(String sessionId, List<TodoItem> todos) throws IOException {
        mutate(sessionId, session -> {
            session.setTodos(todos);
            return null;
        });
    }

    public void clearTodos(String sessionId) throws IOException {
        updateTodos(sessionId, null);
    }

    public void updateCachedTurnCount(String sessionId, int cachedTurnCount) throws IOException {
        mutate(sessionId, session -> {
            session.setCachedTurnCount(cachedTurnCount);
            return null;
        });
    }

    public void appendTurn(String sessionId, Turn turn) throws IOException {
        Objects.requireNonNull(turn, "turn must not be null");
        mutate(sessionId, session -> {
            session.turns().add(turn);
            return null;
        });
    }

    public void deleteTurn(String sessionId, int index) throws IOException {
        mutate(sessionId, session -> {
            session.turns().delete(index);
            return null;
        });
    }

    public void deleteTurns(String sessionId, List<Integer> indices) throws IOException {
        mutate(sessionId, session -> {
            session.turns().deleteAll(indices);
            return null;
        });
    }

    public void editTurn(String sessionId, int index, TurnEdit edit) throws IOException {
        mutate(sessionId, session -> {
            session.turns().edit(index, edit);
            return null;
        });
    }

    /** Deletes turns {@code [start, end]} inclusive and inserts one compressed-history turn at {@code start}. */
    public CompressedHistoryTurn replaceRangeWithSummary(String sessionId, String summary, int start, int end)
        throws IOException {
        OffsetDateTime now = now();
        return mutate(sessionId, session -> session.turns().replaceRangeWithSummary(summary, start, end, now));
    }

    /** Rewrites the session file only when at least one tool response expired. */
    public boolean expireOldToolResponses(String sessionId, int expirationThreshold) throws IOException {
        if (expirationThreshold < 1) {
            throw new IllegalArgumentException("expirationThreshold must be >= 1");
        }
        return mutateIfChanged(sessionId, session -> session.turns().expireOldToolResponses(expirationThreshold));
    }

    public void addToPool(String sessionId, Turn turn) throws IOException {
        Objects.requireNonNull(turn, "turn must not be null");
        mutate(sessionId, session -> {
            session.pools().add(turn);
            return null;
        });
    }

    public boolean mergePool(String sessionId) throws IOException {
        return mutateIfChanged(sessionId, Session::mergePool);
    }

    /** Returns the pooled turns and empties the pool. */
    public List<Turn> takePool(String sessionId) throws IOException {
        return mutate(sessionId, session -> {
            List<Turn> pooled = List.copyOf(session.pools().asList());
            session.replacePools(new TurnCollection());
            return pooled;
        });
    }

    /** Adds {@code path} with the default ttl; returns false when it is already referenced. */
    public boolean addReference(String sessionId, String path) throws IOException {
        return mutateIfChanged(sessionId, session -> {
            boolean present = session.references().stream().anyMatch(ref -> ref.path().equals(path));
            if (present) {
                return false;
            }
            session.references().add(Reference.of(path, referenceTtl));
            return true;
        });
    }

    public Reference toggleReferenceDisabled(String sessionId, int index) throws IOException {
        return mutate(sessionId, session -> {
            Reference current = referenceAt(session, index);
            Reference toggled = current.withDisabled(!current.disabled());
            session.references().set(index, toggled);
            return toggled;
        });
    }

    public Reference updateReferenceTtl(String sessionId, int index, int ttl) throws IOException {
        if (ttl < 0) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        return mutate(sessionId, session -> {
            Reference updated = referenceAt(session, index).withTtl(ttl);
            session.references().set(index, updated);
            return updated;
        });
    }

    public void decrementReferenceTtls(String sessionId) throws IOException {
        mutateIfChanged(sessionId, session -> {
            List<Reference> aged = new ArrayList<>();
            for (Reference reference : session.references()) {
                aged.add(reference.aged());
            }
            boolean changed = !aged.equals(session.references());
            session.setReferences(aged);
            return changed;
        });
    }

    public SessionIndex loadIndex() throws IOException {
        JsonNode document = store.lockedRead(indexPath, SessionIndex.emptyDocument(mapper), CorruptPolicy.USE_DEFAULT);
        return SessionIndex.fromJson(document, mapper);
    }

    public void addToIndex(String sessionId, OffsetDateTime createdAt, String purpose) throws IOException {
        OffsetDateTime now = now();
        modifyIndex(index -> {
            index.put(sessionId, new SessionIndexEntry(createdAt, now, purpose));
            return null;
        });
    }

    /** Removes the session and all of its children; returns the number of entries removed. */
    public int removeFromIndex(String sessionId) throws IOException {
        return modifyIndex(index -> index.removeTree(sessionId));
    }

    public List<IndexedSession> listSortedByLastUpdated() throws IOException {
        return loadIndex().sortedByLastUpdated();
    }

    private void touchIndex(String sessionId, OffsetDateTime createdAt, String purpose) throws IOException {
        OffsetDateTime now = now();
        modifyIndex(index -> {
            SessionIndexEntry entry = index.get(sessionId)
                .map(existing -> existing.touched(now, purpose))
                .orElseGet(() -> new SessionIndexEntry(createdAt, now, purpose));
            index.put(sessionId, entry);
            return null;
        });
    }

    private <T> T modifyIndex(IndexMutation<T> mutation) throws IOException {
        return store.readModifyWrite(indexPath, indexPath, document -> {
            SessionIndex index = SessionIndex.fromJson(document, mapper);
            T value = mutation.apply(index);
            return Modification.replace(index.toJson(mapper), value);
        }, SessionIndex.emptyDocument(mapper), CorruptPolicy.USE_DEFAULT);
    }

    private <T> T mutate(String sessionId, SessionMutation<T> mutation) throws IOException {
        Applied<T> applied = apply(sessionId, session -> new Outcome<>(mutation.apply(session), true));
        touchIndex(sessionId, applied.createdAt(), applied.purpose());
        return applied.value();
    }

    private boolean mutateIfChanged(String sessionId, SessionCheck check) throws IOException {
        Applied<Boolean> applied = apply(sessionId, session -> {
            boolean changed = check.apply(session);
            return new Outcome<>(changed, changed);
        });
        if (applied.value()) {
            touchIndex(sessionId, applied.createdAt(), applied.purpose());
        }
        return applied.value();
    }

    private <T> Applied<T> apply(String sessionId, OutcomeMutation<T> mutation) throws IOException {
        Path path = sessionPath(sessionId);
        if (!Files.exists(path)) {
            throw notFound(sessionId);
        }
        try {
            return store.readModifyWrite(path, path, document -> {
                Session session = fromJson(path, document);
                Outcome<T> outcome = mutation.apply(session);
                Applied<T> applied = new Applied<>(outcome.value(), session.createdAt(), session.purpose());
                if (!outcome.changed()) {
                    return Modification.unchanged(applied);
                }
                return Modification.replace(mapper.valueToTree(session), applied);
            }, null, CorruptPolicy.FAIL);
        } catch (NotFoundException e) {
            throw notFound(sessionId);
        }
    }

    /** Replaces the whole session document; an unreadable file on disk is reported, not overwritten. */
    private void writeSession(Session session) throws IOException {
        Path path = sessionPath(session.sessionId());
        JsonNode document = mapper.valueToTree(session);
        store.readModifyWrite(path, path, current -> Modification.replace(document, null),
            mapper.createObjectNode(), CorruptPolicy.FAIL);
    }

    private Session fromJson(Path path, JsonNode document) throws IOException {
        if (!(document instanceof ObjectNode root)) {
            throw new CorruptDataException(path, new IllegalStateException("session document is not a JSON object"));
        }
        migrate(root);
        try {
            return mapper.treeToValue(root, Session.class);
        } catch (JsonProcessingException e) {
            throw new CorruptDataException(path, e);
        }
    }

    /** Older files lack per-turn timestamps and compressed-history ranges. */
    private void migrate(ObjectNode root) {
        String createdAt = root.path("created_at").asText(now().toString());
        for (String key : List.of("turns", "pools")) {
            JsonNode list = root.get(key);
            if (list == null || !list.isArray()) {
                continue;
            }
            for (JsonNode item : list) {
                if (!(item instanceof ObjectNode turn)) {
                    continue;
                }
                if (!turn.hasNonNull("timestamp")) {
                    turn.put("timestamp", createdAt);
                }
                if (CompressedHistoryTurn.TYPE.equals(turn.path("type").asText())
                    && !turn.has("original_turns_range")) {
                    ArrayNode range = turn.putArray("original_turns_range");
                    range.add(0).add(0);
                }
            }
        }
    }

    private void pruneEmptyDirectories(Path dir) throws IOException {
        Path root = sessionsDir.toAbsolutePath().normalize();
        Path current = dir.toAbsolutePath().normalize();
        while (current != null && !current.equals(root) && current.startsWith(root)) {
            try (Stream<Path> entries = Files.list(current)) {
                if (entries.findAny().isPresent()) {
                    return;
                }
            }
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException e) {
                return;
            }
            current = current.getParent();
        }
    }

    private Reference referenceAt(Session session, int index) {
        List<Reference> references = session.references();
        if (index < 0 || index >= references.size()) {
            throw new IndexOutOfBoundsException(
                "Reference index " + index + " out of range for " + references.size() + " references");
        }
        return references.get(index);
    }

    private NotFoundException notFound(String sessionId) {
        return new NotFoundException("Session with ID '" + sessionId + "' not found.");
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @FunctionalInterface
    private interface SessionMutation<T> {
        T apply(Session session) throws IOException;
    }

    @FunctionalInterface
    private interface SessionCheck {
        boolean apply(Session session) throws IOException;
    }

    @FunctionalInterface
    private interface OutcomeMutation<T> {
        Outcome<T> apply(Session session) throws IOException;
    }

    @FunctionalInterface
    private interface IndexMutation<T> {
        T apply(SessionIndex index);
    }

    private record Outcome<T>(T value, boolean changed) {
    }

    private record Applied<T>(T value, OffsetDateTime createdAt, String purpose) {
    }
}
