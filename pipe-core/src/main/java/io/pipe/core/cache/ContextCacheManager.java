package io.pipe.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.pipe.core.config.model.CacheConfig;
import io.pipe.core.config.model.PipeConfig;
import io.pipe.core.session.Session;
import io.pipe.core.session.SessionStore;
import io.pipe.core.store.JsonMappers;
import io.pipe.core.turn.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a cache split into a concrete plan for one request. When the split asks for an update it
 * reuses a live cache for the same prefix or creates one; otherwise it keeps the session's live
 * cache. The boundary is recorded on the session. Provider failures degrade to sending the full history.
 */
public final class ContextCacheManager {
    private static final Logger LOG = LoggerFactory.getLogger(ContextCacheManager.class);

    private final SessionStore sessions;
    private final CacheRegistryStore registry;
    private final ContextCacheClient client;
    private final CacheSplitPolicy policy;
    private final String model;
    private final Duration ttl;
    private final ObjectWriter turnsWriter;

    public ContextCacheManager(
        SessionStore sessions,
        CacheRegistryStore registry,
        ContextCacheClient client,
        CacheSplitPolicy policy,
        String model,
        Duration ttl
    ) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.turnsWriter = JsonMappers.create().writerFor(new TypeReference<List<Turn>>() { });
    }

    /** Builds a manager from the {@code cache} and {@code history} sections of the configuration. */
    public static ContextCacheManager fromConfig(
        SessionStore sessions,
        CacheRegistryStore registry,
        ContextCacheClient client,
        PipeConfig config
    ) {
        CacheConfig cache = config.cache();
        CacheSplitPolicy policy = new CacheSplitPolicy(cache.updateThreshold(), config.history().toolResponseLimit());
        return new ContextCacheManager(sessions, registry, client, policy, cache.model(), cache.ttl());
    }

    public CachePlan prepare(Session session, CacheContext context) throws IOException {
        CacheSplit split = policy.split(session.turns(), context.lastSummary());
        if (!split.hasCache()) {
            recordBoundary(session, 0);
            return CachePlan.uncached(split.bufferedTurns());
        }

        String cacheName;
        if (split.updateCache()) {
            String key = CacheRegistry.keyFor(serialize(split.cachedTurns()));
            cacheName = registry.find(key).map(CacheRegistryEntry::name).orElse(null);
            if (cacheName == null) {
                cacheName = createCache(session.sessionId(), key, split.cachedTurns());
            }
        } else {
            // The estimated boundary rarely hashes to the prefix the cache was created from.
            cacheName = registry.findForSession(session.sessionId()).map(CacheRegistryEntry::name).orElse(null);
            if (cacheName == null) {
                LOG.info("No live cache for session {}, sending full history", session.sessionId());
            }
        }

        if (cacheName == null) {
            recordBoundary(session, 0);
            return CachePlan.uncached(split.allTurns());
        }
        recordBoundary(session, split.cachedTurnCount());
        return new CachePlan(cacheName, split.cachedTurns(), split.bufferedTurns());
    }

    private String createCache(String sessionId, String key, List<Turn> cachedTurns) throws IOException {
        CachedContent created;
        try {
            created = client.create(model, cachedTurns, ttl);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cache creation failed for session {}, sending full history: {}", sessionId, e.getMessage());
            return null;
        }
        registry.put(key, new CacheRegistryEntry(created.name(), created.expireTime(), sessionId));
        LOG.info("Created cache {} for session {} covering {} turns", created.name(), sessionId, cachedTurns.size());

        for (CacheRegistryEntry previous : registry.removeForSession(sessionId, key)) {
            try {
                client.delete(previous.name());
                LOG.info("Deleted superseded cache {}", previous.name());
            } catch (IOException | RuntimeException e) {
                LOG.warn("Could not delete superseded cache {}: {}", previous.name(), e.getMessage());
            }
        }
        return created.name();
    }

    private void recordBoundary(Session session, int cachedTurnCount) throws IOException {
        if (session.cachedTurnCount() != cachedTurnCount) {
            sessions.updateCachedTurnCount(session.sessionId(), cachedTurnCount);
            session.setCachedTurnCount(cachedTurnCount);
        }
    }

    private String serialize(List<Turn> turns) throws JsonProcessingException {
        return turnsWriter.writeValueAsString(turns);
    }
}
