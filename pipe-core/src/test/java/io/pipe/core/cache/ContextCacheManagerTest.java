package io.pipe.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipe.core.config.model.CacheConfig;
import io.pipe.core.config.model.HistoryConfig;
import io.pipe.core.config.model.PipeConfig;
import io.pipe.core.config.model.SessionsConfig;
import io.pipe.core.session.Session;
import io.pipe.core.session.SessionStore;
import io.pipe.core.turn.ModelResponseTurn;
import io.pipe.core.turn.Turn;
import io.pipe.core.turn.UserTaskTurn;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContextCacheManagerTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SessionStore sessions;
    private CacheRegistryStore registry;
    private FakeCacheClient client;
    private ContextCacheManager manager;

    @BeforeEach
    void setUp() {
        sessions = new SessionStore(tempDir.resolve("sessions"), Duration.ofSeconds(10), Clock.systemUTC());
        registry = new CacheRegistryStore(tempDir.resolve(".cache_registry.json"), Duration.ofSeconds(10), Clock.systemUTC());
        client = new FakeCacheClient();
        manager = ContextCacheManager.fromConfig(sessions, registry, client, PipeConfig.defaults());
    }

    @Test
    void shouldCreateCacheWhenThresholdReachedAndRecordBoundary() throws Exception {
        Session session = sessionWithTurns(11);
        CacheContext context = CacheContext.initial().withUsage(new UsageMetadata(0, 50_000));

        CachePlan plan = manager.prepare(session, context);

        assertThat(plan.usesCache()).isTrue();
        assertThat(plan.cacheName()).isEqualTo("cachedContents/1");
        assertThat(plan.cachedTurns()).hasSize(10);
        assertThat(plan.bufferedTurns()).isEmpty();
        assertThat(client.created).containsExactly("gemini-2.5-flash:10");
        assertThat(sessions.load(session.sessionId()).cachedTurnCount()).isEqualTo(10);
    }

    @Test
    void shouldReuseLiveCacheForSamePrefix() throws Exception {
        Session session = sessionWithTurns(11);
        CacheContext context = CacheContext.initial().withUsage(new UsageMetadata(0, 50_000));

        manager.prepare(session, context);
        CachePlan second = manager.prepare(sessions.load(session.sessionId()), context);

        assertThat(second.cacheName()).isEqualTo("cachedContents/1");
        assertThat(client.created).hasSize(1);
    }

    @Test
    void shouldKeepSessionCacheWhenEstimatedBoundaryMovesBelowThreshold() throws Exception {
        Session session = sessionWithTurns(11);
        manager.prepare(session, CacheContext.initial().withUsage(new UsageMetadata(0, 50_000)));

        sessions.appendTurn(session.sessionId(), new ModelResponseTurn("more", T0.plusMinutes(50)));
        sessions.appendTurn(session.sessionId(), new UserTaskTurn("next", T0.plusMinutes(51)));
        CacheContext context = CacheContext.initial().withUsage(new UsageMetadata(50_000, 52_000));
        CachePlan plan = manager.prepare(sessions.load(session.sessionId()), context);

        assertThat(plan.cacheName()).isEqualTo("cachedContents/1");
        assertThat(plan.cachedTurns()).hasSize(11);
        assertThat(plan.bufferedTurns()).hasSize(1);
        assertThat(client.created).hasSize(1);
        assertThat(client.deleted).isEmpty();
        assertThat(sessions.load(session.sessionId()).cachedTurnCount()).isEqualTo(11);
    }

    @Test
    void shouldIgnoreExpiredSessionCacheBelowThreshold() throws Exception {
        Session session = sessionWithTurns(11);
        registry.put("stale", new CacheRegistryEntry("cachedContents/old", T0, session.sessionId()));

        CachePlan plan = manager.prepare(session, CacheContext.initial().withUsage(new UsageMetadata(5_000, 10_000)));

        assertThat(plan.usesCache()).isFalse();
        assertThat(plan.bufferedTurns()).hasSize(10);
        assertThat(sessions.load(session.sessionId()).cachedTurnCount()).isZero();
    }

    @Test
    void shouldTakeModelTtlAndThresholdFromConfig() throws Exception {
        PipeConfig config = new PipeConfig(
            SessionsConfig.defaults(),
            HistoryConfig.defaults(),
            new CacheConfig(1_000, 600, "gemini-2.5-pro")
        );
        ContextCacheManager configured = ContextCacheManager.fromConfig(sessions, registry, client, config);
        Session session = sessionWithTurns(3);

        CachePlan plan = configured.prepare(session, CacheContext.initial().withUsage(new UsageMetadata(0, 1_500)));

        assertThat(plan.cachedTurns()).hasSize(2);
        assertThat(client.created).containsExactly("gemini-2.5-pro:2");
        assertThat(client.ttls).containsExactly(Duration.ofMinutes(10));
    }

    @Test
    void shouldDeleteSupersededCacheWhenHistoryGrows() throws Exception {
        Session session = sessionWithTurns(11);
        CacheContext context = CacheContext.initial().withUsage(new UsageMetadata(0, 50_000));
        manager.prepare(session, context);

        sessions.appendTurn(session.sessionId(), new ModelResponseTurn("more", T0.plusMinutes(50)));
        sessions.appendTurn(session.sessionId(), new UserTaskTurn("next", T0.plusMinutes(51)));
        CachePlan plan = manager.prepare(sessions.load(session.sessionId()), context);

        assertThat(plan.cacheName()).isEqualTo("cachedContents/2");
        assertThat(plan.cachedTurns()).hasSize(12);
        assertThat(client.deleted).containsExactly("cachedContents/1");
        assertThat(registry.load().size()).isEqualTo(1);
    }

    @Test
    void shouldDegradeToFullHistoryWhenClientFails() throws Exception {
        Session session = sessionWithTurns(11);
        client.failCreate = true;

        CachePlan plan = manager.prepare(session, CacheContext.initial().withUsage(new UsageMetadata(0, 50_000)));

        assertThat(plan.usesCache()).isFalse();
        assertThat(plan.bufferedTurns()).hasSize(10);
        assertThat(registry.load().size()).isZero();
        assertThat(sessions.load(session.sessionId()).cachedTurnCount()).isZero();
    }

    @Test
    void shouldSendEverythingWhenEstimatedPrefixHasNoLiveCache() throws Exception {
        Session session = sessionWithTurns(9);

        CachePlan plan = manager.prepare(session, CacheContext.initial().withUsage(new UsageMetadata(5_000, 10_000)));

        assertThat(plan.usesCache()).isFalse();
        assertThat(plan.bufferedTurns()).hasSize(8);
        assertThat(client.created).isEmpty();
    }

    private Session sessionWithTurns(int count) throws IOException {
        String id = sessions.create("cache test", "", List.of(), false, null).sessionId();
        for (int i = 0; i < count; i++) {
            Turn turn = i % 2 == 0
                ? new UserTaskTurn("task " + i, T0.plusMinutes(i))
                : new ModelResponseTurn("reply " + i, T0.plusMinutes(i));
            sessions.appendTurn(id, turn);
        }
        return sessions.load(id);
    }

    private static final class FakeCacheClient implements ContextCacheClient {
        final List<String> created = new ArrayList<>();
        final List<String> deleted = new ArrayList<>();
        final List<Duration> ttls = new ArrayList<>();
        boolean failCreate;

        @Override
        public CachedContent create(String model, List<Turn> contents, Duration ttl) throws IOException {
            if (failCreate) {
                throw new IOException("quota exceeded");
            }
            created.add(model + ":" + contents.size());
            ttls.add(ttl);
            return new CachedContent("cachedContents/" + created.size(), OffsetDateTime.now(ZoneOffset.UTC).plus(ttl));
        }

        @Override
        public void delete(String name) {
            deleted.add(name);
        }
    }
}
