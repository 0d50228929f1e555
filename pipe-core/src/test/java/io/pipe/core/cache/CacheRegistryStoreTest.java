package io.pipe.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CacheRegistryStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private CacheRegistryStore newStore() {
        return new CacheRegistryStore(
            tempDir.resolve(CacheRegistryStore.REGISTRY_FILE),
            Duration.ofSeconds(5),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void shouldFindOnlyLiveEntries() throws Exception {
        CacheRegistryStore store = newStore();
        OffsetDateTime now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        store.put("live", new CacheRegistryEntry("cachedContents/live", now.plusHours(1), "s1"));
        store.put("stale", new CacheRegistryEntry("cachedContents/stale", now.minusSeconds(1), "s1"));

        assertThat(store.find("live")).map(CacheRegistryEntry::name).contains("cachedContents/live");
        assertThat(store.find("stale")).isEmpty();
        assertThat(store.find("unknown")).isEmpty();

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.load().size()).isEqualTo(1);
        assertThat(store.remove("live")).isTrue();
        assertThat(store.remove("live")).isFalse();
    }

    @Test
    void shouldStartFreshFromCorruptRegistry() throws Exception {
        CacheRegistryStore store = newStore();
        Files.writeString(store.registryPath(), "{\"abc\": {\"name\": ");

        assertThat(store.load().size()).isZero();

        store.put("abc", new CacheRegistryEntry("cachedContents/1", OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(5), null));
        assertThat(Files.readString(store.registryPath())).contains("\"expire_time\"").doesNotContain("session_id");
    }

    @Test
    void shouldRemoveSupersededEntriesForSession() throws Exception {
        CacheRegistryStore store = newStore();
        OffsetDateTime expiry = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1);
        store.put("old", new CacheRegistryEntry("cachedContents/old", expiry, "s1"));
        store.put("other", new CacheRegistryEntry("cachedContents/other", expiry, "s2"));
        store.put("new", new CacheRegistryEntry("cachedContents/new", expiry, "s1"));

        assertThat(store.removeForSession("s1", "new")).extracting(CacheRegistryEntry::name)
            .containsExactly("cachedContents/old");
        assertThat(store.load().size()).isEqualTo(2);
    }

    @Test
    void keyShouldBeStableContentHash() {
        assertThat(CacheRegistry.keyFor("[1,2,3]"))
            .hasSize(64)
            .isEqualTo(CacheRegistry.keyFor("[1,2,3]"))
            .isNotEqualTo(CacheRegistry.keyFor("[1,2]"));
    }
}
