package io.pipe.core.cache;

import io.pipe.core.turn.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Provider API for server-side context caches. */
public interface ContextCacheClient {

    CachedContent create(String model, List<Turn> contents, Duration ttl) throws IOException;

    void delete(String name) throws IOException;
}
