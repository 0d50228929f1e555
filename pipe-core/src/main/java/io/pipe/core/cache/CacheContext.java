package io.pipe.core.cache;

import java.util.Objects;

/**
 * Per-request cache state. Each response produces the next context; nothing is shared between
 * requests or processes.
 */
public record CacheContext(TokenCountSummary lastSummary) {

    public CacheContext {
        Objects.requireNonNull(lastSummary, "lastSummary must not be null");
    }

    public static CacheContext initial() {
        return new CacheContext(TokenCountSummary.EMPTY);
    }

    public CacheContext withUsage(UsageMetadata usage) {
        return new CacheContext(TokenCountSummary.from(usage));
    }
}
