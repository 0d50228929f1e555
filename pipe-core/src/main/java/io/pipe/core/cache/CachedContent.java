package io.pipe.core.cache;

import java.time.OffsetDateTime;

/** Handle of a provider-side cache object. */
public record CachedContent(String name, OffsetDateTime expireTime) {
}
