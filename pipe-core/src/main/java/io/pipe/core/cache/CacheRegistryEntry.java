package io.pipe.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheRegistryEntry(
    String name,
    @JsonProperty("expire_time") OffsetDateTime expireTime,
    @JsonProperty("session_id") String sessionId
) {

    public CacheRegistryEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expireTime, "expireTime must not be null");
    }

    public boolean isLive(OffsetDateTime now) {
        return expireTime.isAfter(now);
    }
}
