package io.pipe.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheConfig(
    @JsonProperty("update_threshold") int updateThreshold,
    @JsonProperty("ttl_seconds") long ttlSeconds,
    String model
) {

    public static CacheConfig defaults() {
        return new CacheConfig(20000, 3600, "gemini-2.5-flash");
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }
}
