package io.pipe.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryConfig(
    @JsonProperty("tool_response_limit") int toolResponseLimit,
    @JsonProperty("tool_response_expiration") int toolResponseExpiration,
    @JsonProperty("reference_ttl") int referenceTtl
) {

    public HistoryConfig {
        if (toolResponseLimit < 0) {
            throw new IllegalArgumentException("tool_response_limit must be >= 0");
        }
        if (toolResponseExpiration < 1) {
            throw new IllegalArgumentException("tool_response_expiration must be >= 1");
        }
        if (referenceTtl < 0) {
            throw new IllegalArgumentException("reference_ttl must be >= 0");
        }
    }

    public static HistoryConfig defaults() {
        return new HistoryConfig(3, 3, 3);
    }
}
