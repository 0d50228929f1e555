package io.pipe.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Token counts reported by the provider for the last request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageMetadata(
    @JsonProperty("cached_content_token_count") int cachedContentTokenCount,
    @JsonProperty("prompt_token_count") int promptTokenCount
) {

    public UsageMetadata {
        if (cachedContentTokenCount < 0 || promptTokenCount < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
    }
}
