package io.pipe.core.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenCountSummary(
    @JsonProperty("cached_tokens") int cachedTokens,
    @JsonProperty("current_prompt_tokens") int currentPromptTokens,
    @JsonProperty("buffered_tokens") int bufferedTokens
) {
    public static final TokenCountSummary EMPTY = new TokenCountSummary(0, 0, 0);

    public static TokenCountSummary from(UsageMetadata usage) {
        int cached = usage.cachedContentTokenCount();
        int prompt = usage.promptTokenCount();
        int buffered = cached > 0 ? prompt - cached : prompt;
        return new TokenCountSummary(cached, prompt, buffered);
    }

    public boolean hasCache() {
        return cachedTokens > 0;
    }
}
