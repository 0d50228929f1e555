package io.pipe.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipeConfig(
    SessionsConfig sessions,
    HistoryConfig history,
    CacheConfig cache
) {

    public static PipeConfig defaults() {
        return new PipeConfig(
            SessionsConfig.defaults(),
            HistoryConfig.defaults(),
            CacheConfig.defaults()
        );
    }
}
