package io.pipe.cli;

import io.pipe.core.cache.CacheSplitPolicy;
import io.pipe.core.config.model.PipeConfig;
import io.pipe.core.session.SessionStore;
import java.time.Clock;

public record CliContext(
    SessionStore sessions,
    CacheSplitPolicy splitPolicy,
    PipeConfig config,
    Clock clock
) {
    public CliContext(SessionStore sessions, PipeConfig config, Clock clock) {
        this(
            sessions,
            new CacheSplitPolicy(config.cache().updateThreshold(), config.history().toolResponseLimit()),
            config,
            clock
        );
    }
}
