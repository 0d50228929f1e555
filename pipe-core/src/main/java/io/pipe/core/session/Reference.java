package io.pipe.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/** A file attached to the session's prompt context for {@code ttl} more instructions. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Reference(String path, int ttl, boolean disabled, boolean persist) {

    public Reference {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static Reference of(String path, int ttl) {
        return new Reference(path, ttl, false, false);
    }

    public Reference withTtl(int newTtl) {
        return new Reference(path, newTtl, disabled, persist);
    }

    public Reference withDisabled(boolean newDisabled) {
        return new Reference(path, ttl, newDisabled, persist);
    }

    /** One instruction later: non-persistent references count down and switch off at zero. */
    public Reference aged() {
        if (persist || disabled) {
            return this;
        }
        int remaining = Math.max(0, ttl - 1);
        return new Reference(path, remaining, remaining == 0, false);
    }
}
