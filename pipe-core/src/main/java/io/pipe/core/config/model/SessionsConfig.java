package io.pipe.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionsConfig(
    String path,
    @JsonProperty("lock_timeout_seconds") int lockTimeoutSeconds,
    String timezone
) {

    public static SessionsConfig defaults() {
        return new SessionsConfig("sessions", 10, "UTC");
    }

    public Duration lockTimeout() {
        return Duration.ofSeconds(lockTimeoutSeconds);
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }
}
