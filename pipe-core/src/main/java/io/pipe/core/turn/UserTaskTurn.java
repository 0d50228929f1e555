package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.OffsetDateTime;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserTaskTurn(String instruction, OffsetDateTime timestamp) implements Turn {
    public static final String TYPE = "user_task";

    public UserTaskTurn {
        instruction = instruction == null ? "" : instruction;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
