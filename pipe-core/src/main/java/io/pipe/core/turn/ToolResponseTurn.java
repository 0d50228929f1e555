package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.OffsetDateTime;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResponseTurn(String name, ToolResponse response, OffsetDateTime timestamp) implements Turn {
    public static final String TYPE = "tool_response";

    public ToolResponseTurn {
        name = name == null ? "" : name;
        response = response == null ? new ToolResponse("", "") : response;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public ToolResponseTurn withResponse(ToolResponse newResponse) {
        return new ToolResponseTurn(name, newResponse, timestamp);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
