package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionCallingTurn(
    String response,
    @JsonProperty("raw_response") String rawResponse,
    OffsetDateTime timestamp
) implements Turn {
    public static final String TYPE = "function_calling";

    public FunctionCallingTurn {
        response = response == null ? "" : response;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
