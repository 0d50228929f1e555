package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelResponseTurn(
    String content,
    String thought,
    @JsonProperty("raw_response") String rawResponse,
    OffsetDateTime timestamp
) implements Turn {
    public static final String TYPE = "model_response";

    public ModelResponseTurn {
        content = content == null ? "" : content;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public ModelResponseTurn(String content, OffsetDateTime timestamp) {
        this(content, null, null, timestamp);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
