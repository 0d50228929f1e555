package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/** Summary standing in for the 1-based inclusive range {@code [first, last]} of the turns it replaced. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompressedHistoryTurn(
    String content,
    @JsonProperty("original_turns_range") List<Integer> originalTurnsRange,
    OffsetDateTime timestamp
) implements Turn {
    public static final String TYPE = "compressed_history";

    public CompressedHistoryTurn {
        content = content == null ? "" : content;
        originalTurnsRange = originalTurnsRange == null ? List.of(0, 0) : List.copyOf(originalTurnsRange);
        if (originalTurnsRange.size() != 2) {
            throw new IllegalArgumentException("original_turns_range must hold exactly two indices");
        }
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
