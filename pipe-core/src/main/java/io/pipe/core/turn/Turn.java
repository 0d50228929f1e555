package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.OffsetDateTime;

/**
 * One event in a session history, discriminated on disk by its {@code type} property.
 * Unknown discriminators are rejected when the session is read.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = UserTaskTurn.class, name = UserTaskTurn.TYPE),
    @JsonSubTypes.Type(value = ModelResponseTurn.class, name = ModelResponseTurn.TYPE),
    @JsonSubTypes.Type(value = FunctionCallingTurn.class, name = FunctionCallingTurn.TYPE),
    @JsonSubTypes.Type(value = ToolResponseTurn.class, name = ToolResponseTurn.TYPE),
    @JsonSubTypes.Type(value = CompressedHistoryTurn.class, name = CompressedHistoryTurn.TYPE)
})
public sealed interface Turn
    permits UserTaskTurn, ModelResponseTurn, FunctionCallingTurn, ToolResponseTurn, CompressedHistoryTurn {

    OffsetDateTime timestamp();

    String typeName();
}
