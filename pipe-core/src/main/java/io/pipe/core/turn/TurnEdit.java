package io.pipe.core.turn;

import java.time.OffsetDateTime;

/**
 * Partial update for an editable turn. Null fields are left unchanged.
 * {@code instruction} applies to user tasks; {@code content} and {@code thought} to model responses.
 */
public record TurnEdit(String instruction, String content, String thought, OffsetDateTime timestamp) {

    public static TurnEdit instruction(String instruction) {
        return new TurnEdit(instruction, null, null, null);
    }

    public static TurnEdit content(String content) {
        return new TurnEdit(null, content, null, null);
    }

    Turn applyTo(Turn turn) {
        if (turn instanceof UserTaskTurn userTask) {
            if (content != null || thought != null) {
                throw new IllegalArgumentException("user_task turns only accept instruction and timestamp edits");
            }
            return new UserTaskTurn(
                instruction != null ? instruction : userTask.instruction(),
                timestamp != null ? timestamp : userTask.timestamp()
            );
        }
        if (turn instanceof ModelResponseTurn response) {
            if (instruction != null) {
                throw new IllegalArgumentException("model_response turns only accept content, thought and timestamp edits");
            }
            return new ModelResponseTurn(
                content != null ? content : response.content(),
                thought != null ? thought : response.thought(),
                response.rawResponse(),
                timestamp != null ? timestamp : response.timestamp()
            );
        }
        throw new IllegalArgumentException("Editing turns of type '" + turn.typeName() + "' is not allowed.");
    }
}
