package io.pipe.core.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a {@link JsonModifier}: the document to write back and the value handed to the caller.
 * A {@code null} document means the modifier edited the input in place. {@link #unchanged} skips the write.
 */
public record Modification<T>(JsonNode document, T value, boolean write) {

    public static <T> Modification<T> inPlace() {
        return new Modification<>(null, null, true);
    }

    public static <T> Modification<T> inPlace(T value) {
        return new Modification<>(null, value, true);
    }

    public static <T> Modification<T> replace(JsonNode document, T value) {
        return new Modification<>(document, value, true);
    }

    public static <T> Modification<T> unchanged(T value) {
        return new Modification<>(null, value, false);
    }
}
