package io.pipe.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

@FunctionalInterface
public interface JsonModifier<T> {
    Modification<T> modify(JsonNode document) throws IOException;
}
