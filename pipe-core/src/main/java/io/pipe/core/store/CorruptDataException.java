package io.pipe.core.store;

import java.io.IOException;
import java.nio.file.Path;

public final class CorruptDataException extends IOException {
    private final Path path;

    public CorruptDataException(Path path, Throwable cause) {
        super("Malformed JSON in " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
