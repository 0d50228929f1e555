package io.pipe.core.lock;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

public final class LockTimeoutException extends IOException {
    private final Path markerPath;

    public LockTimeoutException(Path markerPath, Duration timeout, String owner) {
        super("Could not acquire lock on " + markerPath + " within " + timeout.toMillis() + "ms (held by " + owner + ")");
        this.markerPath = markerPath;
    }

    public Path markerPath() {
        return markerPath;
    }
}
