package io.pipe.core.lock;

import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory cross-process lock backed by a sidecar {@code <resource>.lock} marker file.
 *
 * <p>The marker is created with {@code CREATE_NEW}, so at most one holder exists per resource
 * across every process sharing the filesystem. Waiters poll at a fixed interval until the marker
 * disappears or the timeout elapses. A marker left behind by a crashed process is not reclaimed:
 * it must be removed by hand.
 *
 * <pre>{@code
 * try (FileLock lock = FileLock.acquire(sessionFile, Duration.ofSeconds(10))) {
 *     // exclusive section
 * }
 * }</pre>
 */
public final class FileLock implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(FileLock.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    static final long POLL_INTERVAL_MS = 100;

    private final Path markerPath;
    private boolean released;

    private FileLock(Path markerPath) {
        this.markerPath = markerPath;
    }

    public static Path markerPath(Path resource) {
        return resource.resolveSibling(resource.getFileName() + ".lock");
    }

    public static FileLock acquire(Path resource) throws IOException {
        return acquire(resource, DEFAULT_TIMEOUT);
    }

    public static FileLock acquire(Path resource, Duration timeout) throws IOException {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Path marker = markerPath(resource);
        Path parent = marker.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                Files.writeString(marker, ownerPayload(), StandardCharsets.UTF_8, CREATE_NEW, WRITE);
                return new FileLock(marker);
            } catch (FileAlreadyExistsException held) {
                if (System.nanoTime() >= deadline) {
                    throw new LockTimeoutException(marker, timeout, readOwner(marker));
                }
                sleep(marker);
            }
        }
    }

    public Path markerPath() {
        return markerPath;
    }

    public boolean isHeld() {
        return !released;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(markerPath);
        } catch (IOException e) {
            LOG.warn("Failed to remove lock marker {}: {}", markerPath, e.getMessage());
        }
    }

    private static String ownerPayload() {
        return "{\"pid\":" + ProcessHandle.current().pid() + ",\"acquired_at\":\"" + Instant.now() + "\"}";
    }

    private static String readOwner(Path marker) {
        try {
            String content = Files.readString(marker, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? "unknown" : content;
        } catch (NoSuchFileException e) {
            return "nobody (released)";
        } catch (IOException e) {
            return "unknown";
        }
    }

    private static void sleep(Path marker) throws InterruptedIOException {
        try {
            Thread.sleep(POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for lock " + marker);
        }
    }
}
