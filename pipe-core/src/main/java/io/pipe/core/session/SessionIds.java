package io.pipe.core.session;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class SessionIds {

    private SessionIds() {
    }

    /** {@code a/b/c} maps to {@code <dir>/a/b/c.json}; empty, {@code .} and {@code ..} segments are dropped. */
    static Path fileFor(Path sessionsDir, String sessionId) {
        List<String> parts = segments(sessionId);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Invalid session id: '" + sessionId + "'");
        }
        Path path = sessionsDir;
        for (int i = 0; i < parts.size() - 1; i++) {
            path = path.resolve(parts.get(i));
        }
        return path.resolve(parts.get(parts.size() - 1) + ".json");
    }

    static String parentOf(String sessionId) {
        int slash = sessionId.lastIndexOf('/');
        return slash < 0 ? null : sessionId.substring(0, slash);
    }

    private static List<String> segments(String sessionId) {
        List<String> parts = new ArrayList<>();
        if (sessionId == null) {
            return parts;
        }
        for (String part : sessionId.split("/")) {
            if (!part.isEmpty() && !".".equals(part) && !"..".equals(part)) {
                parts.add(part);
            }
        }
        return parts;
    }
}
