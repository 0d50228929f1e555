package io.pipe.core.session;

public record IndexedSession(String sessionId, SessionIndexEntry entry) {
}
