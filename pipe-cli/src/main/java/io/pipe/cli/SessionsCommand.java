package io.pipe.cli;

import io.pipe.core.session.IndexedSession;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "sessions", description = "List sessions, most recently updated first")
public final class SessionsCommand implements Callable<Integer> {
    private final CliContext context;

    public SessionsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<IndexedSession> sessions = context.sessions().listSortedByLastUpdated();
            if (sessions.isEmpty()) {
                System.out.println("No sessions.");
                return 0;
            }
            for (IndexedSession session : sessions) {
                System.out.println(session.sessionId()
                    + "\t" + session.entry().lastUpdatedAt()
                    + "\t" + (session.entry().purpose() == null ? "" : session.entry().purpose()));
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Sessions command", e);
        }
    }
}
