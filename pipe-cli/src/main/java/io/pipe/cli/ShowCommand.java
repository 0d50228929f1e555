package io.pipe.cli;

import io.pipe.core.session.Session;
import io.pipe.core.store.JsonMappers;
import io.pipe.core.turn.Turn;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show a session and its turns")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = "--json", description = "Print the stored session document")
    boolean json;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Session session = context.sessions().load(sessionId);
            if (json) {
                System.out.println(JsonMappers.create().writerWithDefaultPrettyPrinter().writeValueAsString(session));
                return 0;
            }
            System.out.println("Session: " + session.sessionId());
            System.out.println("Purpose: " + session.purpose());
            System.out.println("Created: " + session.createdAt());
            System.out.println("Cached turns: " + session.cachedTurnCount());
            System.out.println("Pooled turns: " + session.pools().size());
            int index = 0;
            for (Turn turn : session.turns()) {
                System.out.println("[" + index++ + "] " + turn.typeName() + " " + turn.timestamp());
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Show command", e);
        }
    }
}
