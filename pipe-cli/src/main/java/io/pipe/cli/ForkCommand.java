package io.pipe.cli;

import io.pipe.core.session.Session;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "fork", description = "Copy turns up to and including an index into a new session")
public final class ForkCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Parameters(index = "1", arity = "1", description = "Last turn index to keep")
    int forkIndex;

    public ForkCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Session fork = context.sessions().fork(sessionId, forkIndex);
            System.out.println(fork.sessionId());
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Fork command", e);
        }
    }
}
