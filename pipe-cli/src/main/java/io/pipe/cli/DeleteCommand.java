package io.pipe.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a session and drop it and its children from the index")
public final class DeleteCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    public DeleteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.sessions().delete(sessionId)) {
                System.err.println("Delete command failed: Session with ID '" + sessionId + "' not found.");
                return CommandFailures.NOT_FOUND;
            }
            System.out.println("Deleted " + sessionId);
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Delete command", e);
        }
    }
}
