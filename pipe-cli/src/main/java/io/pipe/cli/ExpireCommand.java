package io.pipe.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "expire", description = "Replace old successful tool responses with a placeholder")
public final class ExpireCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = {"-t", "--threshold"}, description = "Number of recent user tasks whose tool responses are kept")
    Integer threshold;

    public ExpireCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int effective = threshold != null ? threshold : context.config().history().toolResponseExpiration();
            boolean changed = context.sessions().expireOldToolResponses(sessionId, effective);
            System.out.println(changed ? "Expired old tool responses." : "Nothing to expire.");
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Expire command", e);
        }
    }
}
