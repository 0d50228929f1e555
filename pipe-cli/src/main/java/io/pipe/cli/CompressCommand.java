package io.pipe.cli;

import io.pipe.core.turn.CompressedHistoryTurn;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "compress", description = "Replace turns [start, end] with a summary")
public final class CompressCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Parameters(index = "1", arity = "1", description = "First turn index")
    int start;

    @Parameters(index = "2", arity = "1", description = "Last turn index, inclusive")
    int end;

    @Parameters(index = "3", arity = "1", description = "Summary text")
    String summary;

    public CompressCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CompressedHistoryTurn turn = context.sessions().replaceRangeWithSummary(sessionId, summary, start, end);
            System.out.println("Compressed turns " + turn.originalTurnsRange() + " at index " + start);
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Compress command", e);
        }
    }
}
