package io.pipe.cli;

import io.pipe.core.cache.CacheSplit;
import io.pipe.core.session.Session;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "cache-split", description = "Show how the history would split between cache and request")
public final class CacheSplitCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = "--prompt-tokens", required = true, description = "Prompt token count of the last request")
    int promptTokens;

    @Option(names = "--cached-tokens", defaultValue = "0", description = "Cached content token count of the last request")
    int cachedTokens;

    @Option(names = "--record", description = "Persist the resulting cached turn count on the session")
    boolean record;

    public CacheSplitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Session session = context.sessions().load(sessionId);
            CacheSplit split = context.splitPolicy().split(session.turns(), cachedTokens, promptTokens);
            System.out.println("Cached turns: " + split.cachedTurnCount());
            System.out.println("Buffered turns: " + split.bufferedTurns().size());
            System.out.println("Update cache: " + split.updateCache());
            if (record) {
                context.sessions().updateCachedTurnCount(sessionId, split.cachedTurnCount());
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Cache split command", e);
        }
    }
}
