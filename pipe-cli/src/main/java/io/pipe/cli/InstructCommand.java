package io.pipe.cli;

import io.pipe.core.session.Session;
import io.pipe.core.session.SessionStore;
import io.pipe.core.turn.UserTaskTurn;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "instruct", description = "Record a user instruction, creating the session when needed")
public final class InstructCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Instruction text")
    String instruction;

    @Option(names = {"-s", "--session"}, description = "Existing session id")
    String sessionId;

    @Option(names = "--purpose", description = "Purpose of a new session")
    String purpose;

    @Option(names = "--background", description = "Background of a new session")
    String background;

    @Option(names = "--role", description = "Role file for a new session (repeatable)")
    List<String> roles;

    @Option(names = "--parent", description = "Parent session id for a new child session")
    String parentId;

    public InstructCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SessionStore sessions = context.sessions();
            String id = sessionId;
            if (id == null) {
                Session created = sessions.create(
                    purpose == null ? instruction : purpose,
                    background == null ? "" : background,
                    roles == null ? List.of() : roles,
                    false,
                    parentId
                );
                id = created.sessionId();
            }
            sessions.appendTurn(id, new UserTaskTurn(instruction, OffsetDateTime.now(context.clock())));
            sessions.decrementReferenceTtls(id);
            sessions.expireOldToolResponses(id, context.config().history().toolResponseExpiration());
            System.out.println(id);
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Instruct command", e);
        }
    }
}
