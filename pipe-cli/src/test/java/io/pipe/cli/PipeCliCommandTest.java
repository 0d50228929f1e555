package io.pipe.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipe.core.config.model.PipeConfig;
import io.pipe.core.session.Session;
import io.pipe.core.session.SessionStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PipeCliCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private SessionStore sessions;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        sessions = new SessionStore(tempDir.resolve("sessions"), Duration.ofSeconds(5), Clock.systemUTC());
        CliContext context = new CliContext(sessions, PipeConfig.defaults(), Clock.systemUTC());
        commandLine = new CommandLine(new PipeCliCommand());
        commandLine.addSubcommand("sessions", new SessionsCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("instruct", new InstructCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("fork", new ForkCommand(context));
        commandLine.addSubcommand("expire", new ExpireCommand(context));
        commandLine.addSubcommand("compress", new CompressCommand(context));
        commandLine.addSubcommand("cache-split", new CacheSplitCommand(context));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void instructShouldCreateSessionAndRecordTask() throws Exception {
        int exitCode = commandLine.execute("instruct", "add a README", "--purpose", "docs");

        assertThat(exitCode).isZero();
        String sessionId = output().trim();
        Session session = sessions.load(sessionId);
        assertThat(session.purpose()).isEqualTo("docs");
        assertThat(session.turns().size()).isEqualTo(1);

        out.reset();
        assertThat(commandLine.execute("sessions")).isZero();
        assertThat(output()).contains(sessionId).contains("docs");

        out.reset();
        assertThat(commandLine.execute("show", sessionId)).isZero();
        assertThat(output()).contains("[0] user_task");
    }

    @Test
    void shouldMapMissingSessionToNotFoundExitCode() {
        int exitCode = commandLine.execute("show", "missing");

        assertThat(exitCode).isEqualTo(CommandFailures.NOT_FOUND);
        assertThat(errors()).contains("Show command failed").contains("missing");
        assertThat(commandLine.execute("delete", "missing")).isEqualTo(CommandFailures.NOT_FOUND);
    }

    @Test
    void shouldMapBadTurnIndexToOutOfRangeExitCode() throws Exception {
        String id = sessions.create("fork me", "", List.of(), false, null).sessionId();

        assertThat(commandLine.execute("fork", id, "0")).isEqualTo(CommandFailures.OUT_OF_RANGE);
        assertThat(errors()).contains("Fork command failed");
    }

    @Test
    void shouldRejectZeroExpireThresholdAsGenericFailure() throws Exception {
        String id = sessions.create("expire", "", List.of(), false, null).sessionId();

        assertThat(commandLine.execute("expire", id, "--threshold", "0")).isEqualTo(CommandFailures.GENERIC);
        assertThat(errors()).contains("Expire command failed").contains("expirationThreshold must be >= 1");
    }

    @Test
    void compressAndCacheSplitShouldOperateOnStoredHistory() throws Exception {
        commandLine.execute("instruct", "one", "--purpose", "split");
        String id = output().trim();
        commandLine.execute("instruct", "two", "--session", id);
        commandLine.execute("instruct", "three", "--session", id);

        out.reset();
        assertThat(commandLine.execute("compress", id, "0", "1", "first two tasks")).isZero();
        assertThat(output()).contains("[1, 2]");
        assertThat(sessions.load(id).turns().size()).isEqualTo(2);

        out.reset();
        assertThat(commandLine.execute("cache-split", id, "--prompt-tokens", "50000", "--record")).isZero();
        assertThat(output()).contains("Cached turns: 1").contains("Update cache: true");
        assertThat(sessions.load(id).cachedTurnCount()).isEqualTo(1);

        out.reset();
        assertThat(commandLine.execute("expire", id)).isZero();
        assertThat(output()).contains("Nothing to expire.");

        out.reset();
        assertThat(commandLine.execute("delete", id)).isZero();
        assertThat(sessions.find(id)).isEmpty();
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
