package io.pipe.app;

import io.pipe.cli.CacheSplitCommand;
import io.pipe.cli.CliContext;
import io.pipe.cli.CompressCommand;
import io.pipe.cli.DeleteCommand;
import io.pipe.cli.ExpireCommand;
import io.pipe.cli.ForkCommand;
import io.pipe.cli.InstructCommand;
import io.pipe.cli.PipeCliCommand;
import io.pipe.cli.SessionsCommand;
import io.pipe.cli.ShowCommand;
import io.pipe.core.config.ConfigPaths;
import io.pipe.core.config.ConfigService;
import io.pipe.core.config.model.PipeConfig;
import io.pipe.core.session.SessionStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class PipeApplication {
    private static final Logger LOG = LoggerFactory.getLogger(PipeApplication.class);

    private PipeApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, Path.of("").toAbsolutePath(), ConfigPaths.defaultConfigPath()));
    }

    static int run(String[] args, Path projectRoot, Path configPath) {
        PipeConfig config = loadConfig(new ConfigService(), configPath);
        Path sessionsDir = ConfigPaths.resolve(projectRoot, config.sessions().path());
        Clock clock = Clock.system(config.sessions().zone());
        SessionStore sessions = new SessionStore(
            sessionsDir,
            config.sessions().lockTimeout(),
            clock,
            config.history().referenceTtl()
        );
        LOG.debug("Using sessions directory {}", sessionsDir);

        CliContext context = new CliContext(sessions, config, clock);
        CommandLine commandLine = new CommandLine(new PipeCliCommand());
        commandLine.addSubcommand("sessions", new SessionsCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("instruct", new InstructCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("fork", new ForkCommand(context));
        commandLine.addSubcommand("expire", new ExpireCommand(context));
        commandLine.addSubcommand("compress", new CompressCommand(context));
        commandLine.addSubcommand("cache-split", new CacheSplitCommand(context));
        return commandLine.execute(args);
    }

    private static PipeConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return PipeConfig.defaults();
        }
    }
}
