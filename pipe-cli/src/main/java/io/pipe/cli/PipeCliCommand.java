package io.pipe.cli;

import picocli.CommandLine.Command;

@Command(name = "pipe", mixinStandardHelpOptions = true, description = "Session history and context cache tooling")
public final class PipeCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
