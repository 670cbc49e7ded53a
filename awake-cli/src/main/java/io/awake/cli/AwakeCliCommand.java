package io.awake.cli;

import picocli.CommandLine.Command;

@Command(name = "awake", mixinStandardHelpOptions = true, description = "Recurring outbound HTTP job engine")
public final class AwakeCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
