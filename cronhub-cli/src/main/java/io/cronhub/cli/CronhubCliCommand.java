package io.cronhub.cli;

import picocli.CommandLine.Command;

@Command(name = "cronhub", mixinStandardHelpOptions = true, description = "Durable cron scheduler for shell commands")
public final class CronhubCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
