package io.cronbot.cli;

import picocli.CommandLine.Command;

@Command(name = "cronbot", mixinStandardHelpOptions = true, description = "Persistent job scheduler for chat-bot collaborators")
public final class CronbotCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
