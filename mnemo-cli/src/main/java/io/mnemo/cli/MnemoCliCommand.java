package io.mnemo.cli;

import picocli.CommandLine.Command;

@Command(name = "mnemo", mixinStandardHelpOptions = true, description = "Mnemo conversational memory")
public final class MnemoCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
