package io.threadkeep.cli;

import picocli.CommandLine.Command;

@Command(name = "threadkeep", mixinStandardHelpOptions = true, description = "Spreadsheet assistant conversation capture")
public final class ThreadkeepCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
