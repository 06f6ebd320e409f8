package com.keystone.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root command. Subcommands other than {@code serve} and {@code health} talk to a running server.
 */
@Command(
        name = "keystone",
        mixinStandardHelpOptions = true,
        version = "Keystone 0.1.0",
        description = "Quality-gated integration pipeline for agent-produced artifacts",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                SubmitCommand.class,
                StatusCommand.class,
                IntegrateCommand.class,
                AgentsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeystoneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
