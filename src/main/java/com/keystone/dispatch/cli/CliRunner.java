package com.keystone.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Executes one {@code keystone} subcommand against the Spring context and keeps its
 * exit code for {@link com.keystone.KeystoneApplication} to return.
 * <p>
 * {@code serve} is not executed here: the application started a servlet context for
 * it and the process lives as long as the server does.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final KeystoneCommand keystoneCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(KeystoneCommand keystoneCommand, IFactory factory) {
        this.keystoneCommand = keystoneCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. Leading options such as
     * {@code --server.port=9090} are skipped; later positionals are never read,
     * so {@code submit ./serve} is a submission.
     */
    public static boolean isServeCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeCommand(args)) {
            return;
        }
        exitCode = new CommandLine(keystoneCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
