package com.tempo.cli;

import com.tempo.exception.TempoException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point for the {@code tempo} command line.
 */
@Command(name = "tempo",
        mixinStandardHelpOptions = true,
        version = "tempo 1.0.0",
        description = {"Tempo - a simple webhook scheduler.",
                "Schedules HTTP requests to webhooks using six-field cron expressions (with seconds)."},
        subcommands = {AddCommand.class,
                ListCommand.class,
                RemoveCommand.class,
                RunCommand.class,
                StartCommand.class,
                ExportCommand.class,
                ImportCommand.class})
public class TempoMain implements Runnable {
    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * Command line with the error handling every subcommand shares: a {@link TempoException}
     * prints {@code Error: <message>} and exits with 1.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new TempoMain());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof TempoException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                commandLine.getErr().flush();
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
        spec.commandLine().getOut().flush();
    }
}
