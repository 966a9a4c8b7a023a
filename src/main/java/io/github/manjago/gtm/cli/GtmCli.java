package io.github.manjago.gtm.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * GTM CLI - compiler, runner and debugger for generic Turing machines.
 * 
 * Usage:
 *   gtm run prog.tm --tape 110        - Run on an input tape
 *   gtm debug prog.tm                 - Interactive debugger
 *   gtm generate prog.tm -o out.txt   - Export for turingmachinesimulator.com
 *   gtm check prog.tm                 - Show the specialized state table
 *   gtm info                          - Show version and config
 * 
 * Programs are read from stdin when the file is '-' or missing.
 */
@Command(
    name = "gtm",
    description = "Generic Turing Machine - specialize, run, debug and export",
    mixinStandardHelpOptions = true,
    version = "GTM 1.0.0",
    subcommands = {
        RunCommand.class,
        DebugCommand.class,
        GenerateCommand.class,
        CheckCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class GtmCli implements Runnable {

    /** Exit code for failures nobody anticipated (bugs, I/O trouble) */
    public static final int EXIT_UNEXPECTED = 2;

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line with the error handling every entry point shares.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new GtmCli())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    cmd.getErr().println("❌ Unexpected error: " + ex);
                    return EXIT_UNEXPECTED;
                });
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
