package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.debug.DebugSession;
import io.github.manjago.gtm.debug.Debugger;
import io.github.manjago.gtm.sim.Machine;
import io.github.manjago.gtm.sim.Tape;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: debug
 *
 * Step through a program interactively.
 *
 * Usage:
 *   gtm debug prog.tm                # Asks for the input tape first
 *   gtm debug prog.tm --tape 0110    # Start with this tape
 *   gtm debug prog.tm --window 10    # Show 10 cells each side of the head
 */
@Command(
    name = "debug",
    description = "Step through a program with breakpoints",
    mixinStandardHelpOptions = true
)
public class DebugCommand implements Callable<Integer> {

    @Mixin
    private ConfigOption configOption;

    @Parameters(index = "0", description = "Program file")
    private String programFile;

    @Option(names = {"-t", "--tape"}, description = "Input tape (asked for when omitted)")
    private String tape;

    @Option(names = {"-w", "--window"}, description = "Cells shown each side of the head (default: debugger.tape-window)")
    private Integer window;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream errStream;

    public DebugCommand() {
        this(System.in, System.out, System.err);
    }

    DebugCommand(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.errStream = err;
    }

    @Override
    public Integer call() {
        PrintWriter err = new PrintWriter(errStream, true);

        if (ProgramSource.isStdin(programFile)) {
            err.println("❌ The debugger reads its commands from stdin, pass the program as a file");
            return 1;
        }

        GtmConfig.Builder builder = configOption.builder();
        if (window != null) builder.tapeWindow(window);
        GtmConfig config = builder.build();

        ProgramSource source;
        try {
            source = ProgramSource.read(programFile, in);
        } catch (IOException e) {
            err.println("❌ Cannot read program: " + e.getMessage());
            return 1;
        }
        SpecializedTable table;
        try {
            table = source.compile(config);
        } catch (ProgramException e) {
            source.printError(e, err);
            return 1;
        }
        source.printWarnings(table, err);

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String cells = tape;
            if (cells == null) {
                out.println("Enter the input tape (space or _ for blank):");
                out.print("Input: ");
                out.flush();
                cells = reader.readLine();
                if (cells == null) {
                    return 0;
                }
            }

            Tape input;
            try {
                input = Tape.of(cells);
            } catch (IllegalArgumentException e) {
                err.println("❌ Bad tape: " + e.getMessage());
                return 1;
            }

            Debugger debugger = new Debugger(new Machine(table, input), source.getProgram(), config);
            new DebugSession(debugger, reader, out).run();
            return 0;
        } catch (IOException e) {
            err.println("❌ Input error: " + e.getMessage());
            return 1;
        }
    }
}
