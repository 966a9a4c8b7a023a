package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.core.Transition;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: check
 * 
 * Parses and specializes a program without running it.
 * 
 * Usage:
 *   gtm check prog.tm             # Summary and warnings
 *   gtm check prog.tm --table     # Also print every instance and transition
 */
@Command(
    name = "check",
    description = "Parse and specialize a program, print the state table",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Parameters(index = "0", arity = "0..1", description = "Program file ('-' or none for stdin)")
    private String programFile;

    @Option(names = {"--table"}, description = "Print all specialized states")
    private boolean showTable;

    @Option(names = {"--max-depth"}, description = "Max generic nesting depth (default: resolver.max-nesting-depth)")
    private Integer maxDepth;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GtmConfig.Builder builder = configOption.builder();
        if (maxDepth != null) builder.maxNestingDepth(maxDepth);
        GtmConfig config = builder.build();

        ProgramSource source;
        try {
            source = ProgramSource.read(programFile, System.in);
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

        out.printf("✓ %s: %d definitions → %d states, %d transitions%n",
                source.getOrigin(), source.getProgram().getDefinitions().size(),
                table.size(), table.transitionCount());
        out.println("  Start: " + table.getStart());
        source.printWarnings(table, err);

        if (showTable) {
            out.println();
            printTable(table, out);
        }
        return 0;
    }

    private static void printTable(SpecializedTable table, PrintWriter out) {
        for (InstanceKey key : table.keys()) {
            if (key.isFinish()) {
                continue;
            }
            out.println(key + ":");
            for (Map.Entry<Symbol, Transition> e : table.row(key).entrySet()) {
                Transition t = e.getValue();
                out.printf("  %s → %s, %-7s → %-20s (line %d)%n",
                        e.getKey(), t.output(), t.movement().getKeyword(), t.target(), t.line());
            }
        }
    }
}
