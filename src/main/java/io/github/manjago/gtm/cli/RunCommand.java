package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.core.Transition;
import io.github.manjago.gtm.sim.*;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Run a program on an input tape.
 *
 * Examples:
 *   gtm run div3.tm --tape 110              # Run until finish
 *   gtm run div3.tm -t 110 --trace          # Print every step
 *   gtm run div3.tm -t 110 --max-steps 500  # Give up after 500 steps
 *   cat div3.tm | gtm run -t 110            # Program from stdin
 */
@Command(
    name = "run",
    description = "Run a program on an input tape",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Parameters(index = "0", arity = "0..1", description = "Program file ('-' or none for stdin)")
    private String programFile;

    @Option(names = {"-t", "--tape"}, description = "Input tape; space and _ are blank", defaultValue = "")
    private String tape;

    @Option(names = {"-m", "--max-steps"}, description = "Step limit (default: run.max-steps)")
    private Long maxSteps;

    @Option(names = {"--trace"}, description = "Print every step")
    private boolean trace;

    @Option(names = {"-q", "--quiet"}, description = "Print only the final tape")
    private boolean quiet;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GtmConfig.Builder builder = configOption.builder();
        if (maxSteps != null) builder.maxSteps(maxSteps);
        GtmConfig config = builder.build();

        Tape input;
        try {
            input = Tape.of(tape);
        } catch (IllegalArgumentException e) {
            err.println("❌ Bad tape: " + e.getMessage());
            return 1;
        }

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
        source.printWarnings(table, err);

        Machine machine = new Machine(table, input);
        if (trace) {
            machine.setListener(new TraceListener(out));
        }

        try {
            RunResult result = machine.run(config.maxSteps());
            if (quiet) {
                out.println(result.tape().render());
            } else {
                out.printf("✅ Accepted after %,d steps%n", result.steps());
                out.println("   Tape: " + result.tape().render());
                out.println("   Head: " + result.head());
            }
            return 0;
        } catch (StuckException e) {
            err.println("❌ Rejected: " + e.getMessage());
            printRuleHint(source, e, err);
            err.println("   Tape: " + machine.getTape().render());
            return 1;
        } catch (StepLimitExceededException e) {
            err.println("❌ " + e.getMessage());
            err.println("   Raise it with --max-steps or run.max-steps");
            return 1;
        }
    }

    private static void printRuleHint(ProgramSource source, StuckException e, PrintWriter err) {
        if (source.getProgram() != null && source.getProgram().isDefined(e.getState().definition())) {
            int line = source.getProgram().definition(e.getState().definition()).getLine();
            err.printf("   %s is declared on line %d%n", e.getState().definition(), line);
        }
    }

    /**
     * One line per step.
     */
    private static class TraceListener implements MachineListener {
        private final PrintWriter out;

        TraceListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onStep(long step, InstanceKey from, Symbol read, int head, Transition t) {
            out.printf("%8d  %-24s @%-5d '%s' → '%s' %-7s → %s%n",
                    step, from, head, read, t.output(), t.movement().getKeyword(), t.target());
        }

        @Override
        public void onStuck(InstanceKey key, Symbol symbol, int head) {
            out.printf("%8s  %-24s @%-5d '%s' ⛔ no rule%n", "", key, head, symbol);
        }
    }
}
