package io.github.manjago.gtm.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Show information about GTM.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println();
        out.println("╔═══════════════════════════════════════╗");
        out.println("║                 GTM                   ║");
        out.println("║     Generic Turing Machine tools      ║");
        out.println("║          Version 1.0.0                ║");
        out.println("╚═══════════════════════════════════════╝");
        out.println();

        out.println("Effective Configuration:");
        out.println(configOption.builder().build());

        out.println("Language:");
        out.println("  start = state                         initial state");
        out.println("  state<p> in = out; target<p> move     rule, move is prev, current or next");
        out.println("  finish                                accepting state");
        out.flush();
        return 0;
    }
}
