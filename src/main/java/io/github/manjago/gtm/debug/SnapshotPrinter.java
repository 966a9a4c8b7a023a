package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.core.Transition;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints debugger snapshots in human-readable format.
 */
public class SnapshotPrinter {

    private final PrintStream out;
    private boolean showSource = true;

    public SnapshotPrinter() {
        this(System.out);
    }

    public SnapshotPrinter(PrintStream out) {
        this.out = out;
    }

    public SnapshotPrinter showSource(boolean show) {
        this.showSource = show;
        return this;
    }

    /**
     * Print state, tape window and the rule that fires next.
     */
    public void print(Snapshot snapshot) {
        out.printf("State: %s | Step %,d | Head %d%n", snapshot.state(), snapshot.steps(), snapshot.head());

        String tape = snapshot.tapeText();
        int caret = snapshot.head() - snapshot.windowStart();
        out.printf("  tape [%d..%d]  %s%n", snapshot.windowStart(),
                snapshot.windowStart() + snapshot.cells().size() - 1, tape);
        out.printf("  %s  %s^%n", " ".repeat(labelWidth(snapshot)), " ".repeat(caret));

        if (snapshot.isAccepted()) {
            out.println("  ✅ accepted");
        } else if (snapshot.isStuck()) {
            out.printf("  ⛔ no rule for '%s'%n", snapshot.current());
        } else {
            out.println("  next: " + describe(snapshot.current().toString(), snapshot.next()));
            if (showSource && snapshot.sourceLine() != null) {
                out.printf("  line %d: %s%n", snapshot.next().line(), snapshot.sourceLine().strip());
            }
        }
    }

    /**
     * One line saying why execution stopped.
     */
    public void printStop(StopReason reason, Snapshot snapshot, Breakpoint hit) {
        switch (reason) {
            case STEPPED -> { }
            case BREAKPOINT -> out.printf("🔴 Breakpoint #%d (%s) hit at step %,d%n",
                    hit.id(), hit.definition(), snapshot.steps());
            case ACCEPTED -> out.printf("✅ Accepted after %,d steps%n", snapshot.steps());
            case STUCK -> out.printf("⛔ Stuck in %s on '%s' at position %d after %,d steps%n",
                    snapshot.state(), snapshot.current(), snapshot.head(), snapshot.steps());
            case STEP_LIMIT -> out.printf("⚠️  Paused after step limit, %,d steps so far%n", snapshot.steps());
        }
    }

    public void printBreakpoints(List<Breakpoint> breakpoints) {
        if (breakpoints.isEmpty()) {
            out.println("No breakpoints.");
            return;
        }
        out.println("Id | State");
        out.println("---+------------");
        for (Breakpoint bp : breakpoints) {
            out.printf("%2d | %s%n", bp.id(), bp.definition());
        }
    }

    // ========== Private helpers ==========

    private static String describe(String read, Transition t) {
        return String.format("read '%s' → write '%s', %s, go to %s",
                read, t.output(), t.movement().getKeyword(), t.target());
    }

    /**
     * Width of the "tape [a..b]" label, so the caret lines up under the head cell.
     */
    private static int labelWidth(Snapshot snapshot) {
        int last = snapshot.windowStart() + snapshot.cells().size() - 1;
        return ("tape [" + snapshot.windowStart() + ".." + last + "]").length();
    }
}
