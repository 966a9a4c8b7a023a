package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.sim.Tape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Line-oriented command loop around a {@link Debugger}.
 * <p>
 * Commands:
 * <pre>
 *   step | s | next | n [count]   execute one or count steps
 *   continue | cont | run         run to the next breakpoint or halt
 *   break | breakpoint | b &lt;state&gt;   break on every instance of a state
 *   clear | c [id | state]        remove breakpoints (all without argument)
 *   breakpoints | bl              list breakpoints
 *   inspect | i                   show state, tape and next rule
 *   reset                         start over with the same tape
 *   tape &lt;cells&gt;                 start over with a new tape
 *   help | h                      list commands
 *   quit | q | exit               leave
 * </pre>
 * An empty line repeats the previous command.
 */
public class DebugSession {

    private static final Logger log = LoggerFactory.getLogger(DebugSession.class);

    private static final String PROMPT = "(gtm) ";

    private final Debugger debugger;
    private final BufferedReader in;
    private final PrintStream out;
    private final SnapshotPrinter printer;

    private String lastCommand;

    public DebugSession(Debugger debugger, BufferedReader in, PrintStream out) {
        this.debugger = debugger;
        this.in = in;
        this.out = out;
        this.printer = new SnapshotPrinter(out);
    }

    /**
     * Read and execute commands until quit or end of input.
     */
    public void run() throws IOException {
        out.println("🐞 GTM debugger. Type 'help' for commands.");
        printer.print(debugger.inspect());

        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (!execute(line)) {
                break;
            }
        }
        log.debug("Debug session ended at step {}", debugger.getMachine().getSteps());
    }

    /**
     * Execute one command line.
     *
     * @return false when the session should end
     */
    public boolean execute(String line) {
        String text = line.strip();
        if (text.isEmpty()) {
            if (lastCommand == null) {
                return true;
            }
            text = lastCommand;
        }
        lastCommand = text;

        String[] words = text.split("\\s+");
        String command = words[0].toLowerCase(Locale.ROOT);
        String argument = words.length > 1 ? words[1] : null;
        if (words.length > 2 && !command.equals("tape")) {
            out.println("❌ Too many arguments for '" + command + "'");
            return true;
        }

        switch (command) {
            case "step", "s", "next", "n" -> step(argument);
            case "continue", "cont", "run" -> continueRun();
            case "break", "breakpoint", "b" -> addBreakpoint(argument);
            case "clear", "c" -> clear(argument);
            case "breakpoints", "bl" -> printer.printBreakpoints(debugger.getBreakpoints());
            case "inspect", "i" -> printer.print(debugger.inspect());
            case "reset" -> {
                debugger.reset();
                out.println("↩️  Reset to the initial tape");
                printer.print(debugger.inspect());
            }
            case "tape" -> loadTape(text.substring(words[0].length()).strip());
            case "help", "h" -> printHelp();
            case "quit", "q", "exit" -> {
                return false;
            }
            default -> out.println("❌ Unknown command '" + command + "' (type 'help')");
        }
        return true;
    }

    // ========== Commands ==========

    private void step(String argument) {
        int count = 1;
        if (argument != null) {
            try {
                count = Integer.parseInt(argument);
            } catch (NumberFormatException e) {
                out.println("❌ Step count must be a number: " + argument);
                return;
            }
            if (count < 1) {
                out.println("❌ Step count must be positive: " + count);
                return;
            }
        }
        StopReason reason = debugger.step(count);
        report(reason);
    }

    private void continueRun() {
        report(debugger.continueRun());
    }

    private void addBreakpoint(String state) {
        if (state == null) {
            out.println("❌ Usage: break <state>");
            return;
        }
        if (state.contains("<")) {
            out.println("❌ Breakpoints take a plain state name; '" + state
                    + "' stops on every instance of " + state.substring(0, state.indexOf('<')));
            return;
        }
        Breakpoint bp = debugger.addBreakpoint(state);
        out.printf("🔴 Breakpoint #%d on %s%n", bp.id(), bp.definition());
        if (!debugger.isReachable(state)) {
            out.println("⚠️  No reachable instance of '" + state + "', this breakpoint will never fire");
        }
    }

    private void clear(String argument) {
        if (argument == null) {
            int removed = debugger.clearBreakpoints();
            out.printf("Removed %d breakpoint(s)%n", removed);
            return;
        }
        if (isNumber(argument)) {
            int id;
            try {
                id = Integer.parseInt(argument);
            } catch (NumberFormatException e) {
                out.println("❌ No breakpoint #" + argument);
                return;
            }
            if (debugger.removeBreakpoint(id)) {
                out.printf("Removed breakpoint #%d%n", id);
            } else {
                out.println("❌ No breakpoint #" + id);
            }
            return;
        }
        int removed = debugger.removeBreakpoints(argument);
        if (removed == 0) {
            out.println("❌ No breakpoint on " + argument);
        } else {
            out.printf("Removed %d breakpoint(s) on %s%n", removed, argument);
        }
    }

    private void loadTape(String cells) {
        Tape tape;
        try {
            tape = Tape.of(cells);
        } catch (IllegalArgumentException e) {
            out.println("❌ " + e.getMessage());
            return;
        }
        debugger.load(tape);
        out.println("📼 Loaded tape '" + cells + "'");
        printer.print(debugger.inspect());
    }

    private void report(StopReason reason) {
        Snapshot snapshot = debugger.inspect();
        printer.printStop(reason, snapshot, debugger.getLastHit().orElse(null));
        printer.print(snapshot);
    }

    private void printHelp() {
        out.println("""
            Commands:
              step | s | next | n [count]   execute one or count steps
              continue | cont | run         run to the next breakpoint or halt
              break | breakpoint | b <state>  break on every instance of a state
              clear | c [id | state]        remove breakpoints (all without argument)
              breakpoints | bl              list breakpoints
              inspect | i                   show state, tape and next rule
              reset                         start over with the same tape
              tape <cells>                  start over with a new tape
              help | h                      this list
              quit | q | exit               leave
            An empty line repeats the previous command.""");
    }

    private static boolean isNumber(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }
}
