package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.Program;
import io.github.manjago.gtm.core.Transition;
import io.github.manjago.gtm.sim.Machine;
import io.github.manjago.gtm.sim.StepResult;
import io.github.manjago.gtm.sim.Tape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Stepping and breakpoint control over one {@link Machine}.
 * <p>
 * Every operation runs to completion before returning; nothing executes between calls.
 * <p>
 * Usage:
 * <pre>
 * Debugger dbg = new Debugger(new Machine(table, Tape.of("110")), program, config);
 * dbg.addBreakpoint("back");
 * StopReason why = dbg.continueRun();   // BREAKPOINT, ACCEPTED, STUCK or STEP_LIMIT
 * Snapshot now = dbg.inspect();
 * </pre>
 */
public class Debugger {

    private static final Logger log = LoggerFactory.getLogger(Debugger.class);

    private final Machine machine;
    private final Program program;
    private final int tapeWindow;
    private final long maxContinueSteps;

    private final List<Breakpoint> breakpoints = new ArrayList<>();
    private int nextBreakpointId = 1;
    private Breakpoint lastHit;

    /**
     * @param machine          machine to drive
     * @param program          source of the machine, used to quote rule lines (may be null)
     * @param tapeWindow       cells shown on each side of the head
     * @param maxContinueSteps most steps a single {@link #continueRun()} may take
     */
    public Debugger(Machine machine, Program program, int tapeWindow, long maxContinueSteps) {
        if (maxContinueSteps < 1) {
            throw new IllegalArgumentException("Continue limit must be positive: " + maxContinueSteps);
        }
        this.machine = machine;
        this.program = program;
        this.tapeWindow = Math.max(0, tapeWindow);
        this.maxContinueSteps = maxContinueSteps;
    }

    public Debugger(Machine machine, Program program, GtmConfig config) {
        this(machine, program, config.tapeWindow(), config.maxContinueSteps());
    }

    // ========== Execution ==========

    /**
     * Execute one step.
     */
    public StopReason step() {
        lastHit = null;
        return toStopReason(machine.step());
    }

    /**
     * Execute up to {@code count} steps, stopping early if the machine halts.
     */
    public StopReason step(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Step count must be positive: " + count);
        }
        StopReason reason = StopReason.STEPPED;
        for (int i = 0; i < count && reason == StopReason.STEPPED; i++) {
            reason = step();
        }
        return reason;
    }

    /**
     * Run until the machine enters a state with a breakpoint, halts, or the continue limit is hit.
     * <p>
     * Always takes at least one step, so continuing from a breakpoint moves on.
     */
    public StopReason continueRun() {
        lastHit = null;
        for (long taken = 0; taken < maxContinueSteps; taken++) {
            StopReason reason = toStopReason(machine.step());
            if (reason != StopReason.STEPPED) {
                return reason;
            }
            Optional<Breakpoint> hit = breakpointAt(machine.getCurrent());
            if (hit.isPresent()) {
                lastHit = hit.get();
                log.debug("Breakpoint #{} hit in {} at step {}", lastHit.id(), machine.getCurrent(), machine.getSteps());
                return StopReason.BREAKPOINT;
            }
        }
        return StopReason.STEP_LIMIT;
    }

    /**
     * Back to the initial state and tape. Breakpoints are kept.
     */
    public void reset() {
        machine.reset();
        lastHit = null;
    }

    /**
     * Run on a different input tape from the beginning.
     */
    public void load(Tape tape) {
        machine.load(tape);
        lastHit = null;
    }

    // ========== Breakpoints ==========

    /**
     * Break whenever the machine enters any instance of the named definition.
     *
     * @param definition state name without generic arguments
     */
    public Breakpoint addBreakpoint(String definition) {
        if (definition == null || definition.isBlank() || definition.contains("<")) {
            throw new IllegalArgumentException("Breakpoints take a plain state name, got: " + definition);
        }
        Breakpoint bp = new Breakpoint(nextBreakpointId++, definition);
        breakpoints.add(bp);
        return bp;
    }

    /**
     * @return true if a breakpoint with this id existed
     */
    public boolean removeBreakpoint(int id) {
        return breakpoints.removeIf(bp -> bp.id() == id);
    }

    /**
     * Remove every breakpoint on the named definition.
     *
     * @return number of breakpoints removed
     */
    public int removeBreakpoints(String definition) {
        int removed = 0;
        for (Iterator<Breakpoint> it = breakpoints.iterator(); it.hasNext(); ) {
            if (it.next().definition().equals(definition)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return number of breakpoints removed
     */
    public int clearBreakpoints() {
        int removed = breakpoints.size();
        breakpoints.clear();
        return removed;
    }

    public List<Breakpoint> getBreakpoints() {
        return List.copyOf(breakpoints);
    }

    /**
     * Breakpoint that stopped the last continue, if that is why it stopped.
     */
    public Optional<Breakpoint> getLastHit() {
        return Optional.ofNullable(lastHit);
    }

    /**
     * @return true if some reachable instance comes from this definition
     */
    public boolean isReachable(String definition) {
        for (InstanceKey key : machine.getTable().keys()) {
            if (key.definition().equals(definition)) {
                return true;
            }
        }
        return false;
    }

    // ========== Inspection ==========

    /**
     * Current state, head, step count and the tape around the head.
     */
    public Snapshot inspect() {
        int head = machine.getHead();
        int from = head - tapeWindow;
        Tape tape = machine.getTape();
        Transition next = machine.peek().orElse(null);
        String source = next != null && program != null ? program.sourceLine(next.line()) : null;
        return new Snapshot(machine.getCurrent(), head, machine.getSteps(), from,
                tape.window(from, head + tapeWindow), next, source);
    }

    public Machine getMachine() {
        return machine;
    }

    private Optional<Breakpoint> breakpointAt(InstanceKey key) {
        for (Breakpoint bp : breakpoints) {
            if (bp.matches(key)) {
                return Optional.of(bp);
            }
        }
        return Optional.empty();
    }

    private static StopReason toStopReason(StepResult result) {
        return switch (result) {
            case OK -> StopReason.STEPPED;
            case ACCEPTED -> StopReason.ACCEPTED;
            case STUCK -> StopReason.STUCK;
        };
    }
}
