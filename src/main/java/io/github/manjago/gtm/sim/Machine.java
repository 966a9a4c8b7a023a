package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.core.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Executes a specialized table against a tape.
 * <p>
 * Holds the machine state: current instance, tape, head position and step counter.
 * The table is only read, so any number of machines may share one.
 */
public final class Machine {

    private static final Logger log = LoggerFactory.getLogger(Machine.class);

    private final SpecializedTable table;

    /** Tape the machine was loaded with, restored by reset() */
    private Tape initialTape;

    private Tape tape;
    private InstanceKey current;
    private int head;
    private long steps;

    private MachineListener listener = MachineListener.NOOP;

    /**
     * Create a machine positioned at the table's start state, head at 0.
     *
     * @param table specialized program
     * @param tape  initial tape (copied)
     */
    public Machine(SpecializedTable table, Tape tape) {
        this.table = table;
        this.initialTape = new Tape(tape);
        reset();
    }

    public void setListener(MachineListener listener) {
        this.listener = listener != null ? listener : MachineListener.NOOP;
    }

    /**
     * Execute a single transition.
     *
     * @return {@link StepResult#ACCEPTED} if the machine is (now) in finish,
     *         {@link StepResult#STUCK} if no rule matches (nothing changes),
     *         {@link StepResult#OK} otherwise
     */
    public StepResult step() {
        if (current.isFinish()) {
            return StepResult.ACCEPTED;
        }

        Symbol read = tape.read(head);
        Transition t = table.row(current).get(read);
        if (t == null) {
            log.debug("Stuck in {} on '{}' at {}", current, read, head);
            listener.onStuck(current, read, head);
            return StepResult.STUCK;
        }

        InstanceKey from = current;
        int at = head;
        tape.write(head, t.output());
        head = t.movement().apply(head);
        current = t.target();
        steps++;
        listener.onStep(steps, from, read, at, t);

        if (current.isFinish()) {
            listener.onAccept(steps);
            return StepResult.ACCEPTED;
        }
        return StepResult.OK;
    }

    /**
     * Step until the finish state is reached.
     *
     * @param maxSteps most steps this call may take; must not be negative
     * @return final state of an accepted run
     * @throws StuckException              no transition matched
     * @throws StepLimitExceededException  finish was not reached within {@code maxSteps}
     */
    public RunResult run(long maxSteps) throws StuckException, StepLimitExceededException {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("Step limit must not be negative: " + maxSteps);
        }

        long taken = 0;
        while (!current.isFinish()) {
            if (taken >= maxSteps) {
                throw new StepLimitExceededException(maxSteps, current, steps);
            }
            if (step() == StepResult.STUCK) {
                throw new StuckException(current, tape.read(head), head, steps);
            }
            taken++;
        }

        log.debug("Accepted after {} steps", steps);
        return new RunResult(steps, head, new Tape(tape));
    }

    /**
     * Transition that the next step would take, if any.
     */
    public Optional<Transition> peek() {
        return table.transition(current, tape.read(head));
    }

    /**
     * Restore the state the machine was created (or last loaded) with.
     */
    public void reset() {
        this.tape = new Tape(initialTape);
        this.current = table.getStart();
        this.head = 0;
        this.steps = 0;
    }

    /**
     * Replace the input tape and reset.
     */
    public void load(Tape input) {
        this.initialTape = new Tape(input);
        reset();
    }

    // ========== Getters ==========

    public SpecializedTable getTable() {
        return table;
    }

    public InstanceKey getCurrent() {
        return current;
    }

    public int getHead() {
        return head;
    }

    public long getSteps() {
        return steps;
    }

    /**
     * Copy of the current tape.
     */
    public Tape getTape() {
        return new Tape(tape);
    }

    public Symbol read() {
        return tape.read(head);
    }

    public boolean isAccepted() {
        return current.isFinish();
    }

    /**
     * @return true if the next step would find no transition
     */
    public boolean isStuck() {
        return !current.isFinish() && peek().isEmpty();
    }
}
