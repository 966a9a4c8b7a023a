package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.core.Transition;

/**
 * Listener for machine events.
 * <p>
 * Implement this interface to trace a run, for example to print every step.
 */
public interface MachineListener {

    /**
     * Called after a transition has been applied.
     *
     * @param step       step number (1 for the first step)
     * @param from       state the transition was taken from
     * @param read       symbol that was under the head
     * @param head       head position before moving
     * @param transition the applied transition
     */
    default void onStep(long step, InstanceKey from, Symbol read, int head, Transition transition) {}

    /**
     * Called when the machine enters the finish state.
     *
     * @param steps total steps taken
     */
    default void onAccept(long steps) {}

    /**
     * Called when no transition matches.
     *
     * @param key    current state
     * @param symbol symbol under the head
     * @param head   head position
     */
    default void onStuck(InstanceKey key, Symbol symbol, int head) {}

    /**
     * No-op listener that does nothing.
     */
    MachineListener NOOP = new MachineListener() {};
}
