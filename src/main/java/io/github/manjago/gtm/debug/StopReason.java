package io.github.manjago.gtm.debug;

/**
 * Why a debugger command stopped executing.
 */
public enum StopReason {

    /** Requested number of steps done */
    STEPPED,

    /** Current state matches a breakpoint */
    BREAKPOINT,

    /** Machine is in the finish state */
    ACCEPTED,

    /** No transition for the current state and symbol */
    STUCK,

    /** A continue ran into the configured step cap */
    STEP_LIMIT;

    /**
     * @return true if the machine cannot move any more
     */
    public boolean isHalted() {
        return this == ACCEPTED || this == STUCK;
    }
}
