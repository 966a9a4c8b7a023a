package io.github.manjago.gtm.sim;

/**
 * Result of executing a single step.
 */
public enum StepResult {

    /** Transition applied, machine still running */
    OK(false, false),

    /** Machine is in the finish state (entered by this step or already there) */
    ACCEPTED(false, true),

    /** No transition for the current state and the symbol under the head */
    STUCK(true, true);

    private final boolean isError;
    private final boolean isHalted;

    StepResult(boolean isError, boolean isHalted) {
        this.isError = isError;
        this.isHalted = isHalted;
    }

    /**
     * @return true if this result indicates an error condition
     */
    public boolean isError() {
        return isError;
    }

    /**
     * @return true if no further step can change the machine
     */
    public boolean isHalted() {
        return isHalted;
    }
}
