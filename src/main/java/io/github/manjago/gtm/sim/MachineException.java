package io.github.manjago.gtm.sim;

/**
 * A run ended without reaching the finish state.
 * <p>
 * Ends one run only; the specialized table it ran on stays valid.
 */
public class MachineException extends Exception {

    private final long steps;

    public MachineException(String message, long steps) {
        super(message);
        this.steps = steps;
    }

    /**
     * @return steps taken when the run stopped
     */
    public long getSteps() {
        return steps;
    }
}
