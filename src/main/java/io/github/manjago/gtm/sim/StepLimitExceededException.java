package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.InstanceKey;

/**
 * A run needed more steps than its cap allowed.
 */
public class StepLimitExceededException extends MachineException {

    private final long limit;
    private final InstanceKey state;

    public StepLimitExceededException(long limit, InstanceKey state, long steps) {
        super(String.format("Step limit of %,d exceeded (state '%s' after %,d steps)", limit, state, steps), steps);
        this.limit = limit;
        this.state = state;
    }

    public long getLimit() {
        return limit;
    }

    /**
     * @return state the machine was in when the limit was hit
     */
    public InstanceKey getState() {
        return state;
    }
}
