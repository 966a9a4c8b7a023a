package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.Symbol;

/**
 * No transition for the current state and the symbol under the head.
 */
public class StuckException extends MachineException {

    private final InstanceKey state;
    private final Symbol symbol;
    private final int head;

    public StuckException(InstanceKey state, Symbol symbol, int head, long steps) {
        super(String.format("Stuck after %d steps: state '%s' has no rule for '%s' (head at %d)",
                steps, state, symbol, head), steps);
        this.state = state;
        this.symbol = symbol;
        this.head = head;
    }

    public InstanceKey getState() {
        return state;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public int getHead() {
        return head;
    }
}
