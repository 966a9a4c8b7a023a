package io.github.manjago.gtm.core;

import java.util.List;

/**
 * A reachable reference names a state that no rule defines.
 */
public class UndefinedStateException extends ProgramException {

    private final String state;
    private final List<String> chain;

    /**
     * @param state undefined name
     * @param chain keys leading to the reference, starting with the start key (may be empty)
     * @param line  line of the offending reference
     */
    public UndefinedStateException(String state, List<String> chain, int line) {
        super(describe(state, chain), line);
        this.state = state;
        this.chain = List.copyOf(chain);
    }

    private static String describe(String state, List<String> chain) {
        String message = "Unknown state '" + state + "'";
        if (!chain.isEmpty()) {
            message += " (reached via " + String.join(" -> ", chain) + ")";
        }
        return message;
    }

    public String getState() {
        return state;
    }

    public List<String> getChain() {
        return chain;
    }
}
