package io.github.manjago.gtm.core;

import java.util.List;

/**
 * Specialization can never finish, or the specialized instance can never leave itself.
 * <p>
 * Raised for generic expansion that keeps nesting its own instance deeper and for an
 * instance that re-enters itself with identical arguments without moving the head.
 */
public class InstantiationCycleException extends ProgramException {

    private final String key;
    private final List<String> chain;

    public InstantiationCycleException(String message, String key, List<String> chain, int line) {
        super(message + " (via " + abbreviate(chain) + ")", line);
        this.key = key;
        this.chain = List.copyOf(chain);
    }

    /**
     * Long chains keep their head and tail only.
     */
    private static String abbreviate(List<String> chain) {
        if (chain.size() <= 6) {
            return String.join(" -> ", chain);
        }
        return String.join(" -> ", chain.subList(0, 3)) + " -> ... -> "
                + String.join(" -> ", chain.subList(chain.size() - 2, chain.size()));
    }

    /**
     * @return canonical key of the instance at which the cycle was detected
     */
    public String getKey() {
        return key;
    }

    public List<String> getChain() {
        return chain;
    }
}
