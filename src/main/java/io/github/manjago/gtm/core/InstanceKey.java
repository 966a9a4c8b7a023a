package io.github.manjago.gtm.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Identity of one fully specialized state.
 * <p>
 * Keeps the originating definition name apart from the concrete argument keys, so two
 * instances are equal exactly when their argument trees are equal, and tools that care only
 * about the definition (breakpoints) never have to pick the canonical text apart.
 * Canonical text is {@code name<arg1,arg2>} without spaces, e.g. {@code r<r<finish>>}.
 */
public record InstanceKey(String definition, List<InstanceKey> arguments) {

    /** The terminal state; reaching it halts the machine successfully */
    public static final InstanceKey FINISH = new InstanceKey(Parser.FINISH, List.of());

    public InstanceKey {
        arguments = List.copyOf(arguments);
    }

    public static InstanceKey of(String definition, InstanceKey... arguments) {
        return new InstanceKey(definition, List.of(arguments));
    }

    public boolean isFinish() {
        return equals(FINISH);
    }

    /**
     * Nesting depth: 1 for a plain state, {@code r<r<f>>} has depth 3.
     */
    public int depth() {
        int deepest = 0;
        for (InstanceKey arg : arguments) {
            deepest = Math.max(deepest, arg.depth());
        }
        return deepest + 1;
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return definition;
        }
        return arguments.stream()
                .map(InstanceKey::toString)
                .collect(Collectors.joining(",", definition + "<", ">"));
    }
}
