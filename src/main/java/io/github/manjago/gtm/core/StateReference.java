package io.github.manjago.gtm.core;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reference to a state as written in a program: a name plus argument references.
 * <p>
 * Arguments are references themselves, so {@code add<num, sub<num, num>>} is a tree.
 * A bare name (no arguments) may stand for a placeholder of the enclosing definition.
 */
public record StateReference(String name, List<StateReference> arguments) {

    public StateReference {
        arguments = List.copyOf(arguments);
    }

    public static StateReference of(String name, StateReference... arguments) {
        return new StateReference(name, List.of(arguments));
    }

    public boolean isBare() {
        return arguments.isEmpty();
    }

    /**
     * Nesting depth as written: 1 for a bare name, {@code r<r<x>>} has depth 3.
     */
    public int depth() {
        int deepest = 0;
        for (StateReference arg : arguments) {
            deepest = Math.max(deepest, arg.depth());
        }
        return deepest + 1;
    }

    /**
     * Rename bare names according to the given mapping, leaving everything else untouched.
     */
    public StateReference rename(Map<String, String> names) {
        if (isBare()) {
            String renamed = names.get(name);
            return renamed == null ? this : new StateReference(renamed, List.of());
        }
        return new StateReference(name, arguments.stream().map(a -> a.rename(names)).toList());
    }

    @Override
    public String toString() {
        if (isBare()) {
            return name;
        }
        return arguments.stream()
                .map(StateReference::toString)
                .collect(Collectors.joining(", ", name + "<", ">"));
    }
}
