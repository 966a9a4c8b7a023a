package io.github.manjago.gtm.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A state as defined by a program, generic or not.
 * <p>
 * All rule lines sharing a head name are collected here, at most one per input symbol.
 * Rules keep the order in which they were declared.
 */
public final class StateDefinition {

    private final String name;
    private final List<String> parameters;
    private final Map<Symbol, TransitionRule> rules;
    private final int line;

    public StateDefinition(String name, List<String> parameters, Map<Symbol, TransitionRule> rules, int line) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.line = line;
    }

    public String getName() {
        return name;
    }

    /**
     * Placeholder names in declaration order; empty for a non-generic state.
     */
    public List<String> getParameters() {
        return parameters;
    }

    public int arity() {
        return parameters.size();
    }

    public boolean isGeneric() {
        return !parameters.isEmpty();
    }

    public Map<Symbol, TransitionRule> getRules() {
        return rules;
    }

    public TransitionRule rule(Symbol input) {
        return rules.get(input);
    }

    /**
     * @return line of the first rule declaring this state
     */
    public int getLine() {
        return line;
    }

    /**
     * Head as it would be written in a program, e.g. {@code back<fn>}.
     */
    public String signature() {
        return isGeneric() ? name + "<" + String.join(", ", parameters) + ">" : name;
    }

    @Override
    public String toString() {
        return "StateDefinition{" + signature() + ", rules=" + rules.size() + ", line=" + line + '}';
    }
}
