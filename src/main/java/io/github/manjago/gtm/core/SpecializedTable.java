package io.github.manjago.gtm.core;

import java.util.*;

/**
 * Result of specialization: every reachable state instance and its transitions.
 * <p>
 * Instances keep the order in which they were discovered from the start key, and each row keeps
 * rule declaration order, so the same program always yields the same table. Immutable.
 */
public final class SpecializedTable {

    private final InstanceKey start;
    private final Map<InstanceKey, Map<Symbol, Transition>> rows;
    private final List<StateDefinition> unreachable;

    public SpecializedTable(InstanceKey start, Map<InstanceKey, Map<Symbol, Transition>> rows,
                            List<StateDefinition> unreachable) {
        Map<InstanceKey, Map<Symbol, Transition>> copy = new LinkedHashMap<>();
        for (Map.Entry<InstanceKey, Map<Symbol, Transition>> e : rows.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.start = start;
        this.rows = Collections.unmodifiableMap(copy);
        this.unreachable = List.copyOf(unreachable);
    }

    public InstanceKey getStart() {
        return start;
    }

    /**
     * All instances, in discovery order. Includes {@link InstanceKey#FINISH} when it is reachable.
     */
    public Set<InstanceKey> keys() {
        return rows.keySet();
    }

    public boolean contains(InstanceKey key) {
        return rows.containsKey(key);
    }

    /**
     * Transitions of one instance; empty for finish and for unknown keys.
     */
    public Map<Symbol, Transition> row(InstanceKey key) {
        return rows.getOrDefault(key, Map.of());
    }

    public Optional<Transition> transition(InstanceKey key, Symbol symbol) {
        return Optional.ofNullable(row(key).get(symbol));
    }

    /**
     * @return number of instances
     */
    public int size() {
        return rows.size();
    }

    public int transitionCount() {
        int count = 0;
        for (Map<Symbol, Transition> row : rows.values()) {
            count += row.size();
        }
        return count;
    }

    /**
     * Definitions that no reachable instance was specialized from.
     */
    public List<StateDefinition> getUnreachable() {
        return unreachable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpecializedTable other)) return false;
        return start.equals(other.start)
                && new ArrayList<>(rows.keySet()).equals(new ArrayList<>(other.rows.keySet()))
                && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, rows);
    }

    @Override
    public String toString() {
        return "SpecializedTable{start=" + start + ", instances=" + rows.size()
                + ", transitions=" + transitionCount() + '}';
    }
}
