package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse tape, unbounded in both directions.
 * <p>
 * Only non-blank cells are stored; every other position reads as blank. Writing blank clears
 * the cell, so two tapes with the same visible content are equal.
 */
public final class Tape {

    private final TreeMap<Integer, Symbol> cells = new TreeMap<>();

    public Tape() {
    }

    /**
     * Copy constructor - creates independent copy of the tape.
     */
    public Tape(Tape other) {
        this.cells.putAll(other.cells);
    }

    /**
     * Tape holding {@code input} from position 0 on. Space and {@code _} are blank.
     *
     * @throws IllegalArgumentException on a character that is not a tape symbol
     */
    public static Tape of(String input) {
        Tape tape = new Tape();
        for (int i = 0; i < input.length(); i++) {
            tape.write(i, Symbol.of(input.charAt(i)));
        }
        return tape;
    }

    public Symbol read(int position) {
        return cells.getOrDefault(position, Symbol.BLANK);
    }

    public void write(int position, Symbol symbol) {
        if (symbol.isBlank()) {
            cells.remove(position);
        } else {
            cells.put(position, symbol);
        }
    }

    /**
     * Cells from {@code from} to {@code to}, both inclusive.
     */
    public List<Symbol> window(int from, int to) {
        List<Symbol> result = new ArrayList<>(Math.max(0, to - from + 1));
        for (int i = from; i <= to; i++) {
            result.add(read(i));
        }
        return result;
    }

    /**
     * @return number of non-blank cells
     */
    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Lowest non-blank position, or 0 for an empty tape.
     */
    public int firstPosition() {
        return cells.isEmpty() ? 0 : cells.firstKey();
    }

    /**
     * Highest non-blank position, or -1 for an empty tape.
     */
    public int lastPosition() {
        return cells.isEmpty() ? -1 : cells.lastKey();
    }

    /**
     * Non-blank span as text, blanks inside it written as {@code _}; empty string for an empty tape.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = firstPosition(); i <= lastPosition(); i++) {
            sb.append(read(i).value());
        }
        return sb.toString();
    }

    /**
     * Non-blank cells by position.
     */
    public Map<Integer, Symbol> cells() {
        return Collections.unmodifiableMap(cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tape other)) return false;
        return cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "Tape{from=" + firstPosition() + ", cells=" + render() + '}';
    }
}
