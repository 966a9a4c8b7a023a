package io.github.manjago.gtm.core;

import org.jetbrains.annotations.NotNull;

/**
 * A single tape cell value.
 * <p>
 * Either the blank marker {@code _} or one printable ASCII character. A space is a symbol only
 * when quoted in a program ({@code ' '}); on an input tape it means blank.
 * A digit written bare in a program ({@code 7}) and the same digit quoted ({@code '7'})
 * denote the same symbol: symbols compare by value and are never interpreted numerically.
 */
public record Symbol(char value) {

    /** Character used for the blank marker, in programs, tapes and exported tables */
    public static final char BLANK_CHAR = '_';

    public static final Symbol BLANK = new Symbol(BLANK_CHAR);

    /** Non-blank space, written {@code ' '} in programs */
    public static final Symbol SPACE = new Symbol(' ');

    public Symbol {
        if (value != ' ' && !isPrintable(value)) {
            throw new IllegalArgumentException(
                    String.format("Not a tape symbol: 0x%02X (expected printable ASCII)", (int) value));
        }
    }

    /**
     * Symbol for a tape input character. Space and {@code _} both mean blank.
     */
    public static @NotNull Symbol of(char c) {
        if (c == ' ' || c == BLANK_CHAR) {
            return BLANK;
        }
        return new Symbol(c);
    }

    /**
     * Symbol for a character written in a program, where only {@code _} means blank.
     */
    public static @NotNull Symbol literal(char c) {
        return c == BLANK_CHAR ? BLANK : new Symbol(c);
    }

    /**
     * @return true for printable, non-space ASCII
     */
    public static boolean isPrintable(char c) {
        return c > 0x20 && c < 0x7F;
    }

    public boolean isBlank() {
        return value == BLANK_CHAR;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
