package io.github.manjago.gtm.core;

/**
 * A state is referenced (or re-declared) with the wrong number of generic arguments.
 */
public class ArityMismatchException extends ProgramException {

    private final String state;
    private final int expected;
    private final int actual;

    public ArityMismatchException(String state, int expected, int actual, int line) {
        super(String.format("State '%s' takes %d generic argument(s), found %d", state, expected, actual), line);
        this.state = state;
        this.expected = expected;
        this.actual = actual;
    }

    public String getState() {
        return state;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
