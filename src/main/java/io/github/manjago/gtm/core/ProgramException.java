package io.github.manjago.gtm.core;

/**
 * Base class for errors that reject a whole program before it runs.
 * <p>
 * Carries the 1-based source line when one is known, -1 otherwise.
 */
public class ProgramException extends Exception {

    private final int line;

    public ProgramException(String message) {
        super(message);
        this.line = -1;
    }

    public ProgramException(String message, int line) {
        super(line > 0 ? "Line " + line + ": " + message : message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLine() {
        return line > 0;
    }
}
