package io.github.manjago.gtm.core;

/**
 * Malformed program text.
 */
public class SyntaxException extends ProgramException {

    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, int line) {
        super(message, line);
    }
}
