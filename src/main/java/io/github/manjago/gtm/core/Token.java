package io.github.manjago.gtm.core;

/**
 * Lexical token with the line it starts on.
 */
public record Token(Type type, String text, int line) {

    public enum Type {
        NAME,
        SYMBOL,
        START,
        MOVE,
        LT,
        GT,
        COMMA,
        EQUALS,
        SEMICOLON,
        NEWLINE,
        EOF
    }

    /**
     * Token as it should appear in an error message.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
