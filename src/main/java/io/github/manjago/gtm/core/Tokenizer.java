package io.github.manjago.gtm.core;

import java.util.ArrayList;
import java.util.List;

import io.github.manjago.gtm.core.Token.Type;

/**
 * Splits program text into tokens.
 * <p>
 * Whitespace other than newlines is dropped. Line comments ({@code // ...}) run to the end of
 * the line; block comments ({@code /* ... *}{@code /}) may span lines and then count as one
 * line break. Keywords {@code start}, {@code prev}, {@code current} and {@code next} get their
 * own token types.
 */
public final class Tokenizer {

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int offset;
    private int line = 1;

    public Tokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the whole input. The result always ends with an {@link Type#EOF} token.
     *
     * @throws SyntaxException on a character that cannot start a token
     */
    public List<Token> tokenize() throws SyntaxException {
        while (offset < input.length()) {
            char c = input.charAt(offset);

            if (c == '\n') {
                add(Type.NEWLINE, "\n");
                offset++;
                line++;
            } else if (Character.isWhitespace(c)) {
                offset++;
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '\'') {
                readQuotedSymbol();
            } else if (c == '_' || isDigit(c)) {
                add(Type.SYMBOL, String.valueOf(c));
                offset++;
            } else if (isLetter(c)) {
                readWord();
            } else {
                Type punctuation = punctuation(c);
                if (punctuation == null) {
                    throw new SyntaxException("Unexpected character '" + c + "'", line);
                }
                add(punctuation, String.valueOf(c));
                offset++;
            }
        }
        add(Type.EOF, "");
        return tokens;
    }

    private void skipLineComment() {
        while (offset < input.length() && input.charAt(offset) != '\n') {
            offset++;
        }
    }

    private void skipBlockComment() throws SyntaxException {
        int startLine = line;
        int end = input.indexOf("*/", offset + 2);
        if (end < 0) {
            throw new SyntaxException("Unterminated block comment", startLine);
        }
        int breaks = 0;
        for (int i = offset; i < end; i++) {
            if (input.charAt(i) == '\n') {
                breaks++;
            }
        }
        if (breaks > 0) {
            add(Type.NEWLINE, "\n");
            line += breaks;
        }
        offset = end + 2;
    }

    private void readQuotedSymbol() throws SyntaxException {
        if (offset + 2 >= input.length() || input.charAt(offset + 2) != '\'') {
            throw new SyntaxException("Invalid character literal: expected a single character between quotes", line);
        }
        char value = input.charAt(offset + 1);
        if ((value != ' ' && !Symbol.isPrintable(value)) || value == '\'' || value == Symbol.BLANK_CHAR) {
            throw new SyntaxException("Invalid character literal '" + value
                    + "': use printable ASCII or space, other than quote and _ (write _ unquoted for blank)", line);
        }
        add(Type.SYMBOL, String.valueOf(value));
        offset += 3;
    }

    private void readWord() {
        int start = offset;
        while (offset < input.length()) {
            char c = input.charAt(offset);
            if (isLetter(c) || isDigit(c) || c == '_') {
                offset++;
            } else {
                break;
            }
        }
        String word = input.substring(start, offset);
        if (word.equals("start")) {
            add(Type.START, word);
        } else if (Movement.fromKeyword(word) != null) {
            add(Type.MOVE, word);
        } else {
            add(Type.NAME, word);
        }
    }

    private Type punctuation(char c) {
        return switch (c) {
            case '<' -> Type.LT;
            case '>' -> Type.GT;
            case ',' -> Type.COMMA;
            case '=' -> Type.EQUALS;
            case ';' -> Type.SEMICOLON;
            default -> null;
        };
    }

    private char peek(int ahead) {
        int i = offset + ahead;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private void add(Type type, String text) {
        tokens.add(new Token(type, text, line));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
