package io.github.manjago.gtm.core;

import io.github.manjago.gtm.core.Token.Type;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<Type> types(String source) throws SyntaxException {
        return new Tokenizer(source).tokenize().stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        @DisplayName("Rule line produces the expected token sequence")
        void ruleLine() throws SyntaxException {
            assertEquals(List.of(Type.NAME, Type.LT, Type.NAME, Type.GT, Type.SYMBOL, Type.EQUALS,
                            Type.SYMBOL, Type.SEMICOLON, Type.NAME, Type.MOVE, Type.EOF),
                    types("back<fn> 0 = _; fn next"));
        }

        @Test
        @DisplayName("Keywords get their own types")
        void keywords() throws SyntaxException {
            List<Token> tokens = new Tokenizer("start prev current next finish").tokenize();
            assertEquals(Type.START, tokens.get(0).type());
            assertEquals(Type.MOVE, tokens.get(1).type());
            assertEquals(Type.MOVE, tokens.get(2).type());
            assertEquals(Type.MOVE, tokens.get(3).type());
            assertEquals(Type.NAME, tokens.get(4).type());
        }

        @Test
        @DisplayName("Names may contain digits and underscores after the first letter")
        void namesWithDigits() throws SyntaxException {
            List<Token> tokens = new Tokenizer("state_2a").tokenize();
            assertEquals(Type.NAME, tokens.get(0).type());
            assertEquals("state_2a", tokens.get(0).text());
        }

        @Test
        @DisplayName("Quoted literal yields its character")
        void quotedLiteral() throws SyntaxException {
            Token token = new Tokenizer("'x'").tokenize().get(0);
            assertEquals(Type.SYMBOL, token.type());
            assertEquals("x", token.text());
        }

        @Test
        @DisplayName("Quoted space is a literal")
        void quotedSpace() throws SyntaxException {
            Token token = new Tokenizer("' '").tokenize().get(0);
            assertEquals(Type.SYMBOL, token.type());
            assertEquals(" ", token.text());
        }

        @Test
        @DisplayName("Output always ends with EOF")
        void endsWithEof() throws SyntaxException {
            assertEquals(List.of(Type.EOF), types(""));
            assertEquals(List.of(Type.NEWLINE, Type.EOF), types("   \n  "));
        }
    }

    @Nested
    @DisplayName("Comments and lines")
    class CommentsAndLines {

        @Test
        @DisplayName("Line comment runs to end of line")
        void lineComment() throws SyntaxException {
            assertEquals(List.of(Type.NAME, Type.NEWLINE, Type.NAME, Type.EOF),
                    types("a // b c = ;\nd"));
        }

        @Test
        @DisplayName("Multi-line block comment counts as one line break")
        void blockCommentSpanningLines() throws SyntaxException {
            List<Token> tokens = new Tokenizer("a /* one\ntwo\nthree */ b").tokenize();
            assertEquals(List.of(Type.NAME, Type.NEWLINE, Type.NAME, Type.EOF),
                    tokens.stream().map(Token::type).toList());
            assertEquals(3, tokens.get(2).line());
        }

        @Test
        @DisplayName("Single-line block comment disappears")
        void inlineBlockComment() throws SyntaxException {
            assertEquals(List.of(Type.NAME, Type.NAME, Type.EOF), types("a /* x */ b"));
        }

        @Test
        @DisplayName("Tokens carry 1-based line numbers")
        void lineNumbers() throws SyntaxException {
            List<Token> tokens = new Tokenizer("a\n\nb").tokenize();
            assertEquals(1, tokens.get(0).line());
            assertEquals(3, tokens.get(3).line());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unterminated block comment reports its start line")
        void unterminatedComment() {
            SyntaxException e = assertThrows(SyntaxException.class,
                    () -> new Tokenizer("a\n/* never closed\n").tokenize());
            assertEquals(2, e.getLine());
        }

        @ParameterizedTest
        @ValueSource(strings = {"''", "'ab'", "'''", "'_'", "'x"})
        @DisplayName("Invalid quoted literals are rejected")
        void badLiterals(String literal) {
            assertThrows(SyntaxException.class, () -> new Tokenizer(literal).tokenize());
        }

        @ParameterizedTest
        @ValueSource(strings = {"#", "a + b", "x @ y", "-"})
        @DisplayName("Unknown characters are rejected")
        void unknownCharacters(String source) {
            assertThrows(SyntaxException.class, () -> new Tokenizer(source).tokenize());
        }
    }
}
