package io.github.manjago.gtm.core;

import io.github.manjago.gtm.core.Token.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Parser for generic Turing machine programs.
 * <p>
 * Turns program text into a {@link Program}: one definition per state name and the single
 * start reference.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * // Comment (from // to end of line), or a block comment between slash-star and star-slash
 * start = state                                 // exactly once
 * state input = output; target movement        // one rule
 * state&lt;p1, p2&gt; input = output; target&lt;p1&gt; movement
 * </pre>
 * Symbols are a digit, {@code _} for blank, or a quoted character like {@code 'x'}.
 * Movements are {@code prev}, {@code current} and {@code next}. A line break right after
 * {@code =}, {@code ;}, {@code <} or {@code ,} continues the statement.
 *
 * <h2>Example:</h2>
 * <pre>
 * start = even
 * even 0 = 0; even next
 * even 1 = 1; switch next
 * even _ = _; finish current
 * back&lt;fn&gt; 0 = 0; back&lt;fn&gt; prev
 * back&lt;fn&gt; _ = _; fn next
 * </pre>
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /** Terminal state; it has no rules and user programs cannot define it */
    public static final String FINISH = "finish";

    /**
     * Parse program text.
     *
     * @param source whole program
     * @return parsed program
     * @throws ProgramException on the first syntax or declaration error
     */
    public Program parse(String source) throws ProgramException {
        List<String> lines = source.lines().toList();
        Cursor in = new Cursor(new Tokenizer(source).tokenize());

        Map<String, DefinitionBuilder> builders = new LinkedHashMap<>();
        StateReference start = null;
        int startLine = -1;

        while (true) {
            in.skipNewlines();
            Token first = in.peek();
            if (first.type() == Type.EOF) {
                break;
            }

            if (first.type() == Type.START) {
                if (start != null) {
                    throw new SyntaxException("Only one start assignment is allowed (first one on line "
                            + startLine + ")", first.line());
                }
                in.next();
                in.expect(Type.EQUALS, "'='");
                in.skipNewlines();
                start = parseReference(in);
                startLine = first.line();
            } else if (first.type() == Type.NAME) {
                parseRule(in, builders);
            } else {
                throw new SyntaxException("Expected 'start' or a state name, found " + first.describe(),
                        first.line());
            }

            Token end = in.next();
            if (end.type() != Type.NEWLINE && end.type() != Type.EOF) {
                throw new SyntaxException("Trailing input " + end.describe() + ", expected end of line",
                        end.line());
            }
            if (end.type() == Type.EOF) {
                break;
            }
        }

        if (start == null) {
            throw new SyntaxException("Missing start assignment (add a line like 'start = state')");
        }

        checkPlaceholders(builders);

        List<StateDefinition> definitions = new ArrayList<>();
        for (DefinitionBuilder builder : builders.values()) {
            definitions.add(builder.build());
        }

        log.info("Parsed {} state definitions from {} lines", definitions.size(), lines.size());
        return new Program(definitions, start, startLine, lines);
    }

    /**
     * Rule line: {@code head input = output; target movement}.
     */
    private void parseRule(Cursor in, Map<String, DefinitionBuilder> builders) throws ProgramException {
        Token head = in.next();
        String name = head.text();
        int line = head.line();

        if (name.equals(FINISH)) {
            throw new SyntaxException("State '" + FINISH + "' is reserved and cannot have rules", line);
        }

        List<String> parameters = new ArrayList<>();
        if (in.accept(Type.LT)) {
            in.skipNewlines();
            do {
                Token param = in.expect(Type.NAME, "parameter name");
                if (in.peek().type() == Type.LT) {
                    throw new SyntaxException("Parameter '" + param.text() + "' of '" + name
                            + "' must be a plain name", param.line());
                }
                if (param.text().equals(FINISH)) {
                    throw new SyntaxException("'" + FINISH + "' cannot be used as a parameter name", param.line());
                }
                if (parameters.contains(param.text())) {
                    throw new SyntaxException("Parameter '" + param.text() + "' declared twice in '"
                            + name + "'", param.line());
                }
                parameters.add(param.text());
            } while (in.acceptComma());
            in.expect(Type.GT, "'>' or ','");
        }

        Symbol input = parseSymbol(in);
        in.expect(Type.EQUALS, "'='");
        in.skipNewlines();
        Symbol output = parseSymbol(in);
        in.expect(Type.SEMICOLON, "';'");
        in.skipNewlines();
        StateReference target = parseReference(in);
        Token move = in.expect(Type.MOVE, "movement (prev, current or next)");
        Movement movement = Movement.fromKeyword(move.text());

        checkPlaceholderArguments(target, parameters, line);

        DefinitionBuilder builder = builders.get(name);
        if (builder == null) {
            builder = new DefinitionBuilder(name, parameters, line);
            builders.put(name, builder);
        } else if (builder.parameters.size() != parameters.size()) {
            throw new ArityMismatchException(name, builder.parameters.size(), parameters.size(), line);
        } else if (!builder.parameters.equals(parameters)) {
            target = renameParameters(target, parameters, builder, line);
        }

        builder.addRule(new TransitionRule(input, output, target, movement, line));
    }

    /**
     * Reference: {@code name} or {@code name<arg, ...>}, arguments nest.
     */
    private StateReference parseReference(Cursor in) throws SyntaxException {
        Token name = in.expect(Type.NAME, "state name");
        List<StateReference> arguments = new ArrayList<>();
        if (in.accept(Type.LT)) {
            in.skipNewlines();
            do {
                arguments.add(parseReference(in));
            } while (in.acceptComma());
            in.expect(Type.GT, "'>' or ','");
        }
        return new StateReference(name.text(), arguments);
    }

    private Symbol parseSymbol(Cursor in) throws SyntaxException {
        Token token = in.expect(Type.SYMBOL, "symbol (digit, _ or quoted character)");
        return Symbol.literal(token.text().charAt(0));
    }

    /**
     * Placeholders stand for concrete states, so {@code fn<x>} is meaningless when fn is one.
     */
    private void checkPlaceholderArguments(StateReference ref, List<String> parameters, int line)
            throws SyntaxException {
        if (!ref.isBare() && parameters.contains(ref.name())) {
            throw new SyntaxException("Placeholder '" + ref.name() + "' cannot take generic arguments", line);
        }
        for (StateReference arg : ref.arguments()) {
            checkPlaceholderArguments(arg, parameters, line);
        }
    }

    /**
     * Bring a rule written with different parameter names onto the names of the first declaration.
     */
    private StateReference renameParameters(StateReference target, List<String> parameters,
                                            DefinitionBuilder builder, int line) throws SyntaxException {
        Map<String, String> names = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            names.put(parameters.get(i), builder.parameters.get(i));
        }
        for (String bare : bareNames(target, new HashSet<>())) {
            if (!names.containsKey(bare) && builder.parameters.contains(bare)) {
                throw new SyntaxException("State '" + bare + "' clashes with parameter '" + bare + "' of '"
                        + builder.name + "' declared on line " + builder.line
                        + "; use the same parameter names on every line", line);
            }
        }
        return target.rename(names);
    }

    /**
     * Bare names used inside generic definitions must be parameters or real states.
     */
    private void checkPlaceholders(Map<String, DefinitionBuilder> builders) throws UndeclaredPlaceholderException {
        for (DefinitionBuilder builder : builders.values()) {
            if (builder.parameters.isEmpty()) {
                continue;
            }
            for (TransitionRule rule : builder.rules.values()) {
                for (String bare : bareNames(rule.target(), new LinkedHashSet<>())) {
                    if (!builder.parameters.contains(bare) && !builders.containsKey(bare) && !bare.equals(FINISH)) {
                        throw new UndeclaredPlaceholderException(builder.name, bare, rule.line());
                    }
                }
            }
        }
    }

    private static Set<String> bareNames(StateReference ref, Set<String> into) {
        if (ref.isBare()) {
            into.add(ref.name());
        }
        for (StateReference arg : ref.arguments()) {
            bareNames(arg, into);
        }
        return into;
    }

    // ========== Helper classes ==========

    /**
     * Rules collected for one state name while scanning.
     */
    private static final class DefinitionBuilder {
        private final String name;
        private final List<String> parameters;
        private final int line;
        private final Map<Symbol, TransitionRule> rules = new LinkedHashMap<>();

        DefinitionBuilder(String name, List<String> parameters, int line) {
            this.name = name;
            this.parameters = List.copyOf(parameters);
            this.line = line;
        }

        void addRule(TransitionRule rule) throws DuplicateRuleException {
            TransitionRule previous = rules.get(rule.input());
            if (previous != null) {
                throw new DuplicateRuleException(name, rule.input(), rule.line(), previous.line());
            }
            rules.put(rule.input(), rule);
        }

        StateDefinition build() {
            return new StateDefinition(name, parameters, rules, line);
        }
    }

    /**
     * Position in the token list.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token next() {
            Token token = tokens.get(pos);
            if (token.type() != Type.EOF) {
                pos++;
            }
            return token;
        }

        boolean accept(Type type) {
            if (peek().type() == type) {
                next();
                return true;
            }
            return false;
        }

        /**
         * Consume a comma and any line breaks after it.
         */
        boolean acceptComma() {
            if (accept(Type.COMMA)) {
                skipNewlines();
                return true;
            }
            return false;
        }

        Token expect(Type type, String what) throws SyntaxException {
            Token token = peek();
            if (token.type() != type) {
                throw new SyntaxException("Expected " + what + ", found " + token.describe(), token.line());
            }
            return next();
        }

        void skipNewlines() {
            while (peek().type() == Type.NEWLINE) {
                next();
            }
        }
    }
}
