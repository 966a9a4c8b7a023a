package io.github.manjago.gtm.core;

/**
 * Two rules of one state match the same input symbol.
 */
public class DuplicateRuleException extends ProgramException {

    private final String state;
    private final Symbol symbol;
    private final int previousLine;

    public DuplicateRuleException(String state, Symbol symbol, int line, int previousLine) {
        super(String.format("Duplicate rule for state '%s' on symbol '%s' (first defined on line %d)",
                state, symbol, previousLine), line);
        this.state = state;
        this.symbol = symbol;
        this.previousLine = previousLine;
    }

    public String getState() {
        return state;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public int getPreviousLine() {
        return previousLine;
    }
}
