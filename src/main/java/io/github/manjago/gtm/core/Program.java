package io.github.manjago.gtm.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed program: state definitions plus the single start reference.
 * <p>
 * Immutable. Keeps the source lines so later stages can quote the line a rule came from.
 */
public final class Program {

    private final Map<String, StateDefinition> definitions;
    private final StateReference start;
    private final int startLine;
    private final List<String> sourceLines;

    public Program(Collection<StateDefinition> definitions, StateReference start, int startLine,
                   List<String> sourceLines) {
        Map<String, StateDefinition> byName = new LinkedHashMap<>();
        for (StateDefinition def : definitions) {
            byName.put(def.getName(), def);
        }
        this.definitions = Collections.unmodifiableMap(byName);
        this.start = start;
        this.startLine = startLine;
        this.sourceLines = List.copyOf(sourceLines);
    }

    /**
     * Definitions in order of first declaration.
     */
    public Collection<StateDefinition> getDefinitions() {
        return definitions.values();
    }

    /**
     * @return the definition, or null if no rule declares this name
     */
    public StateDefinition definition(String name) {
        return definitions.get(name);
    }

    public boolean isDefined(String name) {
        return definitions.containsKey(name);
    }

    public StateReference getStart() {
        return start;
    }

    public int getStartLine() {
        return startLine;
    }

    /**
     * Source text of a 1-based line, or null when out of range.
     */
    public String sourceLine(int line) {
        if (line < 1 || line > sourceLines.size()) {
            return null;
        }
        return sourceLines.get(line - 1);
    }

    public List<String> getSourceLines() {
        return sourceLines;
    }
}
