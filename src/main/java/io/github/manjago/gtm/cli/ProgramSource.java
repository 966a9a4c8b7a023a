package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.Monomorphizer;
import io.github.manjago.gtm.core.Parser;
import io.github.manjago.gtm.core.Program;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.core.StateDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Program text loaded by a command, and the steps that turn it into a table.
 */
public final class ProgramSource {

    /** File argument meaning standard input */
    public static final String STDIN = "-";

    private final String origin;
    private final String text;

    private Program program;

    public ProgramSource(String origin, String text) {
        this.origin = origin;
        this.text = text;
    }

    /**
     * Read a whole program.
     *
     * @param location file path, or null / {@value #STDIN} for {@code stdin}
     */
    public static ProgramSource read(String location, InputStream stdin) throws IOException {
        if (isStdin(location)) {
            return new ProgramSource("<stdin>", new String(stdin.readAllBytes(), StandardCharsets.UTF_8));
        }
        return new ProgramSource(location, Files.readString(Path.of(location), StandardCharsets.UTF_8));
    }

    public static boolean isStdin(String location) {
        return location == null || location.equals(STDIN);
    }

    public Program parse() throws ProgramException {
        program = new Parser().parse(text);
        return program;
    }

    /**
     * Parse and specialize.
     */
    public SpecializedTable compile(GtmConfig config) throws ProgramException {
        return new Monomorphizer(config.maxNestingDepth()).resolve(parse());
    }

    /**
     * Parsed program, or null before a successful {@link #parse()}.
     */
    public Program getProgram() {
        return program;
    }

    public String getOrigin() {
        return origin;
    }

    /**
     * Print one warning per definition the start state never reaches.
     */
    public void printWarnings(SpecializedTable table, PrintWriter err) {
        for (StateDefinition def : table.getUnreachable()) {
            err.printf("⚠️  %s:%d: state '%s' is never reached%n", origin, def.getLine(), def.signature());
        }
    }

    /**
     * Print a program error with the source line it points at.
     */
    public void printError(ProgramException e, PrintWriter err) {
        err.println("❌ " + origin + ": " + e.getMessage());
        if (!e.hasLine()) {
            return;
        }
        String[] lines = text.split("\n", -1);
        if (e.getLine() > lines.length) {
            return;
        }
        String line = lines[e.getLine() - 1].stripTrailing();
        String gutter = String.format("%5d | ", e.getLine());
        int indent = line.length() - line.stripLeading().length();
        err.println(gutter + line);
        err.println(" ".repeat(gutter.length() + indent) + "^".repeat(Math.max(1, line.length() - indent)));
    }
}
