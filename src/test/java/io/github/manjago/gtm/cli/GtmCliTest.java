package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.TestPrograms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line.
 */
@DisplayName("CLI")
class GtmCliTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = GtmCli.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String program(String name) {
        return TestPrograms.path(name).toString();
    }

    private Path write(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    // ========== run ==========

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("Accepting run exits 0 and prints the tape")
        void accepts() {
            assertEquals(0, execute("run", program("div3.tm"), "--tape", "110"));
            assertTrue(out.toString().contains("Accepted after 4 steps"), out.toString());
            assertTrue(out.toString().contains("Tape: 110"));
        }

        @Test
        @DisplayName("Quiet run prints only the final tape")
        void quiet() {
            assertEquals(0, execute("run", program("invert.tm"), "-t", "0110", "-q"));
            assertEquals("1001", out.toString().strip());
        }

        @Test
        @DisplayName("Stuck run exits 1")
        void stuck() {
            assertEquals(1, execute("run", program("div3.tm"), "-t", "101"));
            assertTrue(err.toString().contains("❌ Rejected"), err.toString());
            assertTrue(err.toString().contains("'odd'"), err.toString());
        }

        @Test
        @DisplayName("Step limit from the command line")
        void stepLimit() {
            assertEquals(1, execute("run", program("bounce.tm"), "--max-steps", "100"));
            assertTrue(err.toString().contains("Step limit of 100 exceeded"), err.toString());
        }

        @Test
        @DisplayName("Step limit from a config file")
        void stepLimitFromConfig() {
            assertEquals(1, execute("run", program("bounce.tm"), "-f", program("test.conf")));
            assertTrue(err.toString().contains("Step limit of 50 exceeded"), err.toString());
        }

        @Test
        @DisplayName("Unreachable states are warned about before running")
        void warnings() throws IOException {
            Path file = write("extra.tm", "start = a\na _ = _; finish current\nb _ = _; a next\n");
            assertEquals(0, execute("run", file.toString()));
            assertTrue(err.toString().contains("state 'b' is never reached"), err.toString());
            assertTrue(out.toString().contains("Accepted after 1 steps"), out.toString());
        }

        @Test
        @DisplayName("Trace prints one line per step")
        void trace() {
            assertEquals(0, execute("run", program("div3.tm"), "-t", "11", "--trace"));
            long stepLines = out.toString().lines().filter(l -> l.contains("→")).count();
            assertEquals(3, stepLines, out.toString());
        }

        @Test
        @DisplayName("Program errors show the offending line")
        void programError() {
            assertEquals(1, execute("run", program("broken.tm")));
            String text = err.toString();
            assertTrue(text.contains("❌"), text);
            assertTrue(text.contains("Line 4: Duplicate rule"), text);
            assertTrue(text.contains("    4 | even 0 = 1; odd next"), text);
            assertTrue(text.contains("^^^"), text);
        }

        @Test
        @DisplayName("Bad tape character")
        void badTape() {
            assertEquals(1, execute("run", program("div3.tm"), "-t", "1\t0"));
            assertTrue(err.toString().contains("Bad tape"));
        }

        @Test
        @DisplayName("Missing file")
        void missingFile() {
            assertEquals(1, execute("run", tempDir.resolve("nope.tm").toString()));
            assertTrue(err.toString().contains("Cannot read program"));
        }
    }

    // ========== generate ==========

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("Prints the simulator format")
        void toStdout() {
            assertEquals(0, execute("generate", program("div3.tm")));
            assertTrue(out.toString().startsWith("name: generated turing machine\ninit: even\naccept: finish\n"),
                    out.toString());
        }

        @Test
        @DisplayName("Writes to a file with the configured name")
        void toFile() throws IOException {
            Path target = tempDir.resolve("out.txt");
            assertEquals(0, execute("generate", program("invert.tm"), "-o", target.toString(), "--name", "inv"));
            String text = Files.readString(target);
            assertTrue(text.startsWith("name: inv\n"), text);
        }

        @Test
        @DisplayName("Unexportable symbol exits 1")
        void exportError() throws IOException {
            Path file = write("comma.tm", "start = s\ns ',' = 0; finish current\n");
            assertEquals(1, execute("generate", file.toString()));
            assertTrue(err.toString().contains("Export error"));
        }

        @Test
        @DisplayName("Unreachable states produce a warning but still export")
        void warnings() throws IOException {
            Path file = write("extra.tm", "start = a\na _ = _; finish current\nb _ = _; a next\n");
            assertEquals(0, execute("generate", file.toString()));
            assertTrue(err.toString().contains("state 'b' is never reached"), err.toString());
        }
    }

    // ========== check and info ==========

    @Nested
    @DisplayName("check and info")
    class CheckAndInfo {

        @Test
        @DisplayName("Check summarizes the specialized table")
        void check() {
            assertEquals(0, execute("check", program("invert.tm"), "--table"));
            String text = out.toString();
            assertTrue(text.contains("3 definitions → 5 states, 12 transitions"), text);
            assertTrue(text.contains("back<finish>:"), text);
        }

        @Test
        @DisplayName("Depth override triggers the cycle check")
        void depthOverride() throws IOException {
            Path file = write("grow.tm", "start = r<finish>\nr<x> 0 = 0; r<r<x>> next\nr<x> _ = _; x current\n");
            assertEquals(1, execute("check", file.toString(), "--max-depth", "3"));
            assertTrue(err.toString().contains("more than 3 levels deeper"), err.toString());
        }

        @Test
        @DisplayName("Depth override does not limit references written in the program")
        void depthOverrideKeepsWrittenNesting() {
            assertEquals(0, execute("check", program("invert.tm"), "--max-depth", "1"));
        }

        @Test
        @DisplayName("Cycle is reported with its line")
        void cycle() throws IOException {
            Path file = write("spin.tm", "start = spin<finish>\nspin<x> 0 = 0; spin<x> current\n");
            assertEquals(1, execute("check", file.toString()));
            assertTrue(err.toString().contains("Line 2:"), err.toString());
        }

        @Test
        @DisplayName("Info shows the effective configuration")
        void info() {
            assertEquals(0, execute("info", "-f", program("test.conf")));
            assertTrue(out.toString().contains("from test config"), out.toString());
        }

        @Test
        @DisplayName("Unknown option is a usage error")
        void usageError() {
            assertEquals(2, execute("run", "--bogus"));
        }
    }

    // ========== debug ==========

    @Nested
    @DisplayName("debug")
    class Debug {

        private final ByteArrayOutputStream sessionOut = new ByteArrayOutputStream();
        private final ByteArrayOutputStream sessionErr = new ByteArrayOutputStream();

        private int debug(String input, String... args) {
            DebugCommand command = new DebugCommand(
                    new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                    new PrintStream(sessionOut, true, StandardCharsets.UTF_8),
                    new PrintStream(sessionErr, true, StandardCharsets.UTF_8));
            return new CommandLine(command).execute(args);
        }

        @Test
        @DisplayName("Session with tape option")
        void withTapeOption() {
            assertEquals(0, debug("b flip\ncontinue\nquit\n", program("invert.tm"), "--tape", "01"));
            String text = sessionOut.toString(StandardCharsets.UTF_8);
            assertTrue(text.contains("Breakpoint #1 (flip) hit at step 6"), text);
        }

        @Test
        @DisplayName("Tape is asked for when not given")
        void promptsForTape() {
            assertEquals(0, debug("110\nrun\n", program("div3.tm")));
            String text = sessionOut.toString(StandardCharsets.UTF_8);
            assertTrue(text.contains("Input: "), text);
            assertTrue(text.contains("Accepted after 4 steps"), text);
        }

        @Test
        @DisplayName("Unreachable states are warned about before the session")
        void warnings() throws IOException {
            Path file = write("extra.tm", "start = a\na _ = _; finish current\nb _ = _; a next\n");
            assertEquals(0, debug("quit\n", file.toString(), "--tape", "_"));
            assertTrue(sessionErr.toString(StandardCharsets.UTF_8).contains("state 'b' is never reached"));
        }

        @Test
        @DisplayName("Program must come from a file")
        void needsFile() {
            assertEquals(1, debug("", "-"));
            assertTrue(sessionErr.toString(StandardCharsets.UTF_8).contains("pass the program as a file"));
        }
    }
}
