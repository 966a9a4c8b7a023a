package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.TestPrograms;
import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.Monomorphizer;
import io.github.manjago.gtm.core.Parser;
import io.github.manjago.gtm.core.Program;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.sim.Machine;
import io.github.manjago.gtm.sim.Tape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DebuggerTest {

    private Program invert;
    private Debugger debugger;

    @BeforeEach
    void setUp() throws ProgramException {
        invert = new Parser().parse(TestPrograms.source("invert.tm"));
        debugger = newDebugger(invert, "01", 1_000);
    }

    private static Debugger newDebugger(Program program, String tape, long maxContinue) throws ProgramException {
        Machine machine = new Machine(new Monomorphizer().resolve(program), Tape.of(tape));
        return new Debugger(machine, program, 2, maxContinue);
    }

    // ========== Stepping ==========

    @Nested
    @DisplayName("Stepping")
    class Stepping {

        @Test
        @DisplayName("Step executes exactly one transition")
        void singleStep() {
            assertEquals(StopReason.STEPPED, debugger.step());
            assertEquals(1, debugger.getMachine().getSteps());
        }

        @Test
        @DisplayName("Step count stops early when the machine accepts")
        void stepCountStopsOnAccept() {
            assertEquals(StopReason.ACCEPTED, debugger.step(100));
            assertEquals(12, debugger.getMachine().getSteps());
        }

        @Test
        @DisplayName("Stepping a stuck machine reports STUCK")
        void stuck() throws ProgramException {
            Debugger dbg = newDebugger(new Parser().parse(TestPrograms.source("div3.tm")), "1", 100);
            assertEquals(StopReason.STUCK, dbg.step(5));
            assertEquals(1, dbg.getMachine().getSteps());
        }

        @Test
        @DisplayName("Step count must be positive")
        void badCount() {
            assertThrows(IllegalArgumentException.class, () -> debugger.step(0));
        }
    }

    // ========== Breakpoints ==========

    @Nested
    @DisplayName("Breakpoints")
    class Breakpoints {

        @Test
        @DisplayName("Breakpoint on a generic name fires in every instantiation")
        void genericBreakpoint() {
            debugger.addBreakpoint("back");

            Set<InstanceKey> stoppedIn = new LinkedHashSet<>();
            StopReason reason;
            while ((reason = debugger.continueRun()) == StopReason.BREAKPOINT) {
                InstanceKey current = debugger.getMachine().getCurrent();
                assertEquals("back", current.definition());
                stoppedIn.add(current);
            }

            assertEquals(StopReason.ACCEPTED, reason);
            InstanceKey backFinish = InstanceKey.of("back", InstanceKey.FINISH);
            assertEquals(List.of(InstanceKey.of("back", InstanceKey.of("flip", backFinish)), backFinish),
                    List.copyOf(stoppedIn));
        }

        @Test
        @DisplayName("Continue stops right after entering the breakpoint state")
        void firstHit() {
            Breakpoint bp = debugger.addBreakpoint("flip");
            assertEquals(StopReason.BREAKPOINT, debugger.continueRun());
            assertEquals(6, debugger.getMachine().getSteps());
            assertEquals(bp, debugger.getLastHit().orElseThrow());
        }

        @Test
        @DisplayName("Continue from a breakpoint state moves on")
        void continueMovesOn() {
            debugger.addBreakpoint("flip");
            debugger.continueRun();
            long before = debugger.getMachine().getSteps();
            debugger.continueRun();
            assertTrue(debugger.getMachine().getSteps() > before);
        }

        @Test
        @DisplayName("Without breakpoints continue runs to the end")
        void continueToEnd() {
            assertEquals(StopReason.ACCEPTED, debugger.continueRun());
            assertTrue(debugger.getMachine().isAccepted());
            assertTrue(debugger.getLastHit().isEmpty());
        }

        @Test
        @DisplayName("Continue pauses at the configured step cap")
        void continueCap() throws ProgramException {
            Debugger dbg = newDebugger(new Parser().parse(TestPrograms.source("bounce.tm")), "", 50);
            assertEquals(StopReason.STEP_LIMIT, dbg.continueRun());
            assertEquals(50, dbg.getMachine().getSteps());
            assertEquals(StopReason.STEP_LIMIT, dbg.continueRun());
            assertEquals(100, dbg.getMachine().getSteps());
        }

        @Test
        @DisplayName("Ids increase and removal works by id or by name")
        void removal() {
            Breakpoint a = debugger.addBreakpoint("back");
            Breakpoint b = debugger.addBreakpoint("flip");
            debugger.addBreakpoint("back");
            assertEquals(1, a.id());
            assertEquals(2, b.id());

            assertTrue(debugger.removeBreakpoint(2));
            assertFalse(debugger.removeBreakpoint(2));
            assertEquals(2, debugger.removeBreakpoints("back"));
            assertTrue(debugger.getBreakpoints().isEmpty());

            debugger.addBreakpoint("right");
            assertEquals(4, debugger.getBreakpoints().get(0).id());
            assertEquals(1, debugger.clearBreakpoints());
        }

        @Test
        @DisplayName("Breakpoints take plain names only")
        void plainNamesOnly() {
            assertThrows(IllegalArgumentException.class, () -> debugger.addBreakpoint("back<finish>"));
            assertThrows(IllegalArgumentException.class, () -> debugger.addBreakpoint(" "));
        }

        @Test
        @DisplayName("Reachability check looks at specialized instances")
        void reachable() {
            assertTrue(debugger.isReachable("flip"));
            assertTrue(debugger.isReachable("finish"));
            assertFalse(debugger.isReachable("nowhere"));
        }
    }

    // ========== Inspection and reset ==========

    @Nested
    @DisplayName("Inspection")
    class Inspection {

        @Test
        @DisplayName("Snapshot shows the window around the head and the next rule")
        void snapshot() {
            Snapshot s = debugger.inspect();

            assertEquals("right<back<flip<back<finish>>>>", s.state().toString());
            assertEquals(0, s.head());
            assertEquals(-2, s.windowStart());
            assertEquals("__01_", s.tapeText());
            assertEquals(Symbol.of('0'), s.current());
            assertNotNull(s.next());
            assertEquals(5, s.next().line());
            assertEquals("right<fn> 0 = 0; right<fn> next", s.sourceLine());
            assertFalse(s.isAccepted());
            assertFalse(s.isStuck());
        }

        @Test
        @DisplayName("Snapshot of an accepted machine has no next rule")
        void acceptedSnapshot() {
            debugger.continueRun();
            Snapshot s = debugger.inspect();
            assertTrue(s.isAccepted());
            assertNull(s.next());
            assertNull(s.sourceLine());
        }

        @Test
        @DisplayName("Reset keeps breakpoints")
        void resetKeepsBreakpoints() {
            debugger.addBreakpoint("flip");
            debugger.continueRun();
            debugger.reset();

            assertEquals(0, debugger.getMachine().getSteps());
            assertEquals(1, debugger.getBreakpoints().size());
            assertTrue(debugger.getLastHit().isEmpty());
            assertEquals(StopReason.BREAKPOINT, debugger.continueRun());
        }

        @Test
        @DisplayName("Load starts over on a new tape")
        void load() {
            debugger.step(3);
            debugger.load(Tape.of("111"));
            assertEquals(0, debugger.getMachine().getSteps());
            assertEquals("__111", debugger.inspect().tapeText());
        }
    }
}
