package io.github.manjago.gtm.sim;

import io.github.manjago.gtm.core.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TapeTest {

    @Test
    @DisplayName("Unset cells read blank in both directions")
    void unsetCellsAreBlank() {
        Tape tape = Tape.of("01");
        assertEquals(Symbol.of('0'), tape.read(0));
        assertEquals(Symbol.of('1'), tape.read(1));
        assertEquals(Symbol.BLANK, tape.read(2));
        assertEquals(Symbol.BLANK, tape.read(-1000));
    }

    @Test
    @DisplayName("Input spaces and underscores stay blank")
    void blanksInInput() {
        Tape tape = Tape.of("1 _1");
        assertEquals(2, tape.size());
        assertEquals("1__1", tape.render());
    }

    @Test
    @DisplayName("Writing blank clears the cell")
    void writeBlankClears() {
        Tape tape = Tape.of("101");
        tape.write(2, Symbol.BLANK);
        tape.write(0, Symbol.BLANK);
        assertEquals(1, tape.size());
        assertEquals(Tape.of(" 0"), tape);
        assertEquals("0", tape.render());
        assertEquals(1, tape.firstPosition());
    }

    @Test
    @DisplayName("Negative positions extend the tape to the left")
    void negativePositions() {
        Tape tape = new Tape();
        tape.write(-2, Symbol.of('x'));
        tape.write(1, Symbol.of('y'));
        assertEquals(-2, tape.firstPosition());
        assertEquals(1, tape.lastPosition());
        assertEquals("x__y", tape.render());
    }

    @Test
    @DisplayName("Window is inclusive and padded with blanks")
    void window() {
        Tape tape = Tape.of("ab");
        assertEquals(List.of(Symbol.BLANK, Symbol.of('a'), Symbol.of('b'), Symbol.BLANK),
                tape.window(-1, 2));
    }

    @Test
    @DisplayName("Empty tape")
    void emptyTape() {
        Tape tape = Tape.of("");
        assertTrue(tape.isEmpty());
        assertEquals("", tape.render());
        assertEquals(0, tape.firstPosition());
        assertEquals(-1, tape.lastPosition());
    }

    @Test
    @DisplayName("Copies are independent")
    void copyIsIndependent() {
        Tape original = Tape.of("1");
        Tape copy = new Tape(original);
        copy.write(0, Symbol.of('0'));
        assertEquals(Symbol.of('1'), original.read(0));
    }

    @Test
    @DisplayName("Characters that are not symbols are rejected")
    void badInput() {
        assertThrows(IllegalArgumentException.class, () -> Tape.of("1\t0"));
    }
}
