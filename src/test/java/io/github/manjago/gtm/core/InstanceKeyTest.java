package io.github.manjago.gtm.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstanceKeyTest {

    private final InstanceKey nested = InstanceKey.of("pair",
            InstanceKey.of("back", InstanceKey.FINISH), InstanceKey.of("done"));

    @Test
    @DisplayName("Canonical text has no spaces")
    void canonicalText() {
        assertEquals("pair<back<finish>,done>", nested.toString());
        assertEquals("finish", InstanceKey.FINISH.toString());
    }

    @Test
    @DisplayName("Keys compare structurally")
    void structuralEquality() {
        InstanceKey same = InstanceKey.of("pair",
                InstanceKey.of("back", InstanceKey.of("finish")), InstanceKey.of("done"));
        assertEquals(nested, same);
        assertEquals(nested.hashCode(), same.hashCode());
        assertTrue(InstanceKey.of("finish").isFinish());
        assertNotEquals(nested, InstanceKey.of("pair", InstanceKey.of("done"), InstanceKey.of("back")));
    }

    @Test
    @DisplayName("Depth counts nesting levels")
    void depth() {
        assertEquals(1, InstanceKey.FINISH.depth());
        assertEquals(3, nested.depth());
    }

    @Test
    @DisplayName("Definition name stays apart from the arguments")
    void definition() {
        assertEquals("pair", nested.definition());
        assertEquals(2, nested.arguments().size());
    }
}
