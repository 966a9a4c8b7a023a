package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.core.InstanceKey;

/**
 * Breakpoint on a state definition.
 * <p>
 * Matches every instance specialized from the definition, whatever its arguments:
 * a breakpoint on {@code back} stops in {@code back<add>} and {@code back<finish>} alike.
 *
 * @param id         number shown to the user, unique within a debugger
 * @param definition state name without arguments
 */
public record Breakpoint(int id, String definition) {

    public boolean matches(InstanceKey key) {
        return key.definition().equals(definition);
    }
}
