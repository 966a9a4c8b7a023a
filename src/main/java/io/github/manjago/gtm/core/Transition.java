package io.github.manjago.gtm.core;

/**
 * One specialized transition: what happens when a state reads a given symbol.
 *
 * @param output   symbol written under the head
 * @param target   next state
 * @param movement head movement
 * @param line     source line of the rule this was specialized from
 */
public record Transition(Symbol output, InstanceKey target, Movement movement, int line) {}
