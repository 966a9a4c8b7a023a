package io.github.manjago.gtm.core;

/**
 * One parsed rule line: {@code state input = output; target movement}.
 *
 * @param input  symbol that must be under the head
 * @param output symbol written in its place
 * @param target next state, possibly referring to placeholders
 * @param movement head movement after writing
 * @param line   1-based source line
 */
public record TransitionRule(
    Symbol input,
    Symbol output,
    StateReference target,
    Movement movement,
    int line
) {}
