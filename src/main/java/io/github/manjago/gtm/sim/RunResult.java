package io.github.manjago.gtm.sim;

/**
 * Outcome of a run that reached the finish state.
 *
 * @param steps total steps taken since the machine was created or reset
 * @param head  final head position
 * @param tape  copy of the final tape
 */
public record RunResult(long steps, int head, Tape tape) {}
