package io.github.manjago.gtm.debug;

import io.github.manjago.gtm.core.InstanceKey;
import io.github.manjago.gtm.core.Symbol;
import io.github.manjago.gtm.core.Transition;

import java.util.List;

/**
 * What the debugger shows at one point of a run.
 *
 * @param state       current instance
 * @param head        head position
 * @param steps       steps taken since reset
 * @param windowStart tape position of the first cell in {@code cells}
 * @param cells       tape cells around the head
 * @param next        transition the next step takes, or null when accepted or stuck
 * @param sourceLine  program line that transition was specialized from, or null
 */
public record Snapshot(
    InstanceKey state,
    int head,
    long steps,
    int windowStart,
    List<Symbol> cells,
    Transition next,
    String sourceLine
) {

    public Snapshot {
        cells = List.copyOf(cells);
    }

    public boolean isAccepted() {
        return state.isFinish();
    }

    public boolean isStuck() {
        return !state.isFinish() && next == null;
    }

    /**
     * Symbol under the head.
     */
    public Symbol current() {
        return cells.get(head - windowStart);
    }

    /**
     * Window cells as text, blanks as {@code _}.
     */
    public String tapeText() {
        StringBuilder sb = new StringBuilder(cells.size());
        for (Symbol s : cells) {
            sb.append(s.value());
        }
        return sb.toString();
    }
}
