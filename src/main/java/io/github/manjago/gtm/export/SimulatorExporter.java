package io.github.manjago.gtm.export;

import io.github.manjago.gtm.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes a specialized table in the transition syntax of turingmachinesimulator.com.
 *
 * <h2>Format:</h2>
 * <pre>
 * name: generated turing machine
 * init: even
 * accept: finish
 *
 * even,0
 * 0,&gt;,even
 * </pre>
 * Each transition is a block of two lines: {@code state,input} then
 * {@code output,movement,next-state}, blocks separated by an empty line. Movement is
 * {@code <} (prev), {@code -} (current) or {@code >} (next); blank is {@code _}.
 * State names go through {@link KeyEncoder}.
 */
public final class SimulatorExporter {

    private static final Logger log = LoggerFactory.getLogger(SimulatorExporter.class);

    public static final String DEFAULT_MACHINE_NAME = "generated turing machine";

    private final String machineName;

    public SimulatorExporter() {
        this(DEFAULT_MACHINE_NAME);
    }

    public SimulatorExporter(String machineName) {
        this.machineName = machineName;
    }

    /**
     * Serialize every transition of the table.
     *
     * @throws ExportException if a symbol cannot be written in this format
     */
    public String export(SpecializedTable table) throws ExportException {
        StringBuilder sb = new StringBuilder();
        sb.append("name: ").append(machineName).append('\n');
        sb.append("init: ").append(KeyEncoder.encode(table.getStart())).append('\n');
        sb.append("accept: ").append(KeyEncoder.encode(InstanceKey.FINISH)).append('\n');

        int count = 0;
        for (InstanceKey key : table.keys()) {
            String state = KeyEncoder.encode(key);
            for (Map.Entry<Symbol, Transition> e : table.row(key).entrySet()) {
                Transition t = e.getValue();
                sb.append('\n');
                sb.append(state).append(',').append(symbol(e.getKey(), key)).append('\n');
                sb.append(symbol(t.output(), key)).append(',')
                  .append(movementChar(t.movement())).append(',')
                  .append(KeyEncoder.encode(t.target())).append('\n');
                count++;
            }
        }

        log.info("Exported {} transitions of {} states", count, table.size());
        return sb.toString();
    }

    /**
     * Movement as the simulator writes it.
     */
    public static char movementChar(Movement movement) {
        return switch (movement) {
            case PREV -> '<';
            case CURRENT -> '-';
            case NEXT -> '>';
        };
    }

    private static char symbol(Symbol symbol, InstanceKey key) throws ExportException {
        if (symbol.value() == ',' || symbol.value() == ' ') {
            throw new ExportException("Symbol '" + symbol + "' used by state '" + key
                    + "' cannot be written in the simulator format");
        }
        return symbol.value();
    }
}
