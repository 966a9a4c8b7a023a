package io.github.manjago.gtm.export;

import io.github.manjago.gtm.core.InstanceKey;
import org.jetbrains.annotations.NotNull;

/**
 * Turns canonical instance keys into identifiers the simulator format accepts.
 * <p>
 * The nesting delimiters are escaped with {@code _}, and {@code _} itself is doubled:
 * <pre>
 *   _  -&gt;  __
 *   &lt;  -&gt;  _l
 *   &gt;  -&gt;  _r
 *   ,  -&gt;  _c
 * </pre>
 * Every escape starts with {@code _} and a lone {@code _} never appears unescaped, so the
 * encoding can be undone and distinct keys never collide. {@code r<my_state>} becomes
 * {@code r_lmy__state_r}.
 */
public final class KeyEncoder {

    private KeyEncoder() {
        // Utility class
    }

    public static @NotNull String encode(InstanceKey key) {
        return encode(key.toString());
    }

    public static @NotNull String encode(String canonical) {
        StringBuilder sb = new StringBuilder(canonical.length() + 8);
        for (int i = 0; i < canonical.length(); i++) {
            char c = canonical.charAt(i);
            switch (c) {
                case '_' -> sb.append("__");
                case '<' -> sb.append("_l");
                case '>' -> sb.append("_r");
                case ',' -> sb.append("_c");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Inverse of {@link #encode(String)}.
     *
     * @throws IllegalArgumentException if the text is not a valid encoding
     */
    public static @NotNull String decode(String encoded) {
        StringBuilder sb = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c != '_') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= encoded.length()) {
                throw new IllegalArgumentException("Dangling escape at end of: " + encoded);
            }
            char escaped = encoded.charAt(++i);
            switch (escaped) {
                case '_' -> sb.append('_');
                case 'l' -> sb.append('<');
                case 'r' -> sb.append('>');
                case 'c' -> sb.append(',');
                default -> throw new IllegalArgumentException("Unknown escape _" + escaped + " in: " + encoded);
            }
        }
        return sb.toString();
    }
}
