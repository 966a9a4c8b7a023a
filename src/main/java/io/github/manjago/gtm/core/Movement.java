package io.github.manjago.gtm.core;

/**
 * Head movement after a transition has written its symbol.
 */
public enum Movement {

    /** Toward lower tape index */
    PREV("prev", -1),

    /** Head stays where it is */
    CURRENT("current", 0),

    /** Toward higher tape index */
    NEXT("next", 1);

    private final String keyword;
    private final int delta;

    Movement(String keyword, int delta) {
        this.keyword = keyword;
        this.delta = delta;
    }

    /**
     * @return keyword used for this movement in program text
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * @return offset added to the head position
     */
    public int getDelta() {
        return delta;
    }

    /**
     * Apply this movement to a head position.
     */
    public int apply(int head) {
        return head + delta;
    }

    /**
     * Find movement by keyword.
     *
     * @return matching movement, or null if the word is not a movement keyword
     */
    public static Movement fromKeyword(String word) {
        for (Movement m : values()) {
            if (m.keyword.equals(word)) {
                return m;
            }
        }
        return null;
    }
}
