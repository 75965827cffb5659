package tibskrit;

/**
 * Ordering category of a Tibetan codepoint inside a stack.
 * The ordinal is the canonical left-to-right emission order within a cluster.
 */
public enum Category {
    OTHER,
    BASE,
    SUBSCRIPT,
    BOTTOM_VOWEL,
    BOTTOM_MARK,
    TOP_VOWEL,
    TOP_MARK,
    RIGHT_MARK;

    /**
     * True for the combining categories that extend a cluster (ordinal above BASE).
     */
    public boolean isCombining() {
        return ordinal() > BASE.ordinal();
    }
}
