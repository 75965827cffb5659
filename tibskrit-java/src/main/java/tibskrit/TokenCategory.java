package tibskrit;

/**
 * Semantic role of a token in an aksara.
 */
public enum TokenCategory {
    OTHER,
    BASE,
    SUBSCRIPT,
    AFTER_VOWEL,
    VOWEL,
    VIRAMA
}
