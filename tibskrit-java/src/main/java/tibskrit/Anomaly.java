package tibskrit;

/**
 * Unexpected sequences the automaton recovers from.
 */
public enum Anomaly {
    /** reverse gi gu not preceded by ra or la; its vowel is written as is */
    REVERSE_SIGN_OUTSIDE_LIQUID("reverse gi gu should only be after l or r"),
    /** virama directly after a vowel; the pending syllable is dropped */
    VIRAMA_AFTER_VOWEL("virama after a vowel");

    private final String message;

    Anomaly(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
