package tibskrit;

/**
 * Receives the non-fatal events of a conversion.
 * Implementations must be safe to call from several threads when a
 * {@link TibskritTransliterator} is shared.
 */
public interface Diagnostics {

    /**
     * A Tibetan-only letter was dropped from the output.
     *
     * @param codePoint the dropped codepoint
     * @param offset codepoint offset in the canonical text
     */
    void unsupportedCharacter(int codePoint, int offset);

    /**
     * The automaton met an unexpected sequence and applied its fallback.
     *
     * @param anomaly what happened
     * @param token the token that triggered it
     */
    void anomaly(Anomaly anomaly, Token token);
}
