package tibskrit;

/**
 * Tokens that need special handling by the automaton.
 */
public enum SpecialMark {
    NONE,
    /** a-chung, lengthens the vowel of the syllable */
    LENGTHENER,
    /** ra, base or subjoined */
    R,
    /** la, base or subjoined */
    L,
    /** reverse gi gu, vocalic r/l after a liquid */
    I,
    /** long reverse gi gu */
    LONG_I
}
