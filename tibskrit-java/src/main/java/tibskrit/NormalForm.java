package tibskrit;

import java.util.Locale;

/**
 * Representation chosen for the consonant + aspirate (and a few vowel) pairs
 * that Unicode encodes both as one legacy codepoint and as a sequence.
 */
public enum NormalForm {
    /** Decomposed: base + subjoined h, k + subjoined ṣ, r/l + reverse i. */
    NFD,
    /** Composed: the single legacy codepoint. */
    NFC;

    /**
     * Parse "nfd" or "nfc", case-insensitive.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static NormalForm of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("form cannot be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "nfd":
                return NFD;
            case "nfc":
                return NFC;
            default:
                throw new IllegalArgumentException("Unknown form: " + name + " (expected nfd or nfc)");
        }
    }
}
