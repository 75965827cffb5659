package tibskrit;

/**
 * Unicode character classification for the Tibetan block.
 * Tibetan Unicode Block: U+0F00 - U+0FBC (the part relevant for stacking)
 *
 * Backed by a lookup table indexed by offset into the block.
 */
public final class Classifier {

    private Classifier() {} // Utility class

    // Tibetan Unicode range constants
    public static final int TIBETAN_START = 0x0F00;
    public static final int TIBETAN_END = 0x0FBC;
    private static final int TIBETAN_RANGE = TIBETAN_END - TIBETAN_START + 1;

    private static final Category[] CATEGORIES = new Category[TIBETAN_RANGE];
    static {
        fill(0x0F00, 0x0FBC, Category.OTHER);
        fill(0x0F01, 0x0F01, Category.BASE);         // often followed by 0F83
        fill(0x0F18, 0x0F19, Category.BOTTOM_VOWEL);
        fill(0x0F20, 0x0F33, Category.BASE);         // digits, may carry 0F18/0F19 or a vowel
        fill(0x0F35, 0x0F35, Category.BOTTOM_MARK);
        fill(0x0F37, 0x0F37, Category.BOTTOM_MARK);
        fill(0x0F39, 0x0F39, Category.SUBSCRIPT);    // tsa-phru sits right under the base
        fill(0x0F3E, 0x0F3E, Category.RIGHT_MARK);
        fill(0x0F40, 0x0F6C, Category.BASE);
        fill(0x0F71, 0x0F71, Category.BOTTOM_VOWEL);
        fill(0x0F72, 0x0F73, Category.TOP_VOWEL);
        fill(0x0F74, 0x0F75, Category.BOTTOM_VOWEL);
        fill(0x0F76, 0x0F7D, Category.TOP_VOWEL);
        fill(0x0F7E, 0x0F7E, Category.TOP_MARK);
        fill(0x0F7F, 0x0F7F, Category.RIGHT_MARK);
        fill(0x0F80, 0x0F81, Category.TOP_VOWEL);
        fill(0x0F82, 0x0F83, Category.TOP_MARK);
        fill(0x0F84, 0x0F84, Category.BOTTOM_MARK);
        fill(0x0F86, 0x0F87, Category.TOP_MARK);
        fill(0x0F88, 0x0F8A, Category.BASE);         // 0F8A is always followed by 0F82
        fill(0x0F8C, 0x0F8C, Category.BASE);
        fill(0x0F8D, 0x0FBC, Category.SUBSCRIPT);
    }

    private static void fill(int from, int to, Category category) {
        for (int cp = from; cp <= to; cp++) {
            CATEGORIES[cp - TIBETAN_START] = category;
        }
    }

    /**
     * Check if codepoint is in the classified Tibetan range.
     */
    public static boolean isTibetan(int cp) {
        return cp >= TIBETAN_START && cp <= TIBETAN_END;
    }

    /**
     * Ordering category of a codepoint. OTHER outside the Tibetan range.
     */
    public static Category classify(int cp) {
        if (!isTibetan(cp)) {
            return Category.OTHER;
        }
        return CATEGORIES[cp - TIBETAN_START];
    }

    /**
     * Check if codepoint belongs to the stacking set used by the a-chung placement fix:
     * subjoined consonants 0F8D-0FAC, 0FAE, 0FB0 and 0FB3-0FBC.
     */
    public static boolean isStacking(int cp) {
        return (cp >= 0x0F8D && cp <= 0x0FAC) || cp == 0x0FAE || cp == 0x0FB0
            || (cp >= 0x0FB3 && cp <= 0x0FBC);
    }
}
