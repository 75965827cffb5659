package tibskrit;

import java.util.Objects;

/**
 * Rewrites Tibetan text into one canonical Unicode form.
 *
 * Deprecated codepoints are expanded, the composed/decomposed pairs are unified
 * according to the requested {@link NormalForm}, graphical duplicates are folded,
 * a-chung placement inside stacks is fixed and finally every stack is reordered
 * by {@link Category}.
 */
public final class Canonicalizer {

    private Canonicalizer() {} // Utility class

    // Discouraged or deprecated codepoints and their decompositions, applied in order
    private static final String[][] DEPRECATED = {
        {"\u0F73", "\u0F71\u0F72"},       // use is discouraged
        {"\u0F75", "\u0F71\u0F74"},       // use is discouraged
        {"\u0F77", "\u0FB2\u0F71\u0F80"}, // deprecated
        {"\u0F79", "\u0FB3\u0F71\u0F80"}, // deprecated
        {"\u0F81", "\u0F71\u0F80"},       // use is discouraged
    };

    // Composed codepoint -> decomposed sequence
    private static final String[][] COMPOSITIONS = {
        {"\u0F43", "\u0F42\u0FB7"},
        {"\u0F4D", "\u0F4C\u0FB7"},
        {"\u0F52", "\u0F51\u0FB7"},
        {"\u0F57", "\u0F56\u0FB7"},
        {"\u0F5C", "\u0F5B\u0FB7"},
        {"\u0F69", "\u0F40\u0FB5"},
        {"\u0F76", "\u0FB2\u0F80"},
        {"\u0F78", "\u0FB3\u0F80"},
        {"\u0F93", "\u0F92\u0FB7"},
        {"\u0F9D", "\u0F9C\u0FB7"},
        {"\u0FA2", "\u0FA1\u0FB7"},
        {"\u0FA7", "\u0FA6\u0FB7"},
        {"\u0FAC", "\u0FAB\u0FB7"},
        {"\u0FB9", "\u0F90\u0FB5"},
    };

    private static final int A_CHUNG = 0x0F71;
    private static final int SUBJOINED_A_CHUNG = 0x0FB0;

    /**
     * Outcome of a canonicalization: the canonical text and whether every
     * combining mark was attached to a base.
     */
    public static final class Result {
        private final String text;
        private final boolean valid;

        Result(String text, boolean valid) {
            this.text = text;
            this.valid = valid;
        }

        public String getText() {
            return text;
        }

        /**
         * False when a combining mark occurred outside any cluster.
         */
        public boolean isValid() {
            return valid;
        }
    }

    /**
     * Canonicalize text with the default decomposed form.
     */
    public static Result canonicalize(String text) {
        return canonicalize(text, NormalForm.NFD);
    }

    /**
     * Canonicalize text. Never fails; structural problems are reported through
     * {@link Result#isValid()}.
     */
    public static Result canonicalize(String text, NormalForm form) {
        String s = expandDeprecated(text);
        s = applyForm(s, form);
        // 0F00 was never marked as a composed character; Unicode stability policy keeps it that way
        s = s.replace("\u0F00", "\u0F68\u0F7C\u0F7E");
        s = foldRepeatedSigns(s);
        s = fixStacking(s);
        return reorder(s);
    }

    static String expandDeprecated(String s) {
        for (String[] rule : DEPRECATED) {
            s = s.replace(rule[0], rule[1]);
        }
        return s;
    }

    static String applyForm(String s, NormalForm form) {
        Objects.requireNonNull(form, "form");
        for (String[] pair : COMPOSITIONS) {
            switch (form) {
                case NFD:
                    s = s.replace(pair[0], pair[1]);
                    break;
                case NFC:
                    s = s.replace(pair[1], pair[0]);
                    break;
            }
        }
        return s;
    }

    /**
     * Two e signs look like an ai sign and two o signs like an au sign.
     */
    static String foldRepeatedSigns(String s) {
        s = s.replace("\u0F7A\u0F7A", "\u0F7B");
        return s.replace("\u0F7C\u0F7C", "\u0F7D");
    }

    /**
     * No 0F71 in the middle of stacks, only 0FB0; no 0FB0 at the end of stacks, only 0F71.
     * Each direction is a single left-to-right pass over the original codepoints.
     */
    static String fixStacking(String s) {
        if (s.indexOf(A_CHUNG) < 0 && s.indexOf(SUBJOINED_A_CHUNG) < 0) {
            return s;
        }
        int[] cps = s.codePoints().toArray();
        int n = cps.length;

        // Forward: a-chung followed by a stacking codepoint moves into the stack
        for (int i = 0; i + 1 < n; i++) {
            if (cps[i] == A_CHUNG && Classifier.isStacking(cps[i + 1])) {
                cps[i] = SUBJOINED_A_CHUNG;
                i++; // the following codepoint is part of the match
            }
        }

        // Backward: subjoined a-chung closing a stack goes back to the vowel sign
        int[] result = cps.clone();
        for (int i = 0; i < n; i++) {
            if (cps[i] == SUBJOINED_A_CHUNG && (i + 1 == n || !Classifier.isStacking(cps[i + 1]))) {
                result[i] = A_CHUNG;
                i++;
            }
        }
        return new String(result, 0, n);
    }

    /**
     * Sort every cluster (a base followed by combining marks) by category, keeping the
     * original order between codepoints of the same category.
     */
    static Result reorder(String s) {
        int[] cps = s.codePoints().toArray();
        int n = cps.length;
        Category[] cats = new Category[n];
        for (int i = 0; i < n; i++) {
            cats[i] = Classifier.classify(cps[i]);
        }

        int[] result = new int[n];
        int ri = 0;
        boolean valid = true;
        int i = 0;

        while (i < n) {
            Category c = cats[i];
            if (c != Category.BASE) {
                if (c.isCombining()) {
                    valid = false;
                }
                result[ri++] = cps[i++];
                continue;
            }

            // Scan for end of cluster
            int j = i + 1;
            while (j < n && cats[j].isCombining()) {
                j++;
            }

            // Stable counting pass: emit members category by category in index order
            for (Category target : Category.values()) {
                for (int k = i; k < j; k++) {
                    if (cats[k] == target) {
                        result[ri++] = cps[k];
                    }
                }
            }
            i = j;
        }

        return new Result(new String(result, 0, ri), valid);
    }
}
