package tibskrit;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static table of Tibetan graphemes and their IAST rendering.
 * Stored in a codepoint trie so that two-codepoint ligatures win over their
 * first codepoint at the same position.
 */
public final class TokenTable {

    private TokenTable() {} // Utility class

    public static final String TSHEG = " ";
    public static final String ANUNASIKA = "m\u0310";
    public static final String ANUNASIKA_2 = "m\u0301";

    /** Longest grapheme in the table, in codepoints. */
    public static final int MAX_TOKEN_LENGTH = 2;

    // Tibetan-only letters that have no Sanskrit value
    private static final Set<Integer> UNSUPPORTED = Set.of(
        0x0F5E, 0x0F5F, 0x0F60, 0x0FB8, 0x0FAE, 0x0FAF, 0x0FB0
    );

    private static final Map<String, Token> TOKENS;
    private static final TrieNode TRIE = new TrieNode();

    static {
        Map<String, Token> t = new LinkedHashMap<>();

        // Punctuation
        other(t, "\u0F00", "oṃ");
        other(t, "\u0F0B", TSHEG);
        other(t, "\u0F0C", TSHEG);
        other(t, "\u0F0D", "|");
        other(t, "\u0F0E", "||");
        other(t, "\u0F0F", "|");
        other(t, "\u0F10", "|");
        other(t, "\u0F12", "|");
        other(t, "\u0F14", "|");

        // Digits
        for (int d = 0; d <= 9; d++) {
            other(t, new String(Character.toChars(0x0F20 + d)), String.valueOf(d));
        }

        // Base consonants
        base(t, "\u0F40", "k");
        base(t, "\u0F41", "kh");
        base(t, "\u0F42", "g");
        base(t, "\u0F43", "gh");
        base(t, "\u0F44", "ṅ");
        base(t, "\u0F45", "c");
        base(t, "\u0F46", "ch");
        base(t, "\u0F47", "j");
        base(t, "\u0F49", "ñ");
        base(t, "\u0F4A", "ṭ");
        base(t, "\u0F4B", "ṭh");
        base(t, "\u0F4C", "ḍ");
        base(t, "\u0F4D", "ḍh");
        base(t, "\u0F4E", "ṇ");
        base(t, "\u0F4F", "t");
        base(t, "\u0F50", "th");
        base(t, "\u0F51", "d");
        base(t, "\u0F52", "dh");
        base(t, "\u0F53", "n");
        base(t, "\u0F54", "p");
        base(t, "\u0F55", "ph");
        base(t, "\u0F56", "b");
        base(t, "\u0F57", "bh");
        base(t, "\u0F58", "m");
        base(t, "\u0F59", "c");
        base(t, "\u0F5A", "ch");
        base(t, "\u0F5B", "j");
        base(t, "\u0F5C", "jh");
        base(t, "\u0F5D", "v"); // wa is v in Sanskrit
        base(t, "\u0F61", "y");
        t.put("\u0F62", new Token("r", TokenCategory.BASE, SpecialMark.R));
        t.put("\u0F63", new Token("l", TokenCategory.BASE, SpecialMark.L));
        base(t, "\u0F64", "ś");
        base(t, "\u0F65", "ṣ");
        base(t, "\u0F66", "s");
        base(t, "\u0F67", "h");
        base(t, "\u0F68", ""); // the inherent a is added when the syllable closes
        base(t, "\u0F69", "kṣ");
        t.put("\u0F6A", new Token("r", TokenCategory.BASE, SpecialMark.R));

        // Decomposed aspirates and ksa
        base(t, "\u0F42\u0FB7", "gh");
        base(t, "\u0F4C\u0FB7", "ḍh");
        base(t, "\u0F51\u0FB7", "dh");
        base(t, "\u0F56\u0FB7", "bh");
        base(t, "\u0F5B\u0FB7", "jh");
        base(t, "\u0F40\u0FB5", "kṣ");

        // Vowel signs
        t.put("\u0F71", new Token("ā", TokenCategory.VOWEL, SpecialMark.LENGTHENER));
        vowel(t, "\u0F72", "i");
        vowel(t, "\u0F73", "ī");
        vowel(t, "\u0F74", "u");
        vowel(t, "\u0F75", "ū");
        vowel(t, "\u0F76", "ṛ");
        vowel(t, "\u0F77", "ṝ");
        vowel(t, "\u0F78", "ḷ");
        vowel(t, "\u0F79", "ḹ");
        vowel(t, "\u0F7A", "e");
        vowel(t, "\u0F7B", "ai");
        vowel(t, "\u0F7C", "o");
        vowel(t, "\u0F7D", "au");
        t.put("\u0F80", new Token("i", TokenCategory.VOWEL, SpecialMark.I));
        t.put("\u0F81", new Token("ī", TokenCategory.VOWEL, SpecialMark.LONG_I));

        // Marks following the vowel
        afterVowel(t, "\u0F7E", "ṃ"); // anusvara
        afterVowel(t, "\u0F7F", "ḥ"); // visarga
        afterVowel(t, "\u0F82", ANUNASIKA_2);
        afterVowel(t, "\u0F83", ANUNASIKA);
        afterVowel(t, "\u0F85", "’"); // avagraha
        t.put("\u0F84", new Token("-", TokenCategory.VIRAMA));

        // Subjoined consonants
        sub(t, "\u0F90", "k");
        sub(t, "\u0F91", "kh");
        sub(t, "\u0F92", "g");
        sub(t, "\u0F93", "gh");
        sub(t, "\u0F94", "ṅ");
        sub(t, "\u0F95", "c");
        sub(t, "\u0F96", "ch");
        sub(t, "\u0F97", "j");
        sub(t, "\u0F99", "ñ");
        sub(t, "\u0F9A", "ṭ");
        sub(t, "\u0F9B", "ṭh");
        sub(t, "\u0F9C", "ḍ");
        sub(t, "\u0F9D", "ḍh");
        sub(t, "\u0F9E", "ṇ");
        sub(t, "\u0F9F", "t");
        sub(t, "\u0FA0", "th");
        sub(t, "\u0FA1", "d");
        sub(t, "\u0FA2", "dh");
        sub(t, "\u0FA3", "n");
        sub(t, "\u0FA4", "p");
        sub(t, "\u0FA5", "ph");
        sub(t, "\u0FA6", "b");
        sub(t, "\u0FA7", "bh");
        sub(t, "\u0FA8", "m");
        sub(t, "\u0FA9", "c");
        sub(t, "\u0FAA", "ch");
        sub(t, "\u0FAB", "j");
        sub(t, "\u0FAC", "jh");
        sub(t, "\u0FAD", "v");
        sub(t, "\u0FB1", "y");
        t.put("\u0FB2", new Token("r", TokenCategory.SUBSCRIPT, SpecialMark.R));
        t.put("\u0FB3", new Token("l", TokenCategory.SUBSCRIPT, SpecialMark.L));
        sub(t, "\u0FB4", "ś");
        sub(t, "\u0FB5", "ṣ");
        sub(t, "\u0FB6", "s");
        sub(t, "\u0FB7", "h");
        sub(t, "\u0FB9", "kṣ");
        sub(t, "\u0FBA", "v");
        sub(t, "\u0FBB", "y");
        t.put("\u0FBC", new Token("r", TokenCategory.SUBSCRIPT, SpecialMark.R));

        TOKENS = Collections.unmodifiableMap(t);
        for (Map.Entry<String, Token> entry : TOKENS.entrySet()) {
            insertIntoTrie(entry.getKey(), entry.getValue());
        }
    }

    private static void other(Map<String, Token> t, String grapheme, String iast) {
        t.put(grapheme, new Token(iast, TokenCategory.OTHER));
    }

    private static void base(Map<String, Token> t, String grapheme, String iast) {
        t.put(grapheme, new Token(iast, TokenCategory.BASE));
    }

    private static void sub(Map<String, Token> t, String grapheme, String iast) {
        t.put(grapheme, new Token(iast, TokenCategory.SUBSCRIPT));
    }

    private static void vowel(Map<String, Token> t, String grapheme, String iast) {
        t.put(grapheme, new Token(iast, TokenCategory.VOWEL));
    }

    private static void afterVowel(Map<String, Token> t, String grapheme, String iast) {
        t.put(grapheme, new Token(iast, TokenCategory.AFTER_VOWEL));
    }

    private static void insertIntoTrie(String grapheme, Token token) {
        TrieNode node = TRIE;
        int[] cps = grapheme.codePoints().toArray();
        for (int cp : cps) {
            node = node.getOrCreateChild(cp);
        }
        node.token = token;
    }

    /**
     * Lookup the grapheme cps[start..end) in the trie. Returns null if absent.
     */
    public static Token lookup(int[] cps, int start, int end) {
        TrieNode node = TRIE;
        for (int i = start; i < end; i++) {
            node = node.getChild(cps[i]);
            if (node == null) return null;
        }
        return node.token;
    }

    /**
     * Lookup a grapheme given as a string. Returns null if absent.
     */
    public static Token lookup(String grapheme) {
        return TOKENS.get(grapheme);
    }

    /**
     * Check if codepoint is a Tibetan letter with no Sanskrit transliteration.
     */
    public static boolean isUnsupported(int cp) {
        return UNSUPPORTED.contains(cp);
    }

    /**
     * All graphemes of the table, in declaration order.
     */
    public static Map<String, Token> entries() {
        return TOKENS;
    }

    /**
     * Trie node keyed by codepoint. Nodes are only written during class initialization.
     */
    private static class TrieNode {
        private Map<Integer, TrieNode> children;
        Token token;

        TrieNode getChild(int codepoint) {
            return children == null ? null : children.get(codepoint);
        }

        TrieNode getOrCreateChild(int codepoint) {
            if (children == null) {
                children = new HashMap<>();
            }
            return children.computeIfAbsent(codepoint, k -> new TrieNode());
        }
    }
}
