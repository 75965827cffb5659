package tibskrit;

import java.util.Objects;

/**
 * A Tibetan grapheme of one or two codepoints with its IAST rendering.
 */
public final class Token {

    private final String text;
    private final TokenCategory category;
    private final SpecialMark special;

    public Token(String text, TokenCategory category, SpecialMark special) {
        this.text = Objects.requireNonNull(text, "text");
        this.category = Objects.requireNonNull(category, "category");
        this.special = Objects.requireNonNull(special, "special");
    }

    public Token(String text, TokenCategory category) {
        this(text, category, SpecialMark.NONE);
    }

    /**
     * Plain text token, used for characters outside the table.
     */
    public static Token other(String text) {
        return new Token(text, TokenCategory.OTHER);
    }

    public String getText() {
        return text;
    }

    public TokenCategory getCategory() {
        return category;
    }

    public SpecialMark getSpecial() {
        return special;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return text.equals(other.text) && category == other.category && special == other.special;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, category, special);
    }

    @Override
    public String toString() {
        return "(" + text + ", " + category + ", " + special + ")";
    }
}
