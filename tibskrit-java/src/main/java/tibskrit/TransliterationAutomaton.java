package tibskrit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Left-to-right automaton turning canonical Tibetan tokens into IAST.
 *
 * Consonants are written as soon as they arrive; the vowel, the ra/la that may
 * still turn into a vocalic ṛ/ḷ, and post-vowel marks are kept pending until the
 * aksara is closed by the next base consonant, a non-letter or {@link #finish()}.
 * One instance per conversion, not thread-safe.
 */
public class TransliterationAutomaton {

    private static final Logger log = LoggerFactory.getLogger(TransliterationAutomaton.class);

    enum State {
        OTHER,
        AFTER_CONSONANT,
        AFTER_VOWEL,
        AFTER_VIRAMA
    }

    private final Diagnostics diagnostics;
    private final StringBuilder out = new StringBuilder();

    // Aksara being built, cleared by reset()
    private State state;
    private boolean afterR;
    private boolean afterL;
    private boolean lengthened;
    private String vowel;
    private String postVowel;

    public TransliterationAutomaton(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        reset();
    }

    public TransliterationAutomaton() {
        this(LoggingDiagnostics.INSTANCE);
    }

    /**
     * Long form of a, i and u. Other vowels are returned unchanged.
     */
    static String lengthen(String v) {
        switch (v) {
            case "a":
                return "ā";
            case "i":
                return "ī";
            case "u":
                return "ū";
            default:
                return v;
        }
    }

    private void reset() {
        state = State.OTHER;
        afterR = false;
        afterL = false;
        lengthened = false;
        vowel = null;
        postVowel = null;
    }

    private boolean inAksara() {
        return state == State.AFTER_CONSONANT || state == State.AFTER_VOWEL;
    }

    /**
     * Close the current aksara: write the pending liquid, the vowel (inherent a
     * by default) and the post-vowel mark.
     */
    void flush() {
        if (inAksara()) {
            String v = vowel == null ? "a" : vowel;
            if (lengthened) {
                v = lengthen(v);
            }
            if (afterR) {
                out.append('r');
            } else if (afterL) {
                out.append('l');
            }
            out.append(v);
            if (postVowel != null) {
                out.append(postVowel);
            }
        }
        reset();
    }

    /**
     * Close the last aksara and return everything written so far.
     */
    public String finish() {
        flush();
        return out.toString();
    }

    State getState() {
        return state;
    }

    /**
     * Feed the next token.
     */
    public void accept(Token token) {
        SpecialMark special = token.getSpecial();
        if (log.isDebugEnabled()) {
            log.debug("new token {}, state ('{}', {}, r={}, l={}, long={})",
                token, out, state, afterR, afterL, lengthened);
        }

        // A base ra or la always starts a new aksara
        if (token.getCategory() == TokenCategory.BASE
                && (special == SpecialMark.R || special == SpecialMark.L)
                && inAksara()) {
            flush();
        }

        switch (special) {
            case R:
                if (afterL) {
                    out.append('l');
                    afterL = false;
                }
                if (afterR) {
                    out.append('r');
                }
                afterR = true;
                state = State.AFTER_CONSONANT;
                break;
            case L:
                if (afterR) {
                    out.append('r');
                    afterR = false;
                }
                if (afterL) {
                    out.append('l');
                }
                afterL = true;
                state = State.AFTER_CONSONANT;
                break;
            case I:
            case LONG_I:
                acceptReverseSign(token);
                break;
            case LENGTHENER:
                // a-chung after the vowel sign is attested in sources
                if (vowel != null) {
                    vowel = lengthen(vowel);
                } else {
                    lengthened = true;
                }
                break;
            case NONE:
                acceptPlain(token);
                break;
        }
    }

    private void acceptReverseSign(Token token) {
        if (token.getSpecial() == SpecialMark.LONG_I) {
            lengthened = true;
        }
        if (afterR) {
            vowel = lengthened ? "ṝ" : "ṛ";
        } else if (afterL) {
            vowel = lengthened ? "ḹ" : "ḷ";
        } else {
            // written now and again when the aksara closes
            diagnostics.anomaly(Anomaly.REVERSE_SIGN_OUTSIDE_LIQUID, token);
            vowel = lengthened ? lengthen(token.getText()) : token.getText();
            out.append(vowel);
        }
        state = State.AFTER_VOWEL;
        afterR = false;
        afterL = false;
        lengthened = false;
    }

    private void acceptPlain(Token token) {
        String text = token.getText();
        TokenCategory category = token.getCategory();

        if (category != TokenCategory.VOWEL) {
            // ra or la not followed by a reverse gi gu are plain letters
            if (afterR) {
                out.append('r');
                afterR = false;
            }
            if (afterL) {
                out.append('l');
                afterL = false;
            }
        }

        switch (category) {
            case VOWEL:
                vowel = lengthened ? lengthen(text) : text;
                lengthened = false;
                state = State.AFTER_VOWEL;
                break;
            case OTHER:
                flush();
                out.append(text);
                state = State.OTHER;
                break;
            case VIRAMA:
                if (state == State.AFTER_VOWEL) {
                    diagnostics.anomaly(Anomaly.VIRAMA_AFTER_VOWEL, token);
                }
                reset();
                state = State.AFTER_VIRAMA;
                break;
            case AFTER_VOWEL:
                postVowel = text;
                break;
            case BASE:
                if (inAksara()) {
                    flush();
                }
                out.append(text);
                state = State.AFTER_CONSONANT;
                break;
            case SUBSCRIPT:
                out.append(text);
                break;
        }
    }
}
