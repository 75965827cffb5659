package tibskrit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transliterates Sanskrit written in Tibetan script into IAST.
 *
 * The text is canonicalized, cut into the longest graphemes known to the
 * {@link TokenTable} and fed to a fresh {@link TransliterationAutomaton}.
 * Instances hold no per-call state and can be shared between threads.
 */
public class TibskritTransliterator {

    private static final Logger log = LoggerFactory.getLogger(TibskritTransliterator.class);

    private static final Token NEWLINE = Token.other("\n");
    private static final Token EMPTY = Token.other("");

    private final Diagnostics diagnostics;

    public TibskritTransliterator(Diagnostics diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics cannot be null");
        }
        this.diagnostics = diagnostics;
    }

    public TibskritTransliterator() {
        this(LoggingDiagnostics.INSTANCE);
    }

    /**
     * Transliterate using the decomposed form.
     */
    public String transliterate(String text) {
        return transliterate(text, NormalForm.NFD);
    }

    /**
     * Transliterate with the form given by name ("nfd" or "nfc").
     */
    public String transliterate(String text, String form) {
        return transliterate(text, NormalForm.of(form));
    }

    public String transliterate(String text, NormalForm form) {
        return convert(text, form).getOutput();
    }

    /**
     * Transliterate and report whether the input was structurally valid.
     */
    public Conversion convert(String text, NormalForm form) {
        Canonicalizer.Result canonical = Canonicalizer.canonicalize(text, form);
        if (!canonical.isValid()) {
            log.debug("Combining mark outside of a stack in: {}", text);
        }

        int[] cps = canonical.getText().codePoints().toArray();
        int n = cps.length;
        TransliterationAutomaton automaton = new TransliterationAutomaton(diagnostics);

        int i = 0;
        while (i < n) {
            // Longest match first
            Token token = null;
            int len = Math.min(TokenTable.MAX_TOKEN_LENGTH, n - i);
            for (; len > 0; len--) {
                token = TokenTable.lookup(cps, i, i + len);
                if (token != null) break;
            }

            if (token != null) {
                automaton.accept(token);
                i += len;
                continue;
            }

            int cp = cps[i];
            if (TokenTable.isUnsupported(cp)) {
                diagnostics.unsupportedCharacter(cp, i);
            } else {
                automaton.accept(cp == '\n' ? NEWLINE : EMPTY);
            }
            i++;
        }

        return new Conversion(automaton.finish(), canonical.isValid());
    }
}
