package tibskrit;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Tibetan to IAST transliterator.
 * The corpus in test_cases.json covers both normal forms.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class TransliteratorTest {

    private RecordingDiagnostics diagnostics;
    private TibskritTransliterator transliterator;
    private List<TestCase> testCases;

    static class TestCase {
        int id;
        String input;
        String form;
        String description;
        String expected;
    }

    @BeforeAll
    void loadTestCases() throws IOException {
        Gson gson = new Gson();
        Type listType = new TypeToken<List<TestCase>>() {}.getType();
        try (InputStream in = getClass().getResourceAsStream("/test_cases.json")) {
            assertNotNull(in, "test_cases.json missing from test resources");
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                testCases = gson.fromJson(reader, listType);
            }
        }
    }

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        transliterator = new TibskritTransliterator(diagnostics);
    }

    @Test
    void testAllCasesMatchExpected() {
        StringBuilder failures = new StringBuilder();
        int failCount = 0;

        for (TestCase tc : testCases) {
            String result = transliterator.transliterate(tc.input, tc.form);
            if (!result.equals(tc.expected)) {
                failCount++;
                failures.append(String.format("[%d] %s (%s)%n", tc.id, tc.description, tc.form));
                failures.append(String.format("  Input: %s%n", tc.input));
                failures.append(String.format("  Expected: %s%n", tc.expected));
                failures.append(String.format("  Actual: %s%n", result));
            }
        }

        if (failCount > 0) {
            fail(String.format("%d/%d test cases failed:%n%s", failCount, testCases.size(), failures));
        }
        assertTrue(diagnostics.dropped.isEmpty());
        assertTrue(diagnostics.anomalies.isEmpty());
    }

    @Test
    void testConsonantSequences() {
        assertEquals("karma", transliterator.transliterate("ཀརྨ"));
        assertEquals("padma", transliterator.transliterate("པདྨ"));
    }

    @Test
    void testLongA() {
        assertEquals("ā", transliterator.transliterate("ཨཱ"));
    }

    @Test
    void testDeprecatedVocalicRrMatchesDecomposed() {
        String deprecated = transliterator.transliterate("མཷཏ");
        String decomposed = transliterator.transliterate("མྲཱྀཏ");
        assertEquals("mṝta", deprecated);
        assertEquals(deprecated, decomposed);
    }

    @Test
    void testVowelOrderDoesNotMatter() {
        assertEquals("gū", transliterator.transliterate("གཱུ"));
        assertEquals("gū", transliterator.transliterate("གཱུ"));
    }

    @Test
    void testVirama() {
        assertEquals("gma", transliterator.transliterate("ག྄མ"));
    }

    @Test
    void testStacksAndMarks() {
        assertEquals("bhikṣū", transliterator.transliterate("བྷིཀྵཱུ"));
        assertEquals("ṇāṃ", transliterator.transliterate("ཎཱཾ"));
        assertEquals("durbṛttaṃ", transliterator.transliterate(
            "དུརྦྲྀཏྟཾ"));
    }

    @Test
    void testNfcFormGivesSameResults() {
        assertEquals("bhikṣū", transliterator.transliterate("བྷིཀྵཱུ", NormalForm.NFC));
        assertEquals("bhikṣū", transliterator.transliterate("བྷིཀྵཱུ", "nfd"));
        assertEquals("durbṛttaṃ", transliterator.transliterate(
            "དུརྦྲྀཏྟཾ", "NFC"));
    }

    @Test
    void testUnknownFormIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> transliterator.transliterate("ཀ", "nfkc"));
    }

    @Test
    void testBareConsonantGetsInherentVowel() {
        for (Map.Entry<String, Token> entry : TokenTable.entries().entrySet()) {
            Token token = entry.getValue();
            if (token.getCategory() != TokenCategory.BASE) continue;
            assertEquals(token.getText() + "a", transliterator.transliterate(entry.getKey()),
                "bare " + token);
        }
    }

    @Test
    void testUnsupportedLetterIsDroppedOnce() {
        // ka zha ta: zha has no Sanskrit value
        String result = transliterator.transliterate("ཀཞཏ");
        assertEquals("kata", result);
        assertEquals(List.of(0x0F5E), diagnostics.dropped);
        assertTrue(diagnostics.anomalies.isEmpty());
    }

    @Test
    void testUnsupportedLetterLeavesNeighboursIntact() {
        String clean = transliterator.transliterate("པདྨ་མ་");
        String withZa = transliterator.transliterate("པདྨ་ཟ་མ་");
        assertEquals("padma ma ", clean);
        assertEquals("padma  ma ", withZa);
        assertEquals(1, diagnostics.dropped.size());
    }

    @Test
    void testReverseSignOutsideLiquidIsReported() {
        // ka + reverse gi gu: the vowel is written on arrival and again at the flush
        assertEquals("kii", transliterator.transliterate("\u0F40\u0F80"));
        assertEquals("kiiṃ", transliterator.transliterate("\u0F40\u0F80\u0F7E"));
        assertEquals("kīī", transliterator.transliterate("\u0F40\u0F81"));
        assertEquals(3, diagnostics.anomalies.size());
    }

    @Test
    void testViramaAfterVowelIsReported() {
        // ku + virama + ma: the pending u is discarded
        assertEquals("kma", transliterator.transliterate("\u0F40\u0F74\u0F84\u0F58"));
        assertEquals(List.of(Anomaly.VIRAMA_AFTER_VOWEL), diagnostics.anomalies);
    }

    @Test
    void testLineBreaksPassThrough() {
        assertEquals("ka\nkha", transliterator.transliterate("ཀ\nཁ"));
    }

    @Test
    void testDigitsAndNonBreakingTsheg() {
        // one two, non-breaking tsheg, ka
        assertEquals("12 ka", transliterator.transliterate("\u0F21\u0F22\u0F0C\u0F40"));
        assertTrue(diagnostics.dropped.isEmpty());
    }

    @Test
    void testNonTibetanTextIsDropped() {
        assertEquals("ka", transliterator.transliterate("abc ཀ"));
    }

    @Test
    void testStrayMarkIsFlaggedButConverted() {
        Conversion conversion = transliterator.convert("ིཀ", NormalForm.NFD);
        assertFalse(conversion.isValid());
        assertEquals("ika", conversion.getOutput());

        assertTrue(transliterator.convert("ཀི", NormalForm.NFD).isValid());
    }

    @Test
    void testEmptyString() {
        assertEquals("", transliterator.transliterate(""));
    }
}
