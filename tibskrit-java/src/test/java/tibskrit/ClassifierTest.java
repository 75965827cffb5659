package tibskrit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassifierTest {

    @Test
    void testLetters() {
        assertEquals(Category.BASE, Classifier.classify(0x0F40));
        assertEquals(Category.BASE, Classifier.classify(0x0F6C));
        assertEquals(Category.BASE, Classifier.classify(0x0F21)); // digit one
        assertEquals(Category.SUBSCRIPT, Classifier.classify(0x0F90));
        assertEquals(Category.SUBSCRIPT, Classifier.classify(0x0FBC));
        assertEquals(Category.SUBSCRIPT, Classifier.classify(0x0F39));
    }

    @Test
    void testVowelsAndMarks() {
        assertEquals(Category.BOTTOM_VOWEL, Classifier.classify(0x0F71));
        assertEquals(Category.BOTTOM_VOWEL, Classifier.classify(0x0F74));
        assertEquals(Category.TOP_VOWEL, Classifier.classify(0x0F72));
        assertEquals(Category.TOP_VOWEL, Classifier.classify(0x0F80));
        assertEquals(Category.BOTTOM_MARK, Classifier.classify(0x0F84));
        assertEquals(Category.TOP_MARK, Classifier.classify(0x0F7E));
        assertEquals(Category.TOP_MARK, Classifier.classify(0x0F83));
        assertEquals(Category.RIGHT_MARK, Classifier.classify(0x0F7F));
    }

    @Test
    void testOutsideRangeIsOther() {
        assertEquals(Category.OTHER, Classifier.classify('a'));
        assertEquals(Category.OTHER, Classifier.classify(-1));
        assertEquals(Category.OTHER, Classifier.classify(0x0EFF));
        assertEquals(Category.OTHER, Classifier.classify(0x0FBD));
        assertEquals(Category.OTHER, Classifier.classify(0x1F600));
    }

    @Test
    void testPunctuationIsOther() {
        assertEquals(Category.OTHER, Classifier.classify(0x0F00));
        assertEquals(Category.OTHER, Classifier.classify(0x0F0B));
        assertEquals(Category.OTHER, Classifier.classify(0x0F0D));
        assertEquals(Category.OTHER, Classifier.classify(0x0F85));
    }

    @Test
    void testEveryCodepointIsClassified() {
        for (int cp = Classifier.TIBETAN_START; cp <= Classifier.TIBETAN_END; cp++) {
            assertNotNull(Classifier.classify(cp), String.format("U+%04X", cp));
        }
    }

    @Test
    void testCategoryOrder() {
        assertTrue(Category.SUBSCRIPT.compareTo(Category.BOTTOM_VOWEL) < 0);
        assertTrue(Category.TOP_MARK.compareTo(Category.RIGHT_MARK) < 0);
        assertFalse(Category.BASE.isCombining());
        assertFalse(Category.OTHER.isCombining());
        assertTrue(Category.SUBSCRIPT.isCombining());
    }

    @Test
    void testStackingSet() {
        assertTrue(Classifier.isStacking(0x0F90));
        assertTrue(Classifier.isStacking(0x0FB0));
        assertTrue(Classifier.isStacking(0x0FB5));
        assertFalse(Classifier.isStacking(0x0FAD));
        assertFalse(Classifier.isStacking(0x0FB2));
        assertFalse(Classifier.isStacking(0x0F74));
    }
}
