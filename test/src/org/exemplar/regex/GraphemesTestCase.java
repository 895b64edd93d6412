/* @LICENSE@
 */

package org.exemplar.regex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public class GraphemesTestCase extends AbstractRxTestCase {

    private static final String E_ACUTE = "e\u0301";
    private static final String FAMILY =
        "\uD83D\uDC68\u200D\uD83D\uDC69\u200D\uD83D\uDC67";
    private static final String FLAG_DE = "\uD83C\uDDE9\uD83C\uDDEA";
    private static final String FLAG_FR = "\uD83C\uDDEB\uD83C\uDDF7";

    public static void main(String[] args) {
        junit.textui.TestRunner.run(GraphemesTestCase.class);
    }

    public GraphemesTestCase(String name) {
        super(name);
    }

    private static List<String> texts(String s) {
        List<String> ret = new ArrayList<String>();
        for (Grapheme g : Graphemes.of(s)) {
            assertEquals(Grapheme.Kind.LITERAL, g.kind);
            ret.add(g.text);
        }
        return ret;
    }

    public void testAscii() {
        List<String> t = texts("abc");
        assertEquals(3, t.size());
        assertEquals("a", t.get(0));
        assertEquals("b", t.get(1));
        assertEquals("c", t.get(2));
    }

    public void testEmpty() {
        assertTrue(Graphemes.listOf("").isEmpty());
        assertFalse(Graphemes.of("").iterator().hasNext());
    }

    public void testCombiningMark() {
        List<String> t = texts(E_ACUTE + "x");
        assertEquals(2, t.size());
        assertEquals(E_ACUTE, t.get(0));
        assertEquals(2, Graphemes.listOf(E_ACUTE).get(0).codePointCount());
        assertFalse(Graphemes.listOf(E_ACUTE).get(0).isSingleCodePoint());
    }

    public void testEmojiSequences() {
        assertEquals(1, texts(FAMILY).size());
        assertEquals(FAMILY, texts(FAMILY).get(0));

        List<String> flags = texts(FLAG_DE + FLAG_FR);
        assertEquals(2, flags.size());
        assertEquals(FLAG_DE, flags.get(0));
        assertEquals(FLAG_FR, flags.get(1));
    }

    public void testSupplementary() {
        List<Grapheme> gs = Graphemes.listOf("\uD83D\uDCA9a");
        assertEquals(2, gs.size());
        assertTrue(gs.get(0).isSingleCodePoint());
        assertEquals(0x1F4A9, gs.get(0).codePoint());
    }

    public void testCrLf() {
        assertEquals(1, texts("\r\n").size());
        assertEquals(2, texts("\n\r").size());
    }

    public void testConcatenationRestoresInput() {
        String s = "a" + E_ACUTE + FAMILY + " 1" + FLAG_DE;
        StringBuilder sb = new StringBuilder();
        for (Grapheme g : Graphemes.of(s)) {
            sb.append(g.text);
        }
        assertEquals(s, sb.toString());
    }

    public void testRestartable() {
        Graphemes gs = Graphemes.of("xyz");
        List<Grapheme> first = new ArrayList<Grapheme>();
        for (Grapheme g : gs) first.add(g);
        List<Grapheme> second = new ArrayList<Grapheme>();
        for (Grapheme g : gs) second.add(g);
        assertEquals(first, second);
        assertEquals(3, first.size());
    }

    public void testIterator() {
        Iterator<Grapheme> it = Graphemes.of("a").iterator();
        assertTrue(it.hasNext());
        assertEquals(Grapheme.literal("a"), it.next());
        assertFalse(it.hasNext());
        try {
            it.next();
            fail();
        } catch (NoSuchElementException e) {
            // expected
        }
        try {
            Graphemes.of("a").iterator().remove();
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    public void testNull() {
        try {
            Graphemes.of(null);
            fail();
        } catch (NullPointerException e) {
            // expected
        }
    }
}
