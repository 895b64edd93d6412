/* @LICENSE@
 */

package org.exemplar.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public class DFATestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DFATestCase.class);
    }

    public DFATestCase(String name) {
        super(name);
    }

    private static DFA dfa(String... testCases) {
        List<List<Grapheme>> sequences = new ArrayList<List<Grapheme>>();
        for (String s : testCases) {
            sequences.add(graphemes(s));
        }
        return new DFA(sequences);
    }

    static DFA.State state(int id, boolean accept, Object... arcs) {
        SortedMap<Grapheme, Integer> map = new TreeMap<Grapheme, Integer>();
        for (int i = 0; i < arcs.length; i += 2) {
            map.put(Grapheme.literal((String) arcs[i]), (Integer) arcs[i + 1]);
        }
        return new DFA.State(id, accept, map);
    }

    public void testTrie() {
        DFA dfa = dfa("abc", "abd");
        assertEquals(5, dfa.size());
        assertFalse(dfa.start().accept);
        assertEquals(1, dfa.start().arcs().size());
        assertEquals(Integer.valueOf(1), dfa.start().next(Grapheme.literal("a")));
        assertNull(dfa.start().next(Grapheme.literal("b")));
        assertEquals(2, dfa.state(2).arcs().size());
    }

    public void testEmpty() {
        DFA dfa = new DFA(Collections.<List<Grapheme>>emptyList());
        assertEquals(1, dfa.size());
        assertFalse(dfa.start().accept);
        assertTrue(dfa.start().arcs().isEmpty());
        assertEquals(1, dfa.minimize().size());
    }

    public void testEmptyString() {
        DFA dfa = dfa("");
        assertEquals(1, dfa.size());
        assertTrue(dfa.start().accept);
        assertTrue(dfa.accepts(graphemes("")));
        assertFalse(dfa.accepts(graphemes("a")));
    }

    public void testBreadthFirstIds() {
        DFA dfa = dfa("xbc", "abc");
        assertEquals(7, dfa.size());
        // 'a' sorts before 'x', so its branch is numbered first
        assertEquals(Integer.valueOf(1), dfa.start().next(Grapheme.literal("a")));
        assertEquals(Integer.valueOf(2), dfa.start().next(Grapheme.literal("x")));
        for (int i = 0; i < dfa.size(); ++i) {
            assertEquals(i, dfa.state(i).id);
        }
    }

    public void testMinimizeSharedSuffix() {
        DFA min = dfa("abc", "xbc").minimize();
        assertEquals(4, min.size());
        assertEquals(min.start().next(Grapheme.literal("a")),
            min.start().next(Grapheme.literal("x")));
        assertTrue(min.accepts(graphemes("abc")));
        assertTrue(min.accepts(graphemes("xbc")));
        assertFalse(min.accepts(graphemes("ab")));
        assertFalse(min.accepts(graphemes("abcc")));
    }

    public void testMinimizeMergesLeaves() {
        assertEquals(4, dfa("abc", "abd").minimize().size());
        assertEquals(5, dfa("car", "cars").minimize().size());
    }

    public void testMinimizeKeepsLanguage() {
        String[] testCases = {"", "a", "ab", "abc", "bc", "c", "cab"};
        DFA dfa = dfa(testCases);
        DFA min = dfa.minimize();
        assertTrue(min.size() <= dfa.size());
        for (String s : testCases) {
            assertTrue(s, min.accepts(graphemes(s)));
        }
        for (String s : new String[] {"b", "ac", "ca", "abcd", "bca"}) {
            assertFalse(s, min.accepts(graphemes(s)));
        }
    }

    public void testMinimizeIsIdempotent() {
        DFA min = dfa("one", "two", "three", "four").minimize();
        assertEquals(min.toString(), min.minimize().toString());
    }

    public void testOrderIndependent() {
        List<String> testCases = Arrays.asList("ab", "b", "ba", "abab", "bb");
        String expected = dfa(testCases.toArray(new String[0])).minimize().toString();
        for (int i = 0; i < testCases.size(); ++i) {
            Collections.rotate(testCases, 1);
            DFA dfa = dfa(testCases.toArray(new String[0]));
            assertEquals(expected, dfa.minimize().toString());
        }
        Collections.reverse(testCases);
        assertEquals(expected, dfa(testCases.toArray(new String[0])).minimize().toString());
    }

    public void testCycle() {
        DFA dfa = new DFA(Arrays.asList(
            state(0, true, "a", 1),
            state(1, true, "a", 0)));
        DFA min = dfa.minimize();
        assertEquals(1, min.size());
        assertEquals(Integer.valueOf(0), min.start().next(Grapheme.literal("a")));
        assertTrue(min.accepts(graphemes("aaaaa")));
    }

    public void testBadStates() {
        try {
            new DFA(Collections.<DFA.State>emptyList());
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new DFA(Arrays.asList(state(1, true)));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new DFA(Arrays.asList(state(0, true, "a", 2)));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testToString() {
        String s = dfa("ab").toString();
        assertTrue(s, s.startsWith("total states: 3 total arcs 2"));
        assertTrue(s, s.contains("(init)"));
        assertTrue(s, s.contains("(accept)"));
    }
}
