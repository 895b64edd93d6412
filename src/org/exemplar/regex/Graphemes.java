/* @LICENSE@
 */
package org.exemplar.regex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.exemplar.regex.Misc.ImmutableIterator;

import com.ibm.icu.text.BreakIterator;

/**
 * Splits a string into user-perceived characters, following the extended
 * grapheme cluster rules of <a
 * href="http://www.unicode.org/reports/tr29/">Unicode Standard Annex #29</a>:
 * a combining sequence, a regional indicator pair (flag) or an emoji ZWJ
 * sequence is one {@link Grapheme}.
 * <p>
 * The sequence is lazy, and every call to {@link #iterator()} starts over.
 */
final class Graphemes implements Iterable<Grapheme> {

    private final String s;

    private Graphemes(String s) {
        if (s == null) {
            throw new NullPointerException("null string");
        }
        this.s = s;
    }

    static Graphemes of(String s) {
        return new Graphemes(s);
    }

    static List<Grapheme> listOf(String s) {
        List<Grapheme> ret = new ArrayList<Grapheme>(s.length());
        for (Grapheme g : of(s)) {
            ret.add(g);
        }
        return ret;
    }

    public Iterator<Grapheme> iterator() {
        // BreakIterator is stateful; one per traversal.
        final BreakIterator bi = BreakIterator.getCharacterInstance();
        bi.setText(s);
        return new ImmutableIterator<Grapheme>() {
            private int start = bi.first();
            private int end = bi.next();

            public boolean hasNext() {
                return end != BreakIterator.DONE;
            }

            public Grapheme next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Grapheme ret = Grapheme.literal(s.substring(start, end));
                start = end;
                end = bi.next();
                return ret;
            }
        };
    }

    @Override
    public String toString() {
        return s;
    }
}
