/* @LICENSE@
 */
package org.exemplar.regex;

import static org.exemplar.regex.Misc.compareCodePoints;
import static org.exemplar.regex.Misc.compareLists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An atomic symbol of the automaton alphabet: a user-perceived character
 * (grapheme cluster), a predefined character class standing in for one, a set
 * of single characters, or a bounded repetition of a sequence of graphemes.
 * <p>
 * Instances are immutable, and have value semantics; the natural ordering is
 * the alphabet order used wherever iteration order could leak into output.
 */
final class Grapheme implements Comparable<Grapheme> {

    enum Kind {

        LITERAL(null),
        DIGIT("\\d"),
        NON_DIGIT("\\D"),
        WORD("\\w"),
        NON_WORD("\\W"),
        SPACE("\\s"),
        NON_SPACE("\\S"),
        SET(null),
        REPEAT(null);

        final String glyph;
        Kind(String glyph) {
            this.glyph = glyph;
        }

        boolean isClass() {
            return glyph != null;
        }
    }

    final Kind kind;
    /** the cluster text, LITERAL only */
    final String text;
    private final int[] members;        // SET only, ascending
    /** the repeated sequence, REPEAT only */
    final List<Grapheme> unit;
    final int min, max;

    private Grapheme(Kind kind, String text, int[] members,
            List<Grapheme> unit, int min, int max) {
        this.kind = kind;
        this.text = text;
        this.members = members;
        this.unit = unit;
        this.min = min;
        this.max = max;
    }

    static Grapheme literal(String text) {
        if (text.length() == 0) {
            throw new IllegalArgumentException("empty grapheme");
        }
        return new Grapheme(Kind.LITERAL, text, null, null, 1, 1);
    }

    static Grapheme literal(int codePoint) {
        return literal(new String(Character.toChars(codePoint)));
    }

    static Grapheme classOf(Kind kind) {
        if (!kind.isClass()) {
            throw new IllegalArgumentException("not a class: " + kind);
        }
        return new Grapheme(kind, "", null, null, 1, 1);
    }

    /**
     * @param codePoints
     *            at least two distinct Basic Multilingual Plane code points.
     */
    static Grapheme set(Collection<Integer> codePoints) {
        SortedSet<Integer> sorted = new TreeSet<Integer>(codePoints);
        if (sorted.size() < 2) {
            throw new IllegalArgumentException("degenerate set: " + sorted);
        }
        int[] members = new int[sorted.size()];
        int i = 0;
        for (int c : sorted) {
            assert Character.isBmpCodePoint(c) : Integer.toHexString(c);
            members[i++] = c;
        }
        return new Grapheme(Kind.SET, "", members, null, 1, 1);
    }

    static Grapheme repeat(List<Grapheme> unit, int min, int max) {
        if (unit.isEmpty() || min < 0 || max < min) {
            throw new IllegalArgumentException(
                "bad repetition: " + unit + '{' + min + ',' + max + '}');
        }
        return new Grapheme(Kind.REPEAT, "",  null,
            Collections.unmodifiableList(new ArrayList<Grapheme>(unit)),
            min, max);
    }

    int[] members() {
        return members.clone();
    }

    int codePointCount() {
        return kind == Kind.LITERAL
                ? text.codePointCount(0, text.length())
                : 1;
    }

    boolean isSingleCodePoint() {
        return kind == Kind.LITERAL && codePointCount() == 1;
    }

    int codePoint() {
        assert isSingleCodePoint() : this;
        return text.codePointAt(0);
    }

    public int compareTo(Grapheme o) {
        if (kind != o.kind) {
            return kind.compareTo(o.kind);
        }
        switch (kind) {
        case LITERAL:
            return compareCodePoints(text, o.text);
        case SET:
            for (int i = 0; i < members.length && i < o.members.length; ++i) {
                if (members[i] != o.members[i]) {
                    return members[i] < o.members[i] ? -1 : 1;
                }
            }
            return members.length - o.members.length;
        case REPEAT:
            int c = compareLists(unit, o.unit);
            if (c != 0) return c;
            if (min != o.min) return min < o.min ? -1 : 1;
            return max == o.max ? 0 : max < o.max ? -1 : 1;
        default:
            return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grapheme)) return false;
        Grapheme g = (Grapheme) o;
        return kind == g.kind
            && text.equals(g.text)
            && Arrays.equals(members, g.members)
            && (unit == null ? g.unit == null : unit.equals(g.unit))
            && min == g.min
            && max == g.max;
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + text.hashCode();
        h = 31 * h + Arrays.hashCode(members);
        h = 31 * h + (unit == null ? 0 : unit.hashCode());
        h = 31 * h + min;
        return 31 * h + max;
    }

    /*
     * Raw form, for logging: unescaped text, class glyphs, [set], (unit){m,n}.
     */
    @Override
    public String toString() {
        if (s != null) return s;
        StringBuilder sb = new StringBuilder();
        switch (kind) {
        case LITERAL:
            sb.append(text);
            break;
        case SET:
            sb.append('[');
            for (int c : members) sb.appendCodePoint(c);
            sb.append(']');
            break;
        case REPEAT:
            sb.append('(');
            for (Grapheme g : unit) sb.append(g);
            sb.append("){").append(min).append(',').append(max).append('}');
            break;
        default:
            sb.append(kind.glyph);
        }
        return s = sb.toString();
    }
    private String s;

    /*
     * For SET rendering: the members as [lo, hi] runs of consecutive code
     * points.
     */
    List<int[]> runs() {
        assert kind == Kind.SET;
        List<int[]> ret = new ArrayList<int[]>();
        int[] run = null;
        for (int c : members) {
            if (run != null && run[1] + 1 == c) {
                run[1] = c;
            } else {
                ret.add(run = new int[] {c, c});
            }
        }
        return ret;
    }
}
