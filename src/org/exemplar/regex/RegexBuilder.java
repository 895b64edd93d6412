/*
 * @LICENSE@
 */

package org.exemplar.regex;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.exemplar.regex.AST.Node;
import org.exemplar.regex.Misc.FlagMgr;

/**
 * Builds a regular expression from a set of example strings ("test cases").
 * The expression matches exactly the test cases - unless some of the flags
 * below generalize it - and is as specific and readable as possible:
 * <blockquote><pre>
 * RegexBuilder.from("car", "cars").build()                  // ^cars?$
 * RegexBuilder.from("a", "b").build()                       // ^[ab]$
 * RegexBuilder.from("1", "2", "3").withConvertedDigits()
 *     .build()                                              // ^\d$
 * RegexBuilder.from("aa", "aaa").withConvertedRepetitions()
 *     .build()                                              // ^a{2,3}$
 * </pre></blockquote>
 * Every expression is anchored with <code>^</code> and <code>$</code>, so that
 * it never matches a mere substring of its input.
 * <p>
 * <strong>Unicode support:</strong> the unit of matching is the grapheme
 * cluster, as defined by <a
 * href="http://www.unicode.org/reports/tr29/">Unicode Standard Annex #29</a>:
 * a character followed by combining marks, or an emoji sequence, is treated
 * as one character - never split by a character class or repetition.
 * <p>
 * <strong>Determinism:</strong> the test cases are deduplicated and sorted
 * before use, so the order in which they are given never changes the result.
 * <p>
 * Instances are not thread safe. The static {@link #synthesize(Collection,
 * int)} method is.
 */
public final class RegexBuilder {

    private static final Logger logger = Logger.getLogger("org.exemplar.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Converts any Unicode decimal digit to <code>\d</code>.
     */
    public static final int DIGITS = flagMgr.next("DIGITS");

    /**
     * Converts any character which is not a digit to <code>\D</code>.
     */
    public static final int NON_DIGITS = flagMgr.next("NON_DIGITS");

    /**
     * Converts any word character (letter, digit or underscore) to
     * <code>\w</code>. Digits become <code>\d</code> instead if
     * {@link #DIGITS} is set too.
     */
    public static final int WORDS = flagMgr.next("WORDS");

    public static final int NON_WORDS = flagMgr.next("NON_WORDS");

    /**
     * Converts any white space character to <code>\s</code>.
     */
    public static final int SPACES = flagMgr.next("SPACES");

    public static final int NON_SPACES = flagMgr.next("NON_SPACES");

    /**
     * Folds repeated substrings into <code>{min,max}</code> quantifier
     * notation: <code>abab</code> becomes <code>(ab){2}</code>. Detection is
     * greedy and left-most first, which does not always find the shortest
     * encoding.
     */
    public static final int REPETITIONS = flagMgr.next("REPETITIONS");

    /**
     * Writes every character beyond ASCII as a unicode escape: four hex digits
     * in the Basic Multilingual Plane, a braced hex code point beyond it.
     */
    public static final int ESCAPE_NON_ASCII = flagMgr.next("ESCAPE_NON_ASCII");

    /**
     * With {@link #ESCAPE_NON_ASCII}, writes characters beyond the Basic
     * Multilingual Plane as two surrogate escapes, for regex dialects which
     * work on UTF-16 code units. Without it, this flag has no effect.
     */
    public static final int SURROGATE_PAIRS = flagMgr.next("SURROGATE_PAIRS");

    static final int FLAG_COUNT =
            flagMgr.setImplemented(
                DIGITS | NON_DIGITS | WORDS | NON_WORDS | SPACES | NON_SPACES
                        | REPETITIONS | ESCAPE_NON_ASCII | SURROGATE_PAIRS).freezeAndCount();

    /**
     * Test case order: shorter (in code points) first, then by code point.
     */
    static final Comparator<String> TEST_CASE_ORDER = new Comparator<String>() {
        public int compare(String lhs, String rhs) {
            int l = lhs.codePointCount(0, lhs.length());
            int r = rhs.codePointCount(0, rhs.length());
            return l != r ? (l < r ? -1 : 1) : Misc.compareCodePoints(lhs, rhs);
        }
    };

    private final List<String> testCases;
    private int flags = 0;

    private RegexBuilder(Collection<String> testCases) {
        for (String testCase : testCases) {
            if (testCase == null) {
                throw new NullPointerException("null test case");
            }
        }
        this.testCases = new ArrayList<String>(testCases);
    }

    public static RegexBuilder from(String... testCases) {
        return from(Arrays.asList(testCases));
    }

    /**
     * The test cases need not be sorted, and may contain duplicates. No test
     * cases at all yields <code>^$</code>, the same as the empty string alone.
     */
    public static RegexBuilder from(Collection<String> testCases) {
        if (testCases == null) {
            throw new NullPointerException("null test cases");
        }
        return new RegexBuilder(testCases);
    }

    public RegexBuilder withConvertedDigits() {
        return withFlags(DIGITS);
    }

    public RegexBuilder withConvertedNonDigits() {
        return withFlags(NON_DIGITS);
    }

    public RegexBuilder withConvertedWords() {
        return withFlags(WORDS);
    }

    public RegexBuilder withConvertedNonWords() {
        return withFlags(NON_WORDS);
    }

    public RegexBuilder withConvertedSpaces() {
        return withFlags(SPACES);
    }

    public RegexBuilder withConvertedNonSpaces() {
        return withFlags(NON_SPACES);
    }

    public RegexBuilder withConvertedRepetitions() {
        return withFlags(REPETITIONS);
    }

    /**
     * @param useSurrogatePairs
     *            whether characters beyond the Basic Multilingual Plane are
     *            written as surrogate pairs.
     */
    public RegexBuilder withEscapedNonAscii(boolean useSurrogatePairs) {
        return withFlags(ESCAPE_NON_ASCII | (useSurrogatePairs ? SURROGATE_PAIRS : 0));
    }

    /**
     * Adds <code>flags</code> to the flags already set.
     *
     * @throws IllegalArgumentException
     *             for unknown flags.
     */
    public RegexBuilder withFlags(int flags) {
        flagMgr.check(flags);
        this.flags |= flags;
        return this;
    }

    public int flags() {
        return flags;
    }

    public String build() {
        return synthesize(testCases, flags);
    }

    /**
     * @param testCases
     *            the strings to match.
     * @param flags
     *            any combination of the flags of this class.
     * @return the anchored regular expression.
     * @throws IllegalArgumentException
     *             for unknown flags.
     */
    public static String synthesize(Collection<String> testCases, int flags) {

        flagMgr.check(flags);

        SortedSet<String> sorted = sort(testCases);
        if (logger.isLoggable(level)) {
            logger.log(level, "test cases: " + sorted);
            logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        }

        List<List<Grapheme>> sequences = new ArrayList<List<Grapheme>>(sorted.size());
        for (String testCase : sorted) {
            sequences.add(Normalizer.normalize(Graphemes.listOf(testCase), flags));
        }

        DFA dfa = new DFA(sequences).minimize();
        Node root = new Synthesizer(dfa).synthesize();
        String ret = new Renderer(flags).anchored(root);

        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + ret);
        }
        return ret;
    }

    static SortedSet<String> sort(Collection<String> testCases) {
        SortedSet<String> ret = new TreeSet<String>(TEST_CASE_ORDER);
        for (String testCase : testCases) {
            if (testCase == null) {
                throw new NullPointerException("null test case");
            }
            ret.add(testCase);
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    @Override
    public String toString() {
        return "RegexBuilder" + testCases
            + (flags == 0 ? "" : " [" + flagMgr.stringFrom(flags) + ']');
    }
}
