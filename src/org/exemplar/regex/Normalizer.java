/* @LICENSE@
 */
package org.exemplar.regex;

import static org.exemplar.regex.Misc.isSet;

import java.util.ArrayList;
import java.util.List;

import org.exemplar.regex.Grapheme.Kind;

import com.ibm.icu.lang.UCharacter;

/**
 * Uninstantiable class which serves as a source container for the rewrites
 * applied to grapheme sequences before automaton construction. Both rewrites
 * are pure: the argument is never modified.
 */
final class Normalizer {

    static final int CLASS_FLAGS =
            RegexBuilder.DIGITS | RegexBuilder.NON_DIGITS
            | RegexBuilder.WORDS | RegexBuilder.NON_WORDS
            | RegexBuilder.SPACES | RegexBuilder.NON_SPACES;

    static List<Grapheme> normalize(List<Grapheme> graphemes, int flags) {
        List<Grapheme> ret = graphemes;
        if ((flags & CLASS_FLAGS) != 0) {
            ret = convertClasses(ret, flags);
        }
        if (isSet(flags, RegexBuilder.REPETITIONS)) {
            ret = foldRepetitions(ret);
        }
        return ret;
    }

    /**
     * Replaces single code point graphemes by class placeholders. The first
     * rule that applies wins: digit, word, space, then the complements in the
     * same order. So with both enabled, '7' becomes <code>\d</code>, not
     * <code>\w</code>.
     */
    static List<Grapheme> convertClasses(List<Grapheme> graphemes, int flags) {
        List<Grapheme> ret = new ArrayList<Grapheme>(graphemes.size());
        for (Grapheme g : graphemes) {
            Kind kind = g.isSingleCodePoint() ? classOf(g.codePoint(), flags) : null;
            ret.add(kind == null ? g : Grapheme.classOf(kind));
        }
        return ret;
    }

    private static Kind classOf(int c, int flags) {
        boolean digit = isDigit(c), word = isWord(c), space = isSpace(c);
        if (digit && isSet(flags, RegexBuilder.DIGITS))         return Kind.DIGIT;
        if (word && isSet(flags, RegexBuilder.WORDS))           return Kind.WORD;
        if (space && isSet(flags, RegexBuilder.SPACES))         return Kind.SPACE;
        if (!digit && isSet(flags, RegexBuilder.NON_DIGITS))    return Kind.NON_DIGIT;
        if (!word && isSet(flags, RegexBuilder.NON_WORDS))      return Kind.NON_WORD;
        if (!space && isSet(flags, RegexBuilder.NON_SPACES))    return Kind.NON_SPACE;
        return null;
    }

    static boolean isDigit(int c) {
        return UCharacter.isDigit(c);
    }

    static boolean isWord(int c) {
        return UCharacter.isUAlphabetic(c) || UCharacter.isDigit(c) || c == '_';
    }

    static boolean isSpace(int c) {
        return UCharacter.isUWhiteSpace(c);
    }

    /**
     * Folds runs of consecutive copies of a subsequence into {@code REPEAT}
     * graphemes, scanning left to right. At each position the run covering
     * the most graphemes wins, the shorter unit on a tie; the unit is folded
     * in turn. The scan is greedy: "aabab" folds to a{2}bab, not a(ab){2}.
     */
    static List<Grapheme> foldRepetitions(List<Grapheme> graphemes) {
        final int n = graphemes.size();
        List<Grapheme> ret = new ArrayList<Grapheme>(n);
        int i = 0;
        while (i < n) {
            int bestLen = 0, bestCount = 0;
            for (int len = 1; 2 * len <= n - i; ++len) {
                int count = copies(graphemes, i, len);
                if (count > 1 && count * len > bestCount * bestLen) {
                    bestLen = len;
                    bestCount = count;
                }
            }
            if (bestCount == 0) {
                ret.add(graphemes.get(i++));
            } else {
                List<Grapheme> unit = foldRepetitions(graphemes.subList(i, i + bestLen));
                ret.add(Grapheme.repeat(unit, bestCount, bestCount));
                i += bestLen * bestCount;
            }
        }
        return ret;
    }

    /*
     * number of consecutive copies of s[from, from+len) starting at from
     */
    private static int copies(List<Grapheme> s, int from, int len) {
        final List<Grapheme> unit = s.subList(from, from + len);
        int count = 1;
        for (int j = from + len; j + len <= s.size(); j += len) {
            if (!s.subList(j, j + len).equals(unit)) break;
            ++count;
        }
        return count;
    }

    private Normalizer() {}     // uninstantiable
}
