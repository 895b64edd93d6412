/*
 * @LICENSE@
 */

package org.exemplar.regex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * So many iterators don't suport remove()
     */
    public static abstract class ImmutableIterator<E> implements Iterator<E> {
        public final void remove() {
            throw new UnsupportedOperationException("sorry!");
        }
    }

    /*
     * idiom suppression for walking the code points of a String
     */
    static int[] codePointsOf(CharSequence cs) {
        int[] ret = new int[Character.codePointCount(cs, 0, cs.length())];
        for (int i = 0, n = 0; i < cs.length(); ++n) {
            int c = Character.codePointAt(cs, i);
            ret[n] = c;
            i += Character.charCount(c);
        }
        return ret;
    }

    /**
     * Compares two strings by code point rather than by UTF-16 code unit, so
     * that supplementary characters sort after the whole Basic Multilingual
     * Plane.
     */
    static int compareCodePoints(CharSequence lhs, CharSequence rhs) {
        int i = 0, j = 0;
        while (i < lhs.length() && j < rhs.length()) {
            int c = Character.codePointAt(lhs, i);
            int d = Character.codePointAt(rhs, j);
            if (c != d) {
                return c < d ? -1 : 1;
            }
            i += Character.charCount(c);
            j += Character.charCount(d);
        }
        if (i < lhs.length()) return 1;
        if (j < rhs.length()) return -1;
        return 0;
    }

    static <T extends Comparable<? super T>> int compareLists(
            List<T> lhs, List<T> rhs) {
        for (int i = 0; i < lhs.size() && i < rhs.size(); ++i) {
            int c = lhs.get(i).compareTo(rhs.get(i));
            if (c != 0) return c;
        }
        return lhs.size() - rhs.size();
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagGen");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (!contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }

        MapEscaper backslash(String chars) {
            for (char c : chars.toCharArray()) {
                map(c, "\\" + c);
            }
            return this;
        }
    }

    private static void appendHex(StringBuilder sb, int c) {
        int mark = sb.length();
        sb.append(Integer.toHexString(c));
        while (sb.length() - mark < 4) {
            sb.insert(mark, "0");
        }
        sb.insert(mark, "\\u");
    }

    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\f', "\\f");
    private static final MapEscaper rxpEscaper =
            new MapEscaper().backslash("\\.^$|?*+()[]{}");
    private static final MapEscaper rxccEscaper =
            new MapEscaper().backslash("\\^-[]");

    private static final Escaper controlEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = c < 32 || c == 127;
            if (ret) {
                appendHex(sb, c);
            }
            return ret;
        }
    };

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (Character.isSupplementaryCodePoint(c)) {
                sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                ret = true;
            } else if (0x7f < c) {
                appendHex(sb, c);
                ret = true;
            }
            return ret;
        }
    };

    private static final Escaper surrogateEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (Character.isSupplementaryCodePoint(c)) {
                appendHex(sb, Character.highSurrogate(c));
                appendHex(sb, Character.lowSurrogate(c));
                ret = true;
            } else if (0x7f < c) {
                appendHex(sb, c);
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Regex Pattern escaper - escapes metachars (like '('), \n and
         * friends, other ASCII controls -> \\u codes
         */
        RXP(rxEscaper, rxpEscaper, controlEscaper),
        /**
         * As RXP, plus everything beyond ASCII -> \\u codes, supplementary
         * code points as \\u{...}
         */
        RXP_UNICODE(rxEscaper, rxpEscaper, controlEscaper, unicodeEscaper),
        /**
         * As RXP_UNICODE, but supplementary code points as two \\u surrogate
         * codes
         */
        RXP_SURROGATE(rxEscaper, rxpEscaper, controlEscaper, surrogateEscaper),
        /**
         * Char class escaper - escapes char class metachars (like '-')
         */
        RXCC(rxEscaper, rxccEscaper, controlEscaper),
        RXCC_UNICODE(rxEscaper, rxccEscaper, controlEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.appendCodePoint(c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int c : codePointsOf(cs)) {
                esc(sb, c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
