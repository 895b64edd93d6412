/* @LICENSE@
 */
package org.exemplar.regex;

import static org.exemplar.regex.Misc.LS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.exemplar.regex.AST.Visitor.TraversalOrder;
import org.exemplar.regex.Grapheme.Kind;

/**
 *
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used the construction of Abstract Syntax Trees.
 * <p>
 * Nodes are immutable and are only built through the static factories at the
 * bottom, which keep trees in normal form: no single child {@link Alt}, no
 * nested Alts or {@link Cat}s, no <code>x{1}</code>, alternatives sorted.
 *
 * @author ndw
 *
 */
final class AST {

    static final int UNBOUNDED = Integer.MAX_VALUE;

    static abstract class Node {

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new TreePrinter(sb).print(this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses. Structural comparison goes through toString().
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * @return the unanchored regex for this node, with no escaping beyond
         *         the metacharacters.
         */
        @Override
        public final String toString() {
            if (s == null) {
                s = new Renderer(0).render(this);
            }
            return s;
        }
        private String s;
    }

    static final class Literal extends Node {

        final Grapheme g;

        private Literal(Grapheme g) {
            assert g != null && g.kind != Kind.REPEAT : g;
            this.g = g;
        }
    }

    static abstract class NonTerminal extends Node {

        abstract List<Node> children();
    }

    static final class Repeat extends NonTerminal {

        final Node child;
        final int min, max;

        private Repeat(Node child, int min, int max) {
            assert 0 <= min && min <= max && !(min == 1 && max == 1);
            this.child = child;
            this.min = min;
            this.max = max;
        }

        @Override
        List<Node> children() {
            return Collections.singletonList(child);
        }

        boolean unbounded() {
            return max == UNBOUNDED;
        }
    }

    static abstract class Nary extends NonTerminal {

        private final List<Node> children;

        private Nary(List<Node> children) {
            this.children = Collections.unmodifiableList(
                new ArrayList<Node>(children));
        }

        @Override
        final List<Node> children() {
            return children;
        }
    }

    static final class Cat extends Nary {

        private Cat(List<Node> children) {
            super(children);
        }
    }

    static final class Alt extends Nary {

        private Alt(List<Node> children) {
            super(children);
            assert children.size() > 1;
        }
    }

    /**
     * The empty string. The only Cat with less than two children; never a
     * child of another node.
     */
    static final Cat EPSILON = new Cat(Collections.<Node>emptyList());

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }


        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Literal) {
                visit((Literal) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Nary) {
                visit((Nary) node);
            } else if (node instanceof Repeat){
                visit((Repeat) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Nary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}
        protected void visit(Repeat node) {}

        protected void visit(Literal node) {}

        private static void error(Node node) {
            throw new IllegalStateException("unknown node type " + node.getClass());
        }
    }

    static final class TreePrinter extends Visitor {

        private final StringBuilder sb;
        private int nspace = 0;
        private int position = 0;

        TreePrinter(StringBuilder sb) {
            super(TraversalOrder.TOP_DOWN);
            this.sb = sb;
        }

        void print(Node root) {
            position = 0;
            visit(root);
        }

        private StringBuilder indent() {
            for (int i=0; i<nspace; ++i) {
                sb.append(' ');
            }
            return sb;
        }

        @Override
        protected void visit(NonTerminal node) {
            super.visit(node);
            nspace -= 4;
        }

        @Override
        protected void visit(Cat node) {
            indent().append(node == EPSILON ? "()" : "&").append(LS);
            nspace += 4;
        }

        @Override
        protected void visit(Alt node) {
            indent().append('|').append(LS);
            nspace += 4;
        }

        @Override
        protected void visit(Repeat node) {
            indent().append('{').append(node.min).append(',')
                .append(node.unbounded() ? "" : Integer.toString(node.max))
                .append('}').append(LS);
            nspace += 4;
        }

        @Override
        protected void visit(Literal node) {
            indent().append(node).append(' ')
                .append('{').append(position++).append('}')
                .append(LS);
        }
    }

    /*
     * static factories
     */

    static Literal literal(Grapheme g) {
        return new Literal(g);
    }

    static Node literal(String s) {
        List<Node> nodes = new ArrayList<Node>();
        for (Grapheme g : Graphemes.of(s)) {
            nodes.add(literal(g));
        }
        return cat(nodes);
    }

    /**
     * @return the node for an automaton symbol: a Repeat for a
     *         {@link Kind#REPEAT REPEAT} grapheme, otherwise a Literal.
     */
    static Node symbol(Grapheme g) {
        if (g.kind != Kind.REPEAT) {
            return literal(g);
        }
        List<Node> unit = new ArrayList<Node>(g.unit.size());
        for (Grapheme u : g.unit) {
            unit.add(symbol(u));
        }
        return repeat(cat(unit), g.min, g.max);
    }

    static Node cat(Node... nodes) {
        return cat(Arrays.asList(nodes));
    }

    static Node cat(List<? extends Node> nodes) {
        List<Node> flat = new ArrayList<Node>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof Cat) {
                flat.addAll(((Cat) node).children());  // EPSILON adds nothing
            } else {
                flat.add(node);
            }
        }
        if (flat.isEmpty()) {
            return EPSILON;
        }
        return flat.size() == 1 ? flat.get(0) : new Cat(flat);
    }

    static Node alt(Node... nodes) {
        return alt(Arrays.asList(nodes));
    }

    /**
     * Alternation of <code>nodes</code>, simplified:
     * <ul>
     * <li>EPSILON makes the rest optional, <code>x{1,m}</code> becoming
     * <code>x{0,m}</code>;
     * <li>repetitions of the same node with touching ranges are merged, a
     * plain node counting as <code>{1}</code>: <code>a{2}|a{3}</code> is
     * <code>a{2,3}</code>;
     * <li>two or more single characters are merged into a set:
     * <code>a|b</code> is <code>[ab]</code>;
     * <li>duplicates are dropped, and the rest sorted by regex text.
     * </ul>
     */
    static Node alt(Collection<? extends Node> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("empty alternation");
        }
        boolean optional = false;
        List<Node> flat = new ArrayList<Node>(nodes.size());
        for (Node node : nodes) {
            if (node == EPSILON) {
                optional = true;
            } else if (node instanceof Alt) {
                flat.addAll(((Alt) node).children());
            } else {
                flat.add(node);
            }
        }

        SortedMap<String, Node> sorted = new TreeMap<String, Node>();
        for (Node node : mergeSets(mergeRanges(flat))) {
            sorted.put(node.toString(), node);
        }

        Node ret;
        if (sorted.isEmpty()) {
            ret = EPSILON;
        } else if (sorted.size() == 1) {
            ret = sorted.get(sorted.firstKey());
        } else {
            ret = new Alt(new ArrayList<Node>(sorted.values()));
        }
        return optional ? repeat(ret, 0, 1) : ret;
    }

    private static final Comparator<int[]> byMin = new Comparator<int[]>() {
        public int compare(int[] lhs, int[] rhs) {
            return lhs[0] != rhs[0]
                    ? (lhs[0] < rhs[0] ? -1 : 1)
                    : (lhs[1] == rhs[1] ? 0 : lhs[1] < rhs[1] ? -1 : 1);
        }
    };

    private static List<Node> mergeRanges(List<Node> nodes) {
        Map<String, Node> bases = new LinkedHashMap<String, Node>();
        Map<String, List<int[]>> ranges = new LinkedHashMap<String, List<int[]>>();
        for (Node node : nodes) {
            Node base = node;
            int[] range = {1, 1};
            if (node instanceof Repeat) {
                Repeat r = (Repeat) node;
                base = r.child;
                range = new int[] {r.min, r.max};
            }
            String key = base.toString();
            if (!bases.containsKey(key)) {
                bases.put(key, base);
                ranges.put(key, new ArrayList<int[]>());
            }
            ranges.get(key).add(range);
        }

        List<Node> ret = new ArrayList<Node>(nodes.size());
        for (Map.Entry<String, Node> e : bases.entrySet()) {
            List<int[]> rs = ranges.get(e.getKey());
            Collections.sort(rs, byMin);
            int[] cur = null;
            for (int[] r : rs) {
                if (cur != null && r[0] <= (long) cur[1] + 1) {
                    cur[1] = Math.max(cur[1], r[1]);
                } else {
                    if (cur != null) ret.add(repeat(e.getValue(), cur[0], cur[1]));
                    cur = r.clone();
                }
            }
            ret.add(repeat(e.getValue(), cur[0], cur[1]));
        }
        return ret;
    }

    private static boolean isSetMember(Node node) {
        if (!(node instanceof Literal)) return false;
        Grapheme g = ((Literal) node).g;
        return g.kind == Kind.SET
            || (g.isSingleCodePoint() && Character.isBmpCodePoint(g.codePoint()));
    }

    private static List<Node> mergeSets(List<Node> nodes) {
        SortedSet<Integer> members = new TreeSet<Integer>();
        int count = 0;
        for (Node node : nodes) {
            if (isSetMember(node)) {
                ++count;
                Grapheme g = ((Literal) node).g;
                if (g.kind == Kind.SET) {
                    for (int c : g.members()) members.add(c);
                } else {
                    members.add(g.codePoint());
                }
            }
        }
        if (count < 2) {
            return nodes;
        }
        List<Node> ret = new ArrayList<Node>(nodes.size());
        for (Node node : nodes) {
            if (!isSetMember(node)) ret.add(node);
        }
        ret.add(members.size() == 1
                ? literal(Grapheme.literal(members.first()))
                : literal(Grapheme.set(members)));
        return ret;
    }

    /**
     * @param max
     *            {@link #UNBOUNDED} for no upper bound.
     */
    static Node repeat(Node child, int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("bad bounds {" + min + ',' + max + '}');
        }
        if (child == EPSILON || (min == 1 && max == 1)) {
            return child;
        }
        if (min == 0 && max == 1 && child instanceof Repeat
                && ((Repeat) child).min == 1) {
            return new Repeat(((Repeat) child).child, 0, ((Repeat) child).max);
        }
        return new Repeat(child, min, max);
    }

    static Node star(Node child) {
        return repeat(child, 0, UNBOUNDED);
    }

    static Node plus(Node child) {
        return repeat(child, 1, UNBOUNDED);
    }

    static Node question(Node child) {
        return repeat(child, 0, 1);
    }

    /*
     * for testing: no Alt anywhere with fewer than two children, no Cat other
     * than EPSILON with fewer than two, EPSILON only at the root.
     */
    static boolean isNormal(final Node root) {
        final boolean[] ok = {true};
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Cat node) {
                ok[0] &= node == EPSILON ? node == root : node.children().size() > 1;
            }
            @Override
            protected void visit(Alt node) {
                ok[0] &= node.children().size() > 1;
            }
        }.visit(root);
        return ok[0];
    }

    private AST() {}    // uninstantiable
}
