/* @LICENSE@
 */

package org.exemplar.regex;

import static org.exemplar.regex.AST.*;

import java.util.Arrays;
import java.util.Collections;

public class ASTTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ASTTestCase.class);
    }

    public ASTTestCase(String name) {
        super(name);
    }

    private static Node lit(String s) {
        return literal(s);
    }

    private static void assertNode(String expected, Node node) {
        assertEquals(expected, node.toString());
        assertTrue(node.toTreeString(), isNormal(node));
    }

    public void testLiteral() {
        assertTrue(lit("a") instanceof Literal);
        assertTrue(lit("ab") instanceof Cat);
        assertEquals(2, ((Cat) lit("ab")).children().size());
        assertSame(EPSILON, lit(""));
        assertNode("a\\.b", lit("a.b"));
    }

    public void testCatFlattens() {
        Node node = cat(lit("ab"), EPSILON, lit("c"));
        assertNode("abc", node);
        assertEquals(3, ((Cat) node).children().size());
        assertSame(EPSILON, cat());
        assertSame(EPSILON, cat(EPSILON, EPSILON));
    }

    public void testAltMergesSets() {
        assertNode("[ab]", alt(lit("b"), lit("a")));
        assertNode("[abx]", alt(alt(lit("a"), lit("x")), lit("b")));
        assertNode("[a-d]", alt(lit("d"), lit("b"), lit("c"), lit("a")));
        assertNode("[cd]|ab", alt(lit("c"), lit("ab"), lit("d")));
    }

    public void testAltSetsAreBmpOnly() {
        Node node = alt(lit("\uD83D\uDCA9"), lit("a"));
        assertTrue(node instanceof Alt);
        assertNode("a|\uD83D\uDCA9", node);
    }

    public void testAltSortsAndDedups() {
        assertNode("aa|zz", alt(lit("zz"), lit("aa")));
        assertNode("ab", alt(lit("ab"), lit("ab")));
        assertTrue(alt(lit("ab"), lit("cd")) instanceof Alt);
    }

    public void testAltFlattens() {
        Node node = alt(alt(lit("ab"), lit("cd")), lit("ef"));
        assertNode("ab|cd|ef", node);
        assertEquals(3, ((Alt) node).children().size());
    }

    public void testAltOptional() {
        assertNode("x?", alt(EPSILON, lit("x")));
        assertNode("(xy)?", alt(lit("xy"), EPSILON));
        assertNode("a*", alt(EPSILON, plus(lit("a"))));
        assertNode("a{0,3}", alt(EPSILON, repeat(lit("a"), 1, 3)));
        assertNode("(ab|cd)?", alt(EPSILON, lit("ab"), lit("cd")));
        assertSame(EPSILON, alt(EPSILON, EPSILON));
    }

    public void testAltMergesRanges() {
        assertNode("a{2,3}", alt(repeat(lit("a"), 2, 2), repeat(lit("a"), 3, 3)));
        assertNode("a{1,2}", alt(lit("a"), repeat(lit("a"), 2, 2)));
        assertNode("a|a{3}", alt(lit("a"), repeat(lit("a"), 3, 3)));
        assertNode("(ab){2,}", alt(repeat(lit("ab"), 2, 4), repeat(lit("ab"), 3, UNBOUNDED)));
    }

    public void testAltEmpty() {
        try {
            alt(Collections.<Node>emptyList());
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testRepeat() {
        Node x = lit("x");
        assertSame(x, repeat(x, 1, 1));
        assertSame(EPSILON, repeat(EPSILON, 0, 5));
        assertNode("x?", question(x));
        assertNode("x*", star(x));
        assertNode("x+", plus(x));
        assertNode("x{3}", repeat(x, 3, 3));
        assertNode("x{2,}", repeat(x, 2, UNBOUNDED));
        assertNode("(xy)*", star(lit("xy")));
        assertNode("x{0,4}", question(repeat(x, 1, 4)));
        assertNode("(x{2,4})?", question(repeat(x, 2, 4)));
        try {
            repeat(x, 2, 1);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            repeat(x, -1, 1);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testSymbol() {
        Grapheme a = Grapheme.literal("a"), b = Grapheme.literal("b");
        assertNode("a", symbol(a));
        assertNode("(ab){2}", symbol(Grapheme.repeat(Arrays.asList(a, b), 2, 2)));
        Grapheme aa = Grapheme.repeat(Arrays.asList(a), 2, 2);
        assertNode("(a{2}b){2}", symbol(Grapheme.repeat(Arrays.asList(aa, b), 2, 2)));
        assertNode("\\d{3}", symbol(Grapheme.repeat(
            Arrays.asList(Grapheme.classOf(Grapheme.Kind.DIGIT)), 3, 3)));
    }

    public void testIdentity() {
        Node n0 = lit("ab"), n1 = lit("ab");
        assertEquals(n0.toString(), n1.toString());
        assertFalse(n0.equals(n1));
    }

    public void testTreeString() {
        Node node = cat(lit("a"), alt(lit("b"), lit("cd")));
        assertNode("a(b|cd)", node);
        String tree = node.toTreeString();
        assertTrue(tree, tree.startsWith("&"));
        assertTrue(tree, tree.contains("|"));
        assertTrue(EPSILON.toTreeString().startsWith("()"));
        assertEquals("", EPSILON.toString());
    }
}
