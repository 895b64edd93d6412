/* @LICENSE@
 */
package org.exemplar.regex;

import static org.exemplar.regex.Misc.clear;
import static org.exemplar.regex.Misc.isSet;

import org.exemplar.regex.AST.Alt;
import org.exemplar.regex.AST.Cat;
import org.exemplar.regex.AST.Literal;
import org.exemplar.regex.AST.Nary;
import org.exemplar.regex.AST.Node;
import org.exemplar.regex.AST.Repeat;
import org.exemplar.regex.Grapheme.Kind;
import org.exemplar.regex.Misc.Esc;

/**
 * Serializes an AST to regex syntax. Parenthesis are emitted only where
 * precedence requires them: around an alternation inside a concatenation or
 * under a quantifier, and around any multi-symbol quantifier operand.
 * <p>
 * Not thread safe.
 */
final class Renderer extends AST.Visitor {

    private final StringBuilder sb = new StringBuilder();
    private final Esc rxp;
    private final Esc rxcc;
    private final boolean surrogatePairs;

    Renderer(int flags) {
        super(TraversalOrder.SUBCLASS_DEFINED);
        if (!isSet(flags, RegexBuilder.ESCAPE_NON_ASCII)) {
            rxp = Esc.RXP;
            rxcc = Esc.RXCC;
            surrogatePairs = false;
        } else {
            surrogatePairs = isSet(flags, RegexBuilder.SURROGATE_PAIRS);
            rxp = surrogatePairs ? Esc.RXP_SURROGATE : Esc.RXP_UNICODE;
            rxcc = Esc.RXCC_UNICODE;     // sets are BMP only
        }
    }

    /**
     * @return the regex for <code>root</code>, without anchors.
     */
    String render(Node root) {
        clear(sb);
        visit(root);
        return sb.toString();
    }

    /**
     * @return the regex for <code>root</code>, anchored at both ends. A top
     *         level alternation is grouped so the anchors bind to all of it.
     */
    String anchored(Node root) {
        clear(sb);
        sb.append('^');
        if (root instanceof Alt) {
            group(root);
        } else {
            visit(root);
        }
        sb.append('$');
        return sb.toString();
    }

    private void group(Node node) {
        sb.append('(');
        visit(node);
        sb.append(')');
    }

    @Override
    protected void visit(Cat node) {
        for (Node child : node.children()) {
            if (child instanceof Alt) {
                group(child);
            } else {
                visit(child);
            }
        }
    }

    @Override
    protected void visit(Alt node) {
        boolean first = true;
        for (Node child : node.children()) {
            if (!first) sb.append('|');
            first = false;
            visit(child);
        }
    }

    @Override
    protected void visit(Repeat node) {
        if (isCompound(node.child)) {
            group(node.child);
        } else {
            visit(node.child);
        }
        if (node.min == 0 && node.max == 1) {
            sb.append('?');
        } else if (node.min == 0 && node.unbounded()) {
            sb.append('*');
        } else if (node.min == 1 && node.unbounded()) {
            sb.append('+');
        } else if (node.min == node.max) {
            sb.append('{').append(node.min).append('}');
        } else if (node.unbounded()) {
            sb.append('{').append(node.min).append(",}");
        } else {
            sb.append('{').append(node.min).append(',').append(node.max).append('}');
        }
    }

    /*
     * does a quantifier on node need parens to bind to all of it?
     */
    private boolean isCompound(Node node) {
        if (node instanceof Nary || node instanceof Repeat) {
            return true;
        }
        Grapheme g = ((Literal) node).g;
        if (g.kind != Kind.LITERAL) {
            return false;
        }
        if (g.codePointCount() > 1) {
            return true;
        }
        // two escapes for one code point
        return surrogatePairs && Character.isSupplementaryCodePoint(g.codePoint());
    }

    @Override
    protected void visit(Literal node) {
        Grapheme g = node.g;
        switch (g.kind) {
        case LITERAL:
            rxp.esc(sb, g.text);
            break;
        case SET:
            sb.append('[');
            for (int[] run : g.runs()) {
                rxcc.esc(sb, run[0]);
                if (run[1] - run[0] > 1) {
                    sb.append('-');
                    rxcc.esc(sb, run[1]);
                } else if (run[1] != run[0]) {
                    rxcc.esc(sb, run[1]);
                }
            }
            sb.append(']');
            break;
        case REPEAT:
            throw new IllegalStateException("unexpanded repetition: " + g);
        default:
            assert g.kind.isClass() : g.kind;
            sb.append(g.kind.glyph);
        }
    }
}
