/* @LICENSE@
 */
package org.exemplar.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.exemplar.regex.AST.Node;

/**
 * Converts a {@link DFA} to an equivalent {@link AST} by state elimination.
 * <p>
 * The DFA is embedded in a generalized automaton whose edges carry
 * expressions: a fresh initial node leads to the start state by the empty
 * string, and every accepting state leads to a fresh final node by the empty
 * string. The DFA states are then eliminated one at a time, highest id
 * first; the expression left on the edge from the initial to the final node
 * is the result.
 * <p>
 * Since state ids are breadth first from the start state, elimination works
 * from the accepting end backwards, which factors shared suffixes:
 * {car, cars} comes out as <code>cars?</code>, not <code>car|cars</code>.
 */
final class Synthesizer {

    private static final Logger logger = Logger.getLogger("org.exemplar.regex");
    private static final Level level = Level.FINEST;

    private final DFA dfa;
    private final int initial, terminal;

    /* out.get(p).get(q) is the expression on edge p -> q */
    private final List<SortedMap<Integer, Node>> out;
    private final List<SortedSet<Integer>> in;

    Synthesizer(DFA dfa) {
        this.dfa = dfa;
        this.initial = dfa.size();
        this.terminal = dfa.size() + 1;
        this.out = new ArrayList<SortedMap<Integer, Node>>(dfa.size() + 2);
        this.in = new ArrayList<SortedSet<Integer>>(dfa.size() + 2);
        for (int i = 0; i < dfa.size() + 2; ++i) {
            out.add(new TreeMap<Integer, Node>());
            in.add(new TreeSet<Integer>());
        }
    }

    private void addEdge(int p, int q, Node node) {
        Node existing = out.get(p).get(q);
        out.get(p).put(q, existing == null ? node : AST.alt(existing, node));
        in.get(q).add(p);
    }

    private Node removeEdge(int p, int q) {
        in.get(q).remove(p);
        return out.get(p).remove(q);
    }

    /**
     * @return the expression for the language of the DFA; {@link AST#EPSILON}
     *         for the empty language, which only the empty set of test cases
     *         yields.
     */
    Node synthesize() {

        addEdge(initial, DFA.START, AST.EPSILON);
        for (DFA.State state : dfa.states()) {
            if (state.accept) {
                addEdge(state.id, terminal, AST.EPSILON);
            }
            // parallel arcs become one alternation
            SortedMap<Integer, List<Node>> byTarget = new TreeMap<Integer, List<Node>>();
            for (Map.Entry<Grapheme, Integer> arc : state.arcs().entrySet()) {
                List<Node> symbols = byTarget.get(arc.getValue());
                if (symbols == null) {
                    byTarget.put(arc.getValue(), symbols = new ArrayList<Node>());
                }
                symbols.add(AST.symbol(arc.getKey()));
            }
            for (Map.Entry<Integer, List<Node>> e : byTarget.entrySet()) {
                addEdge(state.id, e.getKey(), AST.alt(e.getValue()));
            }
        }

        for (int k = dfa.size() - 1; k >= 0; --k) {
            eliminate(k);
        }

        for (int k = 0; k < dfa.size(); ++k) {
            if (!out.get(k).isEmpty() || !in.get(k).isEmpty()) {
                throw new IllegalStateException("state " + k + " survived elimination");
            }
        }
        if (out.get(initial).size() > 1) {
            throw new IllegalStateException("dangling edges: " + out.get(initial));
        }

        Node ret = out.get(initial).get(terminal);
        if (ret == null) {
            if (logger.isLoggable(level)) {
                logger.log(level, "empty language, synthesizing the empty string");
            }
            ret = AST.EPSILON;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "ast: " + ret + Misc.LS + ret.toTreeString(), ret);
        }
        return ret;
    }

    private void eliminate(int k) {

        Node loop = removeEdge(k, k);
        Node star = loop == null ? AST.EPSILON : AST.star(loop);

        SortedMap<Integer, Node> successors = new TreeMap<Integer, Node>(out.get(k));
        for (int q : successors.keySet()) {
            removeEdge(k, q);
        }
        for (int p : new ArrayList<Integer>(in.get(k))) {
            Node a = removeEdge(p, k);
            for (Map.Entry<Integer, Node> e : successors.entrySet()) {
                addEdge(p, e.getKey(), AST.cat(a, star, e.getValue()));
            }
        }
    }
}
