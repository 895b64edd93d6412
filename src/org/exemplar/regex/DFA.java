/* @LICENSE@
 */


package org.exemplar.regex;


import static org.exemplar.regex.Misc.LS;
import static org.exemplar.regex.Misc.clear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * A deterministic finite automaton over {@link Grapheme}s. States are kept
 * in an arena indexed by state id; transitions name their next state by id.
 * State 0 is the start state, and ids are always assigned breadth first from
 * the start state, following transitions in alphabet order - so two DFAs for
 * the same language and of the same size are identical.
 * <p>
 * Instances are immutable.
 */
final class DFA {

    private static final Logger logger = Logger.getLogger("org.exemplar.regex");
    // private static final Level level = Level.INFO;
    private static final Level level = Level.FINEST;

    static final int START = 0;

    static final class State {

        final int id;
        final boolean accept;
        private final SortedMap<Grapheme, Integer> arcs;

        State(int id, boolean accept, SortedMap<Grapheme, Integer> arcs) {
            this.id = id;
            this.accept = accept;
            this.arcs = Collections.unmodifiableSortedMap(
                new TreeMap<Grapheme, Integer>(arcs));
        }

        /**
         * @return the transitions, symbol to next state id, in alphabet
         *         order.
         */
        SortedMap<Grapheme, Integer> arcs() {
            return arcs;
        }

        Integer next(Grapheme g) {
            return arcs.get(g);
        }

        private static final String INDENT = "    ";
        private transient StringBuilder sb = new StringBuilder();

        @Override
        public String toString() {

            clear(sb);

            sb.append("state: ").append(id).append(' ');
            if (id == START)    sb.append("(init) ");
            if (accept)         sb.append("(accept) ");
            sb.append(LS);

            for (Map.Entry<Grapheme, Integer> arc : arcs.entrySet()) {
                sb.append(INDENT)
                    .append("{sym:").append(arc.getKey()).append(',')
                    .append(" ns:").append(arc.getValue()).append('}')
                    .append(LS);
            }
            sb.append(LS);

            return sb.toString();
        }
    }

    private final List<State> states;

    /**
     * Construct the trie shaped DFA accepting exactly the given sequences.
     * An empty iterable yields a lone, non accepting start state.
     *
     * @param sequences
     */
    DFA(Iterable<? extends List<Grapheme>> sequences) {

        final List<SortedMap<Grapheme, Integer>> arcs =
            new ArrayList<SortedMap<Grapheme, Integer>>();
        final BitSet accepting = new BitSet();

        arcs.add(new TreeMap<Grapheme, Integer>());
        for (List<Grapheme> sequence : sequences) {
            int state = START;
            for (Grapheme g : sequence) {
                Integer next = arcs.get(state).get(g);
                if (next == null) {
                    next = arcs.size();
                    arcs.add(new TreeMap<Grapheme, Integer>());
                    arcs.get(state).put(g, next);
                }
                state = next;
            }
            accepting.set(state);
        }
        this.states = canonical(START, arcs, accepting);

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa unminimized: " + toString(), this);
        }
    }

    /**
     * For minimization and testing: wrap canonically numbered states.
     */
    DFA(List<State> states) {
        if (states.isEmpty()) {
            throw new IllegalArgumentException("no start state");
        }
        for (int i = 0; i < states.size(); ++i) {
            State state = states.get(i);
            if (state.id != i) {
                throw new IllegalArgumentException("state " + state.id + " at " + i);
            }
            for (int ns : state.arcs.values()) {
                if (ns < 0 || states.size() <= ns) {
                    throw new IllegalArgumentException(
                        "state " + i + ": no such next state: " + ns);
                }
            }
        }
        this.states = Collections.unmodifiableList(new ArrayList<State>(states));
    }

    /*
     * Renumbers the states reachable from start breadth first, following arcs
     * in alphabet order.
     */
    private static List<State> canonical(
            int start,
            List<? extends SortedMap<Grapheme, Integer>> arcs,
            BitSet accepting) {

        final int[] id = new int[arcs.size()];
        Arrays.fill(id, -1);
        final List<Integer> order = new ArrayList<Integer>();
        final Queue<Integer> gray = new LinkedList<Integer>();

        id[start] = 0;
        order.add(start);
        gray.add(start);
        while (!gray.isEmpty()) {
            for (int ns : arcs.get(gray.remove()).values()) {
                if (id[ns] < 0) {
                    id[ns] = order.size();
                    order.add(ns);
                    gray.add(ns);
                }
            }
        }

        List<State> ret = new ArrayList<State>(order.size());
        for (int i = 0; i < order.size(); ++i) {
            final int old = order.get(i);
            SortedMap<Grapheme, Integer> renamed = new TreeMap<Grapheme, Integer>();
            for (Map.Entry<Grapheme, Integer> arc : arcs.get(old).entrySet()) {
                renamed.put(arc.getKey(), id[arc.getValue()]);
            }
            ret.add(new State(i, accepting.get(old), renamed));
        }
        return Collections.unmodifiableList(ret);
    }

    /**
     * Moore style partition refinement. Starting from {accepting,
     * non-accepting}, states are split by the classes their transitions lead
     * to until a round splits nothing. A missing transition is part of a
     * state's signature, so no dead state is needed.
     *
     * @return the minimal DFA for the same language.
     */
    DFA minimize() {

        final int n = states.size();
        int[] block = new int[n];
        int count = 0;

        int[] initial = {-1, -1};           // non-accepting, accepting
        for (State state : states) {
            int k = state.accept ? 1 : 0;
            if (initial[k] < 0) {
                initial[k] = count++;
            }
            block[state.id] = initial[k];
        }

        int rounds = 0;
        while (true) {
            ++rounds;
            final Map<List<Object>, Integer> signatures = new HashMap<List<Object>, Integer>();
            final int[] next = new int[n];
            for (State state : states) {
                List<Object> signature = new ArrayList<Object>(1 + 2 * state.arcs.size());
                signature.add(block[state.id]);
                for (Map.Entry<Grapheme, Integer> arc : state.arcs.entrySet()) {
                    signature.add(arc.getKey());
                    signature.add(block[arc.getValue()]);
                }
                Integer b = signatures.get(signature);
                if (b == null) {
                    b = signatures.size();
                    signatures.put(signature, b);
                }
                next[state.id] = b;
            }
            block = next;
            if (signatures.size() == count) {
                break;
            }
            count = signatures.size();
        }

        // one state per class, the lowest id being the representative
        final List<SortedMap<Grapheme, Integer>> arcs =
            new ArrayList<SortedMap<Grapheme, Integer>>(count);
        final BitSet accepting = new BitSet();
        for (int b = 0; b < count; ++b) {
            arcs.add(null);
        }
        for (State state : states) {
            final int b = block[state.id];
            if (arcs.get(b) != null) {
                continue;
            }
            SortedMap<Grapheme, Integer> redirected = new TreeMap<Grapheme, Integer>();
            for (Map.Entry<Grapheme, Integer> arc : state.arcs.entrySet()) {
                redirected.put(arc.getKey(), block[arc.getValue()]);
            }
            arcs.set(b, redirected);
            accepting.set(b, state.accept);
        }

        DFA ret = new DFA(canonical(block[START], arcs, accepting));
        if (ret.size() > size()) {
            throw new IllegalStateException(
                "minimization grew the automaton: " + size() + " -> " + ret.size());
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "dfa minimized: " + rounds + " rounds, " + ret, ret);
        }
        return ret;
    }

    State start() {
        return states.get(START);
    }

    State state(int id) {
        return states.get(id);
    }

    /**
     * @return the states, in id order.
     */
    List<State> states() {
        return states;
    }

    int size() {
        return states.size();
    }

    boolean accepts(List<Grapheme> sequence) {
        State state = start();
        for (Grapheme g : sequence) {
            Integer ns = state.next(g);
            if (ns == null) return false;
            state = states.get(ns);
        }
        return state.accept;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states) nArcs += state.arcs.size();
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(LS);
        for (State state : states) {
            sb.append(state);
        }
        return sb.toString();
    }
}
