/*
 * @LICENSE@
 */

package org.regviz.automata;

import static org.regviz.automata.Misc.LS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * NFA: Nondeterministic Finite Automaton, as built by Thompson construction.
 * <p>
 * States are dense <code>int</code>s from zero in creation order. Each state
 * owns a list of outgoing {@linkplain Arc arcs}, in the order they were wired.
 * The transition graph may contain cycles (star and plus loops); the arcs
 * refer to targets by id only.
 * <p>
 * Also carries the {@linkplain Region regions}: for each construct of the
 * syntax tree, the states that were allocated while building it.
 */
public final class NFA {

    /**
     * An outgoing transition: a {@link Label} mapped to a target state.
     */
    public static final class Arc {

        final Label label;
        final int target;

        Arc(Label label, int target) {
            this.label = label;
            this.target = target;
        }

        public Label label() {
            return label;
        }

        public int target() {
            return target;
        }

        @Override
        public String toString() {
            return "{" + label + " -> " + target + "}";
        }
    }

    /**
     * Syntactic construct that produced a {@link Region}.
     */
    public enum Construct {
        EPSILON, LITERAL, CONCATENATION, ALTERNATION, STAR, PLUS, OPTIONAL;
    }

    /**
     * The states allocated while building one construct, its sub constructs
     * included. State ids are allocated from a single counter, so the states
     * of a region form the contiguous range
     * <code>[firstState(), endState())</code>. Regions nest like the syntax
     * tree they come from.
     */
    public static final class Region {

        private final int id;
        private final Construct construct;
        private final int parent;
        private final int firstState;
        private final int endState;

        Region(int id, Construct construct, int parent, int firstState, int endState) {
            assert parent < id && firstState <= endState;
            this.id = id;
            this.construct = construct;
            this.parent = parent;
            this.firstState = firstState;
            this.endState = endState;
        }

        public int id() {
            return id;
        }

        public Construct construct() {
            return construct;
        }

        /**
         * @return the id of the enclosing region, -1 for the outermost one.
         */
        public int parent() {
            return parent;
        }

        public int firstState() {
            return firstState;
        }

        public int endState() {
            return endState;
        }

        public boolean contains(int state) {
            return firstState <= state && state < endState;
        }

        @Override
        public String toString() {
            return "region " + id + " " + construct
                + " [" + firstState + "," + endState + ")"
                + (parent < 0 ? "" : " in " + parent);
        }
    }

    private final List<List<Arc>> arcs;
    private final int start;
    private final SortedSet<Integer> accepts;
    private final List<Region> regions;
    private final char[] alphabet;

    NFA(List<List<Arc>> arcs, int start, SortedSet<Integer> accepts, List<Region> regions) {

        final List<List<Arc>> frozen = new ArrayList<List<Arc>>(arcs.size());
        for (List<Arc> list : arcs) {
            frozen.add(Collections.unmodifiableList(new ArrayList<Arc>(list)));
        }
        this.arcs = Collections.unmodifiableList(frozen);
        this.start = start;
        this.accepts = Collections.unmodifiableSortedSet(new TreeSet<Integer>(accepts));
        this.regions = Collections.unmodifiableList(new ArrayList<Region>(regions));

        final SortedSet<Character> sigma = new TreeSet<Character>();
        for (List<Arc> list : this.arcs) {
            for (Arc arc : list) {
                if (!arc.label.isEpsilon()) {
                    sigma.add(arc.label.symbol());
                }
            }
        }
        this.alphabet = new char[sigma.size()];
        int i = 0;
        for (char c : sigma) {
            alphabet[i++] = c;
        }

        assert isValid(start);
        assert new Object() {
            boolean test() {
                for (int state : NFA.this.accepts) {
                    if (!isValid(state)) return false;
                }
                for (List<Arc> list : NFA.this.arcs) {
                    for (Arc arc : list) {
                        if (!isValid(arc.target)) return false;
                    }
                }
                return true;
            }
        }.test();
    }

    private boolean isValid(int state) {
        return 0 <= state && state < arcs.size();
    }

    public int stateCount() {
        return arcs.size();
    }

    public int start() {
        return start;
    }

    /**
     * @return the accepting states, ascending; unmodifiable.
     */
    public SortedSet<Integer> accepts() {
        return accepts;
    }

    public boolean isAccepting(int state) {
        return accepts.contains(state);
    }

    /**
     * @return the outgoing arcs of <code>state</code>, in wiring order;
     *         unmodifiable.
     */
    public List<Arc> arcs(int state) {
        return arcs.get(state);
    }

    /**
     * @return every transition, grouped by source state ascending.
     */
    public List<Edge> edges() {
        final List<Edge> ret = new ArrayList<Edge>();
        for (int state = 0; state < arcs.size(); ++state) {
            for (Arc arc : arcs.get(state)) {
                ret.add(new Edge(state, arc.target, arc.label));
            }
        }
        return ret;
    }

    public int edgeCount() {
        int n = 0;
        for (List<Arc> list : arcs) n += list.size();
        return n;
    }

    /**
     * @return the distinct symbols on non epsilon arcs, sorted ascending.
     */
    public char[] alphabet() {
        return alphabet.clone();
    }

    /**
     * @return the construct regions, outermost first; unmodifiable.
     */
    public List<Region> regions() {
        return regions;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(stateCount())
            .append(" total arcs ").append(edgeCount())
            .append(" alphabet ").append(Arrays.toString(alphabet))
            .append(LS);
        for (int state = 0; state < arcs.size(); ++state) {
            sb.append("state: ").append(state).append(' ');
            if (state == start)         sb.append("(start) ");
            if (isAccepting(state))     sb.append("(accept) ");
            sb.append(LS);
            for (Arc arc : arcs.get(state)) {
                sb.append("    ").append(arc).append(LS);
            }
        }
        return sb.toString();
    }
}
