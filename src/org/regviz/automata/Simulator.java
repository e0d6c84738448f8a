/*
 * @LICENSE@
 */

package org.regviz.automata;

import static org.regviz.automata.Misc.intersects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;

import org.regviz.automata.NFA.Arc;
import org.regviz.automata.SimulationTrace.Step;

/**
 * Stateless simulation of an {@link NFA} or a {@link DFA} over an input
 * string: epsilon closure, single symbol moves, acceptance and step by step
 * traces. A symbol outside the alphabet of the automaton simply rejects.
 */
public final class Simulator {

    private Simulator() {
    } // never instantiated

    /**
     * The smallest superset of <code>seed</code> closed under epsilon
     * transitions. Closing a closed set returns an equal set.
     *
     * @return a new sorted set.
     */
    public static SortedSet<Integer> epsilonClosure(Set<Integer> seed, NFA nfa) {
        return closure(seed, nfa, null);
    }

    /*
     * Depth first over epsilon arcs. If traversed is not null, every epsilon
     * arc leaving a state of the closure is added to it.
     */
    private static SortedSet<Integer> closure(Set<Integer> seed, NFA nfa, Set<Edge> traversed) {
        final SortedSet<Integer> closure = new TreeSet<Integer>(seed);
        final Stack<Integer> stack = new Stack<Integer>();
        stack.addAll(closure);
        while (!stack.isEmpty()) {
            final int state = stack.pop();
            for (Arc arc : nfa.arcs(state)) {
                if (!arc.label.isEpsilon()) continue;
                if (traversed != null) {
                    traversed.add(new Edge(state, arc.target, arc.label));
                }
                if (closure.add(arc.target)) {
                    stack.push(arc.target);
                }
            }
        }
        return closure;
    }

    /**
     * The states reachable from <code>states</code> by exactly one arc labeled
     * <code>symbol</code>; no epsilon closure.
     *
     * @return a new sorted set.
     */
    public static SortedSet<Integer> moveOn(Set<Integer> states, char symbol, NFA nfa) {
        return move(states, symbol, nfa, null);
    }

    private static SortedSet<Integer> move(Set<Integer> states, char symbol, NFA nfa,
            Set<Edge> traversed) {
        final SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int state : states) {
            for (Arc arc : nfa.arcs(state)) {
                if (arc.label.matches(symbol)) {
                    ret.add(arc.target);
                    if (traversed != null) {
                        traversed.add(new Edge(state, arc.target, arc.label));
                    }
                }
            }
        }
        return ret;
    }

    public static boolean accepts(NFA nfa, CharSequence input) {
        Set<Integer> active = epsilonClosure(Collections.singleton(nfa.start()), nfa);
        for (int i = 0; i < input.length(); ++i) {
            active = epsilonClosure(moveOn(active, input.charAt(i), nfa), nfa);
            if (active.isEmpty()) {
                return false;
            }
        }
        return intersects(active, nfa.accepts());
    }

    public static boolean accepts(DFA dfa, CharSequence input) {
        int state = dfa.start();
        for (int i = 0; i < input.length(); ++i) {
            state = dfa.next(state, input.charAt(i));
            if (state == DFA.NONE) {
                return false;
            }
        }
        return dfa.isAccepting(state);
    }

    /**
     * Step 0 is the epsilon closure of the start state. Each later step
     * records the symbol arcs taken and the epsilon arcs followed while
     * closing. If no state is left active the empty step is recorded and the
     * trace stops there.
     */
    public static SimulationTrace trace(NFA nfa, CharSequence input) {
        final List<Step> steps = new ArrayList<Step>(input.length() + 1);
        Set<Edge> traversed = new LinkedHashSet<Edge>();
        SortedSet<Integer> active =
            closure(Collections.singleton(nfa.start()), nfa, traversed);
        steps.add(new Step(0, null, active, traversed, intersects(active, nfa.accepts())));

        for (int i = 0; i < input.length() && !active.isEmpty(); ++i) {
            final char c = input.charAt(i);
            traversed = new LinkedHashSet<Edge>();
            active = closure(move(active, c, nfa, traversed), nfa, traversed);
            steps.add(new Step(i + 1, c, active, traversed, intersects(active, nfa.accepts())));
        }
        return new SimulationTrace(input, steps);
    }

    /**
     * Step 0 is the start state. A missing transition records an empty step
     * and ends the trace.
     */
    public static SimulationTrace trace(DFA dfa, CharSequence input) {
        final List<Step> steps = new ArrayList<Step>(input.length() + 1);
        int state = dfa.start();
        steps.add(new Step(0, null, Collections.singleton(state),
            Collections.<Edge>emptySet(), dfa.isAccepting(state)));

        for (int i = 0; i < input.length(); ++i) {
            final char c = input.charAt(i);
            final int next = dfa.next(state, c);
            if (next == DFA.NONE) {
                steps.add(new Step(i + 1, c, Collections.<Integer>emptySet(),
                    Collections.<Edge>emptySet(), false));
                break;
            }
            steps.add(new Step(i + 1, c, Collections.singleton(next),
                Collections.singleton(new Edge(state, next, Label.of(c))),
                dfa.isAccepting(next)));
            state = next;
        }
        return new SimulationTrace(input, steps);
    }
}
