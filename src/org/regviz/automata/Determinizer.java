/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subset construction: NFA to an equivalent partial {@link DFA}.
 */
final class Determinizer {

    private static final Logger logger = Logger.getLogger("org.regviz.automata");
    private static final Level level = Level.FINER;

    private Determinizer() {
    } // never instantiated

    static DFA determinize(final NFA nfa) {

        final char[] alphabet = nfa.alphabet();

        /*
         * Canonical subsets (sorted sets, compared by content) to DFA state
         * ids, handed out in first seen order. New subsets join the queue.
         */
        final class StateFactory {

            private final Map<SortedSet<Integer>, Integer> map =
                new LinkedHashMap<SortedSet<Integer>, Integer>();
            private final Queue<SortedSet<Integer>> queue =
                new LinkedList<SortedSet<Integer>>();

            private int stateFrom(SortedSet<Integer> nfaStates) {
                Integer state = map.get(nfaStates);
                if (state == null) {
                    state = map.size();
                    map.put(nfaStates, state);
                    queue.add(nfaStates);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        /*
         * Subset construction as breadth first search
         */
        final int start = factory.stateFrom(
            Simulator.epsilonClosure(Collections.singleton(nfa.start()), nfa));
        assert start == 0;

        final List<int[]> rows = new ArrayList<int[]>();
        final List<SortedSet<Integer>> members = new ArrayList<SortedSet<Integer>>();
        while (!factory.queue.isEmpty()) {
            final SortedSet<Integer> nfaStates = factory.queue.remove();
            assert factory.map.get(nfaStates) == rows.size();

            final int[] row = new int[alphabet.length];
            for (int i = 0; i < alphabet.length; ++i) {
                final SortedSet<Integer> moved = Simulator.moveOn(nfaStates, alphabet[i], nfa);
                row[i] = moved.isEmpty()
                    ? DFA.NONE
                    : factory.stateFrom(Simulator.epsilonClosure(moved, nfa));
            }
            rows.add(row);
            members.add(nfaStates);
        }

        final boolean[] accepting = new boolean[rows.size()];
        for (int state = 0; state < accepting.length; ++state) {
            accepting[state] = Misc.intersects(members.get(state), nfa.accepts());
        }

        final DFA dfa = new DFA(rows.toArray(new int[rows.size()][]), alphabet,
            start, accepting, members);
        if (logger.isLoggable(level)) {
            logger.log(level, "dfa unminimized: " + dfa.toString(), dfa);
        }
        return dfa;
    }
}
