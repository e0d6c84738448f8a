/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hopcroft partition refinement. Blocks start as {accepting, rejecting} and
 * are split until no (block, symbol) splitter separates two states of the
 * same block; each final block becomes one state.
 * <p>
 * Every initial block is seeded into the worklist with every symbol, so a
 * missing transition acts as a move into an implicit rejecting block that
 * never splits. When a block splits, a pending (block, symbol) pair gets its new half
 * enqueued too; otherwise only the smaller half is enqueued.
 */
final class Minimizer {

    private static final Logger logger = Logger.getLogger("org.regviz.automata");
    private static final Level level = Level.FINER;

    private Minimizer() {
    } // never instantiated

    static DFA minimize(DFA dfa) {

        final int n = dfa.stateCount();
        if (n <= 1) {
            return dfa;
        }
        final char[] alphabet = dfa.alphabet();
        final int k = alphabet.length;

        /*
         * inverse[a][t]: the states with a transition on alphabet[a] to t
         */
        final List<List<List<Integer>>> inverse = new ArrayList<List<List<Integer>>>(k);
        for (int a = 0; a < k; ++a) {
            final List<List<Integer>> sources = new ArrayList<List<Integer>>(n);
            for (int t = 0; t < n; ++t) {
                sources.add(new ArrayList<Integer>(2));
            }
            inverse.add(sources);
        }
        for (int s = 0; s < n; ++s) {
            for (int a = 0; a < k; ++a) {
                final int t = dfa.transition(s, a);
                if (t != DFA.NONE) {
                    inverse.get(a).get(t).add(s);
                }
            }
        }

        final List<SortedSet<Integer>> blocks = new ArrayList<SortedSet<Integer>>();
        final int[] blockOf = new int[n];
        final SortedSet<Integer> accepting = new TreeSet<Integer>();
        final SortedSet<Integer> rejecting = new TreeSet<Integer>();
        for (int s = 0; s < n; ++s) {
            (dfa.isAccepting(s) ? accepting : rejecting).add(s);
        }
        final List<SortedSet<Integer>> initial = new ArrayList<SortedSet<Integer>>(2);
        initial.add(accepting);
        initial.add(rejecting);
        for (SortedSet<Integer> block : initial) {
            if (block.isEmpty()) continue;
            for (int s : block) {
                blockOf[s] = blocks.size();
            }
            blocks.add(block);
        }

        final class Worklist {
            private final Queue<int[]> queue = new LinkedList<int[]>();
            private final List<boolean[]> pending = new ArrayList<boolean[]>();

            void add(int block, int a) {
                while (pending.size() <= block) {
                    pending.add(new boolean[k]);
                }
                if (!pending.get(block)[a]) {
                    pending.get(block)[a] = true;
                    queue.add(new int[] {block, a});
                }
            }
            boolean isPending(int block, int a) {
                return block < pending.size() && pending.get(block)[a];
            }
            int[] remove() {
                final int[] ret = queue.remove();
                pending.get(ret[0])[ret[1]] = false;
                return ret;
            }
            boolean isEmpty() {
                return queue.isEmpty();
            }
        }
        final Worklist worklist = new Worklist();
        for (int b = 0; b < blocks.size(); ++b) {
            for (int a = 0; a < k; ++a) {
                worklist.add(b, a);
            }
        }

        int splits = 0;
        while (!worklist.isEmpty()) {
            final int[] splitter = worklist.remove();
            final int a = splitter[1];

            final Set<Integer> x = new HashSet<Integer>();
            for (int t : blocks.get(splitter[0])) {
                x.addAll(inverse.get(a).get(t));
            }
            if (x.isEmpty()) continue;

            /*
             * Only blocks holding a state of x can split; blocks appended by
             * this pass are already on one side of x.
             */
            final SortedMap<Integer, SortedSet<Integer>> touched =
                new TreeMap<Integer, SortedSet<Integer>>();
            for (int s : x) {
                SortedSet<Integer> in = touched.get(blockOf[s]);
                if (in == null) {
                    in = new TreeSet<Integer>();
                    touched.put(blockOf[s], in);
                }
                in.add(s);
            }
            for (Map.Entry<Integer, SortedSet<Integer>> entry : touched.entrySet()) {
                final int b = entry.getKey();
                final SortedSet<Integer> in = entry.getValue();
                final SortedSet<Integer> block = blocks.get(b);
                if (in.size() == block.size()) continue;

                final SortedSet<Integer> out;
                if (in.size() <= block.size() - in.size()) {
                    block.removeAll(in);
                    out = block;
                } else {
                    out = new TreeSet<Integer>(block);
                    out.removeAll(in);
                }
                blocks.set(b, in);
                blocks.add(out);
                final int nb = blocks.size() - 1;
                for (int s : out) {
                    blockOf[s] = nb;
                }
                ++splits;
                for (int c = 0; c < k; ++c) {
                    if (worklist.isPending(b, c)) {
                        worklist.add(nb, c);
                    } else {
                        worklist.add(in.size() <= out.size() ? b : nb, c);
                    }
                }
            }
        }

        /*
         * one state per block, wired through a representative
         */
        final int m = blocks.size();
        final int[][] table = new int[m][k];
        final boolean[] accept = new boolean[m];
        for (int b = 0; b < m; ++b) {
            final int rep = blocks.get(b).first();
            for (int a = 0; a < k; ++a) {
                final int t = dfa.transition(rep, a);
                table[b][a] = t == DFA.NONE ? DFA.NONE : blockOf[t];
            }
            accept[b] = dfa.isAccepting(rep);
        }
        final DFA ret = new DFA(table, alphabet, blockOf[dfa.start()], accept, blocks);

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa minimized: " + n + " -> " + m + " states, "
                + splits + " splits" + Misc.LS + ret.toString(), ret);
        }
        return ret;
    }
}
