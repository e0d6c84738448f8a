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
 * DFA: Deterministic Finite Automaton over a fixed, sorted alphabet.
 * <p>
 * The transition table is <em>partial</em>: a missing transition is
 * {@link #NONE} and rejects any continuation. There is no dead state. The
 * table has one row per state and one column per alphabet symbol.
 * <p>
 * Each state remembers its {@linkplain #members(int) members}: the NFA states
 * of the subset it was built from, or the states of the source DFA it was
 * merged from by minimization.
 */
public final class DFA {

    /**
     * Table entry for "no transition".
     */
    public static final int NONE = -1;

    private final int[][] table;
    private final char[] alphabet;
    private final int start;
    private final boolean[] accepting;
    private final List<SortedSet<Integer>> members;

    DFA(int[][] table, char[] alphabet, int start, boolean[] accepting,
            List<SortedSet<Integer>> members) {

        assert table.length > 0;
        assert table.length == accepting.length && table.length == members.size();
        assert 0 <= start && start < table.length;
        assert new Object() {
            boolean test(int[][] table, char[] alphabet) {
                for (int i = 1; i < alphabet.length; ++i) {
                    if (alphabet[i - 1] >= alphabet[i]) return false;
                }
                for (int[] row : table) {
                    if (row.length != alphabet.length) return false;
                    for (int next : row) {
                        if (next < NONE || next >= table.length) return false;
                    }
                }
                return true;
            }
        }.test(table, alphabet);

        this.table = table;
        this.alphabet = alphabet;
        this.start = start;
        this.accepting = accepting;
        final List<SortedSet<Integer>> frozen =
            new ArrayList<SortedSet<Integer>>(members.size());
        for (SortedSet<Integer> m : members) {
            frozen.add(Collections.unmodifiableSortedSet(new TreeSet<Integer>(m)));
        }
        this.members = Collections.unmodifiableList(frozen);
    }

    public int stateCount() {
        return table.length;
    }

    public int start() {
        return start;
    }

    /**
     * @return the sorted, duplicate free alphabet.
     */
    public char[] alphabet() {
        return alphabet.clone();
    }

    /**
     * @return the column of <code>symbol</code>, or a negative number if it is
     *         not in the alphabet.
     */
    public int symbolIndex(char symbol) {
        return Arrays.binarySearch(alphabet, symbol);
    }

    /**
     * Table lookup by column.
     *
     * @return the next state or {@link #NONE}.
     */
    public int transition(int state, int symbolIndex) {
        return table[state][symbolIndex];
    }

    /**
     * @return the next state or {@link #NONE}, which is also the answer for
     *         symbols outside the alphabet.
     */
    public int next(int state, char symbol) {
        final int i = symbolIndex(symbol);
        return i < 0 ? NONE : table[state][i];
    }

    public boolean isAccepting(int state) {
        return accepting[state];
    }

    public SortedSet<Integer> accepts() {
        final SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int state = 0; state < accepting.length; ++state) {
            if (accepting[state]) ret.add(state);
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * @return the NFA states (determinized DFA) or source DFA states
     *         (minimal DFA) this state stands for; unmodifiable.
     */
    public SortedSet<Integer> members(int state) {
        return members.get(state);
    }

    /**
     * @return the defined transitions, by state then alphabet order.
     */
    public List<Edge> edges() {
        final List<Edge> ret = new ArrayList<Edge>();
        for (int state = 0; state < table.length; ++state) {
            for (int i = 0; i < alphabet.length; ++i) {
                if (table[state][i] != NONE) {
                    ret.add(new Edge(state, table[state][i], Label.of(alphabet[i])));
                }
            }
        }
        return ret;
    }

    public int edgeCount() {
        int n = 0;
        for (int[] row : table) {
            for (int next : row) {
                if (next != NONE) ++n;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(stateCount())
            .append(" total arcs ").append(edgeCount())
            .append(" alphabet ").append(Arrays.toString(alphabet))
            .append(LS);
        for (int state = 0; state < table.length; ++state) {
            sb.append("state: ").append(state).append(' ')
                .append(members.get(state)).append(' ');
            if (state == start)     sb.append("(start) ");
            if (accepting[state])   sb.append("(accept) ");
            sb.append(LS);
            for (int i = 0; i < alphabet.length; ++i) {
                if (table[state][i] == NONE) continue;
                sb.append("    {").append(Label.of(alphabet[i]))
                    .append(" -> ").append(table[state][i]).append('}').append(LS);
            }
        }
        return sb.toString();
    }
}
