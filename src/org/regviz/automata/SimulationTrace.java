/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The recorded run of an automaton over one input: an immutable, random
 * access sequence of {@linkplain Step steps}. Step 0 is the initial
 * configuration; step <code>i</code> follows the consumption of
 * <code>input.charAt(i - 1)</code>. A run that dies early has fewer than
 * <code>input.length() + 1</code> steps.
 */
public final class SimulationTrace implements Iterable<SimulationTrace.Step> {

    /**
     * One snapshot of the active states.
     */
    public static final class Step {

        private final int index;
        private final Character consumed;
        private final SortedSet<Integer> active;
        private final Set<Edge> edges;
        private final boolean accepting;

        Step(int index, Character consumed, Set<Integer> active, Set<Edge> edges,
                boolean accepting) {
            assert (index == 0) == (consumed == null);
            this.index = index;
            this.consumed = consumed;
            this.active = Collections.unmodifiableSortedSet(new TreeSet<Integer>(active));
            this.edges = Collections.unmodifiableSet(new LinkedHashSet<Edge>(edges));
            this.accepting = accepting;
        }

        public int index() {
            return index;
        }

        /**
         * @return the symbol consumed to reach this step, null for step 0.
         */
        public Character consumed() {
            return consumed;
        }

        public SortedSet<Integer> active() {
            return active;
        }

        /**
         * @return the transitions traversed to reach this step.
         */
        public Set<Edge> edges() {
            return edges;
        }

        /**
         * @return true if an accepting state is active.
         */
        public boolean isAccepting() {
            return accepting;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("step ").append(index);
            if (consumed != null) {
                sb.append(" '").append(Misc.Esc.JAVA.esc(consumed)).append('\'');
            }
            sb.append(": ").append(active);
            if (accepting) sb.append(" (accept)");
            return sb.toString();
        }
    }

    private final String input;
    private final List<Step> steps;

    SimulationTrace(CharSequence input, List<Step> steps) {
        assert !steps.isEmpty() && steps.size() <= input.length() + 1;
        this.input = input.toString();
        this.steps = Collections.unmodifiableList(new ArrayList<Step>(steps));
    }

    public String input() {
        return input;
    }

    public int size() {
        return steps.size();
    }

    /**
     * @throws IndexOutOfBoundsException
     *             unless <code>0 &lt;= i &lt; size()</code>.
     */
    public Step step(int i) {
        return steps.get(i);
    }

    public List<Step> steps() {
        return steps;
    }

    public Step last() {
        return steps.get(steps.size() - 1);
    }

    /**
     * @return true if every input symbol was consumed.
     */
    public boolean isComplete() {
        return steps.size() == input.length() + 1;
    }

    /**
     * @return the verdict: the run consumed the whole input and ended on an
     *         accepting step.
     */
    public boolean accepted() {
        return isComplete() && last().isAccepting();
    }

    public Iterator<Step> iterator() {
        return steps.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            sb.append(step).append(Misc.LS);
        }
        return sb.toString();
    }
}
