/*
 * @LICENSE@
 */

package org.regviz.automata;

/**
 * A labeled transition <code>from -label-&gt; to</code> between two states of
 * the same automaton. Value semantics; used for listing automata and for the
 * traversed edges of a {@link SimulationTrace}.
 */
public final class Edge {

    private final int from;
    private final int to;
    private final Label label;

    public Edge(int from, int to, Label label) {
        assert from >= 0 && to >= 0 && label != null;
        this.from = from;
        this.to = to;
        this.label = label;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public Label label() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge that = (Edge) o;
        return from == that.from && to == that.to && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return (from * 31 + to) * 31 + label.hashCode();
    }

    @Override
    public String toString() {
        return from + " -" + label + "-> " + to;
    }
}
