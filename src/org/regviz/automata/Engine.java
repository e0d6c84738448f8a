/*
 * @LICENSE@
 */
package org.regviz.automata;

/**
 * Simulation bound to one automaton of a {@link Pattern}.
 */
abstract class Engine {

    final EngineStyle style;
    protected Engine(EngineStyle style) {
        this.style = style;
    }

    abstract boolean accepts(CharSequence input);

    abstract SimulationTrace trace(CharSequence input);

    abstract int stateCount();

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getSimpleName() + " with " + stateCount() + " states";
    }
}
