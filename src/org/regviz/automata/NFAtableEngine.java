/*
 * @LICENSE@
 */
package org.regviz.automata;

/**
 * Runs the Thompson NFA directly, tracking the set of active states.
 */
final class NFAtableEngine extends Engine {

    private final NFA nfa;

    NFAtableEngine(EngineStyle style, NFA nfa) {
        super(style);
        this.nfa = nfa;
    }

    @Override
    boolean accepts(CharSequence input) {
        return Simulator.accepts(nfa, input);
    }

    @Override
    SimulationTrace trace(CharSequence input) {
        return Simulator.trace(nfa, input);
    }

    @Override
    int stateCount() {
        return nfa.stateCount();
    }
}
