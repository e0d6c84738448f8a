/*
 * @LICENSE@
 */
package org.regviz.automata;

/**
 * Table driven DFA run; serves both the determinized and the minimal DFA.
 */
final class DFAtableEngine extends Engine {

    private final DFA dfa;

    DFAtableEngine(EngineStyle style, DFA dfa) {
        super(style);
        this.dfa = dfa;
    }

    @Override
    boolean accepts(CharSequence input) {
        return Simulator.accepts(dfa, input);
    }

    @Override
    SimulationTrace trace(CharSequence input) {
        return Simulator.trace(dfa, input);
    }

    @Override
    int stateCount() {
        return dfa.stateCount();
    }
}
