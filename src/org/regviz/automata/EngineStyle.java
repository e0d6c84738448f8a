/*
 * @LICENSE@
 */
package org.regviz.automata;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The automaton a {@link Pattern} simulates with. Every style recognizes the
 * same language; they differ in the states a {@link SimulationTrace} shows.
 * Internally, this enum class is used as a factory to create "Engine"s.
 */
public enum EngineStyle {

    /**
     * The Thompson NFA, simulated as a set of active states.
     */
    NFA_TABLE {
        @Override
        Engine newEngine(Pattern p) {
            return new NFAtableEngine(this, p.nfa());
        }
    },

    /**
     * The DFA from subset construction. Built on first use.
     */
    DFA_TABLE {
        @Override
        Engine newEngine(Pattern p) {
            return new DFAtableEngine(this, p.dfa());
        }
    },

    /**
     * The minimized DFA. Built on first use.
     */
    MIN_DFA_TABLE {
        @Override
        Engine newEngine(Pattern p) {
            return new DFAtableEngine(this, p.minimalDfa());
        }
    };

    private static final Logger logger = Logger.getLogger("org.regviz.automata");
    private static final Level level = Level.FINEST;

    abstract Engine newEngine(Pattern p);

    final Engine engineFor(Pattern p) {
        final Engine engine = newEngine(p);
        if (logger.isLoggable(level)) {
            logger.log(level, "engine for " + p + ": " + engine);
        }
        return engine;
    }
}
