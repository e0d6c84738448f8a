/*
 * @LICENSE@
 */

/**
 * <h3><b>regviz</b> - regular expressions compiled to finite automata you can
 * watch.</h3>
 * <p>
 * A {@link org.regviz.automata.Pattern} goes through the classic pipeline:
 * <ol>
 * <li>lexing into {@linkplain org.regviz.automata.Token tokens};</li>
 * <li>Pratt parsing into an {@linkplain org.regviz.automata.AST abstract syntax
 * tree};</li>
 * <li>Thompson construction of an {@link org.regviz.automata.NFA};</li>
 * <li>subset construction of a {@link org.regviz.automata.DFA}, on demand;</li>
 * <li>Hopcroft minimization of that DFA, on demand.</li>
 * </ol>
 * The {@link org.regviz.automata.Simulator} runs any of the three automata
 * over a test string, either for a verdict or for a
 * {@link org.regviz.automata.SimulationTrace} that records the active states
 * and traversed edges after every symbol, for step by step playback.
 * <p>
 * Nothing here draws anything. The automata, the regions of the NFA and the
 * traces are plain data for whatever renders them.
 * <p>
 * <h4>Logging.</h4>
 * All classes log to the <code>org.regviz.automata</code>
 * {@link java.util.logging.Logger}: FINEST for compiled patterns and their
 * syntax trees, FINER for full automaton dumps.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Ken Thompson, "Regular expression search algorithm", CACM 1968.</li>
 * <li>John Hopcroft, "An n log n algorithm for minimizing states in a finite
 * automaton", 1971.</li>
 * <li>Vaughan Pratt, "Top down operator precedence", POPL 1973.</li>
 * <li>The first chapters of the Dragon Book.</li>
 * </ul>
 */
package org.regviz.automata;
