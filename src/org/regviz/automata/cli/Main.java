/*
 * @LICENSE@
 */

package org.regviz.automata.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regviz.automata.BuildException;
import org.regviz.automata.DFA;
import org.regviz.automata.EngineStyle;
import org.regviz.automata.Example;
import org.regviz.automata.NFA;
import org.regviz.automata.Pattern;
import org.regviz.automata.SimulationTrace;

/**
 * Command line front end:
 *
 * <pre>
 * regviz [--trace] &lt;pattern&gt; [test-string]
 * regviz --presets
 * </pre>
 *
 * Prints the pattern, its syntax tree and automaton statistics and, given a
 * test string, the verdict of each automaton. A pattern that does not compile
 * is reported on stderr and nothing is simulated.
 */
public final class Main {

    private static final Logger logger = Logger.getLogger("org.regviz.automata.cli");

    static final int EXIT_OK = 0;
    static final int EXIT_BUILD_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "usage: regviz [--trace] [--] <pattern> [test-string]" + System.getProperty("line.separator")
        + "       regviz --presets";

    private final PrintStream out;
    private final PrintStream err;
    private boolean trace = false;

    private Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        final int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * @return the exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        logger.log(Level.FINE, "args: " + Arrays.toString(args));
        return new Main(out, err).run(args);
    }

    private int run(String[] args) {
        int i = 0;
        for (; i < args.length && args[i].startsWith("--"); ++i) {
            if (args[i].equals("--")) {
                ++i;
                break;
            } else if (args[i].equals("--trace")) {
                trace = true;
            } else if (args[i].equals("--presets")) {
                return args.length == 1 ? presets() : usage("--presets takes no arguments");
            } else {
                return usage("unknown option: " + args[i]);
            }
        }
        final int rest = args.length - i;
        if (rest < 1 || rest > 2) {
            return usage(null);
        }
        return describe(args[i], rest == 2 ? args[i + 1] : null);
    }

    private int usage(String problem) {
        if (problem != null) {
            err.println(problem);
        }
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private int describe(String regex, String input) {
        final Pattern p;
        try {
            p = Pattern.compile(regex);
        } catch (BuildException e) {
            logger.log(Level.FINE, "build failed: " + regex, e);
            err.println("Build error: " + e.getKind() + ": " + e.getMessage());
            return EXIT_BUILD_ERROR;
        }

        out.println("Pattern: " + p.pattern());
        out.println("AST: " + p.ast());
        out.print(p.toTreeString());

        final NFA nfa = p.nfa();
        out.println("NFA: states=" + nfa.stateCount()
            + " start=" + nfa.start()
            + " accepts=" + nfa.accepts().size()
            + " edges=" + nfa.edgeCount());
        final DFA dfa = p.dfa();
        out.println("DFA: states=" + dfa.stateCount()
            + " start=" + dfa.start()
            + " accepts=" + dfa.accepts().size()
            + " alphabet=" + Arrays.toString(dfa.alphabet()));
        final DFA min = p.minimalDfa();
        out.println("Minimal DFA: states=" + min.stateCount()
            + " start=" + min.start()
            + " accepts=" + min.accepts().size());

        if (input != null) {
            out.println("Input: \"" + input + "\"");
            out.println("NFA accepts: " + p.accepts(input, EngineStyle.NFA_TABLE));
            out.println("DFA accepts: " + p.accepts(input, EngineStyle.DFA_TABLE));
            out.println("Minimal DFA accepts: " + p.accepts(input, EngineStyle.MIN_DFA_TABLE));
            if (trace) {
                final SimulationTrace t = p.trace(input);
                out.println("NFA trace:");
                for (SimulationTrace.Step step : t) {
                    out.println("    " + step);
                }
            }
        }
        return EXIT_OK;
    }

    private int presets() {
        for (Example example : Example.presets()) {
            final Pattern p = example.compile();
            out.println(example.name() + ": " + example.pattern());
            for (Example.Sample sample : example.samples()) {
                final boolean verdict = p.accepts(sample.input());
                out.println("    \"" + sample.input() + "\" -> " + verdict
                    + (verdict == sample.accepted() ? "" : " (expected " + sample.accepted() + ")"));
            }
        }
        return EXIT_OK;
    }
}
