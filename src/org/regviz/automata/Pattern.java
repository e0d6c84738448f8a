/*
 * @LICENSE@
 */

package org.regviz.automata;

import static org.regviz.automata.Misc.isSet;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regviz.automata.AST.Node;

/**
 * A compiled regular expression; loosely modeled on the
 * {@link java.util.regex.Pattern} class. Compilation lexes and parses the
 * source and builds the Thompson {@link NFA}; the {@link DFA} and the minimal
 * DFA are derived from it on first use and kept. Instances are immutable apart
 * from those two slots, and thread safe.
 * <p>
 * <strong>Syntax:</strong>
 * <ul>
 * <li>any char other than the operators below is a literal, except
 * whitespace and control chars, which must be escaped;</li>
 * <li><code>\x</code> is the literal <code>x</code>, whatever <code>x</code>
 * is;</li>
 * <li><code>XY</code> or <code>X.Y</code> - concatenation;</li>
 * <li><code>X|Y</code> - alternation, the loosest operator;</li>
 * <li><code>X*</code>, <code>X+</code>, <code>X?</code> - zero or more, one
 * or more, zero or one;</li>
 * <li><code>(X)</code> - grouping; <code>()</code> is an error;</li>
 * <li>the empty pattern matches only the empty string.</li>
 * </ul>
 * Character classes, anchors, bounded quantifiers and back references are
 * <em>not</em> supported. Symbols are <code>char</code>s: a character outside
 * the BMP is the concatenation of its surrogate pair, and an unpaired
 * surrogate is a syntax error, escaped or not.
 * <p>
 * <strong>Errors:</strong> syntax errors are reported as {@link LexException}
 * or {@link ParseException}, both {@link java.util.regex.PatternSyntaxException}s
 * carrying the offending index.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.regviz.automata");
    private static final Level level = Level.FINEST;

    /**
     * Compiles the pattern as a literal string: every char matches itself.
     * Same value as {@link java.util.regex.Pattern#LITERAL}.
     */
    public static final int LITERAL = java.util.regex.Pattern.LITERAL;

    private static final int IMPLEMENTED_FLAGS = LITERAL;

    private final String regex;
    private final int flags;
    private final List<Token> tokens;
    private final Node root;
    private final NFA nfa;

    private DFA dfa;            // guarded by this
    private DFA minimalDfa;     // guarded by this
    private final Map<EngineStyle, Engine> engines =
        new EnumMap<EngineStyle, Engine>(EngineStyle.class);   // guarded by this

    private Pattern(String regex, int flags) {
        if ((flags & ~IMPLEMENTED_FLAGS) != 0) {
            throw new IllegalArgumentException(
                "unsupported flags: 0x" + Integer.toHexString(flags & ~IMPLEMENTED_FLAGS));
        }
        this.regex = regex;
        this.flags = flags;
        final String source = isSet(flags, LITERAL) ? quote(regex) : regex;
        this.tokens = Lexer.lex(source);
        this.root = RegexParser.parse(source, tokens);
        this.nfa = NFABuilder.build(root);

        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + Misc.Esc.JAVA.esc(regex));
            logger.log(level, "flags: 0x" + Integer.toHexString(flags));
            logger.log(level, "ast: " + Misc.LS + root.toTreeString());
            logger.log(level, "nfa: " + nfa.stateCount() + " states, "
                + nfa.edgeCount() + " arcs");
        }
    }

    public static Pattern compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @param flags
     *            zero or {@link #LITERAL}.
     * @return the pattern.
     * @throws LexException
     *             for a dangling escape or an unescaped whitespace or control
     *             char.
     * @throws ParseException
     *             for a syntax error.
     * @throws IllegalArgumentException
     *             for an unknown flag.
     */
    public static Pattern compile(String regex, int flags) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        return new Pattern(regex, flags);
    }

    public static boolean matches(String regex, CharSequence input) {
        return compile(regex).accepts(input);
    }

    /**
     * @return a pattern text matching exactly <code>s</code>; it does not
     *         compile if <code>s</code> holds an unpaired surrogate.
     */
    public static String quote(String s) {
        return Misc.Esc.RXP.esc(s);
    }

    public String pattern() {
        return regex;
    }

    public int flags() {
        return flags;
    }

    /**
     * @return the tokens, END included; unmodifiable.
     */
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * @return a copy of the syntax tree.
     */
    public Node ast() {
        return root.copy();
    }

    public NFA nfa() {
        return nfa;
    }

    /**
     * @return the sorted, distinct symbols of the NFA.
     */
    public char[] alphabet() {
        return nfa.alphabet();
    }

    public synchronized DFA dfa() {
        if (dfa == null) {
            dfa = Determinizer.determinize(nfa);
        }
        return dfa;
    }

    public synchronized DFA minimalDfa() {
        if (minimalDfa == null) {
            minimalDfa = Minimizer.minimize(dfa());
        }
        return minimalDfa;
    }

    private synchronized Engine engine(EngineStyle style) {
        Engine engine = engines.get(style);
        if (engine == null) {
            engine = style.engineFor(this);
            engines.put(style, engine);
        }
        return engine;
    }

    /**
     * @return true if the NFA accepts the whole of <code>input</code>.
     */
    public boolean accepts(CharSequence input) {
        return accepts(input, EngineStyle.NFA_TABLE);
    }

    public boolean accepts(CharSequence input, EngineStyle style) {
        return engine(style).accepts(input);
    }

    public SimulationTrace trace(CharSequence input) {
        return trace(input, EngineStyle.NFA_TABLE);
    }

    /**
     * @return the step by step run of the automaton selected by
     *         <code>style</code> over <code>input</code>.
     */
    public SimulationTrace trace(CharSequence input, EngineStyle style) {
        return engine(style).trace(input);
    }

    public String toTreeString() {
        return root.toTreeString();
    }

    @Override
    public String toString() {
        return regex;
    }
}
