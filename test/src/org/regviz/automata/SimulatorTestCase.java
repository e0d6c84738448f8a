/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.regviz.automata.SimulationTrace.Step;

public class SimulatorTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(SimulatorTestCase.class);
    }

    public SimulatorTestCase(String name) {
        super(name);
    }

    private static SortedSet<Integer> set(Integer... ints) {
        return new TreeSet<Integer>(Arrays.asList(ints));
    }

    private static Set<Edge> edges(Edge... edges) {
        return new LinkedHashSet<Edge>(Arrays.asList(edges));
    }

    public void testEpsilonClosure() {
        NFA nfa = nfaOf("a*");
        assertEquals(set(0, 2, 3), Simulator.epsilonClosure(set(2), nfa));
        assertEquals(set(0, 1, 3), Simulator.epsilonClosure(set(1), nfa));
        assertEquals(set(0), Simulator.epsilonClosure(set(0), nfa));
        assertEquals(set(), Simulator.epsilonClosure(set(), nfa));
    }

    public void testEpsilonClosureIsIdempotent() {
        NFA nfa = nfaOf("(a|b*)*c?(d|e)?");
        for (int state = 0; state < nfa.stateCount(); ++state) {
            SortedSet<Integer> once = Simulator.epsilonClosure(set(state), nfa);
            assertTrue(once.contains(state));
            assertEquals(once, Simulator.epsilonClosure(once, nfa));
        }
    }

    public void testMoveOnDoesNotClose() {
        NFA nfa = nfaOf("ab");
        assertEquals(set(1), Simulator.moveOn(set(0), 'a', nfa));
        assertEquals(set(), Simulator.moveOn(set(0), 'b', nfa));
        assertEquals(set(), Simulator.moveOn(set(1), 'b', nfa));
        assertEquals(set(3), Simulator.moveOn(set(0, 1, 2), 'b', nfa));
    }

    public void testAccepts() {
        NFA nfa = nfaOf("a(b|c)*a");
        DFA dfa = Determinizer.determinize(nfa);
        for (String s : new String[] {"aba", "accca", "aa"}) {
            assertTrue(s, Simulator.accepts(nfa, s));
            assertTrue(s, Simulator.accepts(dfa, s));
        }
        for (String s : new String[] {"ab", "", "a", "abx", "xaa"}) {
            assertFalse(s, Simulator.accepts(nfa, s));
            assertFalse(s, Simulator.accepts(dfa, s));
        }
    }

    public void testNfaTrace() {
        SimulationTrace trace = Simulator.trace(nfaOf("ab"), "ab");
        assertEquals(3, trace.size());
        assertTrue(trace.isComplete());
        assertTrue(trace.accepted());

        Step s0 = trace.step(0);
        assertEquals(0, s0.index());
        assertNull(s0.consumed());
        assertEquals(set(0), s0.active());
        assertTrue(s0.edges().isEmpty());
        assertFalse(s0.isAccepting());

        Step s1 = trace.step(1);
        assertEquals(Character.valueOf('a'), s1.consumed());
        assertEquals(set(1, 2), s1.active());
        assertEquals(edges(
                new Edge(0, 1, Label.of('a')),
                new Edge(1, 2, Label.EPSILON)),
            s1.edges());
        assertFalse(s1.isAccepting());

        Step s2 = trace.step(2);
        assertEquals(set(3), s2.active());
        assertEquals(edges(new Edge(2, 3, Label.of('b'))), s2.edges());
        assertTrue(s2.isAccepting());
        assertSame(s2, trace.last());
    }

    public void testInitialStepIsClosed() {
        SimulationTrace trace = Simulator.trace(nfaOf("a*"), "");
        assertEquals(1, trace.size());
        Step s0 = trace.step(0);
        assertEquals(set(0, 2, 3), s0.active());
        assertEquals(edges(
                new Edge(2, 0, Label.EPSILON),
                new Edge(2, 3, Label.EPSILON)),
            s0.edges());
        assertTrue(s0.isAccepting());
        assertTrue(trace.accepted());
    }

    public void testTraceStopsWhenNothingIsActive() {
        SimulationTrace trace = Simulator.trace(nfaOf("ab"), "xbab");
        assertEquals(2, trace.size());
        assertTrue(trace.last().active().isEmpty());
        assertFalse(trace.last().isAccepting());
        assertFalse(trace.isComplete());
        assertFalse(trace.accepted());
        assertEquals("xbab", trace.input());
    }

    public void testTraceDeadAtLastSymbol() {
        SimulationTrace trace = Simulator.trace(nfaOf("a"), "ab");
        assertEquals(3, trace.size());
        assertTrue(trace.last().active().isEmpty());
        assertFalse(trace.accepted());
    }

    public void testDfaTrace() {
        DFA dfa = dfaOf("a*");
        SimulationTrace trace = Simulator.trace(dfa, "aa");
        assertEquals(3, trace.size());
        assertEquals(Collections.singleton(0), trace.step(0).active());
        assertEquals(edges(new Edge(0, 1, Label.of('a'))), trace.step(1).edges());
        assertEquals(edges(new Edge(1, 1, Label.of('a'))), trace.step(2).edges());
        assertTrue(trace.accepted());
    }

    public void testDfaTraceStopsOnMissingTransition() {
        DFA dfa = dfaOf("ab");
        SimulationTrace trace = Simulator.trace(dfa, "aab");
        assertEquals(3, trace.size());
        assertTrue(trace.step(2).active().isEmpty());
        assertTrue(trace.step(2).edges().isEmpty());
        assertFalse(trace.accepted());

        // unknown symbol
        trace = Simulator.trace(dfa, "z");
        assertEquals(2, trace.size());
        assertFalse(trace.accepted());
    }

    public void testTraceVerdictMatchesAccepts() {
        String[] regexes = {"a(b|c)*a", "(ab)*|c", "a+b?", ""};
        String[] inputs = {"", "a", "aa", "aba", "ab", "abab", "c", "aab", "abb"};
        for (String regex : regexes) {
            NFA nfa = nfaOf(regex);
            DFA dfa = Determinizer.determinize(nfa);
            for (String input : inputs) {
                assertEquals(Simulator.accepts(nfa, input), Simulator.trace(nfa, input).accepted());
                assertEquals(Simulator.accepts(dfa, input), Simulator.trace(dfa, input).accepted());
            }
        }
    }

    public void testRandomAccess() {
        SimulationTrace trace = Simulator.trace(nfaOf("abc"), "abc");
        assertEquals(4, trace.size());
        assertEquals(Character.valueOf('c'), trace.step(3).consumed());
        assertEquals(Character.valueOf('a'), trace.step(1).consumed());
        try {
            trace.step(4);
            fail("should throw");
        } catch (IndexOutOfBoundsException e) {
            assertEquals(4, trace.steps().size());
        }
        try {
            trace.steps().clear();
            fail("should throw");
        } catch (UnsupportedOperationException e) {
            assertEquals(4, trace.size());
        }
    }
}
