/*
 * @LICENSE@
 */

package org.regviz.automata.test;

import static org.regviz.automata.RegexAssert.*;

import java.util.Arrays;

import org.regviz.automata.AbstractRxTestCase;
import org.regviz.automata.EngineStyle;
import org.regviz.automata.LexException;
import org.regviz.automata.ParseException;
import org.regviz.automata.Pattern;
import org.regviz.automata.SimulationTrace;
import org.regviz.automata.Token;

public class PatternTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PatternTestCase.class);
    }

    public PatternTestCase(String name) {
        super(name);
    }

    public void testBalancedAs() {
        assertAccepts("a(b|c)*a", "aba", "accca", "aa");
        assertRejects("a(b|c)*a", "ab", "", "a", "abca ");
    }

    public void testPairsOrC() {
        assertAccepts("(ab)*|c", "", "ab", "abab", "c");
        assertRejects("(ab)*|c", "ac", "abc", "cc", "aba");
    }

    public void testEmptyPatternMatchesOnlyEmptyString() {
        assertAccepts("", "");
        assertRejects("", "a", " ", "\u0000");
    }

    public void testStarAcceptsEmpty() {
        for (String regex : new String[] {"a*", "(a|b)*", "(abc)*", "(a+)*", "(a?b)*", "((a|bc)d+)*"}) {
            assertAccepts(regex, "");
        }
    }

    public void testPlusAndOptional() {
        assertAccepts("a+b?", "a", "aaa", "ab", "aaab");
        assertRejects("a+b?", "", "b", "abb", "ba");
        assertAccepts("a(bc|d)+e?", "abc", "ad", "adbcde", "abce");
        assertRejects("a(bc|d)+e?", "a", "ae", "abcee", "ab");
    }

    public void testExplicitConcatenation() {
        assertAccepts("(a.b)*", "", "ab", "abab");
        assertRejects("(a.b)*", "a.b", "aba");
    }

    public void testEscapes() {
        assertAccepts("a\\|b", "a|b");
        assertRejects("a\\|b", "a", "b");
        assertAccepts("\\(\\)*", "(", "()", "())");
        assertAccepts("a\\ b", "a b");
        assertAccepts("\\.\\*", ".*");
    }

    private static final String GRIN = "\uD83D\uDE00";

    public void testSupplementaryCharacters() {
        assertAccepts(GRIN, GRIN);
        assertRejects(GRIN, "", "\uD83D", GRIN + GRIN);
        assertAccepts("\\" + GRIN, GRIN);
        // postfix operators repeat the whole pair
        assertAccepts("a(" + GRIN + ")*", "a", "a" + GRIN + GRIN);
        assertAccepts(GRIN + "+", GRIN, GRIN + GRIN + GRIN);
        assertRejects(GRIN + "+", GRIN + "\uDE00", "\uD83D\uD83D\uDE00");
        assertSyntaxError("a(\uD83D)*", LexException.Kind.INVALID_CHARACTER, 2);
    }

    public void testSupplementaryAstText() {
        Pattern p = Pattern.compile(GRIN + "*");
        String text = p.ast().toString();
        assertEquals("(" + GRIN + ")*", text);
        assertEquals(p.ast(), Pattern.compile(text).ast());
        assertTrue(Pattern.matches(Pattern.quote("x" + GRIN + "|"), "x" + GRIN + "|"));
    }

    private static String repeat(String s, String separator, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; ++i) {
            if (i > 0) sb.append(separator);
            sb.append(s);
        }
        return sb.toString();
    }

    public void testLongConcatenation() {
        String regex = repeat("abc", "", 3400);
        assertEquals(10200, regex.length());
        Pattern p = Pattern.compile(regex);
        assertVerdict(p, true, regex);
        assertVerdict(p, false, regex.substring(1), regex + "a", "");
        assertEquals(regex, p.ast().toString());
        assertEquals(p.ast(), p.ast());
        assertEquals(p.ast().hashCode(), p.ast().hashCode());
        assertFalse(p.ast().equals(Pattern.compile(regex + "a").ast()));
        assertEquals(2 * regex.length(), p.nfa().stateCount());
        assertEquals(regex.length() + 1, p.minimalDfa().stateCount());
    }

    public void testLongAlternation() {
        String regex = repeat("ab", "|", 2500) + "|" + repeat("c", "|", 2501);
        Pattern p = Pattern.compile(regex);
        assertEquals(5001, regex.split("\\|").length);
        assertVerdict(p, true, "ab", "c");
        assertVerdict(p, false, "", "a", "abc", "cc");
        assertEquals(regex, p.ast().toString());
        assertEquals(p.ast(), p.ast());
        assertEquals(3, p.minimalDfa().stateCount());
    }

    public void testDeepPostfixNesting() {
        String regex = "a" + repeat("*", "", 5000);
        Pattern p = Pattern.compile(regex);
        assertVerdict(p, true, "", "a", "aaaa");
        assertVerdict(p, false, "b", "ab");
        assertEquals(regex, p.ast().toString());
        assertEquals(1, p.minimalDfa().stateCount());
    }

    public void testUnknownSymbolsReject() {
        assertRejects("abc", "abd", "xbc", "abcx");
    }

    public void testCompileErrors() {
        assertSyntaxError("((a)", ParseException.Kind.MISMATCHED_LEFT_PAREN, 4);
        assertSyntaxError("a b", LexException.Kind.INVALID_CHARACTER, 1);
        assertSyntaxError("x\\", LexException.Kind.DANGLING_ESCAPE, 1);
    }

    public void testLiteralFlag() {
        Pattern p = Pattern.compile("a|b*(", Pattern.LITERAL);
        assertEquals(Pattern.LITERAL, p.flags());
        assertEquals("a|b*(", p.pattern());
        assertVerdict(p, true, "a|b*(");
        assertVerdict(p, false, "a", "b", "");
        assertTrue(Pattern.compile("a b\t", Pattern.LITERAL).accepts("a b\t"));
    }

    public void testUnknownFlag() {
        try {
            Pattern.compile("a", 0x1);
            fail("should throw");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("0x1"));
        }
    }

    public void testQuote() {
        String text = "(a|b)*.\\ ?+";
        String quoted = Pattern.quote(text);
        assertEquals("\\(a\\|b\\)\\*\\.\\\\\\ \\?\\+", quoted);
        assertTrue(Pattern.matches(quoted, text));
        assertFalse(Pattern.matches(quoted, "a"));
    }

    public void testStaticMatches() {
        assertTrue(Pattern.matches("a(b|c)*a", "abcba"));
        assertFalse(Pattern.matches("a(b|c)*a", "abcb"));
    }

    public void testArtifacts() {
        Pattern p = Pattern.compile("a(b|c)*a");
        assertEquals("a(b|c)*a", p.toString());
        assertEquals(9, p.tokens().size());
        assertEquals(Token.Kind.END, p.tokens().get(8).kind());
        assertEquals(8, p.tokens().get(8).position());
        assertEquals("a(b|c)*a", p.ast().toString());
        assertTrue(Arrays.equals(new char[] {'a', 'b', 'c'}, p.alphabet()));
        assertEquals(12, p.nfa().stateCount());
        assertEquals(5, p.dfa().stateCount());
        assertEquals(3, p.minimalDfa().stateCount());
        assertEquals(p.ast().toTreeString(), p.toTreeString());
    }

    public void testAstIsACopy() {
        Pattern p = Pattern.compile("ab*");
        assertNotSame(p.ast(), p.ast());
        assertEquals(p.ast(), p.ast());
    }

    public void testDerivedAutomataAreCached() {
        Pattern p = Pattern.compile("(a|b)*abb");
        assertSame(p.dfa(), p.dfa());
        assertSame(p.minimalDfa(), p.minimalDfa());
        assertEquals(4, p.minimalDfa().stateCount());
    }

    public void testTraceStyles() {
        Pattern p = Pattern.compile("a(b|c)*a");
        SimulationTrace nfa = p.trace("aca");
        SimulationTrace dfa = p.trace("aca", EngineStyle.DFA_TABLE);
        SimulationTrace min = p.trace("aca", EngineStyle.MIN_DFA_TABLE);
        assertEquals(4, nfa.size());
        assertEquals(4, dfa.size());
        assertEquals(4, min.size());
        assertTrue(nfa.accepted() && dfa.accepted() && min.accepted());
        for (int i = 0; i < 4; ++i) {
            assertEquals(1, dfa.step(i).active().size());
            assertEquals(nfa.step(i).isAccepting(), dfa.step(i).isAccepting());
            assertEquals(nfa.step(i).isAccepting(), min.step(i).isAccepting());
        }
        // the DFA state is the NFA subset
        for (int i = 0; i < 4; ++i) {
            int state = dfa.step(i).active().first();
            assertEquals(nfa.step(i).active(), p.dfa().members(state));
        }
    }

    public void testConcurrentDerivation() throws InterruptedException {
        final Pattern p = Pattern.compile("((a|b)(a|b|c)*d?)+");
        final Object[] seen = new Object[8];
        Thread[] threads = new Thread[seen.length];
        for (int i = 0; i < threads.length; ++i) {
            final int slot = i;
            threads[i] = new Thread() {
                @Override
                public void run() {
                    seen[slot] = p.minimalDfa();
                }
            };
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join();
        }
        for (Object o : seen) {
            assertSame(seen[0], o);
        }
    }
}
