/*
 * @LICENSE@
 */
package org.regviz.automata.test;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.regviz.automata.AbstractRxTestCase;
import org.regviz.automata.DFA;
import org.regviz.automata.EngineStyle;
import org.regviz.automata.Pattern;

public class LogDemoTestCase extends AbstractRxTestCase {

    private List<LogRecord> records;

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        records = captureRxLog();
    }

    protected void tearDown() throws Exception {
        for (LogRecord r : records) {
            logger.log(level, r.getLevel() + " " + r.getMessage());
        }
        super.tearDown();
    }

    private boolean logged(String prefix) {
        for (LogRecord r : records) {
            if (r.getMessage().startsWith(prefix)) return true;
        }
        return false;
    }

    public void testCompileLogsTheTree() {
        Pattern.compile("a(b|c)*a");
        assertTrue(logged("regex: a(b|c)*a"));
        assertTrue(logged("ast: "));
        assertTrue(logged("nfa: 12 states"));
        assertFalse(logged("dfa unminimized: "));
    }

    public void testDerivationsAreLogged() {
        Pattern p = Pattern.compile("(a|b)*abb");
        p.minimalDfa();
        assertTrue(logged("dfa unminimized: total states: 5"));
        assertTrue(logged("dfa minimized: 5 -> 4 states"));
    }

    public void testEngineSelection() {
        Pattern p = Pattern.compile("ab|ac");
        p.accepts("ab", EngineStyle.MIN_DFA_TABLE);
        assertTrue(logged("engine for ab|ac: MIN_DFA_TABLE"));
        p.accepts("ac", EngineStyle.MIN_DFA_TABLE);
        int n = 0;
        for (LogRecord r : records) {
            if (r.getMessage().startsWith("engine for")) ++n;
        }
        assertEquals(1, n);
    }

    public void testParameters() {
        DFA dfa = Pattern.compile("ab*").dfa();
        for (LogRecord r : records) {
            if (r.getMessage().startsWith("dfa unminimized")) {
                assertSame(dfa, r.getParameters()[0]);
                assertEquals(Level.FINER, r.getLevel());
                return;
            }
        }
        fail("no dfa record");
    }

    public void testNothingAtInfo() {
        Pattern p = Pattern.compile("((a|b)(c|d))+e?");
        p.trace("acbd", EngineStyle.MIN_DFA_TABLE);
        assertFalse(records.isEmpty());
        for (LogRecord r : records) {
            assertTrue(r.getMessage(), r.getLevel().intValue() < Level.INFO.intValue());
        }
    }
}
