/*
 * @LICENSE@
 */

package org.regviz.automata.test;

import static org.regviz.automata.RegexAssert.assertVerdict;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.regviz.automata.AbstractRxTestCase;
import org.regviz.automata.Example;

public class ExampleTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ExampleTestCase.class);
    }

    public ExampleTestCase(String name) {
        super(name);
    }

    public void testSamplesHaveTheExpectedVerdicts() {
        for (Example example : Example.presets()) {
            for (Example.Sample sample : example.samples()) {
                assertVerdict(example.compile(), sample.accepted(), sample.input());
            }
        }
    }

    public void testNamesAreUnique() {
        Set<String> names = new HashSet<String>();
        for (Example example : Example.presets()) {
            assertTrue(example.name(), names.add(example.name()));
            assertFalse(example.samples().isEmpty());
        }
    }

    public void testPresetsAreImmutable() {
        List<Example> presets = Example.presets();
        try {
            presets.clear();
            fail("should throw");
        } catch (UnsupportedOperationException e) {
            assertFalse(Example.presets().isEmpty());
        }
        try {
            presets.get(0).samples().clear();
            fail("should throw");
        } catch (UnsupportedOperationException e) {
            assertFalse(presets.get(0).samples().isEmpty());
        }
    }

    public void testFirstPreset() {
        Example first = Example.presets().get(0);
        assertEquals("Balanced As", first.name());
        assertEquals("a(b|c)*a", first.pattern());
        assertEquals("Balanced As: a(b|c)*a", first.toString());
        assertEquals("\"aba\" accept", first.samples().get(0).toString());
    }
}
