/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named demonstration pattern with sample inputs and their expected
 * verdicts. Immutable; {@link #presets()} returns the built in ones.
 */
public final class Example {

    public static final class Sample {

        private final String input;
        private final boolean accepted;

        private Sample(String input, boolean accepted) {
            this.input = input;
            this.accepted = accepted;
        }

        public String input() {
            return input;
        }

        /**
         * @return the expected verdict.
         */
        public boolean accepted() {
            return accepted;
        }

        @Override
        public String toString() {
            return "\"" + Misc.Esc.JAVA.esc(input) + "\" " + (accepted ? "accept" : "reject");
        }
    }

    private final String name;
    private final String pattern;
    private final List<Sample> samples;

    private Example(String name, String pattern, Sample... samples) {
        this.name = name;
        this.pattern = pattern;
        List<Sample> list = new ArrayList<Sample>(samples.length);
        Collections.addAll(list, samples);
        this.samples = Collections.unmodifiableList(list);
    }

    private static Sample accept(String input) {
        return new Sample(input, true);
    }

    private static Sample reject(String input) {
        return new Sample(input, false);
    }

    private static final List<Example> PRESETS;

    static {
        List<Example> list = new ArrayList<Example>();
        list.add(new Example("Balanced As", "a(b|c)*a",
            accept("aba"), accept("accca"), accept("aa"), reject("ab")));
        list.add(new Example("Repeated pairs or c", "(ab)*|c",
            accept(""), accept("ab"), accept("abab"), accept("c"), reject("ac")));
        list.add(new Example("Plus and optional", "a+b?",
            accept("a"), accept("aaab"), reject("b"), reject("abb")));
        list.add(new Example("Grouped repetition", "a(bc|d)+e?",
            accept("abc"), accept("adbce"), reject("a"), reject("ae")));
        list.add(new Example("Explicit concatenation", "(a.b)*",
            accept(""), accept("abab"), reject("aba")));
        list.add(new Example("Escaped operator", "a\\|b",
            accept("a|b"), reject("a"), reject("b")));
        list.add(new Example("Empty pattern", "",
            accept(""), reject("a")));
        PRESETS = Collections.unmodifiableList(list);
    }

    /**
     * @return the built in examples; unmodifiable.
     */
    public static List<Example> presets() {
        return PRESETS;
    }

    public String name() {
        return name;
    }

    public String pattern() {
        return pattern;
    }

    public List<Sample> samples() {
        return samples;
    }

    public Pattern compile() {
        return Pattern.compile(pattern);
    }

    @Override
    public String toString() {
        return name + ": " + pattern;
    }
}
