/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * idiom suppression for Strings
     */
    static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new Iterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    static <T> boolean intersects(Set<T> lhs, Collection<T> rhs) {
        for (T t : rhs) {
            if (lhs.contains(t)) return true;
        }
        return false;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, char c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, char c) {
            boolean ret = map.containsKey(c);
            if (ret)
                sb.append(map.get(c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }

        MapEscaper prefix(String chars) {
            for (char c : iterize(chars)) {
                map(c, "\\" + c);
            }
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"")
                .map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\b', "\\b").map('\f', "\\f");

    private static final MapEscaper rxpEscaper =
            new MapEscaper().prefix("\\|.*+?()");

    /*
     * anything the lexer would refuse as a bare literal gets a backslash
     */
    private static final Escaper rxLiteralEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, char c) {
            boolean ret = !Lexer.isLiteral(c);
            if (ret) {
                sb.append('\\').append(c);
            }
            return ret;
        }
    };

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, char c) {
            boolean ret = false;
            if (c < 32 || 126 < c && !Character.isLetterOrDigit(c)) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, ASCII control chars and
         * non-letter characters beyond ASCII -> \\u codes. For display only.
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * Regex Pattern escaper - prefixes operators, whitespace and control
         * chars with a backslash. The result lexes back to the same literals.
         */
        RXP(rxpEscaper, rxLiteralEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, char c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append(c);
        }

        String esc(char c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (char c : iterize(cs)) {
                esc(sb, c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
