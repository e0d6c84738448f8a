/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.regviz.automata.Token.Kind;

/**
 * Splits regex source text into {@link Token}s. A backslash makes the next
 * character a literal whatever it is; outside of escapes whitespace and
 * control chars are rejected. A surrogate pair is one literal, escaped or not,
 * and an unpaired surrogate is always an error. Exactly one {@link Kind#END}
 * token is appended.
 */
final class Lexer {

    private Lexer() {
    } // never instantiated

    static List<Token> lex(String regex) {
        final List<Token> tokens = new ArrayList<Token>(regex.length() + 1);
        for (int i = 0; i < regex.length(); ++i) {
            final char c = regex.charAt(i);
            switch (c) {
            case '\\':
                if (i + 1 == regex.length()) {
                    throw new LexException(
                        LexException.Kind.DANGLING_ESCAPE, regex, i, c);
                }
                final int escaped = codePointAt(regex, i + 1);
                tokens.add(Token.literal(escaped, i));
                i += Character.charCount(escaped);
                break;
            case '|':
                tokens.add(Token.operator(Kind.ALTERNATION, i));
                break;
            case '.':
                tokens.add(Token.operator(Kind.CONCATENATION, i));
                break;
            case '*':
                tokens.add(Token.operator(Kind.STAR, i));
                break;
            case '+':
                tokens.add(Token.operator(Kind.PLUS, i));
                break;
            case '?':
                tokens.add(Token.operator(Kind.QUESTION, i));
                break;
            case '(':
                tokens.add(Token.operator(Kind.LEFT_PAREN, i));
                break;
            case ')':
                tokens.add(Token.operator(Kind.RIGHT_PAREN, i));
                break;
            default:
                if (!isLiteral(c)) {
                    throw new LexException(
                        LexException.Kind.INVALID_CHARACTER, regex, i, c);
                }
                final int cp = codePointAt(regex, i);
                tokens.add(Token.literal(cp, i));
                i += Character.charCount(cp) - 1;
            }
        }
        tokens.add(Token.operator(Kind.END, regex.length()));
        return Collections.unmodifiableList(tokens);
    }

    /*
     * the code point starting at i; a surrogate must be the high half of a pair
     */
    private static int codePointAt(String regex, int i) {
        final int cp = regex.codePointAt(i);
        if (Character.isSurrogate(regex.charAt(i)) && Character.isBmpCodePoint(cp)) {
            throw new LexException(
                LexException.Kind.INVALID_CHARACTER, regex, i, regex.charAt(i));
        }
        return cp;
    }

    /**
     * @return true if <code>c</code> may appear unescaped as a literal, or as
     *         one half of a surrogate pair.
     */
    static boolean isLiteral(char c) {
        return !(Character.isWhitespace(c)
                || Character.isSpaceChar(c)
                || Character.isISOControl(c));
    }
}
