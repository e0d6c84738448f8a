/*
 * @LICENSE@
 */

package org.regviz.automata;

/**
 * A lexical unit of a regular expression, positioned at the char offset
 * where it begins in the source text. Produced by the lexer, consumed in
 * order by the parser; immutable.
 */
public final class Token {

    public enum Kind {
        LITERAL(null),
        ALTERNATION("|"),
        /** Only when written explicitly; implied concatenation has no token. */
        CONCATENATION("."),
        STAR("*"),
        PLUS("+"),
        QUESTION("?"),
        LEFT_PAREN("("),
        RIGHT_PAREN(")"),
        END("<eos>");

        final String glyph;

        Kind(String glyph) {
            this.glyph = glyph;
        }
    }

    private final Kind kind;
    private final int codePoint;
    private final int position;

    private Token(Kind kind, int codePoint, int position) {
        assert position >= 0;
        this.kind = kind;
        this.codePoint = codePoint;
        this.position = position;
    }

    static Token literal(int codePoint, int position) {
        assert Character.isValidCodePoint(codePoint);
        return new Token(Kind.LITERAL, codePoint, position);
    }

    static Token operator(Kind kind, int position) {
        assert kind != Kind.LITERAL;
        return new Token(kind, -1, position);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the literal code point; a supplementary one spans two chars of
     *         the source.
     * @throws IllegalStateException
     *             if this is not a {@link Kind#LITERAL} token.
     */
    public int codePoint() {
        if (kind != Kind.LITERAL) {
            throw new IllegalStateException("not a literal: " + this);
        }
        return codePoint;
    }

    /**
     * @return the literal symbol.
     * @throws IllegalStateException
     *             if this is not a {@link Kind#LITERAL} token, or if its code
     *             point is not a single char.
     */
    public char symbol() {
        final int cp = codePoint();
        if (!Character.isBmpCodePoint(cp)) {
            throw new IllegalStateException("surrogate pair literal: " + this);
        }
        return (char) cp;
    }

    public int position() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token that = (Token) o;
        return kind == that.kind
                && codePoint == that.codePoint
                && position == that.position;
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + codePoint) * 31 + position;
    }

    @Override
    public String toString() {
        String text = kind == Kind.LITERAL
                ? "'" + Misc.Esc.JAVA.esc(new String(Character.toChars(codePoint))) + "'"
                : kind.glyph;
        return kind + " " + text + " @" + position;
    }
}
