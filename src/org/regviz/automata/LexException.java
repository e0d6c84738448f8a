/*
 * @LICENSE@
 */

package org.regviz.automata;

/**
 * A lexical error: the first invalid position of the source text.
 */
public final class LexException extends BuildException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** A backslash with nothing after it. */
        DANGLING_ESCAPE,
        /** Whitespace or a control character outside of an escape. */
        INVALID_CHARACTER;
    }

    private final Kind kind;
    private final char character;

    LexException(Kind kind, String regex, int index, char character) {
        super(describe(kind, character), regex, index);
        this.kind = kind;
        this.character = character;
    }

    private static String describe(Kind kind, char c) {
        switch (kind) {
        case DANGLING_ESCAPE:
            return "dangling escape";
        case INVALID_CHARACTER:
            return "invalid character '" + Misc.Esc.JAVA.esc(c) + "'";
        default:
            throw new AssertionError(kind);
        }
    }

    @Override
    public Kind getKind() {
        return kind;
    }

    /**
     * @return the offending character; the backslash for a dangling escape.
     */
    public char getCharacter() {
        return character;
    }
}
