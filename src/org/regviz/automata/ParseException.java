/*
 * @LICENSE@
 */

package org.regviz.automata;

/**
 * A syntax error found by the parser, positioned at the offending token.
 */
public final class ParseException extends BuildException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNEXPECTED_EOF("unexpected end of pattern"),
        UNEXPECTED_PREFIX_OPERATOR("operator without operand"),
        MISMATCHED_LEFT_PAREN("unclosed parenthesis"),
        RIGHT_PAREN_WITHOUT_LEFT("unbalanced parenthesis"),
        EMPTY_PARENTHESES("empty parentheses");

        final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    private final Kind kind;

    ParseException(Kind kind, String regex, int index) {
        super(kind.description, regex, index);
        this.kind = kind;
    }

    @Override
    public Kind getKind() {
        return kind;
    }
}
