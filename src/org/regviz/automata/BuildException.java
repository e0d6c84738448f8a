/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a regular expression cannot be compiled. Subclasses carry the
 * structured reason; the {@linkplain #getIndex() index} is the char offset of
 * the offending character or token, and {@link #getMessage()} renders the
 * usual caret diagnostic.
 */
public abstract class BuildException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    BuildException(String description, String regex, int index) {
        super(description, regex, index);
    }

    /**
     * @return the error kind of the concrete subclass.
     */
    public abstract Enum<?> getKind();
}
