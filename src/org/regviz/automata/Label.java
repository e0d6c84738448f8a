/*
 * @LICENSE@
 */

package org.regviz.automata;

/**
 * The label of a transition: either {@link #EPSILON}, which consumes no input,
 * or a single symbol. Epsilon is distinct from every symbol.
 */
public final class Label {

    public static final Label EPSILON = new Label(true, '\0');

    private final boolean epsilon;
    private final char symbol;

    private Label(boolean epsilon, char symbol) {
        this.epsilon = epsilon;
        this.symbol = symbol;
    }

    public static Label of(char symbol) {
        return new Label(false, symbol);
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    /**
     * @throws IllegalStateException
     *             for {@link #EPSILON}.
     */
    public char symbol() {
        if (epsilon) {
            throw new IllegalStateException("epsilon has no symbol");
        }
        return symbol;
    }

    boolean matches(char c) {
        return !epsilon && symbol == c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Label)) return false;
        Label that = (Label) o;
        return epsilon == that.epsilon && symbol == that.symbol;
    }

    @Override
    public int hashCode() {
        return epsilon ? -1 : symbol;
    }

    @Override
    public String toString() {
        return epsilon ? "ε" : Misc.Esc.JAVA.esc(symbol);
    }
}
