/*
 * @LICENSE@
 */
package org.regviz.automata;

import static org.regviz.automata.Misc.LS;

import java.util.Stack;

import org.regviz.automata.AST.Visitor.TraversalOrder;

/**
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used in the construction of Abstract Syntax
 * Trees.
 * <p>
 * Trees are immutable and strictly owned: no node is shared between two
 * parents. The equals relation is structural.
 *
 * @author ndw
 */
public final class AST {

    private AST() {
    } // never instantiated

    public static abstract class Node {

        private Node() {
        }

        public final Node copy() {
            return new CopyVisitor().copy(this);
        }

        /**
         * An indented listing of the tree, one node per line. Operators are
         * shown as <code>&amp; | * + ?</code>, literals with their left to
         * right position among the literals.
         *
         * @return the listing.
         */
        public final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new AbstractTreePrinter() {
                private int nspace = 0;

                private void indent() {
                    for (int i = 0; i < nspace; ++i) {
                        sb.append(' ');
                    }
                }
                @Override
                void push() {
                    nspace += 4;
                }
                @Override
                void pop() {
                    nspace -= 4;
                }
                @Override
                void appendNonTerminal(String label) {
                    indent();
                    sb.append(label).append(LS);
                }
                @Override
                void appendTerminal(int position, String label) {
                    indent();
                    sb.append(label);
                    if (position >= 0) {
                        sb.append(' ')
                            .append('{')
                                .append(Integer.toString(position))
                            .append('}');
                    }
                    sb.append(LS);
                }
            }.print(Node.this);
            return sb.toString();
        }

        /*
         * pairwise walk with explicit stacks
         */
        @Override
        public final boolean equals(Object o) {
            if (!(o instanceof Node)) return false;
            final Stack<Node> lhs = new Stack<Node>();
            final Stack<Node> rhs = new Stack<Node>();
            lhs.push(this);
            rhs.push((Node) o);
            while (!lhs.isEmpty()) {
                final Node l = lhs.pop();
                final Node r = rhs.pop();
                if (l == r) continue;
                if (l.getClass() != r.getClass()) return false;
                if (l instanceof Terminal) {
                    if (((Terminal) l).symbol != ((Terminal) r).symbol) return false;
                } else if (l instanceof NonTerminal) {
                    final Node[] lkids = ((NonTerminal) l).children();
                    final Node[] rkids = ((NonTerminal) r).children();
                    for (int i = 0; i < lkids.length; ++i) {
                        lhs.push(lkids[i]);
                        rhs.push(rkids[i]);
                    }
                }
            }
            return true;
        }

        /*
         * over the node types and symbols in pre order, which determine the tree
         */
        @Override
        public final int hashCode() {
            return new Visitor(TraversalOrder.TOP_DOWN) {
                private int h = 1;

                @Override
                protected void enter(Node node) {
                    h = h * 31 + node.getClass().getName().hashCode();
                    if (node instanceof Terminal) {
                        h = h * 31 + ((Terminal) node).symbol;
                    }
                }

                int hash() {
                    visit(Node.this);
                    return h;
                }
            }.hash();
        }

        /**
         * The normalized regex for this tree, with only the parentheses the
         * grammar needs. Parsing the result yields an equal tree. Epsilon is
         * the empty string, so an epsilon nested inside a larger tree has no
         * textual form.
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();

                /*
                 * nodes still to render and text still to append, the next
                 * item on top
                 */
                private final Stack<Object> pending = new Stack<Object>();

                @Override
                public String toString() {
                    pending.push(Node.this);
                    while (!pending.isEmpty()) {
                        final Object item = pending.pop();
                        if (item instanceof Node) {
                            visit((Node) item);
                        } else {
                            sb.append(item);
                        }
                    }
                    return sb.toString();
                }

                @Override
                protected void visit(Cat node) {
                    later(node.second, node.second instanceof Binary);
                    later(node.first, node.first instanceof Alt);
                }

                @Override
                protected void visit(Alt node) {
                    later(node.second, node.second instanceof Alt);
                    pending.push("|");
                    pending.push(node.first);
                }

                @Override
                protected void visit(Star node) {
                    pending.push("*");
                    later(node.child, node.child instanceof Binary);
                }

                @Override
                protected void visit(Plus node) {
                    pending.push("+");
                    later(node.child, node.child instanceof Binary);
                }

                @Override
                protected void visit(Question node) {
                    pending.push("?");
                    later(node.child, node.child instanceof Binary);
                }

                @Override
                protected void visit(Terminal node) {
                    Misc.Esc.RXP.esc(sb, node.symbol);
                }

                private void later(Node child, boolean paren) {
                    if (paren) {
                        pending.push(")");
                    }
                    pending.push(child);
                    if (paren) {
                        pending.push("(");
                    }
                }
            }.toString();
        }
    }

    /**
     * Matches the empty string.
     */
    public static final class Epsilon extends Node {

        private Epsilon() {
        }
    }

    public static final class Terminal extends Node {

        final char symbol;

        private Terminal(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }
    }

    public static abstract class NonTerminal extends Node {

        private NonTerminal() {
        }

        abstract Node[] children();
    }

    public static abstract class Unary extends NonTerminal {

        final Node child;

        private Unary(Node child) {
            assert child != null;
            this.child = child;
        }

        public final Node child() {
            return child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    public static final class Star extends Unary {

        private Star(Node child) {
            super(child);
        }
    }

    /**
     * One or more.
     */
    public static final class Plus extends Unary {

        private Plus(Node child) {
            super(child);
        }
    }

    /**
     * Zero or one.
     */
    public static final class Question extends Unary {

        private Question(Node child) {
            super(child);
        }
    }

    public static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            assert first != null && second != null;
            this.first = first;
            this.second = second;
        }

        public final Node first() {
            return first;
        }

        public final Node second() {
            return second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    public static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
    }

    public static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
    }

    public static abstract class Visitor {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        private static final class Frame {
            final Node node;
            boolean expanded = false;

            Frame(Node node) {
                this.node = node;
            }
        }

        /**
         * Entry point. With {@link TraversalOrder#TOP_DOWN} or
         * {@link TraversalOrder#BOTTOM_UP} the whole subtree is walked, left to
         * right, with an explicit stack rather than recursion. With
         * {@link TraversalOrder#SUBCLASS_DEFINED} only <code>node</code>
         * itself is dispatched.
         */
        protected void visit(Node node) {
            if (order == TraversalOrder.SUBCLASS_DEFINED) {
                dispatch(node);
                return;
            }
            final Stack<Frame> stack = new Stack<Frame>();
            stack.push(new Frame(node));
            while (!stack.isEmpty()) {
                final Frame top = stack.peek();
                if (!top.expanded) {
                    top.expanded = true;
                    enter(top.node);
                    if (order == TraversalOrder.TOP_DOWN) {
                        dispatch(top.node);
                    }
                    if (top.node instanceof NonTerminal) {
                        final Node[] kids = ((NonTerminal) top.node).children();
                        for (int i = kids.length - 1; i >= 0; --i) {
                            stack.push(new Frame(kids[i]));
                        }
                    }
                } else {
                    stack.pop();
                    if (order == TraversalOrder.BOTTOM_UP) {
                        dispatch(top.node);
                    }
                    leave(top.node);
                }
            }
        }

        /**
         * Called on every walked node before its children; does nothing by
         * default.
         */
        protected void enter(Node node) {}

        /**
         * Called on every walked node after its children; does nothing by
         * default.
         */
        protected void leave(Node node) {}

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        private void dispatch(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Terminal) {
                visit((Terminal) node);
            } else if (node instanceof Epsilon) {
                visit((Epsilon) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Unary) {
                visit((Unary) node);
            } else {
                error(node);
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Unary node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else if (node instanceof Plus) {
                visit((Plus) node);
            } else if (node instanceof Question) {
                visit((Question) node);
            } else error(node);
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}

        protected void visit(Star node) {}
        protected void visit(Plus node) {}
        protected void visit(Question node) {}

        protected void visit(Terminal node) {}
        protected void visit(Epsilon node) {}

        private static void error(Node node) {
            assert false : "unknown node type " + node.getClass();
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        abstract void appendNonTerminal(String label);
        abstract void appendTerminal(int position, String label);
        abstract void push();
        abstract void pop();

        AbstractTreePrinter() {
            super(TraversalOrder.TOP_DOWN);
        }

        final void print(Node root) {
            position = 0;
            visit(root);
        }

        private int position = 0;

        @Override
        protected final void leave(Node node) {
            if (node instanceof NonTerminal) {
                pop();
            }
        }

        @Override
        protected final void visit(Cat node) {
            appendNonTerminal("&");
            push();
        }

        @Override
        protected final void visit(Alt node) {
            appendNonTerminal("|");
            push();
        }

        @Override
        protected final void visit(Plus node) {
            appendNonTerminal("+");
            push();
        }

        @Override
        protected final void visit(Question node) {
            appendNonTerminal("?");
            push();
        }

        @Override
        protected final void visit(Star node) {
            appendNonTerminal("*");
            push();
        }

        @Override
        protected final void visit(Terminal node) {
            appendTerminal(position++,
                "'" + Misc.Esc.JAVA.esc(node.symbol) + "'");
        }

        @Override
        protected final void visit(Epsilon node) {
            appendTerminal(-1, "ε");
        }
        /*
         * prevent subclasses from overriding
         */
        @Override
        protected final void visit(Node node) {
            super.visit(node);
        }
        @Override
        protected final void enter(Node node) {
        }
        @Override
        protected final void visit(NonTerminal node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Binary node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Unary node) {
            super.visit(node);
        }
    }

    static final class CopyVisitor extends Visitor {

        private final Stack<Node> kids = new Stack<Node>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        Node copy(Node root) {
            assert kids.isEmpty();
            visit(root);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Cat node) {
            Node second = kids.pop();
            kids.push(cat(kids.pop(), second));
        }
        @Override
        protected void visit(Alt node) {
            Node second = kids.pop();
            kids.push(alt(kids.pop(), second));
        }
        @Override
        protected void visit(Star node) {
            kids.push(star(kids.pop()));
        }
        @Override
        protected void visit(Plus node) {
            kids.push(plus(kids.pop()));
        }
        @Override
        protected void visit(Question node) {
            kids.push(question(kids.pop()));
        }
        @Override
        protected void visit(Terminal node) {
            kids.push(literal(node.symbol));
        }
        @Override
        protected void visit(Epsilon node) {
            kids.push(epsilon());
        }
    }

    /*
     * static factories of convenience for parser and testing
     */

    public static Epsilon epsilon() {
        return new Epsilon();
    }

    public static Terminal literal(char c) {
        return new Terminal(c);
    }

    /**
     * @return the concatenation of the chars of a non empty String.
     */
    public static Node literal(String s) {
        assert s.length() > 0;
        Node ret = literal(s.charAt(0));
        for (int i = 1; i < s.length(); ++i) {
            ret = cat(ret, literal(s.charAt(i)));
        }
        return ret;
    }

    public static Cat cat(Node first, Node second) {
        return new Cat(first, second);
    }

    public static Alt alt(Node first, Node second) {
        return new Alt(first, second);
    }

    public static Star star(Node child) {
        return new Star(child);
    }

    public static Plus plus(Node child) {
        return new Plus(child);
    }

    public static Question question(Node child) {
        return new Question(child);
    }
}
