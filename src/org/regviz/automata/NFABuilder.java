/*
 * @LICENSE@
 */

package org.regviz.automata;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regviz.automata.AST.Alt;
import org.regviz.automata.AST.Cat;
import org.regviz.automata.AST.Epsilon;
import org.regviz.automata.AST.Node;
import org.regviz.automata.AST.Plus;
import org.regviz.automata.AST.Question;
import org.regviz.automata.AST.Star;
import org.regviz.automata.AST.Terminal;
import org.regviz.automata.AST.Visitor;
import org.regviz.automata.NFA.Arc;
import org.regviz.automata.NFA.Construct;
import org.regviz.automata.NFA.Region;

/**
 * Thompson construction. Each node becomes a fragment: an entry state and a
 * set of exit states, wired from fresh states and the fragments of its
 * children. The tree is walked bottom up, so children are always built before
 * the parent allocates its own states, and all ids come from one counter.
 */
final class NFABuilder extends Visitor {

    private static final Logger logger = Logger.getLogger("org.regviz.automata");
    private static final Level level = Level.FINER;

    private static final class Fragment {
        final int entry;
        final int[] exits;

        Fragment(int entry, int... exits) {
            this.entry = entry;
            this.exits = exits;
        }
    }

    private final List<List<Arc>> arcs = new ArrayList<List<Arc>>();
    private final Stack<Fragment> fragments = new Stack<Fragment>();
    private final List<Region> regions = new ArrayList<Region>();
    private final Stack<Integer> openRegions = new Stack<Integer>();
    private final Stack<Integer> openMarks = new Stack<Integer>();

    private NFABuilder() {
        super(TraversalOrder.BOTTOM_UP);
    }

    static NFA build(Node root) {
        NFABuilder builder = new NFABuilder();
        builder.visit(root);
        assert builder.fragments.size() == 1 && builder.openRegions.isEmpty();

        final Fragment f = builder.fragments.pop();
        final TreeSet<Integer> accepts = new TreeSet<Integer>();
        for (int exit : f.exits) {
            accepts.add(exit);
        }
        final NFA nfa = new NFA(builder.arcs, f.entry, accepts, builder.regions);
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + nfa.toString(), nfa);
        }
        return nfa;
    }

    private int newState() {
        arcs.add(new ArrayList<Arc>(2));
        return arcs.size() - 1;
    }

    private void wire(int from, Label label, int to) {
        arcs.get(from).add(new Arc(label, to));
    }

    private void epsilon(int[] froms, int to) {
        for (int from : froms) {
            wire(from, Label.EPSILON, to);
        }
    }

    /*
     * Region ids are handed out in pre order; the region is completed by
     * close() once the construct has built its states.
     */
    @Override
    protected void enter(Node node) {
        openRegions.push(regions.size());
        openMarks.push(arcs.size());
        regions.add(null);
    }

    private void close(Construct construct) {
        final int id = openRegions.pop();
        final int parent = openRegions.isEmpty() ? -1 : openRegions.peek();
        regions.set(id, new Region(id, construct, parent, openMarks.pop(), arcs.size()));
    }

    @Override
    protected void visit(Epsilon node) {
        final int s = newState();
        fragments.push(new Fragment(s, s));
        close(Construct.EPSILON);
    }

    @Override
    protected void visit(Terminal node) {
        final int entry = newState();
        final int exit = newState();
        wire(entry, Label.of(node.symbol), exit);
        fragments.push(new Fragment(entry, exit));
        close(Construct.LITERAL);
    }

    @Override
    protected void visit(Cat node) {
        final Fragment second = fragments.pop();
        final Fragment first = fragments.pop();
        epsilon(first.exits, second.entry);
        fragments.push(new Fragment(first.entry, second.exits));
        close(Construct.CONCATENATION);
    }

    @Override
    protected void visit(Alt node) {
        final Fragment second = fragments.pop();
        final Fragment first = fragments.pop();
        final int entry = newState();
        final int exit = newState();
        wire(entry, Label.EPSILON, first.entry);
        wire(entry, Label.EPSILON, second.entry);
        epsilon(first.exits, exit);
        epsilon(second.exits, exit);
        fragments.push(new Fragment(entry, exit));
        close(Construct.ALTERNATION);
    }

    @Override
    protected void visit(Star node) {
        repetition(Construct.STAR, true, true);
    }

    @Override
    protected void visit(Plus node) {
        repetition(Construct.PLUS, false, true);
    }

    @Override
    protected void visit(Question node) {
        repetition(Construct.OPTIONAL, true, false);
    }

    private void repetition(Construct construct, boolean bypass, boolean loop) {
        final Fragment inner = fragments.pop();
        final int entry = newState();
        final int exit = newState();
        wire(entry, Label.EPSILON, inner.entry);
        if (bypass) {
            wire(entry, Label.EPSILON, exit);
        }
        for (int e : inner.exits) {
            if (loop) {
                wire(e, Label.EPSILON, inner.entry);
            }
            wire(e, Label.EPSILON, exit);
        }
        fragments.push(new Fragment(entry, exit));
        close(construct);
    }
}
