package com.viffx.CompilerGen.Automata;

import com.viffx.CompilerGen.Automata.RegexNode.*;

import java.util.*;

/**
 * Thompson-construction NFA over the whole rule set. States live in an arena and are referred
 * to by index; state 0 is the synthetic start with an epsilon edge to each rule's fragment.
 */
public class Nfa {
    // ====== INSTANCE FIELDS ====== //
    private final List<State> states = new ArrayList<>();
    private final int start;

    // ====== CONSTRUCTORS ====== //
    private Nfa(List<RegexNode> patterns, List<String> tokenNames) {
        start = newState();
        for (int priority = 0; priority < patterns.size(); priority++) {
            Fragment fragment = build(patterns.get(priority));
            states.get(start).epsilon.add(fragment.start());
            for (int accept : fragment.accepts()) {
                State state = states.get(accept);
                state.token = tokenNames.get(priority);
                state.priority = priority;
            }
        }
    }

    /**
     * Builds the combined NFA. Pattern {@code i} is tagged with {@code tokenNames.get(i)} and priority {@code i}.
     */
    public static Nfa of(List<RegexNode> patterns, List<String> tokenNames) {
        if (patterns.size() != tokenNames.size()) {
            throw new IllegalArgumentException("expected one token name per pattern");
        }
        return new Nfa(patterns, tokenNames);
    }

    // ====== PUBLIC API ====== //
    public int start() {
        return start;
    }

    public int size() {
        return states.size();
    }

    /** Returns the token name a state accepts, or {@code null}. */
    public String token(int state) {
        return states.get(state).token;
    }

    /** Returns the declaration index of the rule a state accepts, or -1. */
    public int priority(int state) {
        return states.get(state).priority;
    }

    /** Every character that labels at least one edge, ascending. */
    public char[] alphabet() {
        TreeSet<Character> alphabet = new TreeSet<>();
        for (State state : states) alphabet.addAll(state.edges.keySet());
        char[] chars = new char[alphabet.size()];
        int i = 0;
        for (char c : alphabet) chars[i++] = c;
        return chars;
    }

    public Set<Integer> epsilonClosure(Collection<Integer> seeds) {
        Set<Integer> closure = new TreeSet<>(seeds);
        Deque<Integer> stack = new ArrayDeque<>(seeds);
        while (!stack.isEmpty()) {
            for (int next : states.get(stack.pop()).epsilon) {
                if (closure.add(next)) stack.push(next);
            }
        }
        return closure;
    }

    public Set<Integer> move(Set<Integer> from, char c) {
        Set<Integer> reached = new TreeSet<>();
        for (int state : from) {
            List<Integer> targets = states.get(state).edges.get(c);
            if (targets != null) reached.addAll(targets);
        }
        return reached;
    }

    // ====== THOMPSON CONSTRUCTION ====== //
    private record Fragment(int start, List<Integer> accepts) {}

    private Fragment build(RegexNode node) {
        if (node instanceof Literal literal) {
            int s = newState();
            int a = newState();
            edge(s, literal.c(), a);
            return new Fragment(s, List.of(a));
        }
        if (node instanceof CharClass charClass) {
            int s = newState();
            int a = newState();
            for (char c : charClass.members()) edge(s, c, a);
            return new Fragment(s, List.of(a));
        }
        if (node instanceof Empty) {
            int s = newState();
            return new Fragment(s, List.of(s));
        }
        if (node instanceof Concat concat) {
            Fragment left = build(concat.left());
            Fragment right = build(concat.right());
            for (int accept : left.accepts()) states.get(accept).epsilon.add(right.start());
            return new Fragment(left.start(), right.accepts());
        }
        if (node instanceof Alternate alternate) {
            int s = newState();
            Fragment left = build(alternate.left());
            Fragment right = build(alternate.right());
            states.get(s).epsilon.add(left.start());
            states.get(s).epsilon.add(right.start());
            List<Integer> accepts = new ArrayList<>(left.accepts());
            accepts.addAll(right.accepts());
            return new Fragment(s, accepts);
        }
        if (node instanceof Closure closure) {
            // the new start accepts on its own (bypass) and every inner accept loops back to it
            int s = newState();
            Fragment inner = build(closure.inner());
            states.get(s).epsilon.add(inner.start());
            for (int accept : inner.accepts()) states.get(accept).epsilon.add(s);
            return new Fragment(s, List.of(s));
        }
        throw new IllegalArgumentException("Unknown regex node: " + node);
    }

    private int newState() {
        states.add(new State());
        return states.size() - 1;
    }

    private void edge(int from, char c, int to) {
        states.get(from).edges.computeIfAbsent(c, k -> new ArrayList<>()).add(to);
    }

    private static final class State {
        private final List<Integer> epsilon = new ArrayList<>();
        private final Map<Character, List<Integer>> edges = new HashMap<>();
        private String token = null;
        private int priority = -1;
    }
}
