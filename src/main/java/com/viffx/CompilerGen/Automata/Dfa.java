package com.viffx.CompilerGen.Automata;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Combined deterministic automaton produced by subset construction.
 * State 0 is the start state; a missing transition is -1.
 */
public class Dfa {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    // ====== INSTANCE FIELDS ====== //
    private final char[] alphabet;
    private final Map<Character, Integer> columns = new HashMap<>();
    private final int[][] transitions;
    private final String[] accepting;
    private final List<Set<Integer>> nfaStates;

    // ====== CONSTRUCTORS ====== //
    private Dfa(char[] alphabet, int[][] transitions, String[] accepting, List<Set<Integer>> nfaStates) {
        this.alphabet = alphabet;
        this.transitions = transitions;
        this.accepting = accepting;
        this.nfaStates = nfaStates;
        for (int i = 0; i < alphabet.length; i++) columns.put(alphabet[i], i);
    }

    /**
     * Runs subset construction over {@code nfa}. A DFA state that contains accepting NFA states of
     * several rules accepts the token of the rule with the lowest declaration index.
     *
     * @param nfa       the combined NFA
     * @param maxStates upper bound on the number of DFA states
     * @return the deterministic automaton
     * @throws IllegalStateException if more than {@code maxStates} states would be created
     */
    public static Dfa construct(Nfa nfa, int maxStates) {
        char[] alphabet = nfa.alphabet();
        Map<Set<Integer>, Integer> stateToId = new LinkedHashMap<>();
        List<int[]> rows = new ArrayList<>();
        Queue<Set<Integer>> queue = new ArrayDeque<>();

        Set<Integer> initial = nfa.epsilonClosure(List.of(nfa.start()));
        stateToId.put(initial, 0);
        queue.add(initial);

        while (!queue.isEmpty()) {
            Set<Integer> state = queue.poll();
            int[] row = new int[alphabet.length];
            Arrays.fill(row, -1);

            for (int i = 0; i < alphabet.length; i++) {
                Set<Integer> moved = nfa.move(state, alphabet[i]);
                if (moved.isEmpty()) continue;
                Set<Integer> target = nfa.epsilonClosure(moved);

                Integer id = stateToId.get(target);
                if (id == null) {
                    if (stateToId.size() >= maxStates) {
                        throw new IllegalStateException("DFA construction exceeded " + maxStates + " states");
                    }
                    id = stateToId.size();
                    stateToId.put(target, id);
                    queue.add(target);
                }
                row[i] = id;
            }
            rows.add(row);
        }

        List<Set<Integer>> nfaStates = new ArrayList<>(stateToId.keySet());
        String[] accepting = new String[nfaStates.size()];
        for (int id = 0; id < nfaStates.size(); id++) {
            accepting[id] = resolve(nfa, nfaStates.get(id));
        }

        Dfa dfa = new Dfa(alphabet, rows.toArray(new int[0][]), accepting, nfaStates);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Subset construction: " + nfa.size() + " NFA states -> " + dfa.size() +
                    " DFA states over " + alphabet.length + " symbols");
        }
        return dfa;
    }

    private static String resolve(Nfa nfa, Set<Integer> states) {
        String token = null;
        int best = Integer.MAX_VALUE;
        for (int state : states) {
            int priority = nfa.priority(state);
            if (priority >= 0 && priority < best) {
                best = priority;
                token = nfa.token(state);
            }
        }
        return token;
    }

    // ====== PUBLIC API ====== //
    public int start() {
        return 0;
    }

    public int size() {
        return transitions.length;
    }

    /** Returns the next state on {@code c}, or -1 when there is no transition. */
    public int next(int state, char c) {
        Integer column = columns.get(c);
        if (column == null) return -1;
        return transitions[state][column];
    }

    /** Returns the token type accepted in {@code state}, or {@code null}. */
    public String accepting(int state) {
        return accepting[state];
    }

    /** Returns the NFA states a DFA state stands for. */
    public Set<Integer> nfaStates(int state) {
        return Collections.unmodifiableSet(nfaStates.get(state));
    }

    /**
     * Runs the whole input through the automaton.
     *
     * @return the accepted token type, or {@code null} if the input is rejected
     */
    public String match(String input) {
        int state = start();
        for (int i = 0; i < input.length(); i++) {
            state = next(state, input.charAt(i));
            if (state < 0) return null;
        }
        return accepting(state);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int state = 0; state < transitions.length; state++) {
            builder.append(state);
            if (accepting[state] != null) builder.append(" [").append(accepting[state]).append("]");
            builder.append(':');
            for (int i = 0; i < alphabet.length; i++) {
                int target = transitions[state][i];
                if (target < 0) continue;
                builder.append(' ').append(printable(alphabet[i])).append("->").append(target);
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    private static String printable(char c) {
        if (c == '\n') return "\\n";
        if (c == '\t') return "\\t";
        if (c == '\r') return "\\r";
        if (c == ' ') return "' '";
        return String.valueOf(c);
    }
}
