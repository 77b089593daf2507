package com.viffx.CompilerGen.Grammar;

import com.viffx.CompilerGen.Translation.EmissionPlan;
import com.viffx.CompilerGen.Translation.ProductionShape;

import java.util.*;

/**
 * A grammar ready for predictive translation, with its analysis tables.
 *
 * @param grammar     the rewritten grammar
 * @param first       FIRST set per symbol index; contains {@code EPSILON()} for nullable symbols
 * @param follow      FOLLOW set per nonterminal index
 * @param selectors   lookahead set per production index
 * @param predictions per nonterminal index, lookahead terminal to production index
 * @param shapes      per production index
 * @param plans       per production index
 */
public record NormalizedGrammar(
        Grammar grammar,
        Map<Integer, Set<Integer>> first,
        Map<Integer, Set<Integer>> follow,
        List<Set<Integer>> selectors,
        List<HashMap<Integer, Integer>> predictions,
        List<ProductionShape> shapes,
        List<EmissionPlan> plans
) {
    /**
     * Returns the production predicted for {@code nonTerminal} on {@code terminal}, or -1.
     */
    public int predict(int nonTerminal, int terminal) {
        Integer production = predictions.get(nonTerminal).get(terminal);
        return production == null ? -1 : production;
    }

    public boolean hasDeclarations() {
        return shapes.stream().anyMatch(shape -> shape instanceof ProductionShape.Declaration);
    }

    public boolean nullable(int symbol) {
        return first.get(symbol).contains(grammar.EPSILON());
    }

    // Name based views, used for diagnostics and tests

    public Set<String> first(String symbol) {
        return names(first.get(indexOf(symbol)));
    }

    public Set<String> follow(String nonTerminal) {
        return names(follow.get(indexOf(nonTerminal)));
    }

    /** Selector sets of {@code nonTerminal}'s alternatives, in order. */
    public List<Set<String>> selectors(String nonTerminal) {
        int nt = indexOf(nonTerminal);
        List<Set<String>> result = new ArrayList<>();
        grammar.forEachProduction(nt, index -> result.add(names(selectors.get(index))));
        return result;
    }

    /** Shapes of {@code nonTerminal}'s alternatives, in order. */
    public List<ProductionShape> shapes(String nonTerminal) {
        int nt = indexOf(nonTerminal);
        List<ProductionShape> result = new ArrayList<>();
        grammar.forEachProduction(nt, index -> result.add(shapes.get(index)));
        return result;
    }

    /** Union of the selector sets of {@code nonTerminal}, i.e. every token that can start it. */
    public Set<String> expected(int nonTerminal) {
        Set<String> expected = new TreeSet<>();
        grammar.forEachProduction(nonTerminal, index -> expected.addAll(names(selectors.get(index))));
        return expected;
    }

    public Set<String> names(Set<Integer> symbols) {
        Set<String> names = new TreeSet<>();
        for (int symbol : symbols) names.add(grammar.name(symbol) == null ? "EPSILON" : grammar.name(symbol));
        return names;
    }

    private int indexOf(String name) {
        int index = grammar.nonTerminal(name);
        if (index < 0) index = grammar.index(com.viffx.CompilerGen.Symbols.Terminal.of(name));
        if (index < 0) throw new IllegalArgumentException("Unknown symbol: " + name);
        return index;
    }

    /** FIRST, FOLLOW, selectors and plans, one production per line. */
    public String dump() {
        StringBuilder builder = new StringBuilder();
        grammar.forEachNonTerminal(nt -> {
            builder.append(grammar.symbol(nt))
                    .append("  FIRST=").append(names(first.get(nt)))
                    .append("  FOLLOW=").append(names(follow.get(nt)))
                    .append('\n');
            grammar.forEachProduction(nt, index -> builder.append("    ")
                    .append(grammar.toString(grammar.production(index)))
                    .append("  SELECT=").append(names(selectors.get(index)))
                    .append("  ").append(shapes.get(index))
                    .append('\n'));
        });
        return builder.toString();
    }
}
