package com.viffx.CompilerGen.Grammar;

import com.viffx.CompilerGen.Errors.GrammarConflictException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.NonTerminal;
import com.viffx.CompilerGen.Symbols.Symbol;
import com.viffx.CompilerGen.Translation.EmissionPlan;
import com.viffx.CompilerGen.Translation.ProductionShape;
import com.viffx.CompilerGen.Translation.ShapeClassifier;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites a grammar into LL(1) form and computes the tables the predictive translator needs.
 * <ol>
 *   <li>immediate left recursion {@code A > A α | β} becomes {@code A > β A_TAIL; A_TAIL > α A_TAIL | EPSILON();}</li>
 *   <li>alternatives sharing a prefix are left factored into {@code A_LF_k} tails (optional)</li>
 *   <li>FIRST and FOLLOW are computed to a fixed point</li>
 *   <li>every alternative gets a selector set, and overlapping selectors are reported as conflicts</li>
 *   <li>every alternative gets a production shape and an emission plan</li>
 * </ol>
 */
public class GrammarNormalizer {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    private final GeneratorConfig config;

    public GrammarNormalizer(@NotNull GeneratorConfig config) {
        this.config = config;
    }

    /**
     * @throws GrammarConflictException if two alternatives of a nonterminal share a lookahead token
     * @throws IllegalArgumentException if a nonterminal is left recursive without a base
     *                                  alternative, derives no terminal string, or was left
     *                                  factored inside code a loop or guard must emit first
     */
    @NotNull
    public NormalizedGrammar normalize(@NotNull Grammar grammar) throws GrammarConflictException {
        LinkedHashMap<NonTerminal, List<List<Symbol>>> rules = grammar.rules();
        NonTerminal start = (NonTerminal) grammar.symbol(grammar.START());

        rules = eliminateLeftRecursion(rules);
        if (config.leftFactoring()) rules = leftFactor(rules);
        Grammar normalized = Grammar.of(rules, start);

        Map<Integer, Set<Integer>> first = computeFirst(normalized);
        checkProductive(normalized, first);
        Map<Integer, Set<Integer>> follow = computeFollow(normalized, first);
        List<Set<Integer>> selectors = computeSelectors(normalized, first, follow);
        List<HashMap<Integer, Integer>> predictions = buildPredictions(normalized, selectors);

        ShapeClassifier classifier = new ShapeClassifier(normalized, config);
        List<ProductionShape> shapes = new ArrayList<>();
        List<EmissionPlan> plans = new ArrayList<>();
        for (int i = 0; i < normalized.productionsSize(); i++) {
            ProductionShape shape = classifier.classify(i);
            shapes.add(shape);
            plans.add(EmissionPlan.of(shape, classifier.planSymbols(i, shape), config));
        }

        NormalizedGrammar result = new NormalizedGrammar(normalized, first, follow, selectors, predictions, shapes, plans);
        if (logger.isLoggable(Level.FINE)) logger.fine("Normalized grammar:\n" + result.dump());
        return result;
    }

    // ====== LEFT RECURSION ====== //
    private LinkedHashMap<NonTerminal, List<List<Symbol>>> eliminateLeftRecursion(LinkedHashMap<NonTerminal, List<List<Symbol>>> rules) {
        LinkedHashMap<NonTerminal, List<List<Symbol>>> result = new LinkedHashMap<>();
        Set<String> names = names(rules);

        for (Map.Entry<NonTerminal, List<List<Symbol>>> entry : rules.entrySet()) {
            NonTerminal a = entry.getKey();
            List<List<Symbol>> recursive = new ArrayList<>();
            List<List<Symbol>> base = new ArrayList<>();
            for (List<Symbol> alternative : entry.getValue()) {
                if (!alternative.isEmpty() && alternative.get(0).equals(a)) recursive.add(alternative);
                else base.add(alternative);
            }
            if (recursive.isEmpty()) {
                result.put(a, entry.getValue());
                continue;
            }
            if (base.isEmpty()) {
                throw new IllegalArgumentException("The nonterminal " + a + " is left recursive but has no non-recursive alternative");
            }

            NonTerminal tail = new NonTerminal(unique(a.value() + "_TAIL", names), NonTerminal.Kind.RECURSION_TAIL, null);
            List<List<Symbol>> alternatives = new ArrayList<>();
            for (List<Symbol> beta : base) {
                List<Symbol> alternative = new ArrayList<>(beta);
                alternative.add(tail);
                alternatives.add(alternative);
            }
            List<List<Symbol>> tailAlternatives = new ArrayList<>();
            for (List<Symbol> recursion : recursive) {
                List<Symbol> alpha = recursion.subList(1, recursion.size());
                if (alpha.isEmpty()) {
                    logger.warning("Dropping the cyclic alternative " + a + " > " + a + ";");
                    continue;
                }
                if (alpha.contains(a)) {
                    logger.warning("Left recursive alternative " + a + " > " + join(recursion) + "; refers to " + a +
                            " again; only the adjacent repetition is folded");
                }
                List<Symbol> alternative = new ArrayList<>(alpha);
                alternative.add(tail);
                tailAlternatives.add(alternative);
            }
            tailAlternatives.add(new ArrayList<>());

            result.put(a, alternatives);
            result.put(tail, tailAlternatives);
            if (logger.isLoggable(Level.FINE)) logger.fine("Eliminated left recursion of " + a + " through " + tail);
        }
        return result;
    }

    // ====== LEFT FACTORING ====== //
    private LinkedHashMap<NonTerminal, List<List<Symbol>>> leftFactor(LinkedHashMap<NonTerminal, List<List<Symbol>>> rules) {
        Set<String> names = names(rules);
        boolean change;
        do {
            change = false;
            LinkedHashMap<NonTerminal, List<List<Symbol>>> result = new LinkedHashMap<>();
            for (Map.Entry<NonTerminal, List<List<Symbol>>> entry : rules.entrySet()) {
                NonTerminal a = entry.getKey();
                List<List<Symbol>> alternatives = entry.getValue();
                List<Integer> group = firstSharedGroup(alternatives);
                if (change || group == null) {
                    result.put(a, alternatives);
                    continue;
                }
                change = true;

                List<Symbol> prefix = commonPrefix(alternatives, group);
                NonTerminal tail = new NonTerminal(unique(a.value() + "_LF_1", names), NonTerminal.Kind.FACTOR_TAIL, prefix);

                List<List<Symbol>> factored = new ArrayList<>();
                List<List<Symbol>> tailAlternatives = new ArrayList<>();
                for (int i = 0; i < alternatives.size(); i++) {
                    if (!group.contains(i)) {
                        factored.add(alternatives.get(i));
                        continue;
                    }
                    List<Symbol> alternative = alternatives.get(i);
                    tailAlternatives.add(new ArrayList<>(alternative.subList(prefix.size(), alternative.size())));
                    if (i == group.get(0)) {
                        List<Symbol> replacement = new ArrayList<>(prefix);
                        replacement.add(tail);
                        factored.add(replacement);
                    }
                }
                result.put(a, factored);
                result.put(tail, tailAlternatives);
                if (logger.isLoggable(Level.FINE)) logger.fine("Left factored " + join(prefix) + " out of " + a + " into " + tail);
            }
            rules = result;
        } while (change);
        return rules;
    }

    // indexes of the first set of two or more alternatives that start with the same symbol
    private static List<Integer> firstSharedGroup(List<List<Symbol>> alternatives) {
        Map<Symbol, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < alternatives.size(); i++) {
            List<Symbol> alternative = alternatives.get(i);
            if (alternative.isEmpty()) continue;
            groups.computeIfAbsent(alternative.get(0), s -> new ArrayList<>()).add(i);
        }
        for (List<Integer> group : groups.values()) {
            if (group.size() > 1) return group;
        }
        return null;
    }

    private static List<Symbol> commonPrefix(List<List<Symbol>> alternatives, List<Integer> group) {
        List<Symbol> prefix = new ArrayList<>(alternatives.get(group.get(0)));
        for (int i : group) {
            List<Symbol> alternative = alternatives.get(i);
            int length = 0;
            while (length < prefix.size() && length < alternative.size() && prefix.get(length).equals(alternative.get(length))) {
                length++;
            }
            prefix = new ArrayList<>(prefix.subList(0, length));
        }
        return prefix;
    }

    // ====== FIRST / FOLLOW ====== //
    private Map<Integer, Set<Integer>> computeFirst(Grammar grammar) {
        Map<Integer, Set<Integer>> first = new HashMap<>();
        for (int symbol = 0; symbol < grammar.symbolsSize(); symbol++) {
            Set<Integer> set = new HashSet<>();
            if (!grammar.isNonTerminal(symbol)) set.add(symbol);
            first.put(symbol, set);
        }

        boolean change;
        do {
            change = false;
            for (int i = 0; i < grammar.productionsSize(); i++) {
                Production production = grammar.production(i);
                change |= first.get(production.lhs()).addAll(firstOf(grammar, first, production));
            }
        } while (change);
        return first;
    }

    /**
     * FIRST of a symbol sequence; contains {@code EPSILON()} if every symbol is nullable.
     */
    static Set<Integer> firstOf(Grammar grammar, Map<Integer, Set<Integer>> first, List<Integer> sequence) {
        Set<Integer> result = new HashSet<>();
        for (int symbol : sequence) {
            Set<Integer> symbolFirst = first.get(symbol);
            for (int terminal : symbolFirst) {
                if (terminal != grammar.EPSILON()) result.add(terminal);
            }
            if (!symbolFirst.contains(grammar.EPSILON())) return result;
        }
        result.add(grammar.EPSILON());
        return result;
    }

    private void checkProductive(Grammar grammar, Map<Integer, Set<Integer>> first) {
        List<String> unproductive = new ArrayList<>();
        grammar.forEachNonTerminal(nt -> {
            if (first.get(nt).isEmpty()) unproductive.add(grammar.name(nt));
        });
        if (!unproductive.isEmpty()) {
            throw new IllegalArgumentException("The following nonTerminals derive no terminal string: " + unproductive);
        }
    }

    private Map<Integer, Set<Integer>> computeFollow(Grammar grammar, Map<Integer, Set<Integer>> first) {
        Map<Integer, Set<Integer>> follow = new HashMap<>();
        grammar.forEachNonTerminal(nt -> follow.put(nt, new HashSet<>()));
        follow.get(grammar.START()).add(grammar.EOF());

        boolean change;
        do {
            change = false;
            for (int i = 0; i < grammar.productionsSize(); i++) {
                Production production = grammar.production(i);
                for (int dot = 0; dot < production.size(); dot++) {
                    int symbol = production.get(dot);
                    if (!grammar.isNonTerminal(symbol)) continue;

                    Set<Integer> rest = firstOf(grammar, first, production.beta(dot));
                    Set<Integer> target = follow.get(symbol);
                    for (int terminal : rest) {
                        if (terminal != grammar.EPSILON()) change |= target.add(terminal);
                    }
                    if (rest.contains(grammar.EPSILON())) change |= target.addAll(follow.get(production.lhs()));
                }
            }
        } while (change);
        return follow;
    }

    private List<Set<Integer>> computeSelectors(Grammar grammar, Map<Integer, Set<Integer>> first, Map<Integer, Set<Integer>> follow) {
        List<Set<Integer>> selectors = new ArrayList<>();
        for (int i = 0; i < grammar.productionsSize(); i++) {
            Production production = grammar.production(i);
            Set<Integer> sequence = firstOf(grammar, first, production);
            Set<Integer> selector = new HashSet<>(sequence);
            selector.remove(grammar.EPSILON());
            if (sequence.contains(grammar.EPSILON())) selector.addAll(follow.get(production.lhs()));
            selectors.add(selector);
        }
        return selectors;
    }

    // ====== PREDICTION TABLE ====== //
    private List<HashMap<Integer, Integer>> buildPredictions(Grammar grammar, List<Set<Integer>> selectors) throws GrammarConflictException {
        List<HashMap<Integer, Integer>> predictions = new ArrayList<>();
        for (int symbol = 0; symbol < grammar.symbolsSize(); symbol++) predictions.add(new HashMap<>());

        for (int nt = 0; nt < grammar.symbolsSize(); nt++) {
            if (!grammar.isNonTerminal(nt)) continue;
            HashMap<Integer, Integer> row = predictions.get(nt);
            int[] range = grammar.productionRanges(nt);
            for (int i = range[0]; i < range[1]; i++) {
                List<Integer> lookaheads = new ArrayList<>(selectors.get(i));
                lookaheads.sort(Comparator.comparing(grammar::name));
                for (int terminal : lookaheads) {
                    Integer existing = row.putIfAbsent(terminal, i);
                    if (existing != null) {
                        throw new GrammarConflictException(grammar.name(nt), grammar.name(terminal),
                                grammar.toString(grammar.production(existing)),
                                grammar.toString(grammar.production(i)));
                    }
                }
            }
        }
        return predictions;
    }

    // ====== HELPERS ====== //
    private static Set<String> names(Map<NonTerminal, ?> rules) {
        Set<String> names = new HashSet<>();
        for (NonTerminal nt : rules.keySet()) names.add(nt.value());
        return names;
    }

    // registers and returns name, or name with a numeric suffix bumped until it is free
    private static String unique(String name, Set<String> names) {
        String candidate = name;
        int k = 1;
        while (names.contains(candidate)) {
            k++;
            candidate = name.endsWith("_1") ? name.substring(0, name.length() - 1) + k : name + k;
        }
        names.add(candidate);
        return candidate;
    }

    private static String join(List<Symbol> symbols) {
        StringJoiner joiner = new StringJoiner(" ");
        for (Symbol symbol : symbols) joiner.add(symbol.toString());
        return joiner.toString();
    }
}
