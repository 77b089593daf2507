package com.viffx.CompilerGen.Grammar;

import com.viffx.CompilerGen.Symbols.NonTerminal;
import com.viffx.CompilerGen.Symbols.Symbol;
import com.viffx.CompilerGen.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable context-free grammar with every symbol interned to an integer index.
 * <p>
 * Productions of one nonterminal are stored contiguously; {@link #productionRanges(int)} gives
 * the {@code [from, to)} range of a nonterminal's production indexes, in declaration order.
 */
public class Grammar {
    // ====== INSTANCE FIELDS ====== //
    // Symbols fields
    private final Symbol[] symbols;
    private final Map<Symbol, Integer> indexes = new HashMap<>();
    private final boolean[] isNonTerminal;
    private final int[] nonTerminals;
    private final int EPSILON;
    private final int EOF;
    private final int START;

    // Productions fields
    private final List<int[]> productionRanges = new ArrayList<>();
    private final List<Production> productions = new ArrayList<>();

    // ====== CONSTRUCTORS ====== //
    private Grammar(LinkedHashMap<NonTerminal, List<List<Symbol>>> rules, NonTerminal start) {
        if (rules.isEmpty()) throw new IllegalArgumentException("The grammar has no rules");
        if (!rules.containsKey(start)) throw new IllegalArgumentException("The start symbol " + start + " is not defined");

        // register the nonterminals first so that each one is interned with its defining instance
        LinkedHashMap<Symbol, Integer> symbolsMap = new LinkedHashMap<>();
        for (NonTerminal nonTerminal : rules.keySet()) {
            symbolsMap.put(nonTerminal, symbolsMap.size());
        }
        checkForUndefinedNonTerminals(rules);
        for (List<List<Symbol>> alternatives : rules.values()) {
            for (List<Symbol> alternative : alternatives) {
                for (Symbol symbol : alternative) {
                    if (!Terminal.EPSILON.equals(symbol)) symbolsMap.putIfAbsent(symbol, symbolsMap.size());
                }
            }
        }
        EPSILON = symbolsMap.computeIfAbsent(Terminal.EPSILON, s -> symbolsMap.size());
        EOF = symbolsMap.computeIfAbsent(Terminal.EOF, s -> symbolsMap.size());

        symbols = new Symbol[symbolsMap.size()];
        isNonTerminal = new boolean[symbolsMap.size()];
        for (Map.Entry<Symbol, Integer> entry : symbolsMap.entrySet()) {
            int index = entry.getValue();
            symbols[index] = entry.getKey();
            isNonTerminal[index] = entry.getKey() instanceof NonTerminal;
            indexes.put(entry.getKey(), index);
        }
        nonTerminals = new int[rules.size()];
        for (int i = 0; i < nonTerminals.length; i++) nonTerminals[i] = i;
        START = symbolsMap.get(start);

        // intern the productions, dropping explicit epsilons
        for (int symbol = 0; symbol < symbols.length; symbol++) {
            if (!isNonTerminal[symbol]) {
                productionRanges.add(new int[0]);
                continue;
            }
            List<List<Symbol>> alternatives = rules.get((NonTerminal) symbols[symbol]);
            if (alternatives.isEmpty()) throw new IllegalArgumentException("The nonterminal " + symbols[symbol] + " has no alternatives");

            int from = productions.size();
            for (List<Symbol> alternative : alternatives) {
                Production production = new Production(symbol);
                for (Symbol s : alternative) {
                    if (!Terminal.EPSILON.equals(s)) production.add(indexes.get(s));
                }
                productions.add(production);
            }
            productionRanges.add(new int[]{from, productions.size()});
        }
    }

    /**
     * Builds a grammar from user rules.
     *
     * @param rules nonterminal name to ordered alternatives; an empty alternative derives ε
     * @param start the start nonterminal's name
     * @throws IllegalArgumentException if the rules are empty, the start symbol is not defined,
     *                                  a nonterminal has no alternatives or an undefined nonterminal is referenced
     */
    @NotNull
    @Contract("_, _ -> new")
    public static Grammar of(@NotNull Map<String, List<List<Symbol>>> rules, @NotNull String start) {
        LinkedHashMap<NonTerminal, List<List<Symbol>>> declared = new LinkedHashMap<>();
        rules.forEach((name, alternatives) -> declared.put(new NonTerminal(name), alternatives));
        return new Grammar(declared, new NonTerminal(start));
    }

    static Grammar of(LinkedHashMap<NonTerminal, List<List<Symbol>>> rules, NonTerminal start) {
        return new Grammar(rules, start);
    }

    // ====== PUBLIC API ====== //

    // Productions

    /**
     * Returns a string representation of the given {@link Production}, in the form
     * <pre>
     *   A > B 'c';
     * </pre>
     * An empty production renders as {@code A > EPSILON();}.
     */
    public String toString(Production production) {
        StringBuilder builder = new StringBuilder();
        builder.append(symbols[production.lhs()]);
        builder.append(" > ");

        if (production.isEmpty()) {
            builder.append("EPSILON();");
            return builder.toString();
        }

        for (int i = 0; i < production.size(); i++) {
            builder.append(symbols[production.get(i)]);
            if (i + 1 < production.size()) builder.append(" ");
        }
        builder.append(";");
        return builder.toString();
    }

    // Grammar - Symbol Access

    public Symbol symbol(int symbol) {
        return symbols[symbol];
    }

    /**
     * Returns the index of {@code symbol}, or -1 if the grammar does not use it.
     */
    public int index(Symbol symbol) {
        Integer index = indexes.get(symbol);
        return index == null ? -1 : index;
    }

    /**
     * Returns the index of the nonterminal named {@code name}, or -1.
     */
    public int nonTerminal(String name) {
        return index(new NonTerminal(name));
    }

    public boolean isNonTerminal(int symbol) {
        return isNonTerminal[symbol];
    }

    public NonTerminal.Kind kind(int nonTerminal) {
        return ((NonTerminal) symbols[nonTerminal]).kind();
    }

    /** Returns the symbol's name: the nonterminal name or the terminal's token type. */
    public String name(int symbol) {
        return symbols[symbol].value();
    }

    public int symbolsSize() {
        return symbols.length;
    }

    public void forEachNonTerminal(Consumer<Integer> consumer) {
        for (int nonTerminal : nonTerminals) {
            consumer.accept(nonTerminal);
        }
    }

    // Grammar - Production Access

    public Production production(int production) {
        return productions.get(production);
    }

    public int productionsSize() {
        return productions.size();
    }

    public void forEachProduction(Consumer<Production> consumer) {
        productions.forEach(consumer);
    }

    /**
     * Applies the given {@link Consumer} to each production index of {@code nonTerminal}.
     */
    public void forEachProduction(int nonTerminal, Consumer<Integer> consumer) {
        int[] data = productionRanges.get(nonTerminal);
        for (int i = data[0]; i < data[1]; i++) {
            consumer.accept(i);
        }
    }

    /**
     * Returns {@code [from, to)} production indexes of {@code nonTerminal}.
     */
    public int[] productionRanges(int nonTerminal) {
        return productionRanges.get(nonTerminal);
    }

    /**
     * Converts the grammar back into editable rules, nonterminals in index order.
     */
    public LinkedHashMap<NonTerminal, List<List<Symbol>>> rules() {
        LinkedHashMap<NonTerminal, List<List<Symbol>>> rules = new LinkedHashMap<>();
        for (int nonTerminal : nonTerminals) {
            List<List<Symbol>> alternatives = new ArrayList<>();
            forEachProduction(nonTerminal, index -> {
                List<Symbol> alternative = new ArrayList<>();
                for (int symbol : productions.get(index)) alternative.add(symbols[symbol]);
                alternatives.add(alternative);
            });
            rules.put((NonTerminal) symbols[nonTerminal], alternatives);
        }
        return rules;
    }

    // Grammar - Special Symbols

    public int EPSILON() {
        return EPSILON;
    }

    public int EOF() {
        return EOF;
    }

    public int START() {
        return START;
    }

    // ====== VALIDATION ====== //
    private static void checkForUndefinedNonTerminals(LinkedHashMap<NonTerminal, List<List<Symbol>>> rules) {
        Set<String> undefined = new TreeSet<>();
        for (List<List<Symbol>> alternatives : rules.values()) {
            for (List<Symbol> alternative : alternatives) {
                for (Symbol symbol : alternative) {
                    if (symbol instanceof NonTerminal && !rules.containsKey(symbol)) undefined.add(symbol.value());
                }
            }
        }
        if (!undefined.isEmpty())
            throw new IllegalArgumentException("\n\tThe following nonTerminals are undefined in the input grammar: \n\t\t" + String.join("\n\t\t", undefined));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Production production : productions) {
            builder.append(toString(production)).append('\n');
        }
        return builder.toString();
    }
}
