package com.viffx.CompilerGen.Translation;

import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Grammar.Grammar;
import com.viffx.CompilerGen.Grammar.Production;
import com.viffx.CompilerGen.Symbols.NonTerminal;
import com.viffx.CompilerGen.Symbols.Symbol;
import com.viffx.CompilerGen.Symbols.Terminal;
import com.viffx.CompilerGen.Translation.ProductionShape.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Derives a {@link ProductionShape} for every alternative from the kinds and positions of its
 * symbols, never from nonterminal names. Token types only matter through the sets named in
 * {@link GeneratorConfig}.
 */
public class ShapeClassifier {
    private final Grammar grammar;
    private final GeneratorConfig config;
    private final boolean[] operatorNonTerminal;
    private final boolean[] foldTail;
    private final int[] owner;
    private final ProductionShape[] shapes;

    public ShapeClassifier(Grammar grammar, GeneratorConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.operatorNonTerminal = new boolean[grammar.symbolsSize()];
        this.foldTail = new boolean[grammar.symbolsSize()];
        this.owner = new int[grammar.symbolsSize()];
        this.shapes = new ProductionShape[grammar.productionsSize()];
        grammar.forEachNonTerminal(nt -> operatorNonTerminal[nt] = allSingleOperators(nt));
        grammar.forEachNonTerminal(nt -> foldTail[nt] = isFoldTail(nt));

        // every factored tail ends exactly one alternative, the one it was split from
        Arrays.fill(owner, -1);
        for (int i = 0; i < grammar.productionsSize(); i++) {
            Production p = grammar.production(i);
            if (p.isEmpty()) continue;
            int last = p.get(p.size() - 1);
            if (grammar.isNonTerminal(last) && grammar.kind(last) == NonTerminal.Kind.FACTOR_TAIL) owner[last] = i;
        }
    }

    /**
     * @throws IllegalArgumentException if left factoring split an alternative inside the code its
     *                                  guard must emit first, so no plan can translate it
     */
    public ProductionShape classify(int production) {
        if (shapes[production] == null) shapes[production] = classifyProduction(production);
        return shapes[production];
    }

    /**
     * Returns the alternative's symbols as the plan builder sees them: a recombined factored
     * alternative is prefixed with the symbols it inherits.
     */
    public List<Symbol> planSymbols(int production, ProductionShape shape) {
        Production p = grammar.production(production);
        List<Symbol> symbols = new ArrayList<>();
        if (shape instanceof Recombined) symbols.addAll(sharedPrefix(p.lhs()));
        symbols.addAll(symbols(p));
        return symbols;
    }

    private ProductionShape classifyProduction(int production) {
        Production p = grammar.production(production);
        List<Symbol> symbols = symbols(p);
        if (grammar.kind(p.lhs()) != NonTerminal.Kind.FACTOR_TAIL || closesGuard(p.lhs())) {
            return foldTail[p.lhs()] ? classifyInTail(symbols) : classify(symbols);
        }

        // classified as the alternative it was factored out of
        List<Symbol> whole = sharedPrefix(p.lhs());
        int prefixLength = whole.size();
        whole.addAll(symbols);
        ProductionShape shape = foldTail[root(p.lhs())] ? classifyInTail(whole) : classify(whole);

        boolean cut = false;
        if (shape instanceof Guarded guarded) cut = guarded.body() < prefixLength || (guarded.loop() && guarded.condition() < prefixLength);
        if (shape instanceof GuardedElse guardedElse) cut = guardedElse.thenBody() < prefixLength;
        if (cut) {
            throw new IllegalArgumentException("Left factoring splits " + join(whole) + " after " + prefixLength +
                    " symbols, inside code its guard has to precede; give the shared part its own nonterminal");
        }
        return new Recombined(shape, prefixLength);
    }

    // every symbol a factored tail's alternatives share, counted from the declared alternative
    private List<Symbol> sharedPrefix(int tail) {
        List<Symbol> prefix = new ArrayList<>();
        int production = owner[tail];
        if (production >= 0 && classify(production) instanceof Recombined) {
            prefix.addAll(sharedPrefix(grammar.production(production).lhs()));
        }
        prefix.addAll(((NonTerminal) grammar.symbol(tail)).prefix());
        return prefix;
    }

    // the nonterminal whose alternatives a factored tail was split from
    private int root(int tail) {
        int production = owner[tail];
        if (production < 0) return tail;
        int lhs = grammar.production(production).lhs();
        boolean nested = grammar.kind(lhs) == NonTerminal.Kind.FACTOR_TAIL && classify(production) instanceof Recombined;
        return nested ? root(lhs) : lhs;
    }

    // a factored optional else: the guard in front of it hands down its exit label
    private boolean closesGuard(int tail) {
        int production = owner[tail];
        if (production < 0) return false;
        ProductionShape shape = classify(production);
        if (shape instanceof Recombined recombined) shape = recombined.shape();
        return shape instanceof Guarded guarded && guarded.elseTail() >= 0;
    }

    private static String join(List<Symbol> symbols) {
        StringBuilder builder = new StringBuilder();
        for (Symbol symbol : symbols) builder.append(builder.length() == 0 ? "" : " ").append(symbol);
        return builder.toString();
    }

    // ====== CLASSIFICATION ====== //
    private ProductionShape classify(List<Symbol> s) {
        int n = s.size();
        if (n == 0) return new Empty();
        if (n == 2 && isTerminalIn(s.get(0), config.elseKeywords())) return new ElseBranch(1);

        if (n == 6 && matches(s, "TTNTNN") && isKeyword(s.get(0)) && !isTerminalIn(s.get(0), config.loopKeywords()) && isElseTail(s.get(5))) {
            return new Guarded(2, 4, false, 5);
        }
        if (n >= 2 && isFactorTail(s.get(n - 1))) return new Factored(n - 1);
        if (n >= 2 && isFoldTail(s.get(n - 1))) return new Chain(classify(s.subList(0, n - 1)), n - 1);

        if (isTerminalIn(s.get(0), config.declarationKeywords())) return new Declaration(n);
        if (n == 5 && matches(s, "TTNTN") && isKeyword(s.get(0))) return new Guarded(2, 4, isTerminalIn(s.get(0), config.loopKeywords()), -1);
        if (n == 7 && matches(s, "TTNTNTN") && isKeyword(s.get(0))) return new GuardedElse(2, 4, 6);
        if (n >= 2 && isTerminalIn(s.get(0), config.inputKeywords()) && isIdentifier(s.get(1))) return new Read(0, 1);
        if (n >= 4 && n <= 5 && matches(s, "TTNT") && isKeyword(s.get(0))) return new Call(0, 2);
        if (n >= 3 && isIdentifier(s.get(0)) && isTerminalIn(s.get(1), config.assignmentTokens()) && !isOperator(s.get(2))) {
            boolean operation = n >= 5 && isOperator(s.get(3)) && !isOperator(s.get(4)) && (n == 5 || (n == 6 && s.get(5) instanceof Terminal));
            return operation ? new BinaryAssignment(0, 2, 3, 4) : new Assignment(0, 2);
        }
        if (n == 3 && isOperator(s.get(1)) && !isOperator(s.get(0)) && !isOperator(s.get(2))) return new BinaryOp(0, 1, 2);
        if (n == 3 && matches(s, "TNT")) return new Group(1);
        if (n == 1) return new Copy(0);
        return new Structural(n);
    }

    private ProductionShape classifyInTail(List<Symbol> s) {
        int n = s.size();
        if (n == 0) return new Empty();
        if (n == 2 && isTerminalIn(s.get(0), config.elseKeywords())) return new ElseBranch(1);
        if (isFactorTail(s.get(n - 1))) return new Factored(n - 1);
        if (isOperator(s.get(0)) && (n == 2 || (n == 3 && isFoldTail(s.get(2))))) {
            return new TailFold(0, 1, n == 3 ? 2 : -1);
        }
        if (isFoldTail(s.get(n - 1))) return new Passthrough(n - 1);
        return new Structural(n);
    }

    // ====== SYMBOL PREDICATES ====== //
    private List<Symbol> symbols(Production p) {
        List<Symbol> symbols = new ArrayList<>();
        for (int symbol : p) symbols.add(grammar.symbol(symbol));
        return symbols;
    }

    // T = terminal, N = nonterminal
    private static boolean matches(List<Symbol> s, String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            boolean terminal = s.get(i) instanceof Terminal;
            if (terminal != (pattern.charAt(i) == 'T')) return false;
        }
        return true;
    }

    private boolean isIdentifier(Symbol symbol) {
        return symbol instanceof Terminal && config.identifierToken().equals(symbol.value());
    }

    // a terminal that can open a statement: not an identifier, punctuation or operand token
    private boolean isKeyword(Symbol symbol) {
        return symbol instanceof Terminal &&
                !isIdentifier(symbol) &&
                !config.nonOperatorTokens().contains(symbol.value()) &&
                !config.assignmentTokens().contains(symbol.value());
    }

    private static boolean isTerminalIn(Symbol symbol, Set<String> types) {
        return symbol instanceof Terminal && types.contains(symbol.value());
    }

    boolean isOperator(Symbol symbol) {
        if (symbol instanceof Terminal terminal) return terminal.value() != null && config.isOperatorToken(terminal.value());
        int index = grammar.index(symbol);
        return index >= 0 && operatorNonTerminal[index];
    }

    private static boolean isFactorTail(Symbol symbol) {
        return symbol instanceof NonTerminal nonTerminal && nonTerminal.kind() == NonTerminal.Kind.FACTOR_TAIL;
    }

    private boolean isFoldTail(Symbol symbol) {
        if (!(symbol instanceof NonTerminal)) return false;
        int index = grammar.index(symbol);
        return index >= 0 && foldTail[index];
    }

    // a nonterminal whose every alternative is one operator terminal, e.g. RelOp > 'LT' | 'GT';
    private boolean allSingleOperators(int nonTerminal) {
        int[] range = grammar.productionRanges(nonTerminal);
        for (int i = range[0]; i < range[1]; i++) {
            Production p = grammar.production(i);
            if (p.size() != 1 || grammar.isNonTerminal(p.get(0))) return false;
            if (!config.isOperatorToken(grammar.name(p.get(0)))) return false;
        }
        return true;
    }

    // synthesized tails always fold; a declared one folds if it looks like
    // Tail > op X Tail | op X | EPSILON();
    private boolean isFoldTail(int nonTerminal) {
        if (grammar.kind(nonTerminal) != NonTerminal.Kind.DECLARED) return true;
        boolean empty = false;
        int[] range = grammar.productionRanges(nonTerminal);
        for (int i = range[0]; i < range[1]; i++) {
            Production p = grammar.production(i);
            if (p.isEmpty()) {
                empty = true;
                continue;
            }
            if (p.size() > 3 || p.size() < 2) return false;
            if (!isOperator(grammar.symbol(p.get(0)))) return false;
            if (p.size() == 3 && !grammar.isNonTerminal(p.get(2))) return false;
        }
        return empty;
    }

    // Tail > else X | EPSILON();
    private boolean isElseTail(Symbol symbol) {
        if (!(symbol instanceof NonTerminal)) return false;
        int index = grammar.index(symbol);
        if (index < 0) return false;
        boolean branch = false;
        int[] range = grammar.productionRanges(index);
        for (int i = range[0]; i < range[1]; i++) {
            Production p = grammar.production(i);
            if (p.isEmpty()) continue;
            if (p.size() != 2 || !config.elseKeywords().contains(grammar.name(p.get(0)))) return false;
            branch = true;
        }
        return branch;
    }
}
