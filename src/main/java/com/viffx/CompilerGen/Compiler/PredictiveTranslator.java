package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.Errors.SemanticDiagnostic;
import com.viffx.CompilerGen.Errors.SemanticException;
import com.viffx.CompilerGen.Errors.SyntaxException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Grammar.Grammar;
import com.viffx.CompilerGen.Grammar.NormalizedGrammar;
import com.viffx.CompilerGen.Grammar.Production;
import com.viffx.CompilerGen.Symbols.AstNode;
import com.viffx.CompilerGen.Symbols.Terminal;
import com.viffx.CompilerGen.Symbols.Token;
import com.viffx.CompilerGen.Translation.*;
import com.viffx.CompilerGen.Translation.Step.*;
import com.viffx.CompilerGen.Utils.Suggestions;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-pass recursive descent translator. Every nonterminal expansion picks its alternative by
 * the current token and then executes that alternative's {@link EmissionPlan}.
 * <p>
 * Each call to {@link #translate} runs with fresh counters, a fresh symbol table and a fresh
 * instruction buffer, so translators can be reused.
 */
public class PredictiveTranslator {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    private final NormalizedGrammar normalized;
    private final Grammar grammar;
    private final GeneratorConfig config;
    private final boolean explicitDeclaration;
    private AstNode lastTree;

    public PredictiveTranslator(@NotNull NormalizedGrammar normalized, @NotNull GeneratorConfig config) {
        this.normalized = normalized;
        this.grammar = normalized.grammar();
        this.config = config;
        this.explicitDeclaration = config.requireExplicitDeclaration() != null
                ? config.requireExplicitDeclaration()
                : normalized.hasDeclarations();
    }

    /**
     * Translates a token stream from the grammar's start symbol.
     *
     * @see #translate(List, String)
     */
    @NotNull
    public List<String> translate(@NotNull List<Token> tokens) throws SyntaxException, SemanticException {
        return translate(tokens, grammar.name(grammar.START()));
    }

    /**
     * Translates a token stream, which must derive from {@code start} and end with {@code EOF}.
     *
     * @return the three-address instructions in execution order
     * @throws SyntaxException   at the first token that does not fit the grammar
     * @throws SemanticException after the whole input was translated, if undeclared identifiers were referenced
     * @throws IllegalArgumentException if {@code start} is not a nonterminal of the grammar
     */
    @NotNull
    public List<String> translate(@NotNull List<Token> tokens, @NotNull String start) throws SyntaxException, SemanticException {
        int startSymbol = grammar.nonTerminal(start);
        if (startSymbol < 0) throw new IllegalArgumentException("Unknown start symbol: " + start);

        Run run = new Run(tokens);
        AstNode tree = run.parse(startSymbol, null);
        run.expect(grammar.EOF());
        lastTree = config.retainTree() ? tree : null;

        Set<String> unresolved = run.emitter.buffer().unresolvedLabels();
        if (!unresolved.isEmpty()) throw new IllegalStateException("Jumps to labels that were never emitted: " + unresolved);

        List<String> instructions = run.emitter.instructions();
        if (logger.isLoggable(Level.FINE)) logger.fine("Translated " + tokens.size() + " tokens into " + instructions.size() + " instructions");
        if (!run.diagnostics.isEmpty()) {
            for (SemanticDiagnostic diagnostic : run.diagnostics) logger.warning(diagnostic.toString());
            throw new SemanticException(run.diagnostics, instructions);
        }
        return instructions;
    }

    /** The parse tree of the last successful run, if {@code retainTree} is set. */
    public AstNode lastTree() {
        return lastTree;
    }

    // state of one translation run
    private final class Run {
        private final List<Token> tokens;
        private final InstructionEmitter emitter = new InstructionEmitter(config.tempPrefix(), config.labelPrefix());
        private final SymbolTable symbolTable = new SymbolTable();
        private final List<SemanticDiagnostic> diagnostics = new ArrayList<>();
        private int position = 0;

        private Run(List<Token> tokens) {
            this.tokens = tokens;
        }

        private Token current() {
            if (position < tokens.size()) return tokens.get(position);
            Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            return new Token(Terminal.EOF_NAME, "", last == null ? 1 : last.line(), last == null ? 1 : last.column());
        }

        private int lookahead() {
            return grammar.index(Terminal.of(current().type()));
        }

        private AstNode expect(int terminal) throws SyntaxException {
            Token token = current();
            if (lookahead() != terminal) {
                throw syntaxError(Set.of(grammar.name(terminal)), token);
            }
            if (!token.isEof()) position++;
            return new AstNode(grammar.symbol(terminal), token, 0);
        }

        // A plan whose last step parses a child it only passes on continues with that child in
        // this loop, so right recursive lists do not nest a call per element.
        private AstNode parse(int symbol, AstNode inherited) throws SyntaxException {
            if (!grammar.isNonTerminal(symbol)) return expect(symbol);

            AstNode root = null;
            AstNode parent = null;
            int slot = -1;
            List<AstNode> passing = new ArrayList<>();
            List<Integer> passingSlots = new ArrayList<>();
            while (true) {
                int production = predict(symbol);
                Production p = grammar.production(production);
                AstNode node = new AstNode(grammar.symbol(symbol), p.size());
                if (parent == null) root = node;
                else parent.child(slot, node);

                EmissionPlan plan = normalized.plans().get(production);
                Scope scope = new Scope(plan, p, node, inherited);
                int tail = plan.tailCall();
                Parse next = tail < 0 ? null : (Parse) plan.steps().get(tail);
                if (next == null || !grammar.isNonTerminal(p.get(next.index()))) {
                    scope.execute(plan.steps().size());
                    break;
                }

                scope.execute(tail);
                Operand yielded = ((Yield) plan.steps().get(tail + 1)).operand();
                if (yielded instanceof Operand.Child) {
                    passing.add(node);
                    passingSlots.add(next.index());
                } else {
                    node.value(yielded == null ? null : scope.value(yielded));
                }
                inherited = next.inherited() == null ? null : scope.node(next.inherited());
                symbol = p.get(next.index());
                parent = node;
                slot = next.index();
            }
            for (int i = passing.size() - 1; i >= 0; i--) {
                AstNode node = passing.get(i);
                node.value(node.child(passingSlots.get(i)).value());
            }
            return root;
        }

        private int predict(int nonTerminal) throws SyntaxException {
            Token token = current();
            int terminal = lookahead();
            int production = terminal < 0 ? -1 : normalized.predict(nonTerminal, terminal);
            if (production < 0 && token.isEof()) production = nullableAlternative(nonTerminal);
            if (production < 0) throw syntaxError(normalized.expected(nonTerminal), token);
            if (logger.isLoggable(Level.FINER)) logger.finer("On " + token + " predict " + grammar.toString(grammar.production(production)));
            return production;
        }

        // lets a run that starts below the grammar's start symbol end on EOF
        private int nullableAlternative(int nonTerminal) {
            int[] range = grammar.productionRanges(nonTerminal);
            for (int i = range[0]; i < range[1]; i++) {
                boolean nullable = true;
                for (int symbol : grammar.production(i)) nullable &= normalized.nullable(symbol);
                if (nullable) return i;
            }
            return -1;
        }

        // one node's plan being executed: its temporaries, labels and marks
        private final class Scope {
            private final EmissionPlan plan;
            private final Production production;
            private final AstNode node;
            private final AstNode inherited;
            private final String[] temps;
            private final String[] labels;
            private final int[] marks;

            private Scope(EmissionPlan plan, Production production, AstNode node, AstNode inherited) {
                this.plan = plan;
                this.production = production;
                this.node = node;
                this.inherited = inherited;
                this.temps = new String[plan.temps()];
                this.labels = new String[plan.labels()];
                this.marks = new int[plan.marks()];
            }

            // runs the steps below end
            private void execute(int end) throws SyntaxException {
                for (Step step : plan.steps().subList(0, end)) {
                    if (step instanceof Parse parse) {
                        AstNode handed = parse.inherited() == null ? null : node(parse.inherited());
                        node.child(parse.index(), parse(production.get(parse.index()), handed));
                    } else if (step instanceof Compute compute) {
                        String rhs = compute.rhs().render(this::value);
                        if (rhs == null) {
                            skipped(step);
                            continue;
                        }
                        temps[compute.slot()] = emitter.newTemp();
                        emitter.emit(temps[compute.slot()] + " = " + rhs);
                    } else if (step instanceof Emit emit) {
                        String instruction = emit.template().render(this::value);
                        if (instruction != null) emitter.emit(instruction);
                        else skipped(step);
                    } else if (step instanceof AllocateLabel label) {
                        labels[label.slot()] = emitter.newLabel();
                    } else if (step instanceof Mark mark) {
                        marks[mark.slot()] = emitter.mark();
                    } else if (step instanceof InsertAt insert) {
                        String instruction = insert.template().render(this::value);
                        if (instruction != null) emitter.insertAt(marks[insert.mark()], instruction);
                        else skipped(step);
                    } else if (step instanceof Identifier identifier) {
                        AstNode target = node(identifier.operand());
                        if (target != null && target.token() != null && config.identifierToken().equals(target.token().type())) {
                            check(target.token(), identifier.role());
                        }
                    } else if (step instanceof EnterDeclaration) {
                        symbolTable.enterDeclaration();
                    } else if (step instanceof ExitDeclaration) {
                        symbolTable.exitDeclaration();
                    } else if (step instanceof Yield result) {
                        node.value(result.operand() == null ? null : value(result.operand()));
                    }
                }
            }

            private void skipped(Step step) {
                logger.warning("Skipped " + step + " of " + grammar.toString(production) + ": an operand has no value");
            }

            private String value(Operand operand) {
                if (operand instanceof Operand.Temp temp) return temps[temp.slot()];
                if (operand instanceof Operand.Label label) return labels[label.slot()];
                AstNode source = node(operand);
                return source == null ? null : source.value();
            }

            // children and the inherited node are handed on as they are, so tails can still see their tokens
            private AstNode node(Operand operand) {
                if (operand instanceof Operand.Child child) return node.child(child.index());
                if (operand instanceof Operand.Inherited) return inherited;
                if (operand instanceof Operand.Prefix prefix) return inherited == null ? null : inherited.child(prefix.index());
                if (operand instanceof Operand.Bundle bundle) {
                    AstNode carrier = AstNode.carrier(inherited == null ? null : inherited.value(), bundle.parts().size());
                    for (int i = 0; i < bundle.parts().size(); i++) carrier.child(i, node(bundle.parts().get(i)));
                    return carrier;
                }
                if (operand instanceof Operand.Temp || operand instanceof Operand.Label) {
                    String value = value(operand);
                    return value == null ? null : AstNode.carrier(value, 0);
                }
                throw new IllegalArgumentException("Unknown operand: " + operand);
            }
        }

        private void check(Token token, Role role) {
            String name = token.value();
            if (symbolTable.inDeclaration()) {
                symbolTable.declare(name);
                return;
            }
            if (symbolTable.isDeclared(name)) return;

            boolean report = config.semanticChecks() && (role == Role.USE || explicitDeclaration);
            if (report) {
                String hint = Suggestions.hint(name, symbolTable.names(), config.suggestionDistance());
                diagnostics.add(new SemanticDiagnostic(name, token.line(), token.column(), hint));
            }
            // assignments declare implicitly; after a report the name counts as declared
            if (role == Role.DEFINE) symbolTable.declare(name);
        }

        private SyntaxException syntaxError(Set<String> expected, Token token) {
            return new SyntaxException(expected, token.type(), token.value(), token.line(), token.column());
        }
    }
}
