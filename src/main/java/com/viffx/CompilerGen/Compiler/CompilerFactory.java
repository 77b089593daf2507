package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.Automata.AutomatonCompiler;
import com.viffx.CompilerGen.Automata.Dfa;
import com.viffx.CompilerGen.Automata.LexicalRule;
import com.viffx.CompilerGen.Errors.GrammarConflictException;
import com.viffx.CompilerGen.Errors.LexicalException;
import com.viffx.CompilerGen.Errors.PatternException;
import com.viffx.CompilerGen.Errors.SemanticException;
import com.viffx.CompilerGen.Errors.SyntaxException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Grammar.Grammar;
import com.viffx.CompilerGen.Grammar.GrammarNormalizer;
import com.viffx.CompilerGen.Grammar.NormalizedGrammar;
import com.viffx.CompilerGen.Symbols.Token;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point of the generator. Each operation returns its result or fails with one typed
 * exception; none of them touches files.
 */
public class CompilerFactory {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    private final GeneratorConfig config;

    public CompilerFactory() {
        this(GeneratorConfig.defaults());
    }

    public CompilerFactory(@NotNull GeneratorConfig config) {
        this.config = config;
    }

    @NotNull
    public Dfa compileLexer(@NotNull List<LexicalRule> rules) throws PatternException {
        return new AutomatonCompiler(config).compile(rules);
    }

    @NotNull
    public List<Token> tokenize(@NotNull Dfa dfa, @NotNull String text) throws LexicalException {
        return new Lexer(dfa, config).tokenize(text);
    }

    @NotNull
    public NormalizedGrammar normalizeGrammar(@NotNull Grammar grammar) throws GrammarConflictException {
        return new GrammarNormalizer(config).normalize(grammar);
    }

    @NotNull
    public List<String> translate(@NotNull List<Token> tokens, @NotNull NormalizedGrammar grammar, @NotNull String start)
            throws SyntaxException, SemanticException {
        return new PredictiveTranslator(grammar, config).translate(tokens, start);
    }

    /**
     * Builds a compiler for a rule set and a grammar. Pattern and grammar errors surface here,
     * before any source is scanned.
     */
    @NotNull
    @Contract("_, _ -> new")
    public GeneratedCompiler create(@NotNull List<LexicalRule> rules, @NotNull Grammar grammar)
            throws PatternException, GrammarConflictException {
        Dfa dfa = compileLexer(rules);
        NormalizedGrammar normalized = normalizeGrammar(grammar);
        logger.info("Generated compiler: " + rules.size() + " lexical rules, " + dfa.size() + " DFA states, " +
                normalized.grammar().productionsSize() + " productions");
        return new GeneratedCompiler(dfa, normalized, config);
    }

    public GeneratorConfig config() {
        return config;
    }
}
