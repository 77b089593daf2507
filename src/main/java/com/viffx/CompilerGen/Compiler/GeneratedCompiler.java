package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.Automata.Dfa;
import com.viffx.CompilerGen.Errors.LexicalException;
import com.viffx.CompilerGen.Errors.SemanticException;
import com.viffx.CompilerGen.Errors.SyntaxException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Grammar.NormalizedGrammar;
import com.viffx.CompilerGen.Symbols.Token;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A scanner and a translator generated from one rule set and one grammar.
 */
public class GeneratedCompiler {
    private final Lexer lexer;
    private final PredictiveTranslator translator;

    public GeneratedCompiler(@NotNull Dfa dfa, @NotNull NormalizedGrammar grammar, @NotNull GeneratorConfig config) {
        this.lexer = new Lexer(dfa, config);
        this.translator = new PredictiveTranslator(grammar, config);
    }

    /**
     * Scans and translates {@code source}.
     *
     * @return the three-address instructions
     */
    @NotNull
    public List<String> compile(@NotNull String source) throws LexicalException, SyntaxException, SemanticException {
        return translator.translate(lexer.tokenize(source));
    }

    @NotNull
    public List<Token> tokenize(@NotNull String source) throws LexicalException {
        return lexer.tokenize(source);
    }

    public Lexer lexer() {
        return lexer;
    }

    public PredictiveTranslator translator() {
        return translator;
    }
}
