package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.Automata.Dfa;
import com.viffx.CompilerGen.Errors.LexicalException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.Terminal;
import com.viffx.CompilerGen.Symbols.Token;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.Character.isWhitespace;

/**
 * Maximal-munch scanner driven by a combined {@link Dfa}.
 */
public class Lexer {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    /** Token type given to whitespace that no rule matched, visible only through {@link #scan}. */
    public static final String IMPLICIT_WHITESPACE = "IMPLICIT_WHITESPACE";

    private final Dfa dfa;
    private final GeneratorConfig config;

    public Lexer(@NotNull Dfa dfa, @NotNull GeneratorConfig config) {
        this.dfa = dfa;
        this.config = config;
    }

    /**
     * Tokenizes {@code text}, dropping skip tokens and unmatched whitespace.
     * The result always ends with an {@code EOF} token with an empty value.
     *
     * @throws LexicalException at the first position where no rule matches
     */
    @NotNull
    public List<Token> tokenize(@NotNull String text) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        for (Token token : scan(text)) {
            if (config.skipTokens().contains(token.type()) || token.type().equals(IMPLICIT_WHITESPACE)) continue;
            tokens.add(token);
        }
        if (logger.isLoggable(Level.FINE)) logger.fine("Tokenized " + text.length() + " characters into " + tokens.size() + " tokens");
        return tokens;
    }

    /**
     * Tokenizes {@code text} keeping every lexeme, so that concatenating the values of the
     * returned tokens reproduces {@code text} exactly.
     *
     * @throws LexicalException at the first position where no rule matches
     */
    @NotNull
    public List<Token> scan(@NotNull String text) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        int line = 1;
        int column = 1;

        while (position < text.length()) {
            // run the automaton as far as it goes, remembering the last accepting position
            int state = dfa.start();
            int index = position;
            int lastAccept = -1;
            String lastType = null;
            while (index < text.length()) {
                state = dfa.next(state, text.charAt(index));
                if (state < 0) break;
                index++;
                String type = dfa.accepting(state);
                if (type != null) {
                    lastAccept = index;
                    lastType = type;
                }
            }

            if (lastAccept < 0) {
                char c = text.charAt(position);
                if (!config.implicitWhitespace() || !isWhitespace(c)) {
                    throw new LexicalException(line, column, c);
                }
                lastAccept = position + 1;
                lastType = IMPLICIT_WHITESPACE;
            }

            String lexeme = text.substring(position, lastAccept);
            tokens.add(new Token(lastType, lexeme, line, column));
            if (logger.isLoggable(Level.FINEST)) logger.finest("Matched " + lastType + " at " + line + ":" + column);

            for (int i = 0; i < lexeme.length(); i++) {
                if (lexeme.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            position = lastAccept;
        }

        tokens.add(new Token(Terminal.EOF_NAME, "", line, column));
        return tokens;
    }
}
