package com.viffx.CompilerGen.Errors;

/**
 * Two alternatives of one nonterminal are predicted by the same lookahead token,
 * so the grammar is not LL(1).
 */
public class GrammarConflictException extends CompilerException {
    private final String nonTerminal;
    private final String token;

    public GrammarConflictException(String nonTerminal, String token, String first, String second) {
        super("LL(1) conflict for nonterminal " + nonTerminal + " on token " + token +
                "\n\t1. " + first +
                "\n\t2. " + second);
        this.nonTerminal = nonTerminal;
        this.token = token;
    }

    public String nonTerminal() {
        return nonTerminal;
    }

    public String token() {
        return token;
    }
}
