package com.viffx.CompilerGen.Automata;

import com.viffx.CompilerGen.Errors.PatternException;
import com.viffx.CompilerGen.GeneratorConfig;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles an ordered rule list into one combined {@link Dfa}: every pattern is parsed, all
 * patterns are unioned into one Thompson NFA and the NFA is determinized.
 */
public class AutomatonCompiler {
    private static final Logger logger = Logger.getLogger("com.viffx.CompilerGen");

    private final GeneratorConfig config;

    public AutomatonCompiler(@NotNull GeneratorConfig config) {
        this.config = config;
    }

    /**
     * @param rules lexical rules in declaration order
     * @return the combined automaton
     * @throws PatternException         if any pattern is malformed; no automaton is produced
     * @throws IllegalArgumentException if the rule list is empty or a rule name repeats
     * @throws IllegalStateException    if determinization exceeds the configured state limit
     */
    @NotNull
    public Dfa compile(@NotNull List<LexicalRule> rules) throws PatternException {
        if (rules.isEmpty()) throw new IllegalArgumentException("at least one lexical rule is required");

        Set<String> names = new HashSet<>();
        List<RegexNode> patterns = new ArrayList<>();
        List<String> tokenNames = new ArrayList<>();
        for (LexicalRule rule : rules) {
            if (!names.add(rule.name())) throw new IllegalArgumentException("duplicate lexical rule: " + rule.name());
            RegexNode node = RegexParser.parse(rule.name(), rule.pattern());
            if (logger.isLoggable(Level.FINER)) logger.finer(rule.name() + " := " + node);
            patterns.add(node);
            tokenNames.add(rule.name());
        }

        Nfa nfa = Nfa.of(patterns, tokenNames);
        Dfa dfa = Dfa.construct(nfa, config.maxDfaStates());
        if (logger.isLoggable(Level.FINER)) logger.finer("DFA transition table:\n" + dfa);
        return dfa;
    }
}
