package com.viffx.CompilerGen.Automata;

import java.util.Objects;

/**
 * One lexical rule. Rules are compiled in list order and earlier rules win ties.
 */
public record LexicalRule(String name, String pattern) {
    public LexicalRule {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        if (name.isBlank()) throw new IllegalArgumentException("rule name cannot be blank");
    }

    @Override
    public String toString() {
        return name + ": " + pattern;
    }
}
