package com.viffx.CompilerGen.Symbols;

import java.util.List;
import java.util.Objects;

/**
 * A grammar nonterminal. Identity is the name only; {@code kind} and {@code prefix} record how
 * the normalizer introduced the symbol.
 *
 * @param value  the nonterminal name
 * @param kind   whether the user declared it or a rewrite synthesized it
 * @param prefix for {@link Kind#FACTOR_TAIL} symbols, the common prefix that was factored out
 */
public record NonTerminal(String value, Kind kind, List<Symbol> prefix) implements Symbol {
    public enum Kind {
        DECLARED,
        RECURSION_TAIL,
        FACTOR_TAIL
    }

    public NonTerminal {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        prefix = prefix == null ? List.of() : List.copyOf(prefix);
    }

    public NonTerminal(String value) {
        this(value, Kind.DECLARED, null);
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        NonTerminal that = (NonTerminal) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
