package com.viffx.CompilerGen.Symbols;

import java.util.Objects;

/**
 * A grammar terminal. For {@link SymbolType#TOKEN} terminals the value is the token type name
 * produced by the scanner.
 */
public record Terminal(SymbolType type, String value) implements Symbol {
    public static final String EOF_NAME = "EOF";
    public static final Terminal EPSILON = new Terminal(SymbolType.EPSILON, null);
    public static final Terminal EOF = new Terminal(SymbolType.EOF, EOF_NAME);

    public static Terminal of(String tokenType) {
        Objects.requireNonNull(tokenType, "tokenType cannot be null");
        if (tokenType.equals(EOF_NAME)) return EOF;
        return new Terminal(SymbolType.TOKEN, tokenType);
    }

    @Override
    public String toString() {
        return switch (type) {
            case TOKEN -> "'" + value + "'";
            case EPSILON -> "EPSILON()";
            case EOF -> "EOF()";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Terminal terminal = (Terminal) o;
        return Objects.equals(value, terminal.value) && type == terminal.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
