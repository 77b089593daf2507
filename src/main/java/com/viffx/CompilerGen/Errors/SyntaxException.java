package com.viffx.CompilerGen.Errors;

import java.util.Set;

/**
 * The token stream does not fit the grammar. Aborts the translation of the current input.
 */
public class SyntaxException extends CompilerException {
    private final Set<String> expected;
    private final String actual;
    private final int line;
    private final int column;

    public SyntaxException(Set<String> expected, String actual, String lexeme, int line, int column) {
        super(String.format("Syntax error at line %d, column %d: expected %s, found %s '%s'",
                line,
                column,
                expected.size() == 1 ? expected.iterator().next() : "one of " + expected,
                actual,
                lexeme
        ));
        this.expected = Set.copyOf(expected);
        this.actual = actual;
        this.line = line;
        this.column = column;
    }

    public Set<String> expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
