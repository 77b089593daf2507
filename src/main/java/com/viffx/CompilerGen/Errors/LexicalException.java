package com.viffx.CompilerGen.Errors;

/**
 * No token could be matched at a position of the input.
 */
public class LexicalException extends CompilerException {
    private final int line;
    private final int column;
    private final char character;

    public LexicalException(int line, int column, char character) {
        super(String.format("Lexical error at line %d, column %d: unexpected character '%s'",
                line,
                column,
                printable(character)
        ));
        this.line = line;
        this.column = column;
        this.character = character;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public char character() {
        return character;
    }

    private static String printable(char c) {
        return switch (c) {
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            default -> c < ' ' ? String.format("\\u%04x", (int) c) : String.valueOf(c);
        };
    }
}
