package com.viffx.CompilerGen.Symbols;

/**
 * A scanned token. Lines and columns are 1-based and point at the first character of the lexeme.
 */
public record Token(String type, String value, int line, int column) {
    public boolean isEof() {
        return Terminal.EOF_NAME.equals(type);
    }

    @Override
    public String toString() {
        if (isEof()) return type;
        return type + "(" + value.replace("\n", "\\n") + ")";
    }
}
