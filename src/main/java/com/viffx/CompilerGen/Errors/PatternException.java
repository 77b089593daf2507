package com.viffx.CompilerGen.Errors;

/**
 * A lexical rule's pattern could not be parsed. Fatal to the whole automaton compilation.
 */
public class PatternException extends CompilerException {
    private final String ruleName;
    private final String pattern;
    private final int offset;

    public PatternException(String ruleName, String pattern, int offset, String reason) {
        super(String.format("Rule %s: malformed pattern '%s' at offset %d: %s", ruleName, pattern, offset, reason));
        this.ruleName = ruleName;
        this.pattern = pattern;
        this.offset = offset;
    }

    public String ruleName() {
        return ruleName;
    }

    public String pattern() {
        return pattern;
    }

    public int offset() {
        return offset;
    }
}
