package com.viffx.CompilerGen.Errors;

/**
 * One reference to an undeclared identifier.
 *
 * @param identifier the undeclared name
 * @param line       line of the offending token
 * @param column     column of the offending token
 * @param hint       a "did you mean" suggestion or the declared names, empty when nothing is declared
 */
public record SemanticDiagnostic(String identifier, int line, int column, String hint) {
    @Override
    public String toString() {
        String message = String.format("line %d, column %d: identifier '%s' is not declared", line, column, identifier);
        return hint.isEmpty() ? message : message + " (" + hint + ")";
    }
}
