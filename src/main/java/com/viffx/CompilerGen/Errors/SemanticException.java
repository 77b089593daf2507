package com.viffx.CompilerGen.Errors;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised once at the end of a translation run that collected semantic diagnostics.
 * The run itself completed, so the generated instructions are still available.
 */
public class SemanticException extends CompilerException {
    private final List<SemanticDiagnostic> diagnostics;
    private final List<String> instructions;

    public SemanticException(List<SemanticDiagnostic> diagnostics, List<String> instructions) {
        super(diagnostics.size() + " semantic error(s):\n\t" +
                diagnostics.stream().map(SemanticDiagnostic::toString).collect(Collectors.joining("\n\t")));
        this.diagnostics = List.copyOf(diagnostics);
        this.instructions = List.copyOf(instructions);
    }

    public List<SemanticDiagnostic> diagnostics() {
        return diagnostics;
    }

    public List<String> instructions() {
        return instructions;
    }
}
