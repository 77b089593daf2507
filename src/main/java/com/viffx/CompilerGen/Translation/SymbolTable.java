package com.viffx.CompilerGen.Translation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names declared during one translation run, plus whether the run is inside a declaration.
 */
public class SymbolTable {
    private final Set<String> declared = new LinkedHashSet<>();
    private int declarationDepth = 0;

    public void enterDeclaration() {
        declarationDepth++;
    }

    public void exitDeclaration() {
        if (declarationDepth == 0) throw new IllegalStateException("not inside a declaration");
        declarationDepth--;
    }

    public boolean inDeclaration() {
        return declarationDepth > 0;
    }

    /** @return whether the name was new */
    public boolean declare(String name) {
        return declared.add(name);
    }

    public boolean isDeclared(String name) {
        return declared.contains(name);
    }

    public List<String> names() {
        return List.copyOf(declared);
    }
}
