package com.viffx.CompilerGen.Symbols;

public enum SymbolType {
    TOKEN,
    EPSILON,
    EOF
}
