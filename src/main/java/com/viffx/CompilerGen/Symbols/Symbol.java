package com.viffx.CompilerGen.Symbols;

public sealed interface Symbol permits Terminal, NonTerminal {
    String value();
}
