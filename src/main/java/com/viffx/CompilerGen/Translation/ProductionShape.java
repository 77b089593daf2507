package com.viffx.CompilerGen.Translation;

/**
 * Structural classification of one alternative, computed once during normalization.
 * Indexes refer to positions in the alternative.
 */
public sealed interface ProductionShape {
    /** ε: passes the inherited value through. */
    record Empty() implements ProductionShape {}

    /** A single symbol whose value becomes the node's. */
    record Copy(int value) implements ProductionShape {}

    /** {@code '(' X ')'}. */
    record Group(int inner) implements ProductionShape {}

    /** {@code X op Y}. */
    record BinaryOp(int left, int operator, int right) implements ProductionShape {}

    /** {@code ID '=' X ...}. */
    record Assignment(int target, int value) implements ProductionShape {}

    /** {@code ID '=' X op Y ...}: the operation goes to a temporary first. */
    record BinaryAssignment(int target, int left, int operator, int right) implements ProductionShape {}

    /** {@code READ ID ...}. */
    record Read(int keyword, int target) implements ProductionShape {}

    /** {@code keyword '(' X ')' ...}: passes one argument to the keyword's routine. */
    record Call(int keyword, int argument) implements ProductionShape {}

    /**
     * {@code keyword '(' cond ')' body [elseTail]}. The guard is emitted before the body is parsed.
     * {@code elseTail} is -1 when there is none.
     */
    record Guarded(int condition, int body, boolean loop, int elseTail) implements ProductionShape {}

    /** {@code keyword '(' cond ')' body else body}. */
    record GuardedElse(int condition, int thenBody, int elseBody) implements ProductionShape {}

    /** {@code else body} inside an optional else tail; receives the false label as inherited value. */
    record ElseBranch(int body) implements ProductionShape {}

    /** Starts with a declaration keyword: identifiers below it are declared. */
    record Declaration(int length) implements ProductionShape {}

    /** {@code op X [tail]} inside a tail: folds {@code inherited op X} and hands it to the next tail. */
    record TailFold(int operator, int operand, int nextTail) implements ProductionShape {}

    /** Inside a tail, no operator: the inherited value goes to the trailing tail. */
    record Passthrough(int tail) implements ProductionShape {}

    /** {@code prefix tail}: the prefix value is inherited by the trailing tail, whose value is the node's. */
    record Chain(ProductionShape prefix, int tail) implements ProductionShape {}

    /**
     * {@code prefix tail} where the tail was left factored out: the prefix children are handed down
     * untranslated and the tail's value is the node's.
     */
    record Factored(int tail) implements ProductionShape {}

    /**
     * A factored tail alternative classified together with the prefix it was split from. The first
     * {@code prefixLength} symbols were parsed by the parent and arrive as the inherited node's children.
     */
    record Recombined(ProductionShape shape, int prefixLength) implements ProductionShape {}

    /** No translation: children are parsed, identifiers checked, the inherited value passed through. */
    record Structural(int length) implements ProductionShape {}
}
