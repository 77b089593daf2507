package com.viffx.CompilerGen.Symbols;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Translation-time parse tree node. Children are filled in the order an emission plan parses
 * them, which is not always left to right, so slots start out empty.
 */
public final class AstNode {
    private final Symbol symbol;
    private final Token token;
    private final AstNode[] children;
    private String value;

    public AstNode(Symbol symbol, int arity) {
        this(symbol, null, arity);
    }

    public AstNode(Symbol symbol, Token token, int arity) {
        this.symbol = symbol;
        this.token = token;
        this.children = new AstNode[arity];
        this.value = token == null ? null : token.value();
    }

    /**
     * A detached node carrying a value, used to hand inherited values down to tails. Its
     * {@code arity} slots hold the nodes a factored tail inherits.
     */
    public static AstNode carrier(String value, int arity) {
        AstNode node = new AstNode(Terminal.EPSILON, arity);
        node.value = value;
        return node;
    }

    public Symbol symbol() {
        return symbol;
    }

    public Token token() {
        return token;
    }

    public String value() {
        return value;
    }

    public void value(String value) {
        this.value = value;
    }

    public AstNode child(int index) {
        return children[index];
    }

    public void child(int index, AstNode child) {
        children[index] = child;
    }

    /** The children parsed so far, in slot order. */
    public List<AstNode> children() {
        return new ArrayList<>(Arrays.stream(children).filter(Objects::nonNull).toList());
    }

    /** Renders the subtree, one node per line, indented by depth. */
    public String dump() {
        StringBuilder builder = new StringBuilder();
        dump(builder, 0);
        return builder.toString();
    }

    private void dump(StringBuilder builder, int depth) {
        builder.append("  ".repeat(depth)).append(symbol);
        if (value != null) builder.append(" = ").append(value);
        builder.append('\n');
        for (AstNode child : children()) child.dump(builder, depth + 1);
    }

    @Override
    public String toString() {
        return "AstNode{" +
                "symbol=" + symbol + ", " +
                "value=" + value + ", " +
                "children=" + children() +
                '}';
    }
}
