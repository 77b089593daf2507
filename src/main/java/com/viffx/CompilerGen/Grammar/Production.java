package com.viffx.CompilerGen.Grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * One alternative of a nonterminal, stored as interned symbol indexes. An empty production derives ε.
 */
public class Production extends ArrayList<Integer> {
    private final int lhs;

    public Production(int lhs) {
        this.lhs = lhs;
    }

    public int lhs() {
        return lhs;
    }

    public boolean atEnd(int dot) {
        return dot >= size();
    }

    /**
     * Returns the symbols that follow position {@code dot}, possibly none.
     *
     * @throws IndexOutOfBoundsException if {@code dot} is not a position of this production
     */
    public List<Integer> beta(int dot) {
        if (dot < 0 || atEnd(dot)) {
            throw new IndexOutOfBoundsException(String.format("Index %d out of bounds for length %d", dot, size()));
        }
        return new ArrayList<>(subList(dot + 1, size()));
    }

    @Override
    public String toString() {
        return "Production{" +
                "lhs=" + lhs +
                ", elements=" + super.toString() +
                '}';
    }
}
