package com.viffx.CompilerGen.Translation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A value an emission step reads while its alternative is being translated.
 */
public sealed interface Operand {
    Inherited INHERITED = new Inherited();

    /** The synthesized value of child {@code index}. */
    record Child(int index) implements Operand {
        @Override
        public String toString() {
            return "c" + index;
        }
    }

    /** The value handed down by the parent, used by tails to fold left operands. */
    record Inherited() implements Operand {
        @Override
        public String toString() {
            return "in";
        }
    }

    /** Child {@code index} of the inherited node: a symbol of a factored prefix, parsed by the parent. */
    record Prefix(int index) implements Operand {
        @Override
        public String toString() {
            return "p" + index;
        }
    }

    /**
     * A node built from {@code parts} that keeps the inherited value, handed to a factored tail so
     * it can reach every prefix symbol.
     */
    record Bundle(List<Operand> parts) implements Operand {
        public Bundle {
            parts = List.copyOf(parts);
        }

        @Override
        public String toString() {
            return parts.stream().map(Operand::toString).collect(Collectors.joining(",", "[", "]"));
        }
    }

    /** A temporary allocated by a {@link Step.Compute} of the same plan. */
    record Temp(int slot) implements Operand {
        @Override
        public String toString() {
            return "t" + slot;
        }
    }

    /** A label allocated by a {@link Step.AllocateLabel} of the same plan. */
    record Label(int slot) implements Operand {
        @Override
        public String toString() {
            return "l" + slot;
        }
    }
}
