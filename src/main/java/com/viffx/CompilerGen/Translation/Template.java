package com.viffx.CompilerGen.Translation;

import java.util.List;
import java.util.function.Function;

/**
 * An instruction text with {@code %s} holes filled from operands.
 */
public record Template(String format, List<Operand> operands) {
    public Template {
        operands = List.copyOf(operands);
    }

    public static Template of(String format, Operand... operands) {
        return new Template(format, List.of(operands));
    }

    /**
     * Fills the holes.
     *
     * @return the instruction, or {@code null} if any operand has no value
     */
    public String render(Function<Operand, String> resolver) {
        Object[] values = new Object[operands.size()];
        for (int i = 0; i < values.length; i++) {
            String value = resolver.apply(operands.get(i));
            if (value == null) return null;
            values[i] = value;
        }
        return String.format(format, values);
    }

    @Override
    public String toString() {
        return String.format(format, operands.stream().map(o -> "{" + o + "}").toArray());
    }
}
