package com.viffx.CompilerGen.Translation;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered, indexable list of three-address instructions and label lines ({@code L1:}).
 */
public class InstructionBuffer {
    private static final Pattern JUMP = Pattern.compile("goto (\\S+)$");

    private final List<String> instructions = new ArrayList<>();

    public void append(String instruction) {
        instructions.add(Objects.requireNonNull(instruction, "instruction cannot be null"));
    }

    /**
     * Inserts at {@code index}, shifting later instructions back.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size()]}
     */
    public void insert(int index, String instruction) {
        Objects.requireNonNull(instruction, "instruction cannot be null");
        if (index < 0 || index > instructions.size()) {
            throw new IndexOutOfBoundsException(String.format("Index %d out of bounds for length %d", index, instructions.size()));
        }
        instructions.add(index, instruction);
    }

    public String get(int index) {
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    /** Labels that some jump targets but no label line defines. */
    public Set<String> unresolvedLabels() {
        Set<String> defined = new HashSet<>();
        Set<String> targets = new TreeSet<>();
        for (String instruction : instructions) {
            if (instruction.endsWith(":")) {
                defined.add(instruction.substring(0, instruction.length() - 1));
                continue;
            }
            Matcher matcher = JUMP.matcher(instruction);
            if (matcher.find()) targets.add(matcher.group(1));
        }
        targets.removeAll(defined);
        return targets;
    }

    public List<String> toList() {
        return List.copyOf(instructions);
    }

    @Override
    public String toString() {
        return String.join("\n", instructions);
    }
}
