package com.viffx.CompilerGen.Translation;

import java.util.List;

/**
 * Writes instructions for one translation run and hands out fresh temporary and label names.
 * Names are numbered from 1 per emitter, so every run starts over at {@code t1} and {@code L1}.
 */
public class InstructionEmitter {
    private final InstructionBuffer buffer = new InstructionBuffer();
    private final String tempPrefix;
    private final String labelPrefix;
    private int tempCounter = 0;
    private int labelCounter = 0;

    public InstructionEmitter(String tempPrefix, String labelPrefix) {
        this.tempPrefix = tempPrefix;
        this.labelPrefix = labelPrefix;
    }

    public void emit(String instruction) {
        buffer.append(instruction);
    }

    public void insertAt(int index, String instruction) {
        buffer.insert(index, instruction);
    }

    /** The index the next {@link #emit} will write to. */
    public int mark() {
        return buffer.size();
    }

    public String newTemp() {
        return tempPrefix + (++tempCounter);
    }

    public String newLabel() {
        return labelPrefix + (++labelCounter);
    }

    public InstructionBuffer buffer() {
        return buffer;
    }

    public List<String> instructions() {
        return buffer.toList();
    }
}
