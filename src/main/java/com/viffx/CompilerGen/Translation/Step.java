package com.viffx.CompilerGen.Translation;

/**
 * One step of an {@link EmissionPlan}.
 */
public sealed interface Step {
    enum Role {
        /** A reference to a name; inside a declaration it declares the name. */
        USE,
        /** An assignment target. */
        DEFINE
    }

    /** Parse child {@code index}, handing it {@code inherited} (may be {@code null}). */
    record Parse(int index, Operand inherited) implements Step {
        @Override
        public String toString() {
            return inherited == null ? "parse " + index : "parse " + index + " <- {" + inherited + "}";
        }
    }

    /** Render {@code rhs}; if every operand has a value, allocate a temporary and emit {@code temp = rhs}. */
    record Compute(int slot, Template rhs) implements Step {
        @Override
        public String toString() {
            return "{t" + slot + "} = " + rhs;
        }
    }

    /** Append an instruction, skipped if an operand has no value. */
    record Emit(Template template) implements Step {
        @Override
        public String toString() {
            return "emit " + template;
        }
    }

    record AllocateLabel(int slot) implements Step {
        @Override
        public String toString() {
            return "label l" + slot;
        }
    }

    /** Remember the current end of the instruction buffer. */
    record Mark(int slot) implements Step {
        @Override
        public String toString() {
            return "mark m" + slot;
        }
    }

    /** Insert an instruction at a remembered position. */
    record InsertAt(int mark, Template template) implements Step {
        @Override
        public String toString() {
            return "insert at m" + mark + " " + template;
        }
    }

    /** Run the semantic check for an identifier operand. */
    record Identifier(Operand operand, Role role) implements Step {
        @Override
        public String toString() {
            return role.name().toLowerCase() + " {" + operand + "}";
        }
    }

    record EnterDeclaration() implements Step {
        @Override
        public String toString() {
            return "enter declaration";
        }
    }

    record ExitDeclaration() implements Step {
        @Override
        public String toString() {
            return "exit declaration";
        }
    }

    /** Set the node's synthesized value; a {@code null} operand synthesizes nothing. */
    record Yield(Operand operand) implements Step {
        @Override
        public String toString() {
            return "yield " + (operand == null ? "nothing" : "{" + operand + "}");
        }
    }
}
