package com.viffx.CompilerGen.Translation;

import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.Symbol;
import com.viffx.CompilerGen.Symbols.Terminal;
import com.viffx.CompilerGen.Translation.Operand.Child;
import com.viffx.CompilerGen.Translation.Operand.Label;
import com.viffx.CompilerGen.Translation.Operand.Temp;
import com.viffx.CompilerGen.Translation.ProductionShape.*;
import com.viffx.CompilerGen.Translation.Step.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The ordered steps that translate one alternative. The translator executes plans without
 * knowing which construct they came from; control flow is expressed by where the plan puts its
 * {@link Parse} steps relative to the guard it emits.
 * <p>
 * Children are always parsed in increasing index order, since each parse consumes tokens.
 */
public record EmissionPlan(List<Step> steps, int temps, int labels, int marks) {
    public EmissionPlan {
        steps = List.copyOf(steps);
    }

    /**
     * Builds the plan for an alternative.
     *
     * @param shape   the alternative's shape
     * @param symbols the alternative's symbols; for a {@link Recombined} shape, preceded by the inherited prefix
     * @param config  supplies the identifier token type
     */
    public static EmissionPlan of(ProductionShape shape, List<Symbol> symbols, GeneratorConfig config) {
        Builder builder = new Builder(symbols, config);
        Operand result = builder.build(shape, symbols.size());
        builder.steps.add(new Yield(result));
        return new EmissionPlan(builder.steps, builder.temps, builder.labels, builder.marks);
    }

    /**
     * Returns the position of a last {@link Parse} step whose child the plan only passes on, or
     * -1. The translator can run such a step after the node is finished, in a loop instead of a
     * nested call.
     */
    public int tailCall() {
        int n = steps.size();
        if (n < 2 || !(steps.get(n - 2) instanceof Parse parse) || !(steps.get(n - 1) instanceof Yield result)) return -1;
        Operand operand = result.operand();
        boolean passed = operand == null || operand instanceof Operand.Inherited || operand.equals(new Child(parse.index()));
        return passed ? n - 2 : -1;
    }

    @Override
    public String toString() {
        return steps.stream().map(Step::toString).collect(Collectors.joining("; "));
    }

    private static final class Builder {
        private final List<Step> steps = new ArrayList<>();
        private final List<Symbol> symbols;
        private final GeneratorConfig config;
        private final Set<Integer> deferred = new HashSet<>();
        private int offset = 0;
        private int next = 0;
        private int temps = 0;
        private int labels = 0;
        private int marks = 0;

        private Builder(List<Symbol> symbols, GeneratorConfig config) {
            this.symbols = symbols;
            this.config = config;
        }

        // Emits the steps for symbols [0, length) and returns the operand holding the result
        private Operand build(ProductionShape shape, int length) {
            if (shape instanceof Empty) {
                return Operand.INHERITED;
            }
            if (shape instanceof Copy copy) {
                parseUpTo(length);
                return child(copy.value());
            }
            if (shape instanceof Group group) {
                parseUpTo(length);
                return child(group.inner());
            }
            if (shape instanceof BinaryOp op) {
                parseUpTo(length);
                return compute(Template.of("%s %s %s", child(op.left()), child(op.operator()), child(op.right())));
            }
            if (shape instanceof Assignment assignment) {
                deferred.add(assignment.target());
                parseUpTo(length);
                steps.add(new Identifier(child(assignment.target()), Role.DEFINE));
                steps.add(new Emit(Template.of("%s = %s", child(assignment.target()), child(assignment.value()))));
                return null;
            }
            if (shape instanceof BinaryAssignment assignment) {
                deferred.add(assignment.target());
                parseUpTo(length);
                steps.add(new Identifier(child(assignment.target()), Role.DEFINE));
                Temp value = compute(Template.of("%s %s %s", child(assignment.left()), child(assignment.operator()), child(assignment.right())));
                steps.add(new Emit(Template.of("%s = %s", child(assignment.target()), value)));
                return null;
            }
            if (shape instanceof Read read) {
                deferred.add(read.target());
                parseUpTo(length);
                steps.add(new Identifier(child(read.target()), Role.DEFINE));
                Temp temp = compute(Template.of("call %s, 0", child(read.keyword())));
                steps.add(new Emit(Template.of("%s = %s", child(read.target()), temp)));
                return null;
            }
            if (shape instanceof Call call) {
                parseUpTo(length);
                steps.add(new Emit(Template.of("param %s", child(call.argument()))));
                steps.add(new Emit(Template.of("call %s, 1", child(call.keyword()))));
                return null;
            }
            if (shape instanceof Guarded guarded) {
                return guarded.loop() ? loop(guarded, length) : conditional(guarded, length);
            }
            if (shape instanceof GuardedElse guarded) {
                parseUpTo(guarded.thenBody());
                Temp test = compute(Template.of("not %s", child(guarded.condition())));
                Label elseLabel = label();
                steps.add(new Emit(Template.of("if %s goto %s", test, elseLabel)));
                parseUpTo(guarded.thenBody() + 1);
                Label end = label();
                steps.add(new Emit(Template.of("goto %s", end)));
                steps.add(new Emit(Template.of("%s:", elseLabel)));
                parseUpTo(length);
                steps.add(new Emit(Template.of("%s:", end)));
                return null;
            }
            if (shape instanceof ElseBranch) {
                // the inherited value is the label the guard jumps to when the test fails
                Label end = label();
                steps.add(new Emit(Template.of("goto %s", end)));
                steps.add(new Emit(Template.of("%s:", Operand.INHERITED)));
                parseUpTo(length);
                return end;
            }
            if (shape instanceof Declaration) {
                steps.add(new EnterDeclaration());
                parseUpTo(length);
                steps.add(new ExitDeclaration());
                return null;
            }
            if (shape instanceof TailFold fold) {
                parseUpTo(fold.operand() + 1);
                Temp folded = compute(Template.of("%s %s %s", Operand.INHERITED, child(fold.operator()), child(fold.operand())));
                if (fold.nextTail() < 0) {
                    parseUpTo(length);
                    return folded;
                }
                parseUpTo(fold.nextTail());
                parse(fold.nextTail(), folded);
                parseUpTo(length);
                return child(fold.nextTail());
            }
            if (shape instanceof Passthrough passthrough) {
                parseUpTo(passthrough.tail());
                parse(passthrough.tail(), Operand.INHERITED);
                parseUpTo(length);
                return child(passthrough.tail());
            }
            if (shape instanceof Chain chain) {
                Operand prefix = build(chain.prefix(), chain.tail());
                parseUpTo(chain.tail());
                parse(chain.tail(), prefix);
                parseUpTo(length);
                return child(chain.tail());
            }
            if (shape instanceof Factored factored) {
                // the tail's recombined plan translates the prefix, identifier checks included
                List<Operand> prefix = new ArrayList<>();
                for (int i = 0; i < factored.tail(); i++) {
                    deferred.add(i);
                    prefix.add(child(i));
                }
                parseUpTo(factored.tail());
                parse(factored.tail(), new Operand.Bundle(prefix));
                parseUpTo(length);
                return child(factored.tail());
            }
            if (shape instanceof Recombined recombined) {
                offset = recombined.prefixLength();
                return build(recombined.shape(), length);
            }
            if (shape instanceof Structural) {
                parseUpTo(length);
                return Operand.INHERITED;
            }
            throw new IllegalArgumentException("Unknown production shape: " + shape);
        }

        // keyword '(' cond ')' body [elseTail]
        private Operand conditional(Guarded guarded, int length) {
            parseUpTo(guarded.body());
            Temp test = compute(Template.of("not %s", child(guarded.condition())));
            Label exit = label();
            steps.add(new Emit(Template.of("if %s goto %s", test, exit)));
            parseUpTo(guarded.body() + 1);
            if (guarded.elseTail() < 0) {
                parseUpTo(length);
                steps.add(new Emit(Template.of("%s:", exit)));
                return null;
            }
            parseUpTo(guarded.elseTail());
            parse(guarded.elseTail(), exit);
            parseUpTo(length);
            // the tail yields the label that closes the construct
            steps.add(new Emit(Template.of("%s:", child(guarded.elseTail()))));
            return null;
        }

        // the entry label is only known once the condition is translated, so it is inserted
        // in front of the condition's code
        private Operand loop(Guarded guarded, int length) {
            int mark = marks++;
            steps.add(new Mark(mark));
            parseUpTo(guarded.body());
            Temp test = compute(Template.of("not %s", child(guarded.condition())));
            Label entry = label();
            Label exit = label();
            steps.add(new InsertAt(mark, Template.of("%s:", entry)));
            steps.add(new Emit(Template.of("if %s goto %s", test, exit)));
            parseUpTo(length);
            steps.add(new Emit(Template.of("goto %s", entry)));
            steps.add(new Emit(Template.of("%s:", exit)));
            return null;
        }

        // Parses every not yet parsed symbol below end
        private void parseUpTo(int end) {
            while (next < end) parse(next, null);
        }

        private void parse(int index, Operand inherited) {
            if (index >= offset) steps.add(new Parse(index - offset, inherited));
            if (isIdentifier(index) && !deferred.contains(index)) steps.add(new Identifier(child(index), Role.USE));
            next = Math.max(next, index + 1);
        }

        private Operand child(int index) {
            return index < offset ? new Operand.Prefix(index) : new Child(index - offset);
        }

        private Temp compute(Template rhs) {
            Temp temp = new Temp(temps++);
            steps.add(new Compute(temp.slot(), rhs));
            return temp;
        }

        private Label label() {
            Label label = new Label(labels++);
            steps.add(new AllocateLabel(label.slot()));
            return label;
        }

        private boolean isIdentifier(int index) {
            Symbol symbol = symbols.get(index);
            return symbol instanceof Terminal && config.identifierToken().equals(symbol.value());
        }
    }
}
