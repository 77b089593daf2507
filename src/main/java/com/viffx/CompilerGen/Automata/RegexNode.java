package com.viffx.CompilerGen.Automata;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Regular expression syntax tree. {@code +} and {@code ?} never appear here: the parser
 * desugars them into {@link Concat}/{@link Closure} and {@link Alternate}/{@link Empty}.
 */
public sealed interface RegexNode {
    record Literal(char c) implements RegexNode {
        @Override
        public String toString() {
            return printable(c);
        }
    }

    record Concat(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public String toString() {
            return "(" + left + right + ")";
        }
    }

    record Alternate(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public String toString() {
            return "(" + left + "|" + right + ")";
        }
    }

    record Closure(RegexNode inner) implements RegexNode {
        @Override
        public String toString() {
            return inner + "*";
        }
    }

    record CharClass(Set<Character> members) implements RegexNode {
        public CharClass {
            if (members.isEmpty()) throw new IllegalArgumentException("character class cannot be empty");
            members = Set.copyOf(members);
        }

        @Override
        public String toString() {
            return new TreeSet<>(members).stream()
                    .map(RegexNode::printable)
                    .collect(Collectors.joining("", "[", "]"));
        }
    }

    /** Matches the empty string. */
    record Empty() implements RegexNode {
        @Override
        public String toString() {
            return "ε";
        }
    }

    private static String printable(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\t' -> "\\t";
            case '\r' -> "\\r";
            default -> String.valueOf(c);
        };
    }
}
