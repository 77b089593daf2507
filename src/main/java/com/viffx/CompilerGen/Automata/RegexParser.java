package com.viffx.CompilerGen.Automata;

import com.viffx.CompilerGen.Automata.RegexNode.*;
import com.viffx.CompilerGen.Errors.PatternException;

import java.util.HashSet;
import java.util.Set;

/**
 * Recursive descent parser for rule patterns.
 * <pre>
 *   regex  := branch ('|' branch)*
 *   branch := piece piece*
 *   piece  := atom ('*' | '+' | '?')*
 *   atom   := char | '\' escape | '[' '^'? item+ ']' | '(' ('?:')? regex ')'
 * </pre>
 * {@code .} has no special meaning and matches itself.
 */
public class RegexParser {
    // Complement universe for negated classes: printable ASCII plus tab, newline and carriage return
    private static final Set<Character> UNIVERSE = new HashSet<>();
    static {
        for (char c = 32; c <= 126; c++) UNIVERSE.add(c);
        UNIVERSE.add('\t');
        UNIVERSE.add('\n');
        UNIVERSE.add('\r');
    }

    private final String ruleName;
    private final String pattern;
    private int index = 0;

    private RegexParser(String ruleName, String pattern) {
        this.ruleName = ruleName;
        this.pattern = pattern;
    }

    /**
     * Parses one rule's pattern.
     *
     * @param ruleName the owning rule, reported in errors
     * @param pattern  the pattern text
     * @return the syntax tree
     * @throws PatternException if the pattern is malformed
     */
    public static RegexNode parse(String ruleName, String pattern) throws PatternException {
        RegexParser parser = new RegexParser(ruleName, pattern);
        if (pattern.isEmpty()) throw parser.error("empty pattern");
        RegexNode node = parser.regex();
        if (!parser.eof()) {
            // regex() only stops early on an unmatched ')'
            throw parser.error("unbalanced ')'");
        }
        return node;
    }

    private RegexNode regex() throws PatternException {
        RegexNode node = branch();
        while (!eof() && peek() == '|') {
            index++;
            node = new Alternate(node, branch());
        }
        return node;
    }

    private RegexNode branch() throws PatternException {
        if (eof() || peek() == '|' || peek() == ')') {
            throw error(index > 0 && pattern.charAt(index - 1) == '(' ? "empty group" : "empty alternation branch");
        }
        RegexNode node = piece();
        while (!eof() && peek() != '|' && peek() != ')') {
            node = new Concat(node, piece());
        }
        return node;
    }

    private RegexNode piece() throws PatternException {
        RegexNode node = atom();
        while (!eof()) {
            char c = peek();
            if (c == '*') node = new Closure(node);
            else if (c == '+') node = new Concat(node, new Closure(node));
            else if (c == '?') node = new Alternate(node, new Empty());
            else break;
            index++;
        }
        return node;
    }

    private RegexNode atom() throws PatternException {
        char c = next();
        switch (c) {
            case '(':
                if (pattern.startsWith("?:", index)) index += 2;
                if (eof()) throw error("unbalanced '('");
                RegexNode inner = regex();
                if (eof()) throw error("unbalanced '('");
                index++; // ')'
                return inner;
            case '[':
                return charClass();
            case '\\':
                return escape();
            case '*':
            case '+':
            case '?':
                throw error("dangling quantifier '" + c + "'");
            default:
                return new Literal(c);
        }
    }

    private RegexNode charClass() throws PatternException {
        int start = index - 1;
        boolean negated = !eof() && peek() == '^';
        if (negated) index++;

        Set<Character> members = new HashSet<>();
        boolean first = true;
        while (true) {
            if (eof()) {
                index = start;
                throw error("unterminated character class");
            }
            int itemStart = index;
            char c = next();
            if (c == ']') {
                if (first) throw error("empty character class");
                break;
            }
            first = false;

            // shorthand escapes expand to a set and cannot start a range
            if (c == '\\') {
                Set<Character> shorthand = shorthand();
                if (shorthand != null) {
                    members.addAll(shorthand);
                    continue;
                }
                c = escapedChar();
            }

            // a '-' that is the last item of the class is a literal
            if (!eof() && peek() == '-' && index + 1 < pattern.length() && pattern.charAt(index + 1) != ']') {
                index++;
                char end = next();
                if (end == '\\') {
                    if (shorthand() != null) throw error("invalid range end");
                    end = escapedChar();
                }
                if (end < c) {
                    index = itemStart;
                    throw error("invalid range");
                }
                for (char x = c; x <= end; x++) {
                    members.add(x);
                    if (x == Character.MAX_VALUE) break;
                }
            } else {
                members.add(c);
            }
        }

        if (negated) {
            Set<Character> complement = new HashSet<>(UNIVERSE);
            complement.removeAll(members);
            if (complement.isEmpty()) throw error("negated character class matches nothing");
            return new CharClass(complement);
        }
        return new CharClass(members);
    }

    private RegexNode escape() throws PatternException {
        Set<Character> shorthand = shorthand();
        if (shorthand != null) return new CharClass(shorthand);
        return new Literal(escapedChar());
    }

    // Consumes a class escape (\d \w \s) after the backslash, or returns null without consuming
    private Set<Character> shorthand() throws PatternException {
        if (eof()) throw error("dangling '\\'");
        Set<Character> set = new HashSet<>();
        switch (peek()) {
            case 'd':
                for (char c = '0'; c <= '9'; c++) set.add(c);
                break;
            case 'w':
                for (char c = '0'; c <= '9'; c++) set.add(c);
                for (char c = 'a'; c <= 'z'; c++) set.add(c);
                for (char c = 'A'; c <= 'Z'; c++) set.add(c);
                set.add('_');
                break;
            case 's':
                set.add(' ');
                set.add('\t');
                set.add('\n');
                set.add('\r');
                set.add('\f');
                break;
            default:
                return null;
        }
        index++;
        return set;
    }

    // Consumes a single-character escape after the backslash
    private char escapedChar() throws PatternException {
        if (eof()) throw error("dangling '\\'");
        char c = next();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case 'f': return '\f';
            case '0': return '\0';
            default:
                if (Character.isLetterOrDigit(c)) {
                    index--;
                    throw error("invalid escape '\\" + c + "'");
                }
                return c;
        }
    }

    private boolean eof() {
        return index >= pattern.length();
    }

    private char peek() {
        return pattern.charAt(index);
    }

    private char next() {
        return pattern.charAt(index++);
    }

    private PatternException error(String reason) {
        return new PatternException(ruleName, pattern, index, reason);
    }
}
