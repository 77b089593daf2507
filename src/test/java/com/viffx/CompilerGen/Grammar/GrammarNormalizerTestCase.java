package com.viffx.CompilerGen.Grammar;

import com.viffx.CompilerGen.AbstractGeneratorTestCase;
import com.viffx.CompilerGen.Errors.GrammarConflictException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.NonTerminal;
import com.viffx.CompilerGen.Symbols.Terminal;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class GrammarNormalizerTestCase extends AbstractGeneratorTestCase {

    public GrammarNormalizerTestCase(String name) {
        super(name);
    }

    public void testImmediateLeftRecursion() throws Exception {
        NormalizedGrammar normalized = normalize("E -> E 'PLUS' 'NUM' | 'NUM'");
        Grammar grammar = normalized.grammar();
        assertEquals("E > 'NUM' E_TAIL;\n" +
                "E_TAIL > 'PLUS' 'NUM' E_TAIL;\n" +
                "E_TAIL > EPSILON();\n", grammar.toString());
        assertEquals(NonTerminal.Kind.RECURSION_TAIL, grammar.kind(grammar.nonTerminal("E_TAIL")));
        assertEquals(List.of(Set.of("PLUS"), Set.of("EOF")), normalized.selectors("E_TAIL"));
    }

    public void testSeveralRecursiveAlternatives() throws Exception {
        NormalizedGrammar normalized = normalize("E -> E 'PLUS' 'NUM' | E 'MINUS' 'NUM' | 'NUM' | 'ID'");
        assertEquals(List.of(Set.of("NUM"), Set.of("ID")), normalized.selectors("E"));
        assertEquals(List.of(Set.of("PLUS"), Set.of("MINUS"), Set.of("EOF")), normalized.selectors("E_TAIL"));
    }

    public void testTailNameAvoidsCollisions() throws Exception {
        NormalizedGrammar normalized = normalize(
                "S -> E E_TAIL",
                "E -> E 'PLUS' 'NUM' | 'NUM'",
                "E_TAIL -> 'SEMI'");
        Grammar grammar = normalized.grammar();
        assertTrue(grammar.nonTerminal("E_TAIL2") >= 0);
        assertEquals(NonTerminal.Kind.DECLARED, grammar.kind(grammar.nonTerminal("E_TAIL")));
        assertEquals(NonTerminal.Kind.RECURSION_TAIL, grammar.kind(grammar.nonTerminal("E_TAIL2")));
    }

    public void testCyclicAlternativeIsDropped() throws Exception {
        NormalizedGrammar normalized = normalize("A -> A | 'X'");
        assertEquals("A > 'X' A_TAIL;\nA_TAIL > EPSILON();\n", normalized.grammar().toString());
    }

    public void testLeftRecursionWithoutBase() {
        try {
            normalize("A -> A 'X'");
            fail("expected an IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("A"));
        } catch (Exception e) {
            fail("unexpected " + e);
        }
    }

    public void testLeftFactoring() throws Exception {
        NormalizedGrammar normalized = normalize("S -> 'IF' 'ID' 'THEN' 'ID' | 'IF' 'ID' 'THEN' 'ID' 'ELSE' 'ID'");
        Grammar grammar = normalized.grammar();
        assertEquals("S > 'IF' 'ID' 'THEN' 'ID' S_LF_1;\n" +
                "S_LF_1 > EPSILON();\n" +
                "S_LF_1 > 'ELSE' 'ID';\n", grammar.toString());

        NonTerminal tail = (NonTerminal) grammar.symbol(grammar.nonTerminal("S_LF_1"));
        assertEquals(NonTerminal.Kind.FACTOR_TAIL, tail.kind());
        assertEquals(alternative("'IF' 'ID' 'THEN' 'ID'"), tail.prefix());
        assertEquals(List.of(Set.of("EOF"), Set.of("ELSE")), normalized.selectors("S_LF_1"));
    }

    public void testFactoringIsRepeatedUntilNoPrefixIsShared() throws Exception {
        NormalizedGrammar normalized = normalize("S -> 'A' 'B' 'C' | 'A' 'B' 'D' | 'A' 'E'");
        Grammar grammar = normalized.grammar();
        grammar.forEachNonTerminal(nt -> {
            List<Set<String>> selectors = normalized.selectors(grammar.name(nt));
            for (int i = 0; i < selectors.size(); i++) {
                for (int j = i + 1; j < selectors.size(); j++) {
                    Set<String> overlap = new HashSet<>(selectors.get(i));
                    overlap.retainAll(selectors.get(j));
                    assertTrue(grammar.name(nt) + " overlaps on " + overlap, overlap.isEmpty());
                }
            }
        });
        assertEquals(1, normalized.selectors("S").size());
    }

    public void testFactoringCanBeDisabled() throws Exception {
        GeneratorConfig noFactoring = config().toBuilder().leftFactoring(false).build();
        try {
            new GrammarNormalizer(noFactoring).normalize(grammar("E -> 'NUM' 'PLUS' 'NUM' | 'NUM'"));
            fail("expected a GrammarConflictException");
        } catch (GrammarConflictException e) {
            assertEquals("E", e.nonTerminal());
            assertEquals("NUM", e.token());
        }
    }

    public void testIndirectConflictSurvivesFactoring() {
        try {
            normalize("A -> B 'PLUS' | 'NUM'", "B -> 'NUM'");
            fail("expected a GrammarConflictException");
        } catch (GrammarConflictException e) {
            assertEquals("A", e.nonTerminal());
            assertEquals("NUM", e.token());
            assertTrue(e.getMessage(), e.getMessage().contains("A > B 'PLUS';"));
            assertTrue(e.getMessage(), e.getMessage().contains("A > 'NUM';"));
        } catch (Exception e) {
            fail("unexpected " + e);
        }
    }

    public void testFirstAndFollow() throws Exception {
        NormalizedGrammar normalized = normalize(TOY_GRAMMAR);
        assertEquals(Set.of("ID", "LPAREN", "NUM"), normalized.first("Factor"));
        assertEquals(Set.of("ID", "WHILE", "IF", "READ", "WRITE", "LBRACE"), normalized.first("Stmt"));
        assertTrue(normalized.first("StmtList").contains("EPSILON"));

        assertEquals(Set.of("EOF", "RBRACE"), normalized.follow("StmtList"));
        assertEquals(Set.of("SEMI", "RPAREN", "LT", "GT", "EQ"), normalized.follow("Expr"));
        assertEquals(Set.of("EOF", "ID", "IF", "LBRACE", "RBRACE", "READ", "WHILE", "WRITE"), normalized.follow("Stmt"));
        assertEquals(normalized.follow("Stmt"), normalized.follow("ElsePart"));
    }

    public void testSelectorsOfNullableAlternative() throws Exception {
        NormalizedGrammar normalized = normalize(TOY_GRAMMAR);
        List<Set<String>> selectors = normalized.selectors("ElsePart");
        assertEquals(Set.of("ELSE"), selectors.get(0));
        assertEquals(normalized.follow("ElsePart"), selectors.get(1));
        assertEquals(Set.of("EOF", "ID", "IF", "LBRACE", "RBRACE", "READ", "WHILE", "WRITE"),
                normalized.expected(normalized.grammar().nonTerminal("StmtList")));
    }

    public void testPrediction() throws Exception {
        NormalizedGrammar normalized = normalize(TOY_GRAMMAR);
        Grammar grammar = normalized.grammar();
        int stmt = grammar.nonTerminal("Stmt");
        int production = normalized.predict(stmt, grammar.index(Terminal.of("WHILE")));
        assertEquals("Stmt > 'WHILE' 'LPAREN' Cond 'RPAREN' Stmt;", grammar.toString(grammar.production(production)));
        assertEquals(-1, normalized.predict(stmt, grammar.index(Terminal.of("SEMI"))));
    }

    public void testUnproductiveNonTerminal() {
        try {
            normalize("A -> 'X' | B", "B -> 'Y' B");
            fail("expected an IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("B"));
        } catch (Exception e) {
            fail("unexpected " + e);
        }
    }

    public void testUndefinedNonTerminal() {
        try {
            grammar("A -> 'X' Missing");
            fail("expected an IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Missing"));
        }
    }

    public void testUndefinedStart() {
        try {
            Grammar.of(ruleMap("A -> 'X'"), "S");
            fail("expected an IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
        }
    }
}
