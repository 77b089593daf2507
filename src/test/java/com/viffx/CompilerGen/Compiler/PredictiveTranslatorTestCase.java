package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.AbstractGeneratorTestCase;
import com.viffx.CompilerGen.Errors.SemanticDiagnostic;
import com.viffx.CompilerGen.Errors.SemanticException;
import com.viffx.CompilerGen.Errors.SyntaxException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.AstNode;
import com.viffx.CompilerGen.Symbols.NonTerminal;
import com.viffx.CompilerGen.Symbols.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.LogRecord;

public class PredictiveTranslatorTestCase extends AbstractGeneratorTestCase {
    private static final String[] DECLARING_GRAMMAR = withDeclarations();

    public PredictiveTranslatorTestCase(String name) {
        super(name);
    }

    public void testAssignment() throws Exception {
        assertInstructions(toyCompiler().compile("x = 10 + 20;"),
                "t1 = 10 + 20",
                "x = t1");
    }

    public void testLeftAssociativeFold() throws Exception {
        assertInstructions(toyCompiler().compile("x = 10 - 3 - 2;"),
                "t1 = 10 - 3",
                "t2 = t1 - 2",
                "x = t2");
    }

    public void testPrecedence() throws Exception {
        assertInstructions(toyCompiler().compile("x = 1 + 2 * 3;"),
                "t1 = 2 * 3",
                "t2 = 1 + t1",
                "x = t2");
        assertInstructions(toyCompiler().compile("x = (1 + 2) * 3;"),
                "t1 = 1 + 2",
                "t2 = t1 * 3",
                "x = t2");
    }

    public void testWhileLoop() throws Exception {
        assertInstructions(toyCompiler().compile("i = 0; while (i < 10) i = i + 1;"),
                "i = 0",
                "L1:",
                "t1 = i < 10",
                "t2 = not t1",
                "if t2 goto L2",
                "t3 = i + 1",
                "i = t3",
                "goto L1",
                "L2:");
    }

    public void testIfWithoutElse() throws Exception {
        assertInstructions(toyCompiler().compile("x = 1; if (x > 0) { y = 1; }"),
                "x = 1",
                "t1 = x > 0",
                "t2 = not t1",
                "if t2 goto L1",
                "y = 1",
                "L1:");
    }

    public void testIfElse() throws Exception {
        assertInstructions(toyCompiler().compile("x = 1; if (x > 0) { y = 1; } else { y = 2; }"),
                "x = 1",
                "t1 = x > 0",
                "t2 = not t1",
                "if t2 goto L1",
                "y = 1",
                "goto L2",
                "L1:",
                "y = 2",
                "L2:");
    }

    public void testNestedControlFlow() throws Exception {
        List<String> instructions = toyCompiler().compile(
                "i = 0;\n" +
                "while (i < 3) {\n" +
                "  if (i == 1) { write(i); } else { read i; }\n" +
                "  i = i + 1;\n" +
                "}\n");
        assertInstructions(instructions,
                "i = 0",
                "L1:",
                "t1 = i < 3",
                "t2 = not t1",
                "if t2 goto L2",
                "t3 = i == 1",
                "t4 = not t3",
                "if t4 goto L3",
                "param i",
                "call write, 1",
                "goto L4",
                "L3:",
                "t5 = call read, 0",
                "i = t5",
                "L4:",
                "t6 = i + 1",
                "i = t6",
                "goto L1",
                "L2:");
    }

    public void testReadAndWrite() throws Exception {
        assertInstructions(toyCompiler().compile("read x; write(x + 1);"),
                "t1 = call read, 0",
                "x = t1",
                "t2 = x + 1",
                "param t2",
                "call write, 1");
    }

    public void testGuardWithMandatoryElse() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Program -> StmtList",
                "StmtList -> Stmt StmtList | ",
                "Stmt -> 'IF' 'LPAREN' Cond 'RPAREN' Stmt 'ELSE' Stmt | 'ID' 'ASSIGN' 'NUM' 'SEMI'",
                "Cond -> 'ID' RelOp 'NUM'",
                "RelOp -> 'LT' | 'GT'"));
        assertInstructions(compiler.compile("x = 1; if (x > 0) y = 1; else y = 2;"),
                "x = 1",
                "t1 = x > 0",
                "t2 = not t1",
                "if t2 goto L1",
                "y = 1",
                "goto L2",
                "L1:",
                "y = 2",
                "L2:");
    }

    public void testFactoredExpression() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'ID' 'ASSIGN' Expr 'SEMI'",
                "Expr -> 'NUM' 'PLUS' 'NUM' | 'NUM'"));
        assertInstructions(compiler.compile("x = 10 + 20;"), "t1 = 10 + 20", "x = t1");
        assertInstructions(compiler.compile("x = 5;"), "x = 5");
    }

    public void testFactoredIdentifierIsCheckedOnce() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'ID' 'ASSIGN' Expr 'SEMI'",
                "Expr -> 'ID' 'PLUS' 'NUM' | 'ID'"));
        try {
            compiler.compile("x = y + 1;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals(1, e.diagnostics().size());
            assertEquals("y", e.diagnostics().get(0).identifier());
            assertEquals(Arrays.asList("t1 = y + 1", "x = t1"), e.instructions());
        }
    }

    public void testScenarioWithImplicitWhitespace() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(
                "ID", "[a-zA-Z_][a-zA-Z0-9_]*",
                "NUM", "[0-9]+",
                "PLUS", "\\+",
                "ASSIGN", "=",
                "SEMI", ";"), grammar(
                "Stmt -> 'ID' 'ASSIGN' Expr 'SEMI'",
                "Expr -> 'NUM' 'PLUS' 'NUM' | 'NUM'"));
        List<String> tokens = new ArrayList<>();
        for (Token token : compiler.tokenize("x = 10 + 20 ;")) tokens.add(token.type() + "(" + token.value() + ")");
        assertEquals(Arrays.asList("ID(x)", "ASSIGN(=)", "NUM(10)", "PLUS(+)", "NUM(20)", "SEMI(;)", "EOF()"), tokens);
        assertInstructions(compiler.compile("x = 10 + 20 ;"), "t1 = 10 + 20", "x = t1");
    }

    public void testLongSharedPrefixAssignment() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'ID' 'ASSIGN' 'NUM' 'SEMI' | 'ID' 'ASSIGN' 'NUM' 'PLUS' 'NUM' 'SEMI'"));
        assertInstructions(compiler.compile("x = 5;"), "x = 5");
        assertInstructions(compiler.compile("x = 1 + 2;"), "t1 = 1 + 2", "x = t1");
    }

    public void testLongSharedPrefixCall() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'WRITE' 'LPAREN' 'NUM' 'RPAREN' 'SEMI' | 'WRITE' 'LPAREN' 'NUM' 'COMMA' 'NUM' 'RPAREN' 'SEMI'"));
        assertInstructions(compiler.compile("write(5);"), "param 5", "call write, 1");
    }

    public void testRepeatedFactoring() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'ID' 'ASSIGN' 'NUM' 'SEMI' | 'ID' 'ASSIGN' 'NUM' 'PLUS' 'NUM' 'SEMI' | 'ID' 'ASSIGN' 'ID' 'SEMI'"));
        assertInstructions(compiler.compile("x = 5;"), "x = 5");
        assertInstructions(compiler.compile("x = 1 + 2;"), "t1 = 1 + 2", "x = t1");
        try {
            compiler.compile("x = y;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            // only the right hand side is a use
            assertEquals(1, e.diagnostics().size());
            assertEquals("y", e.diagnostics().get(0).identifier());
            assertEquals(List.of("x = y"), e.instructions());
        }
    }

    public void testFactoredRecursionTail() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Program -> Stmt Program | ",
                "Stmt -> 'ID' 'ASSIGN' E 'SEMI'",
                "E -> E 'PLUS' 'NUM' | E 'PLUS' 'ID' | 'NUM'"));
        assertInstructions(compiler.compile("y = 3; x = 1 + 2 + y;"),
                "y = 3",
                "t1 = 1 + 2",
                "t2 = t1 + y",
                "x = t2");
    }

    public void testFactoredOptionalElse() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Program -> Stmt Program | ",
                "Stmt -> 'IF' 'LPAREN' Cond 'RPAREN' Block | 'IF' 'LPAREN' Cond 'RPAREN' Block 'ELSE' Block | 'ID' 'ASSIGN' 'NUM' 'SEMI'",
                "Block -> 'LBRACE' Program 'RBRACE'",
                "Cond -> 'ID'"));
        assertInstructions(compiler.compile("x = 1; if (x) { x = 2; } else { x = 3; }"),
                "x = 1",
                "t1 = not x",
                "if t1 goto L1",
                "x = 2",
                "goto L2",
                "L1:",
                "x = 3",
                "L2:");
        assertInstructions(compiler.compile("x = 1; if (x) { x = 2; }"),
                "x = 1",
                "t1 = not x",
                "if t1 goto L1",
                "x = 2",
                "L1:");
    }

    public void testLongStatementList() throws Exception {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 10000; i++) source.append("x = 1;\n");
        List<String> instructions = toyCompiler().compile(source.toString());
        assertEquals(10000, instructions.size());
        assertEquals("x = 1", instructions.get(9999));
    }

    public void testLongExpression() throws Exception {
        StringBuilder source = new StringBuilder("x = 1");
        for (int i = 1; i < 5000; i++) source.append(" + 1");
        List<String> instructions = toyCompiler().compile(source.append(";").toString());
        assertEquals(5000, instructions.size());
        assertEquals("t4999 = t4998 + 1", instructions.get(4998));
        assertEquals("x = t4999", instructions.get(4999));
    }

    public void testSkippedInstructionIsLogged() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(
                "Stmt -> 'ID' 'ASSIGN' E 'SEMI'",
                "E -> E 'PLUS' 'NUM' | 'MINUS' 'NUM' | 'NUM'"));
        List<LogRecord> warnings = recordWarnings();
        // the unary minus alternative has no value to fold into
        assertTrue(compiler.compile("x = - 5 + 1;").isEmpty());
        boolean named = false;
        for (LogRecord record : warnings) named |= record.getMessage().contains("E_TAIL > 'PLUS' 'NUM' E_TAIL;");
        assertTrue(warnings.toString(), named);
    }

    public void testUndeclaredUse() throws Exception {
        try {
            toyCompiler().compile("count = 1;\nx = cuont + 1;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals(1, e.diagnostics().size());
            SemanticDiagnostic diagnostic = e.diagnostics().get(0);
            assertEquals("cuont", diagnostic.identifier());
            assertEquals(2, diagnostic.line());
            assertEquals(5, diagnostic.column());
            assertEquals("did you mean 'count'?", diagnostic.hint());
            // translation still completes
            assertEquals(Arrays.asList("count = 1", "t1 = cuont + 1", "x = t1"), e.instructions());
        }
    }

    public void testEveryUndeclaredUseIsReported() throws Exception {
        try {
            toyCompiler().compile("a = b + c;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals(2, e.diagnostics().size());
            assertEquals("b", e.diagnostics().get(0).identifier());
            assertEquals("c", e.diagnostics().get(1).identifier());
            assertEquals("", e.diagnostics().get(0).hint());
        }
    }

    public void testSemanticChecksCanBeDisabled() throws Exception {
        GeneratorConfig unchecked = config().toBuilder().semanticChecks(false).build();
        GeneratedCompiler compiler = new CompilerFactory(unchecked).create(rules(TOY_RULES), grammar(TOY_GRAMMAR));
        assertInstructions(compiler.compile("a = b;"), "a = b");
    }

    public void testExplicitDeclarations() throws Exception {
        GeneratedCompiler compiler = new CompilerFactory(config()).create(rules(TOY_RULES), grammar(DECLARING_GRAMMAR));
        assertInstructions(compiler.compile("var a, b; a = 1; b = a;"), "a = 1", "b = a");
        try {
            compiler.compile("var total; totl = 1;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals(1, e.diagnostics().size());
            assertEquals("totl", e.diagnostics().get(0).identifier());
            assertEquals("did you mean 'total'?", e.diagnostics().get(0).hint());
            assertEquals(List.of("totl = 1"), e.instructions());
        }
        try {
            compiler.compile("var total; zzzzzz = 1;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals("declared identifiers: total", e.diagnostics().get(0).hint());
        }
    }

    public void testExplicitDeclarationsCanBeTurnedOff() throws Exception {
        GeneratorConfig implicit = config().toBuilder().requireExplicitDeclaration(false).build();
        GeneratedCompiler compiler = new CompilerFactory(implicit).create(rules(TOY_RULES), grammar(DECLARING_GRAMMAR));
        assertInstructions(compiler.compile("x = 1; y = x;"), "x = 1", "y = x");
    }

    public void testSyntaxErrorListsExpectedTokens() throws Exception {
        try {
            toyCompiler().compile("x = ;");
            fail("expected a SyntaxException");
        } catch (SyntaxException e) {
            assertEquals(Set.of("ID", "LPAREN", "NUM"), e.expected());
            assertEquals("SEMI", e.actual());
            assertEquals(1, e.line());
            assertEquals(5, e.column());
        }
    }

    public void testMissingTerminatorAtEnd() throws Exception {
        try {
            toyCompiler().compile("x = 1");
            fail("expected a SyntaxException");
        } catch (SyntaxException e) {
            assertEquals(Set.of("SEMI"), e.expected());
            assertEquals("EOF", e.actual());
        }
    }

    public void testTrailingInput() throws Exception {
        try {
            toyCompiler().compile("x = 1; }");
            fail("expected a SyntaxException");
        } catch (SyntaxException e) {
            assertEquals("RBRACE", e.actual());
            assertEquals(8, e.column());
        }
    }

    public void testRunsAreIndependent() throws Exception {
        GeneratedCompiler compiler = toyCompiler();
        try {
            compiler.compile("a = b;");
            fail("expected a SemanticException");
        } catch (SemanticException expected) {
        }
        assertInstructions(compiler.compile("b = 1 + 2;"), "t1 = 1 + 2", "b = t1");
        assertInstructions(compiler.compile("b = 1 + 2;"), "t1 = 1 + 2", "b = t1");
        // names declared by an earlier run are forgotten
        try {
            compiler.compile("c = b;");
            fail("expected a SemanticException");
        } catch (SemanticException e) {
            assertEquals("b", e.diagnostics().get(0).identifier());
        }
    }

    public void testAlternateStartSymbol() throws Exception {
        GeneratedCompiler compiler = toyCompiler();
        List<String> instructions = compiler.translator().translate(compiler.tokenize("1 + 2"), "Expr");
        assertInstructions(instructions, "t1 = 1 + 2");
        try {
            compiler.translator().translate(compiler.tokenize("1"), "Nowhere");
            fail("expected an IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
        }
    }

    public void testRetainTree() throws Exception {
        assertNull(toyCompiler().translator().lastTree());
        GeneratorConfig retaining = config().toBuilder().retainTree(true).build();
        GeneratedCompiler compiler = new CompilerFactory(retaining).create(rules(TOY_RULES), grammar(TOY_GRAMMAR));
        compiler.compile("x = 1;");
        AstNode tree = compiler.translator().lastTree();
        assertNotNull(tree);
        assertEquals(new NonTerminal("Program"), tree.symbol());
        assertEquals(1, tree.children().size());
        assertTrue(tree.dump(), tree.dump().contains("'ID' = x"));
    }

    public void testEmptyProgram() throws Exception {
        assertTrue(toyCompiler().compile("// nothing here\n").isEmpty());
    }

    private static String[] withDeclarations() {
        String[] lines = Arrays.copyOf(TOY_GRAMMAR, TOY_GRAMMAR.length + 2);
        lines[2] = lines[2] + " | 'VAR' IdList 'SEMI'";
        lines[TOY_GRAMMAR.length] = "IdList -> 'ID' IdTail";
        lines[TOY_GRAMMAR.length + 1] = "IdTail -> 'COMMA' 'ID' IdTail | ";
        return lines;
    }
}
