package com.viffx.CompilerGen.Compiler;

import com.viffx.CompilerGen.AbstractGeneratorTestCase;
import com.viffx.CompilerGen.Automata.AutomatonCompiler;
import com.viffx.CompilerGen.Errors.LexicalException;
import com.viffx.CompilerGen.GeneratorConfig;
import com.viffx.CompilerGen.Symbols.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class LexerTestCase extends AbstractGeneratorTestCase {

    public LexerTestCase(String name) {
        super(name);
    }

    public void testMaximalMunch() throws Exception {
        List<Token> tokens = toyLexer().tokenize("x==1=y");
        assertEquals(List.of("ID", "EQ", "NUM", "ASSIGN", "ID", "EOF"), types(tokens));
        assertEquals("==", tokens.get(1).value());
    }

    public void testKeywordsVersusIdentifiers() throws Exception {
        List<Token> tokens = toyLexer().tokenize("while whilex if iff");
        assertEquals(List.of("WHILE", "ID", "IF", "ID", "EOF"), types(tokens));
    }

    public void testSkipTokensAreDropped() throws Exception {
        List<Token> tokens = toyLexer().tokenize("a // note\n  b");
        assertEquals(List.of("ID", "ID", "EOF"), types(tokens));
    }

    public void testPositions() throws Exception {
        List<Token> tokens = toyLexer().tokenize("x = 1;\n  y = 22;");
        Token y = tokens.get(4);
        assertEquals("y", y.value());
        assertEquals(2, y.line());
        assertEquals(3, y.column());
        Token number = tokens.get(6);
        assertEquals("22", number.value());
        assertEquals(2, number.line());
        assertEquals(7, number.column());
    }

    public void testEofAlwaysLast() throws Exception {
        List<Token> empty = toyLexer().tokenize("");
        assertEquals(1, empty.size());
        assertTrue(empty.get(0).isEof());
        assertEquals("", empty.get(0).value());

        List<Token> tokens = toyLexer().tokenize("a\n");
        Token eof = tokens.get(tokens.size() - 1);
        assertTrue(eof.isEof());
        assertEquals(2, eof.line());
        assertEquals(1, eof.column());
    }

    public void testScanReconstructsInput() throws Exception {
        String text = "while (i < 10) {\n\ti = i + 1; // step\n}\n";
        List<Token> tokens = toyLexer().scan(text);
        String rebuilt = tokens.stream().map(Token::value).collect(Collectors.joining());
        assertEquals(text, rebuilt);
    }

    public void testImplicitWhitespace() throws Exception {
        LexerFixture fixture = new LexerFixture(config(), "ID", "[a-z]+");
        List<Token> scanned = fixture.lexer.scan("ab cd");
        assertEquals(List.of("ID", Lexer.IMPLICIT_WHITESPACE, "ID", "EOF"), types(scanned));
        assertEquals(List.of("ID", "ID", "EOF"), types(fixture.lexer.tokenize("ab cd")));

        GeneratorConfig strict = config().toBuilder().implicitWhitespace(false).build();
        try {
            new LexerFixture(strict, "ID", "[a-z]+").lexer.tokenize("ab cd");
            fail("expected a LexicalException");
        } catch (LexicalException e) {
            assertEquals(1, e.line());
            assertEquals(3, e.column());
            assertEquals(' ', e.character());
        }
    }

    public void testUnexpectedCharacter() throws Exception {
        try {
            toyLexer().tokenize("x = 1;\ny = 2 @ 3;");
            fail("expected a LexicalException");
        } catch (LexicalException e) {
            assertEquals(2, e.line());
            assertEquals(7, e.column());
            assertEquals('@', e.character());
            assertTrue(e.getMessage(), e.getMessage().contains("'@'"));
        }
    }

    public void testFallsBackToLastAcceptingPosition() throws Exception {
        // "ab" is a prefix of "abc" but only "a" and "abc" are tokens
        LexerFixture fixture = new LexerFixture(config(), "ABC", "abc", "A", "a", "B", "b");
        assertEquals(List.of("A", "B", "A", "B", "EOF"), types(fixture.lexer.tokenize("abab")));
        assertEquals(List.of("ABC", "A", "EOF"), types(fixture.lexer.tokenize("abca")));
    }

    private Lexer toyLexer() throws Exception {
        return new LexerFixture(config(), TOY_RULES).lexer;
    }

    private static List<String> types(List<Token> tokens) {
        List<String> types = new ArrayList<>();
        for (Token token : tokens) types.add(token.type());
        return types;
    }

    private static final class LexerFixture {
        private final Lexer lexer;

        private LexerFixture(GeneratorConfig config, String... rules) throws Exception {
            lexer = new Lexer(new AutomatonCompiler(config).compile(rules(rules)), config);
        }
    }
}
