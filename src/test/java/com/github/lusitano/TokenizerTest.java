package com.github.lusitano;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.lusitano.Tokenizer.Token;
import com.github.lusitano.Tokenizer.TokenType;
import com.github.lusitano.diagnostics.Diagnostic;
import com.github.lusitano.diagnostics.Diagnostics;

public class TokenizerTest {

    @ParameterizedTest
    @MethodSource("tokenTypes")
    void testTokenTypes(String code, List<TokenType> expected) {
        var diagnostics = new Diagnostics();
        var tokens = new Tokenizer().tokenize(code, diagnostics);

        assertEquals(expected, tokens.asList().stream().map(Token::type).toList());
        assertTrue(diagnostics.isEmpty(), () -> diagnostics.all().toString());
    }

    @ParameterizedTest
    @MethodSource("literals")
    void testLiteralValues(String code, TokenType type, Object value) {
        var diagnostics = new Diagnostics();
        var token = new Tokenizer().tokenize(code, diagnostics).next();

        assertEquals(type, token.type());
        assertEquals(value, token.value());
        assertTrue(diagnostics.isEmpty(), () -> diagnostics.all().toString());
    }

    @Test
    void positionsAreOneBased() {
        var tokens = new Tokenizer().tokenize("var x\n  = 1", new Diagnostics()).asList();

        assertEquals(new Token(TokenType.VAR, "var", null, 1, 1), tokens.get(0));
        assertEquals(new Token(TokenType.IDENTIFIER, "x", null, 1, 5), tokens.get(1));
        assertEquals(new Token(TokenType.EQUALS, "=", null, 2, 3), tokens.get(2));
        assertEquals(new Token(TokenType.NUMBER, "1", 1L, 2, 5), tokens.get(3));
        assertEquals(TokenType.EOF, tokens.get(4).type());
    }

    @Test
    void commentsAreSkipped() {
        var tokens = new Tokenizer().tokenize("a // x\n/* y\n z */ b", new Diagnostics()).asList();

        assertEquals(3, tokens.size());
        assertEquals("a", tokens.get(0).image());
        assertEquals("b", tokens.get(1).image());
        assertEquals(3, tokens.get(1).line());
        assertEquals(7, tokens.get(1).column());
    }

    @Test
    void unknownCharacterIsReportedAndScanningContinues() {
        var diagnostics = new Diagnostics();
        var tokens = new Tokenizer().tokenize("x @ y", diagnostics).asList();

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), tokens.stream().map(Token::type).toList());
        assertEquals(1, diagnostics.size());
        var error = diagnostics.all().get(0);
        assertEquals(Diagnostic.Kind.LEXICAL_ERROR, error.kind());
        assertEquals(1, error.line());
        assertEquals(3, error.column());
    }

    @Test
    void exclamationMarkSuggestsNao() {
        var diagnostics = new Diagnostics();
        new Tokenizer().tokenize("se (!ok) { }", diagnostics);

        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.all().get(0).message().contains("nao"));
    }

    @Test
    void everyLexicalErrorIsCollected() {
        var diagnostics = new Diagnostics();
        new Tokenizer().tokenize("@ #\n$", diagnostics);

        assertEquals(3, diagnostics.size());
        assertEquals(2, diagnostics.all().get(2).line());
    }

    @Test
    void unterminatedStringStopsAtEndOfLine() {
        var diagnostics = new Diagnostics();
        var tokens = new Tokenizer().tokenize("\"abc\nx", diagnostics).asList();

        assertEquals(1, diagnostics.size());
        assertEquals(1, diagnostics.all().get(0).line());
        assertEquals(1, diagnostics.all().get(0).column());
        assertEquals(new Token(TokenType.IDENTIFIER, "x", null, 2, 1), tokens.get(0));
    }

    @Test
    void unterminatedBlockComment() {
        var diagnostics = new Diagnostics();
        var tokens = new Tokenizer().tokenize("a /* b", diagnostics).asList();

        assertEquals(1, diagnostics.size());
        assertEquals(3, diagnostics.all().get(0).column());
        assertEquals(2, tokens.size());
    }

    @Test
    void malformedExponent() {
        var diagnostics = new Diagnostics();
        new Tokenizer().tokenize("1e+", diagnostics);

        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.LEXICAL_ERROR, diagnostics.all().get(0).kind());
    }

    @Test
    void bareExponentIsNumberFollowedByKeyword() {
        var diagnostics = new Diagnostics();
        var tokens = new Tokenizer().tokenize("1e", diagnostics).asList();

        assertTrue(diagnostics.isEmpty());
        assertEquals(List.of(TokenType.NUMBER, TokenType.E, TokenType.EOF), tokens.stream().map(Token::type).toList());
    }

    @Test
    void integerOverflow() {
        var diagnostics = new Diagnostics();
        var token = new Tokenizer().tokenize("99999999999999999999", diagnostics).next();

        assertEquals(1, diagnostics.size());
        assertEquals(TokenType.NUMBER, token.type());
    }

    @Test
    void lookaheadAndExpectedTokens() {
        var tokens = new Tokenizer().tokenize("leia(n)", new Diagnostics());

        assertEquals(TokenType.IDENTIFIER, tokens.peek(2).type());
        assertEquals(TokenType.EOF, tokens.peek(10).type());
        tokens.next(TokenType.LEIA);

        var e = assertThrows(SyntaxErrorException.class, () -> tokens.next(TokenType.RPAREN));
        assertEquals("')'", e.expected());
        assertEquals(TokenType.LPAREN, e.found().type());
        assertEquals("expected ')' but found '('", e.getMessage());
    }

    @Test
    void nextStaysAtEndOfFile() {
        var tokens = new Tokenizer().tokenize("", new Diagnostics());

        assertEquals(TokenType.EOF, tokens.next().type());
        assertEquals(TokenType.EOF, tokens.next().type());
        assertEquals(0, tokens.position());
    }

    private static Object[][] tokenTypes() {
        return new Object[][] {
            {
                "se senao senaose seX Se",
                List.of(TokenType.SE, TokenType.SENAO, TokenType.SENAOSE, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF)
            }, {
                "** * <= < == = += != -= /= *=",
                List.of(TokenType.STAR_STAR, TokenType.STAR, TokenType.LE, TokenType.LT, TokenType.EQUALS_EQUALS,
                        TokenType.EQUALS, TokenType.PLUS_EQUALS, TokenType.NOT_EQUALS, TokenType.MINUS_EQUALS,
                        TokenType.SLASH_EQUALS, TokenType.STAR_EQUALS, TokenType.EOF)
            }, {
                "var x: inteiro = 25;",
                List.of(TokenType.VAR, TokenType.IDENTIFIER, TokenType.COLON, TokenType.INTEIRO, TokenType.EQUALS,
                        TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF)
            }, {
                "a/b//c",
                List.of(TokenType.IDENTIFIER, TokenType.SLASH, TokenType.IDENTIFIER, TokenType.EOF)
            }, {
                "_valor2 paraTexto(x)",
                List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.IDENTIFIER,
                        TokenType.RPAREN, TokenType.EOF)
            }, {
                "x-1",
                List.of(TokenType.IDENTIFIER, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF)
            }
        };
    }

    private static Object[][] literals() {
        return new Object[][] {
            { "42", TokenType.NUMBER, 42L },
            { "3.14", TokenType.DECIMAL, 3.14 },
            { "1e3", TokenType.DECIMAL, 1000.0 },
            { "2.5E-3", TokenType.DECIMAL, 0.0025 },
            { "\"a\\\"b\"", TokenType.STRING, "a\"b" },
            { "'tab\\tfim'", TokenType.STRING, "tab\tfim" },
            { "'c'", TokenType.STRING, "c" },
            { "\"\"", TokenType.STRING, "" },
            { "'sem \\q escape'", TokenType.STRING, "sem \\q escape" },
        };
    }

}
