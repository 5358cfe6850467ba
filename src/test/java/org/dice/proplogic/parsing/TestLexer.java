package org.dice.proplogic.parsing;

import org.dice.proplogic.exception.LexException;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.dice.proplogic.parsing.TokenType.*;

public class TestLexer {

    @Test
    public void recognizesOperators() {

        Assert.assertArrayEquals(
                new TokenType[]{VARIABLE, AND, VARIABLE, OR, VARIABLE, IMPLIES, NOT, VARIABLE},
                tokenize("a && b || c -> ~d"));
        Assert.assertArrayEquals(
                new TokenType[]{VARIABLE, AND, VARIABLE, OR, VARIABLE, IMPLIES, NOT, VARIABLE},
                tokenize("a&&b||c->~d"));
        Assert.assertArrayEquals(
                new TokenType[]{LPAREN, TRUE, OR, FALSE, RPAREN},
                tokenize("(T||F)"));
    }

    @Test
    public void ignoresWhitespace() {

        Assert.assertArrayEquals(
                new TokenType[]{VARIABLE, AND, VARIABLE},
                tokenize("  a\t&&\r\nb  "));
        Assert.assertArrayEquals(new TokenType[]{}, tokenize(" \t\r\n"));
        Assert.assertArrayEquals(new TokenType[]{}, tokenize(""));
    }

    @Test
    public void readsVariableNamesGreedily() {
        List<Token> tokens = new Lexer("alpha && beta").lex();
        Assert.assertEquals(4, tokens.size());
        Assert.assertEquals("alpha", tokens.get(0).getValue());
        Assert.assertEquals("beta", tokens.get(2).getValue());

        // T and F inside a name do not split it
        tokens = new Lexer("aTF").lex();
        Assert.assertEquals(VARIABLE, tokens.get(0).getType());
        Assert.assertEquals("aTF", tokens.get(0).getValue());
    }

    @Test
    public void alwaysReadsLeadingTAndFAsLiterals() {
        List<Token> tokens = new Lexer("True").lex();
        Assert.assertArrayEquals(new TokenType[]{TRUE, VARIABLE}, tokenize("True"));
        Assert.assertEquals("rue", tokens.get(1).getValue());
        Assert.assertEquals(1, tokens.get(1).getPosition());

        Assert.assertArrayEquals(new TokenType[]{FALSE, VARIABLE}, tokenize("False"));
        Assert.assertArrayEquals(new TokenType[]{TRUE, FALSE, TRUE}, tokenize("TFT"));
    }

    @Test
    public void tracksPositions() {
        List<Token> tokens = new Lexer("a && bc -> ~T").lex();
        int[] expected = new int[]{0, 2, 5, 8, 11, 12, 13};
        Assert.assertEquals(expected.length, tokens.size());
        for (int i = 0; i < expected.length; i++) {
            Assert.assertEquals(expected[i], tokens.get(i).getPosition());
        }
    }

    @Test
    public void appendsEofToken() {
        List<Token> tokens = new Lexer("a ").lex();
        Token eof = tokens.get(tokens.size() - 1);
        Assert.assertEquals(EOF, eof.getType());
        Assert.assertEquals(2, eof.getPosition());
        Assert.assertEquals("<EOF>", eof.getValue());

        tokens = new Lexer(null).lex();
        Assert.assertEquals(1, tokens.size());
        Assert.assertEquals(0, tokens.get(0).getPosition());
    }

    @Test
    public void rejectsInvalidSymbols() {
        assertInvalidSymbol("a & b", 2, '&');
        assertInvalidSymbol("a | b", 2, '|');
        assertInvalidSymbol("a - b", 2, '-');
        assertInvalidSymbol("a1", 1, '1');
        assertInvalidSymbol("!a", 0, '!');
    }

    @Test
    public void formatsLexErrorMessage() {
        try {
            new Lexer("a $ b").lex();
            Assert.fail("expected LexException");
        } catch (LexException ex) {
            Assert.assertEquals("Error at 2: invalid symbol $", ex.getMessage());
        }
    }

    private void assertInvalidSymbol(String input, int position, char symbol) {
        try {
            new Lexer(input).lex();
            Assert.fail("expected LexException for " + input);
        } catch (LexException ex) {
            Assert.assertEquals(position, ex.getPosition());
            Assert.assertEquals(symbol, ex.getSymbol());
        }
    }

    private TokenType[] tokenize(String input){
        List<TokenType> lst = Lexer.tokenize(input);
        TokenType[] a = new TokenType[lst.size()];
        return lst.toArray(a);
    }
}
