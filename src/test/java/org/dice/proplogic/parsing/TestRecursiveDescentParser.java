package org.dice.proplogic.parsing;

import org.dice.proplogic.exception.LexException;
import org.dice.proplogic.exception.ParseException;
import org.dice.proplogic.parsing.ast.Expression;
import org.junit.Test;

import java.util.EnumSet;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.fail;
import static org.dice.proplogic.parsing.ast.Expressions.*;

public class TestRecursiveDescentParser {

    @Test
    public void rendersFullyParenthesized()
    {
        assertEquals("(a && b)", parse("a&&b"));
        assertEquals("(a && b)", parse("a && b"));
        assertEquals("((a || b) && (~ c))", parse("(a || b) && ~c"));
        assertEquals("(T -> F)", parse("T->F"));
        assertEquals("a", parse("a"));
        assertEquals("a", parse("((a))"));
    }

    @Test
    public void enforcesOperatorPrecedence(){
        assertEquals(or(var("a"), and(var("b"), var("c"))), parseTree("a||b&&c"));
        assertEquals(and(not(var("a")), var("b")), parseTree("~a&&b"));
        assertEquals("((a && b) || c)", parse("a && b || c"));
        assertEquals("(a -> (b || c))", parse("a -> b || c"));
        assertEquals("((a || b) -> c)", parse("a || b -> c"));
        assertEquals("((a || b) && c)", parse("(a || b) && c"));
    }

    @Test
    public void implicationGroupsToTheRight(){
        assertEquals(implies(var("a"), implies(var("b"), var("c"))), parseTree("a->b->c"));
        assertEquals("((a -> b) -> c)", parse("(a->b)->c"));
    }

    @Test
    public void andOrGroupToTheLeft(){
        assertEquals("((a || b) || c)", parse("a || b || c"));
        assertEquals("((a && b) && c)", parse("a && b && c"));
    }

    @Test
    public void parsesNotOperator(){
        assertEquals("(~ a)", parse("~a"));
        assertEquals("(~ (~ a))", parse("~~a"));
        assertEquals("(~ (a && b))", parse("~(a && b)"));
        assertEquals("((~ T) || F)", parse("~T || F"));
    }

    @Test
    public void reportsMissingOperand(){
        ParseException ex = getParserError("a &&");
        assertEquals(ParserErrors.MissingOperand, ex.getError());
        assertEquals(4, ex.getPosition());
        assertEquals(EnumSet.of(TokenType.VARIABLE, TokenType.TRUE, TokenType.FALSE, TokenType.LPAREN), ex.getExpected());
        assertEquals(TokenType.EOF, ex.getActual().getType());
        assertEquals("Error at 4: expected [T, F, <var>, (], but got <EOF>", ex.getMessage());

        assertEquals(ParserErrors.MissingOperand, getParserError("").getError());
        assertEquals(0, getParserError("").getPosition());
        assertEquals(ParserErrors.MissingOperand, getParserError("&& a").getError());
        assertEquals(ParserErrors.MissingOperand, getParserError("a || -> b").getError());
        assertEquals(ParserErrors.MissingOperand, getParserError("~").getError());
        assertEquals(1, getParserError("()").getPosition());
        assertEquals(ParserErrors.MissingOperand, getParserError(")").getError());
    }

    @Test
    public void reportsMissingRightParen(){
        ParseException ex = getParserError("(a && b");
        assertEquals(ParserErrors.MissingRightParen, ex.getError());
        assertEquals(EnumSet.of(TokenType.RPAREN), ex.getExpected());
        assertEquals(7, ex.getPosition());
        assertEquals("Error at 7: expected [)], but got <EOF>", ex.getMessage());

        assertEquals(ParserErrors.MissingRightParen, getParserError("((a)").getError());
        assertEquals(ParserErrors.MissingRightParen, getParserError("a || (b -> c").getError());
    }

    @Test
    public void reportsMissingLeftParen(){
        ParseException ex = getParserError("a && b)");
        assertEquals(ParserErrors.MissingLeftParen, ex.getError());
        assertEquals(EnumSet.of(TokenType.EOF), ex.getExpected());
        assertEquals(6, ex.getPosition());
        assertEquals("Error at 6: expected [<EOF>], but got )", ex.getMessage());

        assertEquals(ParserErrors.MissingLeftParen, getParserError("(a))").getError());
    }

    @Test
    public void reportsMalformedExpression(){
        ParseException ex = getParserError("a b");
        assertEquals(ParserErrors.MalFormedExpression, ex.getError());
        assertEquals(2, ex.getPosition());
        assertEquals("Error at 2: expected [&&, ||, ->, ), <EOF>], but got b", ex.getMessage());

        assertEquals(ParserErrors.MalFormedExpression, getParserError("a ~ b").getError());
        assertEquals(ParserErrors.MalFormedExpression, getParserError("(a) (b)").getError());
        assertEquals(ParserErrors.MalFormedExpression, getParserError("T F").getError());
    }

    @Test(expected = LexException.class)
    public void propagatesLexErrors(){
        parseTree("a # b");
    }

    @Test
    public void limitsNesting(){
        assertEquals("a", new RecursiveDescentParser(new Lexer("(((a)))"), 3).parse().toText());
        assertEquals("(~ (~ (~ a)))", new RecursiveDescentParser(new Lexer("~~~a"), 3).parse().toText());

        ParseException ex = getParserError("((((a))))", 3);
        assertEquals(ParserErrors.NestingTooDeep, ex.getError());
        assertEquals(3, ex.getPosition());
        assertEquals(ParserErrors.NestingTooDeep, getParserError("~~~~a", 3).getError());
        assertEquals(ParserErrors.NestingTooDeep, getParserError("a -> b -> c -> d -> e", 3).getError());
    }

    @Test
    public void parsesDeepNestingWithinDefaultLimit(){
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            sb.append('(');
        }
        sb.append('a');
        for (int i = 0; i < 100; i++) {
            sb.append(')');
        }
        assertEquals("a", parse(sb.toString()));
    }

    private String parse(String input){
        return parseTree(input).toText();
    }

    private Expression parseTree(String input){
        return new RecursiveDescentParser(new Lexer(input)).parse();
    }

    private ParseException getParserError(String input){
        return getParserError(input, 256);
    }

    private ParseException getParserError(String input, int maxDepth){
        RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer(input), maxDepth);
        try {
            parser.parse();
        } catch (ParseException ex) {
            return ex;
        }
        fail("expected ParseException for " + input);
        return null;
    }
}
