package org.dice.proplogic.parsing;

import org.dice.proplogic.config.ProplogicConfig;
import org.dice.proplogic.exception.ParseException;
import org.dice.proplogic.parsing.ast.Expression;
import org.dice.proplogic.parsing.ast.operands.Literal;
import org.dice.proplogic.parsing.ast.operands.Variable;
import org.dice.proplogic.parsing.ast.operators.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds an {@link Expression} from the tokens of a {@link Lexer}. Implication binds
 * loosest and groups to the right; || and && group to the left; ~ binds tightest.
 * A parser instance handles one input.
 */
public class RecursiveDescentParser {

    private static final Logger log = LoggerFactory.getLogger( RecursiveDescentParser.class );

    // tokens that can start an operand
    private static final Set<TokenType> FIRST = EnumSet.of(
            TokenType.VARIABLE, TokenType.TRUE, TokenType.FALSE, TokenType.LPAREN);

    private static final Set<TokenType> EXPRESSION_FOLLOW = EnumSet.of(
            TokenType.EOF, TokenType.RPAREN);
    private static final Set<TokenType> OR_FOLLOW = EnumSet.of(
            TokenType.EOF, TokenType.RPAREN, TokenType.IMPLIES);
    private static final Set<TokenType> AND_FOLLOW = EnumSet.of(
            TokenType.EOF, TokenType.RPAREN, TokenType.IMPLIES, TokenType.OR);
    private static final Set<TokenType> NOT_FOLLOW = EnumSet.of(
            TokenType.EOF, TokenType.RPAREN, TokenType.IMPLIES, TokenType.OR, TokenType.AND);

    private final Lexer lexer;
    private final int maxDepth;

    private List<Token> tokens;
    private int current;
    private int depth;

    public RecursiveDescentParser(Lexer lexer) {
        this(lexer, ProplogicConfig.DEFAULT_MAX_DEPTH);
    }

    public RecursiveDescentParser(Lexer lexer, int maxDepth) {
        this.lexer = lexer;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses text using the limits of {@link ProplogicConfig#getInstance()}.
     */
    public static Expression parse(String text) {
        return new RecursiveDescentParser(new Lexer(text), ProplogicConfig.getInstance().getMaxDepth()).parse();
    }

    /**
     * @throws org.dice.proplogic.exception.LexException if the input contains an invalid symbol
     * @throws ParseException if the tokens do not form an expression
     */
    public Expression parse() {
        this.tokens = lexer.lex();
        this.current = 0;
        this.depth = 0;

        Expression root = expression();
        // only a surplus ')' can be left over here
        if (peek().getType() != TokenType.EOF) {
            throw new ParseException(peek(), EnumSet.of(TokenType.EOF), ParserErrors.MissingLeftParen);
        }
        if (log.isDebugEnabled()) {
            log.debug(String.format("Parsed '%s' as %s", lexer, root.toText()));
        }
        return root;
    }

    private Expression expression() {
        Expression left = orExpression();
        if (peek().getType() == TokenType.IMPLIES) {
            Token arrow = advance();
            descend(arrow);
            Expression right = expression();
            ascend();
            left = new Implies(left, right);
        }
        expectFollow(EXPRESSION_FOLLOW);
        return left;
    }

    private Expression orExpression() {
        Expression root = andExpression();
        while (peek().getType() == TokenType.OR) {
            advance();
            Expression right = andExpression();
            root = new Or(root, right);
        }
        expectFollow(OR_FOLLOW);
        return root;
    }

    private Expression andExpression() {
        Expression root = notExpression();
        while (peek().getType() == TokenType.AND) {
            advance();
            Expression right = notExpression();
            root = new And(root, right);
        }
        expectFollow(AND_FOLLOW);
        return root;
    }

    private Expression notExpression() {
        Expression root;
        if (peek().getType() == TokenType.NOT) {
            Token not = advance();
            descend(not);
            root = new Not(notExpression());
            ascend();
        }
        else {
            root = term();
        }
        expectFollow(NOT_FOLLOW);
        return root;
    }

    private Expression term() {
        Token token = peek();
        Expression root;
        switch (token.getType()) {
            case VARIABLE:
                root = new Variable(token.getValue());
                break;

            case TRUE:
                root = new Literal(true);
                break;

            case FALSE:
                root = new Literal(false);
                break;

            case LPAREN:
                advance();
                descend(token);
                root = expression();
                ascend();
                if (peek().getType() != TokenType.RPAREN) {
                    throw new ParseException(peek(), EnumSet.of(TokenType.RPAREN), ParserErrors.MissingRightParen);
                }
                break;

            default:
                throw new ParseException(token, FIRST, ParserErrors.MissingOperand);
        }
        // consumes the operand, or the closing paren
        advance();
        expectFollow(NOT_FOLLOW);
        return root;
    }

    private void expectFollow(Set<TokenType> follow) {
        if (!follow.contains(peek().getType())) {
            throw new ParseException(peek(), follow, ParserErrors.MalFormedExpression);
        }
    }

    private void descend(Token token) {
        depth++;
        if (depth > maxDepth) {
            String message = String.format("Error at %d: expression nested deeper than %d levels", token.getPosition(), maxDepth);
            throw new ParseException(message, token, EnumSet.noneOf(TokenType.class), ParserErrors.NestingTooDeep);
        }
    }

    private void ascend() {
        depth--;
    }

    private Token peek() {
        return tokens.get(current);
    }

    // never moves past the EOF sentinel
    private Token advance() {
        Token token = tokens.get(current);
        if (token.getType() != TokenType.EOF) {
            current++;
        }
        return token;
    }
}
