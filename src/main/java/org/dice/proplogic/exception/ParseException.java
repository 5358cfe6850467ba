package org.dice.proplogic.exception;

import org.dice.proplogic.parsing.ParserErrors;
import org.dice.proplogic.parsing.Token;
import org.dice.proplogic.parsing.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raised when the current token is not one of the valid continuations at that point
 * of the grammar.
 */
public class ParseException extends ProplogicException {

    private final int position;
    private final Set<TokenType> expected;
    private final Token actual;
    private final ParserErrors error;

    public ParseException(Token actual, Set<TokenType> expected, ParserErrors error) {
        this(String.format("Error at %d: expected %s, but got %s", actual.getPosition(), expected, actual.getValue()),
                actual, expected, error);
    }

    public ParseException(String message, Token actual, Set<TokenType> expected, ParserErrors error) {
        super(message);
        this.position = actual.getPosition();
        this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.actual = actual;
        this.error = error;
    }

    public int getPosition() {
        return position;
    }

    public Set<TokenType> getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }

    public ParserErrors getError() {
        return error;
    }
}
