package org.dice.proplogic.exception;

/**
 * Base class of every failure raised while lexing, parsing or evaluating an expression.
 * The message is the one-line text shown to the user.
 */
public class ProplogicException extends RuntimeException {

    public ProplogicException(String message) {
        super(message);
    }
}
