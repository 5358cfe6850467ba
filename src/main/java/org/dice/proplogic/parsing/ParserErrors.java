package org.dice.proplogic.parsing;

public enum  ParserErrors {
    MissingLeftParen,
    MissingRightParen,
    MissingOperand,
    MalFormedExpression,
    NestingTooDeep
}
