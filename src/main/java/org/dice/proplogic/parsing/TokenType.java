package org.dice.proplogic.parsing;

/**
 * Symbols produced by the {@link Lexer}. The string form is the symbol as it
 * appears in error messages.
 */
public enum TokenType {
    TRUE("T"),
    FALSE("F"),
    NOT("~"),
    AND("&&"),
    OR("||"),
    IMPLIES("->"),
    VARIABLE("<var>"),
    LPAREN("("),
    RPAREN(")"),
    EOF("<EOF>");

    private final String symbol;
    TokenType(String symbol){
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString(){
        return this.symbol;
    }
}
