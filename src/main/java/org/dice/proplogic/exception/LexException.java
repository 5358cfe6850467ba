package org.dice.proplogic.exception;

public class LexException extends ProplogicException {

    private final int position;
    private final char symbol;

    public LexException(int position, char symbol) {
        super(String.format("Error at %d: invalid symbol %c", position, symbol));
        this.position = position;
        this.symbol = symbol;
    }

    public int getPosition() {
        return position;
    }

    public char getSymbol() {
        return symbol;
    }
}
