package org.dice.proplogic.exception;

public class TooManyVariablesException extends ProplogicException {

    private final int count;
    private final int limit;

    public TooManyVariablesException(int count, int limit) {
        super(String.format("Error: expression has %d variables, truth tables are limited to %d", count, limit));
        this.count = count;
        this.limit = limit;
    }

    public int getCount() {
        return count;
    }

    public int getLimit() {
        return limit;
    }
}
