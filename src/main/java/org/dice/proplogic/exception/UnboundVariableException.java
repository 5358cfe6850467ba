package org.dice.proplogic.exception;

public class UnboundVariableException extends ProplogicException {

    private final String name;

    public UnboundVariableException(String name) {
        super(String.format("Error: no value assigned to variable %s", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
