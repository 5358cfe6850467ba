package org.dice.proplogic.truthtable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One assignment of the variables of an expression, with the value the expression takes under it.
 */
public class TruthTableRow {

    private final Map<String, Boolean> assignment;
    private final boolean result;

    public TruthTableRow(Map<String, Boolean> assignment, boolean result) {
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<String, Boolean>(assignment));
        this.result = result;
    }

    /**
     * @return the assignment, iterating in the order of the table's variables
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public boolean getValue(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Variable not in row: " + variable);
        }
        return value;
    }

    public boolean getResult() {
        return result;
    }

    @Override
    public String toString(){
        return String.format("%s -> %s", this.assignment, this.result);
    }
}
