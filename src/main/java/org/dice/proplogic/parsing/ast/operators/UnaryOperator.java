package org.dice.proplogic.parsing.ast.operators;

import org.apache.commons.lang.Validate;
import org.apache.commons.lang.builder.HashCodeBuilder;
import org.dice.proplogic.parsing.ast.Expression;

import java.util.Set;

public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        Validate.notNull(child, "operand is null");
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }

    public Set<String> vars() {
        return child.vars();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        return child.equals(((UnaryOperator) obj).child);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(19, 41)
                .append(getClass().getSimpleName())
                .append(child)
                .toHashCode();
    }

    @Override
    public String toString(){
        return this.toText();
    }
}
