package org.dice.proplogic.parsing.ast.operators;

import org.apache.commons.lang.Validate;
import org.apache.commons.lang.builder.HashCodeBuilder;
import org.dice.proplogic.parsing.ast.Expression;

import java.util.Set;

public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;

    BinaryOperator(Expression left, Expression right){
        Validate.notNull(left, "left operand is null");
        Validate.notNull(right, "right operand is null");
        this.left = left;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public Set<String> vars() {
        Set<String> vars = left.vars();
        vars.addAll(right.vars());
        return vars;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        BinaryOperator other = (BinaryOperator) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(getClass().getSimpleName())
                .append(left)
                .append(right)
                .toHashCode();
    }

	@Override
	public String toString(){
		return this.toText();
	}
}
