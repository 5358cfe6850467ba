package org.dice.proplogic.parsing.ast.operators;

import org.dice.proplogic.parsing.ast.Expression;

import java.util.Map;

public final class And extends BinaryOperator {
	public And(Expression left, Expression right){
		super(left, right);
	}

	public boolean evaluate(Map<String, Boolean> env) {
		return left.evaluate(env) && right.evaluate(env);
	}

	public String toText() {
		return String.format("(%s && %s)", left.toText(), right.toText());
	}
}
