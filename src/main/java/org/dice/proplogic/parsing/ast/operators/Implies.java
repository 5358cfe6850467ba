package org.dice.proplogic.parsing.ast.operators;

import org.dice.proplogic.parsing.ast.Expression;

import java.util.Map;

/**
 * Material implication, false only when the left side holds and the right side does not.
 */
public final class Implies extends BinaryOperator {

	public Implies(Expression left, Expression right){
		super(left, right);
	}

	public boolean evaluate(Map<String, Boolean> env) {
		return !left.evaluate(env) || right.evaluate(env);
	}

	public String toText() {
		return String.format("(%s -> %s)", left.toText(), right.toText());
	}
}
