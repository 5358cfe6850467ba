package org.dice.proplogic.parsing.ast.operators;

import org.dice.proplogic.parsing.ast.Expression;

import java.util.Map;

public final class Not extends UnaryOperator {
	public Not(Expression child){
		super(child);
	}

	public boolean evaluate(Map<String, Boolean> env) {
		return !child.evaluate(env);
	}

	public String toText() {
		return String.format("(~ %s)", child.toText());
	}
}
