package org.dice.proplogic.parsing.ast.operands;

import org.dice.proplogic.parsing.ast.Expression;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public final class Literal implements Expression {
	private final boolean value;

	public Literal(boolean value) {
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	public boolean evaluate(Map<String, Boolean> env) {
		return value;
	}

	public Set<String> vars() {
		return new HashSet<String>();
	}

	public String toText() {
		return value ? "T" : "F";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Literal && value == ((Literal) obj).value;
	}

	@Override
	public int hashCode() {
		return Boolean.valueOf(value).hashCode();
	}

	@Override
	public String toString(){
		return this.toText();
	}
}
