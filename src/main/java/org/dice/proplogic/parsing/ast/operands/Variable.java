package org.dice.proplogic.parsing.ast.operands;

import org.apache.commons.lang.CharUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.dice.proplogic.exception.UnboundVariableException;
import org.dice.proplogic.parsing.ast.Expression;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public final class Variable implements Expression {
	private final String name;

	public Variable(String name) {
		Validate.isTrue(StringUtils.isNotEmpty(name), "variable name is empty");
		Validate.isTrue(isAsciiAlpha(name), "variable name must contain only the letters a-z and A-Z: " + name);
		this.name = name;
	}

	// same letters the lexer reads as a name
	private static boolean isAsciiAlpha(String name) {
		for (int i = 0; i < name.length(); i++) {
			if (!CharUtils.isAsciiAlpha(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public String getName() {
		return name;
	}

	public boolean evaluate(Map<String, Boolean> env) {
		Boolean value = env.get(name);
		if (value == null) {
			throw new UnboundVariableException(name);
		}
		return value;
	}

	public Set<String> vars() {
		Set<String> vars = new HashSet<String>();
		vars.add(name);
		return vars;
	}

	public String toText() {
		return name;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Variable && name.equals(((Variable) obj).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString(){
		return this.toText();
	}
}
