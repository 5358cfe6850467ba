package org.dice.proplogic.parsing.ast;

import java.util.Map;
import java.util.Set;

/**
 * <expression>::=<or>["->"<expression>]
 * <or>::=<and>{"||"<and>}
 * <and>::=<not>{"&&"<not>}
 * <not>::="~"<not>|<atom>
 * <atom>::=<variable>|"T"|"F"|"("<expression>")"
 *
 * Implementations are immutable. equals compares variant and children in order, so
 * (a && b) is not equal to (b && a).
 */
public interface Expression {

	/**
	 * @throws org.dice.proplogic.exception.UnboundVariableException if a variable has no value in env
	 */
	public boolean evaluate(Map<String, Boolean> env);

	/**
	 * @return a new set holding the name of every variable in the expression
	 */
	public Set<String> vars();

	/**
	 * @return the fully parenthesized infix form
	 */
	public String toText();
}
