package org.dice.proplogic.parsing.ast;

import org.dice.proplogic.parsing.ast.operands.Literal;
import org.dice.proplogic.parsing.ast.operands.Variable;
import org.dice.proplogic.parsing.ast.operators.And;
import org.dice.proplogic.parsing.ast.operators.Implies;
import org.dice.proplogic.parsing.ast.operators.Not;
import org.dice.proplogic.parsing.ast.operators.Or;

/**
 * Shorthand constructors for building trees by hand, e.g.
 * {@code and(or(var("a"), var("b")), not(var("c")))}.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Expression trueLiteral() {
        return new Literal(true);
    }

    public static Expression falseLiteral() {
        return new Literal(false);
    }

    public static Expression var(String name) {
        return new Variable(name);
    }

    public static Expression and(Expression left, Expression right) {
        return new And(left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new Or(left, right);
    }

    public static Expression implies(Expression left, Expression right) {
        return new Implies(left, right);
    }

    public static Expression not(Expression child) {
        return new Not(child);
    }
}
