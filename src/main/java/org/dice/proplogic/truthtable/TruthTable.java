package org.dice.proplogic.truthtable;

import org.dice.proplogic.config.ProplogicConfig;
import org.dice.proplogic.exception.TooManyVariablesException;
import org.dice.proplogic.parsing.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every assignment of an expression's variables, with the value of the expression under each.
 *
 * Variables are sorted by name. Rows are produced depth first, trying true before false
 * for each variable, so for variables a, b the rows are TT, TF, FT, FF.
 */
public class TruthTable implements Iterable<TruthTableRow> {

    private static final Logger log = LoggerFactory.getLogger( TruthTable.class );

    private final Expression expression;
    private final List<String> variables;
    private final List<TruthTableRow> rows;

    private TruthTable(Expression expression, List<String> variables, List<TruthTableRow> rows) {
        this.expression = expression;
        this.variables = Collections.unmodifiableList(variables);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static TruthTable enumerate(Expression expression) {
        return enumerate(expression, ProplogicConfig.getInstance().getMaxVariables());
    }

    /**
     * @throws TooManyVariablesException if the expression has more than maxVariables variables
     */
    public static TruthTable enumerate(Expression expression, int maxVariables) {
        List<String> variables = variables(expression, maxVariables);

        final List<TruthTableRow> rows = new ArrayList<TruthTableRow>();
        forEachRow(expression, variables, new RowHandler() {
            public void handle(Map<String, Boolean> assignment, boolean result) {
                rows.add(new TruthTableRow(assignment, result));
            }
        });
        if (log.isDebugEnabled()) {
            log.debug(String.format("Enumerated %d rows over %s", rows.size(), variables));
        }
        return new TruthTable(expression, variables, rows);
    }

    /**
     * @return the variables of the expression, sorted by name
     * @throws TooManyVariablesException if there are more than maxVariables
     */
    public static List<String> variables(Expression expression, int maxVariables) {
        List<String> variables = new ArrayList<String>(expression.vars());
        Collections.sort(variables);
        if (variables.size() > maxVariables) {
            throw new TooManyVariablesException(variables.size(), maxVariables);
        }
        return variables;
    }

    /**
     * Passes each row to the handler as it is evaluated, in table order, without keeping any.
     * The assignment given to the handler is a read-only view that changes after the call returns.
     *
     * @throws TooManyVariablesException if the expression has more than maxVariables variables
     */
    public static void forEachRow(Expression expression, int maxVariables, RowHandler handler) {
        forEachRow(expression, variables(expression, maxVariables), handler);
    }

    private static void forEachRow(Expression expression, List<String> variables, RowHandler handler) {
        Map<String, Boolean> env = new LinkedHashMap<String, Boolean>();
        enumerate(expression, variables, 0, env, Collections.unmodifiableMap(env), handler);
    }

    private static void enumerate(Expression expression, List<String> variables, int index,
                                  Map<String, Boolean> env, Map<String, Boolean> view, RowHandler handler) {
        if (index == variables.size()) {
            handler.handle(view, expression.evaluate(view));
            return;
        }
        for (boolean value : new boolean[]{true, false}) {
            env.put(variables.get(index), value);
            enumerate(expression, variables, index + 1, env, view, handler);
        }
        env.remove(variables.get(index));
    }

    /**
     * Receives the rows of {@link #forEachRow}.
     */
    public interface RowHandler {
        void handle(Map<String, Boolean> assignment, boolean result);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public Iterator<TruthTableRow> iterator() {
        return rows.iterator();
    }

    public boolean isTautology() {
        for (TruthTableRow row : rows) {
            if (!row.getResult()) {
                return false;
            }
        }
        return true;
    }

    public boolean isSatisfiable() {
        for (TruthTableRow row : rows) {
            if (row.getResult()) {
                return true;
            }
        }
        return false;
    }

    public boolean isContradiction() {
        return !isSatisfiable();
    }
}
