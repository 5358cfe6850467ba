package org.dice.proplogic.truthtable;

import org.apache.commons.lang.StringUtils;
import org.dice.proplogic.parsing.ast.Expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link TruthTable} as text:
 * <pre>
 * a b | (a || b)
 * ----+---------
 * T T | T
 * T F | T
 * F T | T
 * F F | F
 * </pre>
 */
public final class TruthTablePrinter {

    private static final String SPACE = " ";
    private static final String COLUMN_SEPARATOR = " | ";

    private TruthTablePrinter() {
    }

    public static void print(TruthTable table, PrintStream out) {
        for (String line : lines(table)) {
            out.println(line);
        }
    }

    /**
     * Prints the table of the expression row by row as it is enumerated, so memory use does not
     * grow with the number of rows.
     *
     * @throws org.dice.proplogic.exception.TooManyVariablesException before anything is printed
     */
    public static void print(Expression expression, int maxVariables, final PrintStream out) {
        final String text = expression.toText();
        List<String> variables = TruthTable.variables(expression, maxVariables);

        out.println(header(variables, text));
        out.println(separator(variables, text));
        TruthTable.forEachRow(expression, maxVariables, new TruthTable.RowHandler() {
            public void handle(Map<String, Boolean> assignment, boolean result) {
                out.println(row(assignment.values(), result));
            }
        });
    }

    public static String render(TruthTable table) {
        return StringUtils.join(lines(table), "\n");
    }

    static List<String> lines(TruthTable table) {
        final String text = table.getExpression().toText();
        final List<String> variables = table.getVariables();

        List<String> lines = new ArrayList<String>();
        lines.add(header(variables, text));
        lines.add(separator(variables, text));

        for (TruthTableRow row : table) {
            List<Boolean> values = new ArrayList<Boolean>(variables.size());
            for (String variable : variables) {
                values.add(row.getValue(variable));
            }
            lines.add(row(values, row.getResult()));
        }
        return lines;
    }

    private static String header(List<String> variables, String text) {
        return StringUtils.join(variables, SPACE) + COLUMN_SEPARATOR + text;
    }

    private static String separator(List<String> variables, String text) {
        return StringUtils.repeat("--", variables.size()) + "+-" + StringUtils.repeat("-", text.length());
    }

    private static String row(Collection<Boolean> values, boolean result) {
        StringBuilder sb = new StringBuilder();
        for (Boolean value : values) {
            if (sb.length() > 0) {
                sb.append(SPACE);
            }
            sb.append(torF(value));
        }
        return sb.append(COLUMN_SEPARATOR).append(torF(result)).toString();
    }

    static String torF(boolean value) {
        return value ? "T" : "F";
    }
}
