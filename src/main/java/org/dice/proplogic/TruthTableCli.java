package org.dice.proplogic;

import org.dice.proplogic.config.ProplogicConfig;
import org.dice.proplogic.exception.ProplogicException;
import org.dice.proplogic.parsing.Lexer;
import org.dice.proplogic.parsing.RecursiveDescentParser;
import org.dice.proplogic.parsing.ast.Expression;
import org.dice.proplogic.truthtable.TruthTablePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints the parsed form and the truth table of the expression given as first argument, e.g.
 * <pre>java -jar dice-proplogic.jar "(a || b) && ~c"</pre>
 * Errors are reported on a single line.
 */
public class TruthTableCli {

    private static final Logger log = LoggerFactory.getLogger( TruthTableCli.class );

    public static void main(String[] args) {
        run(args, System.out, ProplogicConfig.getInstance());
    }

    static void run(String[] args, PrintStream out, ProplogicConfig config) {
        if (args == null || args.length < 1) {
            out.println("Error: you need to enter an expression");
            return;
        }

        final String input = args[0];
        try {
            RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer(input), config.getMaxDepth());
            Expression expression = parser.parse();
            out.println(expression.toText());
            TruthTablePrinter.print(expression, config.getMaxVariables(), out);
        }
        catch (ProplogicException ex) {
            log.debug(String.format("Failed to process expression '%s'", input), ex);
            out.println(ex.getMessage());
        }
    }
}
