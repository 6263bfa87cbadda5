package norswap.symex;

import norswap.symex.ast.Expression;
import norswap.symex.ast.VariableNode;
import norswap.symex.printing.Numbers;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line driver.
 *
 * <pre>
 * symex &lt;postfix&gt; [name=value ...] [--diff &lt;var&gt;] [--simplify] [--verbose]
 * </pre>
 *
 * Prints the infix and postfix forms of the expression and its variables, then its value when
 * every variable is bound, or the expression with the bound variables substituted otherwise.
 * With {@code --diff}, also prints the simplified partial derivative; with {@code --simplify},
 * the simplified expression.
 */
public final class Main
{
    // ---------------------------------------------------------------------------------------------

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "usage: symex <postfix> [name=value ...] [--diff <var>] [--simplify] [--verbose]";

    // ---------------------------------------------------------------------------------------------

    public static void main (String[] args)
    {
        configureLogging();
        int status = new Main(System.out, System.err).run(args);
        if (status != 0)
            System.exit(status);
    }

    // ---------------------------------------------------------------------------------------------

    private static void configureLogging ()
    {
        if (System.getProperty("java.util.logging.config.file") != null)
            return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null)
                LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "could not read logging.properties", e);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private final PrintStream out;
    private final PrintStream err;
    private final ExpressionEngine engine = new ExpressionEngine();

    Main (PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Runs the driver and returns the process exit status.
     */
    int run (String[] args)
    {
        String postfix = null;
        Map<Character, Double> bindings = new LinkedHashMap<>();
        Character diffVariable = null;
        boolean simplify = false;

        for (int i = 0; i < args.length; ++i) {
            String arg = args[i];
            switch (arg) {
                case "--diff":
                    if (i + 1 >= args.length || !isVariable(args[i + 1]))
                        return usage("--diff expects a variable name");
                    diffVariable = args[++i].charAt(0);
                    break;
                case "--simplify":
                    simplify = true;
                    break;
                case "--verbose":
                    Logger.getLogger("norswap.symex").setLevel(Level.FINE);
                    for (Handler handler: Logger.getLogger("").getHandlers())
                        handler.setLevel(Level.FINE);
                    break;
                default:
                    if (arg.startsWith("--"))
                        return usage("unknown option " + arg);
                    int eq = arg.indexOf('=');
                    if (eq >= 0) {
                        String name = arg.substring(0, eq);
                        if (!isVariable(name))
                            return usage("not a variable name: " + name);
                        try {
                            bindings.put(name.charAt(0), Double.parseDouble(arg.substring(eq + 1)));
                        } catch (NumberFormatException e) {
                            return usage("not a number: " + arg.substring(eq + 1));
                        }
                    } else if (postfix == null) {
                        postfix = arg;
                    } else {
                        return usage("more than one expression given");
                    }
            }
        }

        if (postfix == null)
            return usage("no expression given");

        try {
            Expression expression = engine.buildFromPostfix(postfix);
            Set<Character> variables = engine.collectVariables(expression);

            out.println("infix:     " + expression.infix);
            out.println("postfix:   " + engine.toPostfix(expression));
            out.println("variables: " + variables);

            if (bindings.keySet().containsAll(variables))
                out.println("value:     " + Numbers.decimal(engine.evaluate(expression, bindings)));
            else if (!bindings.isEmpty())
                out.println("bound:     " + engine.substituteBoundVariables(expression, bindings).infix);

            if (simplify)
                out.println("simplified: " + engine.simplify(expression).infix);

            if (diffVariable != null) {
                Expression derivative = engine.simplify(engine.derivative(expression, diffVariable));
                out.println("d/d" + diffVariable + ":      " + derivative.infix);
            }
            return 0;
        } catch (ExpressionException e) {
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    // ---------------------------------------------------------------------------------------------

    private static boolean isVariable (String s) {
        return s.length() == 1 && VariableNode.isVariableName(s.charAt(0));
    }

    private int usage (String problem)
    {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
