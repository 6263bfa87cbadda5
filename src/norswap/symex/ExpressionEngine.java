package norswap.symex;

import norswap.symex.ast.Expression;
import norswap.symex.ast.NodePath;
import norswap.symex.ast.Nodes;
import norswap.symex.ast.UnaryFunction;
import norswap.symex.ast.VariableNode;
import norswap.symex.calculus.DerivationException;
import norswap.symex.calculus.Differentiator;
import norswap.symex.interpreter.EvaluationException;
import norswap.symex.interpreter.Evaluator;
import norswap.symex.printing.InfixPrinter;
import norswap.symex.printing.PostfixPrinter;
import norswap.symex.rewrite.Simplifier;
import norswap.symex.transform.Composer;
import norswap.symex.transform.CompositionException;
import norswap.symex.transform.Substitution;
import norswap.symex.transform.Wrapping;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point of the engine for its callers (user interfaces, the command line driver).
 *
 * <p>Every operation is stateless: it reads its input expressions without modifying them and
 * returns new values. Operations that can fail throw a subclass of {@link ExpressionException}
 * describing the failure; the exception propagates unchanged from the point where the failure
 * was detected.
 *
 * <p>The engine holds no mutable state and can be shared between threads.
 */
public final class ExpressionEngine
{
    // ---------------------------------------------------------------------------------------------

    private static final Logger LOGGER = Logger.getLogger(ExpressionEngine.class.getName());

    // ---------------------------------------------------------------------------------------------

    /**
     * Builds a tree from postfix text.
     *
     * @throws ParseException see {@link PostfixParser#parse}
     */
    public Expression buildFromPostfix (String text)
    {
        Expression expression = logged("parse", () -> new PostfixParser().parse(text));
        LOGGER.fine(() -> "parsed \"" + expression.postfix + "\" as " + expression.infix);
        return expression;
    }

    // ---------------------------------------------------------------------------------------------

    public String toPostfix (Expression expression) {
        return new PostfixPrinter().print(expression.root);
    }

    public String toInfix (Expression expression) {
        return new InfixPrinter().print(expression.root);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the names of the variables occurring in the expression, in alphabetical order.
     */
    public SortedSet<Character> collectVariables (Expression expression)
    {
        SortedSet<Character> variables = new TreeSet<>();
        if (!expression.isEmpty())
            Nodes.collectVariables(expression.root, variables);
        return Collections.unmodifiableSortedSet(variables);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * @throws EvaluationException if a variable has no binding, on a division by zero, on
     * {@code ln} of a non-positive value, or if the expression is empty
     */
    public double evaluate (Expression expression, Map<Character, Double> bindings)
    {
        double value = logged("evaluate", () -> new Evaluator(bindings).evaluate(expression));
        LOGGER.fine(() -> "evaluated " + expression.infix + " under " + bindings + ": " + value);
        return value;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the (unsimplified) partial derivative of the expression with respect to
     * {@code variable}.
     *
     * @throws IllegalArgumentException if {@code variable} is not a lowercase letter
     * @throws DerivationException if the expression is empty
     */
    public Expression derivative (Expression expression, char variable)
    {
        if (!VariableNode.isVariableName(variable))
            throw new IllegalArgumentException("not a variable name: '" + variable + "'");
        Expression result = logged("derivative",
            () -> new Differentiator(variable).derive(expression));
        LOGGER.fine(() -> "d/d" + variable + " " + expression.infix + " = " + result.infix);
        return result;
    }

    // ---------------------------------------------------------------------------------------------

    public Expression simplify (Expression expression)
    {
        Expression result = new Simplifier().simplify(expression);
        LOGGER.fine(() -> "simplified " + expression.infix + " to " + result.infix);
        return result;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * @throws CompositionException see {@link Composer#compose}
     */
    public Expression compose (Expression a, Expression b, char op)
    {
        Expression result = logged("compose", () -> Composer.compose(a, b, op));
        LOGGER.fine(() -> "composed " + result.infix);
        return result;
    }

    // ---------------------------------------------------------------------------------------------

    public Expression clone (Expression expression) {
        return expression.copy();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Replaces every variable present in {@code bindings} by its value; other variables stay
     * symbolic.
     */
    public Expression substituteBoundVariables
            (Expression expression, Map<Character, Double> bindings)
    {
        Expression result = new Substitution(bindings).apply(expression);
        LOGGER.fine(() -> "substituted " + bindings + " in " + expression.infix + ": " + result.infix);
        return result;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a copy of the subtree addressed by {@code path}, as an expression of its own.
     *
     * @throws CompositionException if the expression is empty or the path leaves the tree
     */
    public Expression subtree (Expression expression, NodePath path) {
        return logged("subtree",
            () -> Expression.of(Wrapping.subtree(expression, path).copy()));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a copy of the expression where the subtree addressed by {@code path} is replaced
     * by {@code function} applied to it.
     *
     * @throws CompositionException if the expression is empty or the path leaves the tree
     */
    public Expression wrapInFunction (Expression expression, NodePath path, UnaryFunction function)
    {
        Expression result = logged("wrap",
            () -> Wrapping.wrapInFunction(expression, path, function));
        LOGGER.fine(() -> "wrapped " + path + " of " + expression.infix + ": " + result.infix);
        return result;
    }

    // ---------------------------------------------------------------------------------------------

    private static <T> T logged (String operation, Supplier<T> action)
    {
        try {
            return action.get();
        } catch (ExpressionException e) {
            LOGGER.fine(() -> operation + " failed: " + e.getMessage());
            throw e;
        }
    }
}
