package norswap.symex.interpreter;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

import java.util.Map;

/**
 * Computes the value of an expression tree under a set of variable bindings.
 *
 * <p>The walk is post-order; the first error met aborts the whole evaluation and propagates
 * unchanged as an {@link EvaluationException}:
 * <ul>
 *     <li>a variable missing from the bindings: {@link EvaluationException.Kind#UNBOUND_VARIABLE}</li>
 *     <li>{@code ln} of a non-positive value: {@link EvaluationException.Kind#DOMAIN_ERROR}</li>
 *     <li>a divisor within {@link Tolerance#EPSILON} of zero:
 *     {@link EvaluationException.Kind#DIVISION_BY_ZERO}</li>
 * </ul>
 *
 * <p>Powers are computed by {@link Math#pow} without any domain guard, so they may yield NaN or
 * an infinity.
 *
 * <p>An evaluator is bound to one set of bindings and is not thread-safe.
 */
public final class Evaluator
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<ExpressionNode, Double> visitor = new ValuedVisitor<>();
    private final Map<Character, Double> bindings;

    // ---------------------------------------------------------------------------------------------

    public Evaluator (Map<Character, Double> bindings)
    {
        this.bindings = bindings;

        visitor.register(NumberNode.class,            this::number);
        visitor.register(VariableNode.class,          this::variable);
        visitor.register(FunctionNode.class,          this::function);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    public double evaluate (Expression expression)
    {
        if (expression.isEmpty())
            throw EvaluationException.emptyExpression();
        return evaluate(expression.root);
    }

    // ---------------------------------------------------------------------------------------------

    public double evaluate (ExpressionNode node) {
        return visitor.apply(node);
    }

    // ---------------------------------------------------------------------------------------------

    private Double number (NumberNode node) {
        return node.value;
    }

    // ---------------------------------------------------------------------------------------------

    private Double variable (VariableNode node)
    {
        Double value = bindings.get(node.name);
        if (value == null)
            throw EvaluationException.unboundVariable(node.name);
        return value;
    }

    // ---------------------------------------------------------------------------------------------

    private Double function (FunctionNode node)
    {
        double x = evaluate(node.operand);
        if (node.function == UnaryFunction.LN && x <= 0)
            throw EvaluationException.domainError(node.function, x);
        return node.function.apply(x);
    }

    // ---------------------------------------------------------------------------------------------

    private Double binaryExpression (BinaryExpressionNode node)
    {
        double x = evaluate(node.left);
        double y = evaluate(node.right);

        if (node.operator == BinaryOperator.DIVIDE && Tolerance.isZero(y))
            throw EvaluationException.divisionByZero();

        return node.operator.apply(x, y);
    }
}
