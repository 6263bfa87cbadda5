package norswap.symex.rewrite;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

import java.util.logging.Logger;

import static norswap.symex.ast.Nodes.*;

/**
 * Rewrites a tree into a reduced, equivalent form.
 *
 * <p>The rewrite is bottom-up: children are simplified first, then the first applicable rule
 * rewrites the node itself.
 * <ol>
 *     <li>Functions of a number are folded, except {@code ln} of a non-positive number.</li>
 *     <li>Operators on two numbers are folded, except division by zero.</li>
 *     <li>Like terms of addition chains are merged ({@link TermAggregation}).</li>
 *     <li>Factors of multiplication chains are merged ({@link FactorAggregation}).</li>
 *     <li>Identities: {@code x+0}, {@code 0+x}, {@code x-0}, {@code x*1}, {@code 1*x},
 *     {@code x/1}, {@code x^1} give {@code x}; {@code x*0}, {@code 0*x} give {@code 0};
 *     {@code x^0} gives {@code 1}.</li>
 * </ol>
 * A node rebuilt by rules 3 or 4 is simplified again. This guarantees convergence for each
 * rewritten node, not a global normal form.
 *
 * <p>Simplification never fails and never modifies its input: the result is a new tree that
 * shares no node with the input.
 */
public final class Simplifier
{
    // ---------------------------------------------------------------------------------------------

    private static final Logger LOGGER = Logger.getLogger(Simplifier.class.getName());

    private final ValuedVisitor<ExpressionNode, ExpressionNode> visitor = new ValuedVisitor<>();

    // ---------------------------------------------------------------------------------------------

    public Simplifier ()
    {
        visitor.register(NumberNode.class,            NumberNode::copy);
        visitor.register(VariableNode.class,          VariableNode::copy);
        visitor.register(FunctionNode.class,          this::functionCall);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    public Expression simplify (Expression expression) {
        return expression.isEmpty()
            ? expression
            : Expression.of(simplify(expression.root));
    }

    // ---------------------------------------------------------------------------------------------

    public ExpressionNode simplify (ExpressionNode node) {
        return visitor.apply(node);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode functionCall (FunctionNode node)
    {
        ExpressionNode operand = simplify(node.operand);

        if (operand instanceof NumberNode) {
            double x = ((NumberNode) operand).value;
            if (node.function != UnaryFunction.LN || x > 0) {
                LOGGER.finer(() -> "fold " + node.function.string + "(" + x + ")");
                return number(node.function.apply(x));
            }
        }

        return call(node.function, operand);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode binaryExpression (BinaryExpressionNode node) {
        return rewrite(simplify(node.left), node.operator, simplify(node.right));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Rewrites {@code left operator right}, where both operands are already simplified.
     */
    private ExpressionNode rewrite (ExpressionNode left, BinaryOperator operator, ExpressionNode right)
    {
        if (left instanceof NumberNode && right instanceof NumberNode) {
            double x = ((NumberNode) left).value;
            double y = ((NumberNode) right).value;
            if (operator != BinaryOperator.DIVIDE || !Tolerance.isZero(y)) {
                LOGGER.finer(() -> "fold " + x + " " + operator.symbol + " " + y);
                return number(operator.apply(x, y));
            }
        }

        BinaryExpressionNode node = new BinaryExpressionNode(left, operator, right);

        if (operator == BinaryOperator.ADD) {
            ExpressionNode merged = TermAggregation.aggregate(node);
            if (merged != null) {
                LOGGER.finer(() -> "merge terms of " + node.contents());
                return simplify(merged);
            }
        }

        if (operator == BinaryOperator.MULTIPLY) {
            ExpressionNode merged = FactorAggregation.aggregate(node);
            if (merged != null) {
                LOGGER.finer(() -> "merge factors of " + node.contents());
                return simplify(merged);
            }
        }

        ExpressionNode reduced = identity(left, operator, right);
        return reduced != null ? reduced : node;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the reduced form of {@code left operator right} if an identity applies, else null.
     */
    private static ExpressionNode identity
            (ExpressionNode left, BinaryOperator operator, ExpressionNode right)
    {
        switch (operator) {
            case ADD:
                if (isNumber(right, 0)) return left;
                if (isNumber(left, 0))  return right;
                return null;
            case SUBTRACT:
                return isNumber(right, 0) ? left : null;
            case MULTIPLY:
                if (isNumber(right, 0) || isNumber(left, 0)) return number(0);
                if (isNumber(right, 1)) return left;
                if (isNumber(left, 1))  return right;
                return null;
            case DIVIDE:
                return isNumber(right, 1) ? left : null;
            case POWER:
                if (isNumber(right, 0)) return number(1);
                if (isNumber(right, 1)) return left;
                return null;
            default:
                return null;
        }
    }
}
