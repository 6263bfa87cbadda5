package norswap.symex.calculus;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

import static norswap.symex.ast.Nodes.*;
import static norswap.symex.ast.UnaryFunction.COS;
import static norswap.symex.ast.UnaryFunction.LN;
import static norswap.symex.ast.UnaryFunction.SIN;

/**
 * Computes symbolic partial derivatives with respect to one variable.
 *
 * <p>The result is a brand new tree: every operand of the source that appears in the result is
 * deep-copied, so the result never shares a node with the source. The result is not simplified;
 * feed it to {@link norswap.symex.rewrite.Simplifier} for a readable form.
 *
 * <h2>Rules</h2>
 * <ul>
 *     <li>{@code c' = 0}, {@code x' = 1}, {@code y' = 0}</li>
 *     <li>{@code (u ± v)' = u' ± v'}</li>
 *     <li>{@code (u * v)' = u'*v + u*v'}</li>
 *     <li>{@code (u / v)' = (u'*v - u*v') / v^2}</li>
 *     <li>{@code (u ^ n)' = (n * u^(n-1)) * u'} for a constant exponent ({@code 0} when
 *     {@code n = 0}, {@code u'} when {@code n = 1})</li>
 *     <li>{@code (u ^ v)' = u^v * (v'*ln(u) + v*(u'/u))} otherwise</li>
 *     <li>{@code sin(u)' = cos(u)*u'}, {@code cos(u)' = (-1*sin(u))*u'},
 *     {@code tan(u)' = (1/cos(u)^2)*u'}, {@code ln(u)' = u'/u}</li>
 * </ul>
 */
public final class Differentiator
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<ExpressionNode, ExpressionNode> visitor = new ValuedVisitor<>();
    private final char variable;

    // ---------------------------------------------------------------------------------------------

    /**
     * Creates a differentiator with respect to {@code variable}.
     */
    public Differentiator (char variable)
    {
        this.variable = variable;

        visitor.register(NumberNode.class,            this::numberLiteral);
        visitor.register(VariableNode.class,          this::variableReference);
        visitor.register(FunctionNode.class,          this::functionCall);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    public Expression derive (Expression expression)
    {
        if (expression.isEmpty())
            throw DerivationException.emptyExpression();
        return Expression.of(derive(expression.root));
    }

    // ---------------------------------------------------------------------------------------------

    public ExpressionNode derive (ExpressionNode node) {
        return visitor.apply(node);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode numberLiteral (NumberNode node) {
        return number(0);
    }

    private ExpressionNode variableReference (VariableNode node) {
        return number(node.name == variable ? 1 : 0);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode functionCall (FunctionNode node)
    {
        ExpressionNode u  = node.operand;
        ExpressionNode du = derive(u);

        switch (node.function) {
            case SIN:
                return multiply(call(COS, u.copy()), du);
            case COS:
                return multiply(multiply(number(-1), call(SIN, u.copy())), du);
            case TAN:
                return multiply(divide(number(1), power(call(COS, u.copy()), number(2))), du);
            case LN:
                return divide(du, u.copy());
            default:
                throw DerivationException.unsupportedFunction(node.function.code);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode binaryExpression (BinaryExpressionNode node)
    {
        ExpressionNode u = node.left;
        ExpressionNode v = node.right;

        switch (node.operator) {
            case ADD:
            case SUBTRACT:
                return new BinaryExpressionNode(derive(u), node.operator, derive(v));

            case MULTIPLY: {
                ExpressionNode du = derive(u);
                ExpressionNode dv = derive(v);
                return add(multiply(du, v.copy()), multiply(u.copy(), dv));
            }

            case DIVIDE: {
                ExpressionNode du = derive(u);
                ExpressionNode dv = derive(v);
                ExpressionNode numerator = subtract(multiply(du, v.copy()), multiply(u.copy(), dv));
                return divide(numerator, power(v.copy(), number(2)));
            }

            case POWER:
                return powerRule(node);

            default:
                throw DerivationException.unsupportedOperator(node.operator.symbol);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode powerRule (BinaryExpressionNode node)
    {
        ExpressionNode u  = node.left;
        ExpressionNode v  = node.right;
        ExpressionNode du = derive(u);

        if (v instanceof NumberNode) {
            // the derivative of the constant exponent is zero and never needed
            double n = ((NumberNode) v).value;
            if (Tolerance.isZero(n))
                return number(0);
            if (Tolerance.same(n, 1))
                return du;
            return multiply(multiply(number(n), power(u.copy(), number(n - 1))), du);
        }

        // logarithmic differentiation
        ExpressionNode dv = derive(v);
        ExpressionNode inside = add(
            multiply(dv, call(LN, u.copy())),
            multiply(v.copy(), divide(du, u.copy())));
        return multiply(power(u.copy(), v.copy()), inside);
    }
}
