package norswap.symex.transform;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

import java.util.Map;

/**
 * Replaces the variables that have a binding by number leaves; unbound variables stay symbolic.
 * The result is a new tree, the input is left untouched.
 */
public final class Substitution
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<ExpressionNode, ExpressionNode> visitor = new ValuedVisitor<>();
    private final Map<Character, Double> bindings;

    // ---------------------------------------------------------------------------------------------

    public Substitution (Map<Character, Double> bindings)
    {
        this.bindings = bindings;

        visitor.register(NumberNode.class,            NumberNode::copy);
        visitor.register(VariableNode.class,          this::variable);
        visitor.register(FunctionNode.class,          this::function);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    public Expression apply (Expression expression) {
        return expression.isEmpty()
            ? expression
            : Expression.of(apply(expression.root));
    }

    public ExpressionNode apply (ExpressionNode node) {
        return visitor.apply(node);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode variable (VariableNode node)
    {
        Double value = bindings.get(node.name);
        return value == null ? node.copy() : new NumberNode(value);
    }

    private ExpressionNode function (FunctionNode node) {
        return new FunctionNode(node.function, apply(node.operand));
    }

    private ExpressionNode binaryExpression (BinaryExpressionNode node) {
        return new BinaryExpressionNode(apply(node.left), node.operator, apply(node.right));
    }
}
