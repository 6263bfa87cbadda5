package norswap.symex.printing;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

/**
 * Renders a tree as fully parenthesized infix text: {@code ((a + b) * sin(c))}.
 */
public final class InfixPrinter
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<ExpressionNode, String> visitor = new ValuedVisitor<>();

    // ---------------------------------------------------------------------------------------------

    public InfixPrinter ()
    {
        visitor.register(NumberNode.class,            this::number);
        visitor.register(VariableNode.class,          this::variable);
        visitor.register(FunctionNode.class,          this::function);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the infix text of {@code root}, or the empty string for a null root.
     */
    public String print (ExpressionNode root) {
        return root == null ? "" : visitor.apply(root);
    }

    // ---------------------------------------------------------------------------------------------

    private String number (NumberNode node) {
        return Numbers.decimal(node.value);
    }

    private String variable (VariableNode node) {
        return String.valueOf(node.name);
    }

    private String function (FunctionNode node) {
        return node.function.string + "(" + visitor.apply(node.operand) + ")";
    }

    private String binaryExpression (BinaryExpressionNode node) {
        return "(" + visitor.apply(node.left) + " " + node.operator.symbol + " "
            + visitor.apply(node.right) + ")";
    }
}
