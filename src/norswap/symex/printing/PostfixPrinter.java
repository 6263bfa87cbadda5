package norswap.symex.printing;

import norswap.symex.ast.*;
import norswap.utils.visitors.ValuedVisitor;

/**
 * Renders a tree as postfix text, in the token alphabet read by
 * {@link norswap.symex.PostfixParser} plus the function codes {@code s c t l}, which are output
 * only.
 */
public final class PostfixPrinter
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<ExpressionNode, String> visitor = new ValuedVisitor<>();

    // ---------------------------------------------------------------------------------------------

    public PostfixPrinter ()
    {
        visitor.register(NumberNode.class,            this::number);
        visitor.register(VariableNode.class,          this::variable);
        visitor.register(FunctionNode.class,          this::function);
        visitor.register(BinaryExpressionNode.class,  this::binaryExpression);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the postfix text of {@code root}, or the empty string for a null root.
     */
    public String print (ExpressionNode root) {
        return root == null ? "" : visitor.apply(root);
    }

    // ---------------------------------------------------------------------------------------------

    private String number (NumberNode node) {
        return Numbers.postfixToken(node.value);
    }

    private String variable (VariableNode node) {
        return String.valueOf(node.name);
    }

    private String function (FunctionNode node) {
        return visitor.apply(node.operand) + node.function.code;
    }

    private String binaryExpression (BinaryExpressionNode node) {
        return visitor.apply(node.left) + visitor.apply(node.right) + node.operator.symbol;
    }
}
