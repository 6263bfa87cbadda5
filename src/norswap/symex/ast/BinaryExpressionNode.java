package norswap.symex.ast;

import java.util.Objects;

public final class BinaryExpressionNode extends ExpressionNode
{
    public final ExpressionNode left;
    public final BinaryOperator operator;
    public final ExpressionNode right;

    public BinaryExpressionNode (ExpressionNode left, BinaryOperator operator, ExpressionNode right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override public BinaryExpressionNode copy () {
        return new BinaryExpressionNode(left.copy(), operator, right.copy());
    }

    @Override public String contents ()
    {
        String candidate = String.format("(%s %c %s)",
            left.contents(), operator.symbol, right.contents());

        if (candidate.length() <= contentsBudget())
            return candidate;

        candidate = String.format("(%s %c (?))", left.contents(), operator.symbol);
        return candidate.length() <= contentsBudget()
            ? candidate
            : String.format("((?) %c (?))", operator.symbol);
    }
}
