package norswap.symex.ast;

import java.util.Objects;

public final class FunctionNode extends ExpressionNode
{
    public final UnaryFunction function;
    public final ExpressionNode operand;

    public FunctionNode (UnaryFunction function, ExpressionNode operand) {
        this.function = Objects.requireNonNull(function, "function");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override public FunctionNode copy () {
        return new FunctionNode(function, operand.copy());
    }

    @Override public String contents ()
    {
        String candidate = function.string + "(" + operand.contents() + ")";
        return candidate.length() <= contentsBudget()
            ? candidate
            : function.string + "(?)";
    }
}
