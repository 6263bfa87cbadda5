package norswap.symex.ast;

import norswap.symex.printing.Numbers;

public final class NumberNode extends ExpressionNode
{
    public final double value;

    public NumberNode (double value) {
        this.value = value;
    }

    @Override public NumberNode copy () {
        return new NumberNode(value);
    }

    @Override public String contents () {
        return Numbers.decimal(value);
    }
}
