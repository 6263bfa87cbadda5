package norswap.symex.ast;

public enum BinaryOperator
{
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    POWER('^');

    public final char symbol;

    BinaryOperator (char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the operator written as {@code symbol}, or null if there is none.
     */
    public static BinaryOperator of (char symbol)
    {
        for (BinaryOperator operator: values())
            if (operator.symbol == symbol)
                return operator;
        return null;
    }

    /**
     * Plain floating-point application, with no domain check.
     */
    public double apply (double left, double right)
    {
        switch (this) {
            case ADD:       return left + right;
            case SUBTRACT:  return left - right;
            case MULTIPLY:  return left * right;
            case DIVIDE:    return left / right;
            case POWER:     return Math.pow(left, right);
            default:
                throw new Error("should not reach here");
        }
    }
}
