package norswap.symex.transform;

import norswap.symex.ast.BinaryExpressionNode;
import norswap.symex.ast.BinaryOperator;
import norswap.symex.ast.Expression;

/**
 * Combines two expressions under a binary operator.
 */
public final class Composer
{
    private Composer () {}

    /**
     * Returns {@code (a) op (b)} built over deep copies of both roots; the inputs are left
     * untouched.
     *
     * @throws CompositionException if {@code op} is not one of {@code + - * / ^}
     * ({@link CompositionException.Kind#INVALID_OPERATOR}), or if either operand is empty
     * ({@link CompositionException.Kind#EMPTY_OPERAND})
     */
    public static Expression compose (Expression a, Expression b, char op)
    {
        BinaryOperator operator = BinaryOperator.of(op);
        if (operator == null)
            throw CompositionException.invalidOperator(op);
        if (a.isEmpty() || b.isEmpty())
            throw CompositionException.emptyOperand();

        return Expression.of(new BinaryExpressionNode(a.root.copy(), operator, b.root.copy()));
    }
}
