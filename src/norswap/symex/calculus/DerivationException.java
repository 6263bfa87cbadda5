package norswap.symex.calculus;

import norswap.symex.ExpressionException;

/**
 * Failure to differentiate a tree.
 */
public final class DerivationException extends ExpressionException
{
    public enum Kind {
        UNSUPPORTED_OPERATOR,
        UNSUPPORTED_FUNCTION,
        EMPTY_EXPRESSION
    }

    public final Kind kind;

    /** The operator symbol or function code that has no rule, 0 for an empty expression. */
    public final char symbol;

    private DerivationException (Kind kind, char symbol, String message) {
        super(message);
        this.kind = kind;
        this.symbol = symbol;
    }

    public static DerivationException unsupportedOperator (char symbol) {
        return new DerivationException(Kind.UNSUPPORTED_OPERATOR, symbol,
            "no differentiation rule for operator '" + symbol + "'");
    }

    public static DerivationException unsupportedFunction (char code) {
        return new DerivationException(Kind.UNSUPPORTED_FUNCTION, code,
            "no differentiation rule for function '" + code + "'");
    }

    public static DerivationException emptyExpression () {
        return new DerivationException(Kind.EMPTY_EXPRESSION, (char) 0,
            "cannot differentiate an empty expression");
    }
}
