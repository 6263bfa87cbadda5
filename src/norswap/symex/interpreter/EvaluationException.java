package norswap.symex.interpreter;

import norswap.symex.ExpressionException;
import norswap.symex.ast.UnaryFunction;
import norswap.symex.printing.Numbers;

/**
 * Failure to compute the numeric value of a tree.
 */
public final class EvaluationException extends ExpressionException
{
    // ---------------------------------------------------------------------------------------------

    public enum Kind {
        UNBOUND_VARIABLE,
        DIVISION_BY_ZERO,
        DOMAIN_ERROR,
        EMPTY_EXPRESSION
    }

    // ---------------------------------------------------------------------------------------------

    public final Kind kind;

    /** The unbound variable for {@link Kind#UNBOUND_VARIABLE}, 0 otherwise. */
    public final char variable;

    /** The function for {@link Kind#DOMAIN_ERROR}, null otherwise. */
    public final UnaryFunction function;

    /** The rejected argument for {@link Kind#DOMAIN_ERROR}, NaN otherwise. */
    public final double argument;

    // ---------------------------------------------------------------------------------------------

    private EvaluationException
            (Kind kind, char variable, UnaryFunction function, double argument, String message)
    {
        super(message);
        this.kind = kind;
        this.variable = variable;
        this.function = function;
        this.argument = argument;
    }

    // ---------------------------------------------------------------------------------------------

    public static EvaluationException unboundVariable (char variable) {
        return new EvaluationException(Kind.UNBOUND_VARIABLE, variable, null, Double.NaN,
            "variable '" + variable + "' has no value");
    }

    public static EvaluationException divisionByZero () {
        return new EvaluationException(Kind.DIVISION_BY_ZERO, (char) 0, null, Double.NaN,
            "division by zero");
    }

    public static EvaluationException domainError (UnaryFunction function, double argument) {
        return new EvaluationException(Kind.DOMAIN_ERROR, (char) 0, function, argument,
            function.string + " is undefined at " + Numbers.decimal(argument));
    }

    public static EvaluationException emptyExpression () {
        return new EvaluationException(Kind.EMPTY_EXPRESSION, (char) 0, null, Double.NaN,
            "cannot evaluate an empty expression");
    }
}
