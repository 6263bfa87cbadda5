package norswap.symex.transform;

import norswap.symex.ExpressionException;
import norswap.symex.ast.NodePath;

/**
 * Failure to build a tree out of existing ones.
 */
public final class CompositionException extends ExpressionException
{
    public enum Kind {
        INVALID_OPERATOR,
        EMPTY_OPERAND,
        INVALID_PATH
    }

    public final Kind kind;

    /** The rejected operator for {@link Kind#INVALID_OPERATOR}, 0 otherwise. */
    public final char operator;

    /** The rejected path for {@link Kind#INVALID_PATH}, null otherwise. */
    public final NodePath path;

    private CompositionException (Kind kind, char operator, NodePath path, String message) {
        super(message);
        this.kind = kind;
        this.operator = operator;
        this.path = path;
    }

    public static CompositionException invalidOperator (char operator) {
        return new CompositionException(Kind.INVALID_OPERATOR, operator, null,
            "'" + operator + "' is not a binary operator");
    }

    public static CompositionException emptyOperand () {
        return new CompositionException(Kind.EMPTY_OPERAND, (char) 0, null,
            "cannot compose an empty expression");
    }

    public static CompositionException invalidPath (NodePath path) {
        return new CompositionException(Kind.INVALID_PATH, (char) 0, path,
            "path " + path + " does not address a node");
    }
}
