package norswap.symex;

/**
 * Failure to build a tree from postfix text.
 */
public final class ParseException extends ExpressionException
{
    // ---------------------------------------------------------------------------------------------

    public enum Kind
    {
        /** A character outside the postfix alphabet; see {@link #token}. */
        INVALID_TOKEN,
        /** An operator with fewer than two operands on the stack. */
        INSUFFICIENT_OPERANDS,
        /** The input did not reduce to exactly one tree. */
        MALFORMED_EXPRESSION
    }

    // ---------------------------------------------------------------------------------------------

    public final Kind kind;

    /** The offending character for {@link Kind#INVALID_TOKEN}, 0 otherwise. */
    public final char token;

    /** Offset of the offending character in the input, or -1 when the failure has none. */
    public final int offset;

    // ---------------------------------------------------------------------------------------------

    private ParseException (Kind kind, char token, int offset, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.offset = offset;
    }

    // ---------------------------------------------------------------------------------------------

    public static ParseException invalidToken (char token, int offset) {
        return new ParseException(Kind.INVALID_TOKEN, token, offset,
            "invalid character '" + token + "' at offset " + offset);
    }

    public static ParseException insufficientOperands (char operator, int offset) {
        return new ParseException(Kind.INSUFFICIENT_OPERANDS, (char) 0, offset,
            "not enough operands for '" + operator + "' at offset " + offset);
    }

    public static ParseException malformed (int stackSize) {
        return new ParseException(Kind.MALFORMED_EXPRESSION, (char) 0, -1,
            "malformed expression: " + stackSize + " values left on the stack instead of 1");
    }
}
