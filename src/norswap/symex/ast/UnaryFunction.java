package norswap.symex.ast;

public enum UnaryFunction
{
    SIN("sin", 's'),
    COS("cos", 'c'),
    TAN("tan", 't'),
    LN ("ln",  'l');

    /** Name used in infix output. */
    public final String string;

    /** Letter appended after the operand in postfix output. */
    public final char code;

    UnaryFunction (String string, char code) {
        this.string = string;
        this.code = code;
    }

    /**
     * Plain floating-point application, with no domain check.
     */
    public double apply (double x)
    {
        switch (this) {
            case SIN:   return Math.sin(x);
            case COS:   return Math.cos(x);
            case TAN:   return Math.tan(x);
            case LN:    return Math.log(x);
            default:
                throw new Error("should not reach here");
        }
    }
}
