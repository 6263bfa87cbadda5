package norswap.symex.printing;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Textual forms of node values.
 */
public final class Numbers
{
    private Numbers () {}

    private static final MathContext SIX_DIGITS = new MathContext(6);

    /** Beyond this magnitude, integral values are no longer printed digit by digit. */
    private static final double INTEGRAL_LIMIT = 1e15;

    // ---------------------------------------------------------------------------------------------

    private static boolean isIntegral (double value) {
        return value == Math.rint(value) && Math.abs(value) < INTEGRAL_LIMIT;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Display form: integral values without fraction, other values rounded to six significant
     * digits ({@code 0.333333}, {@code 1.5E-7}).
     */
    public static String decimal (double value)
    {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return Double.toString(value);
        if (isIntegral(value))
            return Long.toString((long) value);
        return new BigDecimal(value).round(SIX_DIGITS).stripTrailingZeros().toString();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Whether {@code value} is written as a single bare digit in postfix text.
     */
    public static boolean isDigit (double value) {
        return value == Math.rint(value) && value >= 0 && value <= 9;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Postfix token for {@code value}: a bare digit when {@link #isDigit} holds, otherwise the
     * exact value between brackets ({@code [12]}, {@code [-0.5]}, {@code [1.0E-7]}).
     */
    public static String postfixToken (double value)
    {
        if (isDigit(value))
            return String.valueOf((char) ('0' + (int) value));
        String literal = isIntegral(value)
            ? Long.toString((long) value)
            : Double.toString(value);
        return "[" + literal + "]";
    }
}
