package norswap.symex.ast;

/**
 * Absolute tolerance used for every "is zero", "is one" and equality test on node values.
 */
public final class Tolerance
{
    public static final double EPSILON = 1e-12;

    private Tolerance () {}

    public static boolean isZero (double x) {
        return Math.abs(x) < EPSILON;
    }

    public static boolean same (double x, double y) {
        return Math.abs(x - y) < EPSILON;
    }
}
