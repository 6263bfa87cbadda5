package norswap.symex.ast;

import norswap.symex.printing.InfixPrinter;
import norswap.symex.printing.PostfixPrinter;

/**
 * An expression tree: a root node that exclusively owns its subtree, together with the postfix
 * text it was built from and its infix rendering.
 *
 * <p>An expression may be empty, in which case {@link #root} is null and both texts are empty.
 *
 * <p>Expressions are immutable: every operation on them returns a new expression.
 */
public final class Expression
{
    // ---------------------------------------------------------------------------------------------

    private static final Expression EMPTY = new Expression(null, "", "");

    // ---------------------------------------------------------------------------------------------

    /** Null for the empty expression. */
    public final ExpressionNode root;

    /**
     * For a parsed expression, the trimmed source text; otherwise the postfix rendering of
     * {@link #root}.
     */
    public final String postfix;

    public final String infix;

    // ---------------------------------------------------------------------------------------------

    private Expression (ExpressionNode root, String postfix, String infix) {
        this.root = root;
        this.postfix = postfix;
        this.infix = infix;
    }

    // ---------------------------------------------------------------------------------------------

    public static Expression empty () {
        return EMPTY;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Wraps a freshly built tree. The caller must not keep references into {@code root}.
     */
    public static Expression of (ExpressionNode root)
    {
        if (root == null)
            return EMPTY;
        return new Expression(root, new PostfixPrinter().print(root), new InfixPrinter().print(root));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Wraps a tree parsed from {@code source}, recording the trimmed text verbatim.
     */
    public static Expression parsed (ExpressionNode root, String source) {
        return new Expression(root, source.trim(), new InfixPrinter().print(root));
    }

    // ---------------------------------------------------------------------------------------------

    public boolean isEmpty () {
        return root == null;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a deep copy of this expression, with the same texts.
     */
    public Expression copy () {
        return root == null ? EMPTY : new Expression(root.copy(), postfix, infix);
    }

    // ---------------------------------------------------------------------------------------------

    @Override public String toString () {
        return infix;
    }
}
