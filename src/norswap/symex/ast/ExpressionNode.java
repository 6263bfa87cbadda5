package norswap.symex.ast;

/**
 * Base class of the expression tree nodes.
 *
 * <p>The hierarchy is closed: the only subclasses are {@link NumberNode}, {@link VariableNode},
 * {@link FunctionNode} and {@link BinaryExpressionNode}. Nodes are immutable and their children
 * are never null.
 *
 * <p>A node belongs to exactly one tree. Operations that need to reuse a subexpression in
 * another tree must go through {@link #copy()}.
 */
public abstract class ExpressionNode
{
    // ---------------------------------------------------------------------------------------------

    ExpressionNode () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a deep copy of this node: the result shares no node with this tree.
     */
    public abstract ExpressionNode copy ();

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a short rendering of the node, for diagnostics. Long subexpressions are elided
     * as {@code (?)} so that the result stays within {@link #contentsBudget()} characters where
     * possible.
     */
    public abstract String contents ();

    // ---------------------------------------------------------------------------------------------

    /**
     * Maximum size for the string returned by {@link #contents()}.
     */
    protected int contentsBudget () {
        return 100;
    }

    // ---------------------------------------------------------------------------------------------

    @Override public String toString () {
        return contents();
    }
}
