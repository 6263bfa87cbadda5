package norswap.symex;

import norswap.symex.ast.*;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

/**
 * Assertions on expression trees shared by the test classes.
 */
public final class TreeAssertions
{
    private TreeAssertions () {}

    // ---------------------------------------------------------------------------------------------

    public static void assertStructurallyEqual (ExpressionNode actual, ExpressionNode expected) {
        assertTrue(Nodes.structurallyEqual(actual, expected),
            "expected " + expected.contents() + " but got " + actual.contents());
    }

    // ---------------------------------------------------------------------------------------------

    public static void assertDisjoint (ExpressionNode a, ExpressionNode b) {
        assertFalse(sharesNodes(a, b),
            a.contents() + " and " + b.contents() + " share nodes");
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Whether {@code a} and {@code b} have at least one node object in common.
     */
    public static boolean sharesNodes (ExpressionNode a, ExpressionNode b)
    {
        Set<ExpressionNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        gather(a, seen);
        return reaches(b, seen);
    }

    private static void gather (ExpressionNode node, Set<ExpressionNode> out)
    {
        out.add(node);
        if (node instanceof FunctionNode)
            gather(((FunctionNode) node).operand, out);
        else if (node instanceof BinaryExpressionNode) {
            gather(((BinaryExpressionNode) node).left, out);
            gather(((BinaryExpressionNode) node).right, out);
        }
    }

    private static boolean reaches (ExpressionNode node, Set<ExpressionNode> seen)
    {
        if (seen.contains(node))
            return true;
        if (node instanceof FunctionNode)
            return reaches(((FunctionNode) node).operand, seen);
        if (node instanceof BinaryExpressionNode)
            return reaches(((BinaryExpressionNode) node).left, seen)
                || reaches(((BinaryExpressionNode) node).right, seen);
        return false;
    }
}
