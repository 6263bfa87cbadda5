package norswap.symex.ast;

import java.util.Set;

import static norswap.symex.ast.BinaryOperator.*;

/**
 * Algebraic constructors and structural queries over expression nodes.
 */
public final class Nodes
{
    private Nodes () {}

    // ---------------------------------------------------------------------------------------------

    public static NumberNode number (double value) {
        return new NumberNode(value);
    }

    public static ExpressionNode add (ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(left, ADD, right);
    }

    public static ExpressionNode subtract (ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(left, SUBTRACT, right);
    }

    public static ExpressionNode multiply (ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(left, MULTIPLY, right);
    }

    public static ExpressionNode divide (ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(left, DIVIDE, right);
    }

    public static ExpressionNode power (ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(left, POWER, right);
    }

    public static ExpressionNode call (UnaryFunction function, ExpressionNode operand) {
        return new FunctionNode(function, operand);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Whether {@code node} is a number equal to {@code value}, within {@link Tolerance#EPSILON}.
     */
    public static boolean isNumber (ExpressionNode node, double value) {
        return node instanceof NumberNode && Tolerance.same(((NumberNode) node).value, value);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Node-by-node equality: same variant, numbers within {@link Tolerance#EPSILON}, variables by
     * name, functions and operators by code with recursively equal children. Operand order
     * matters: {@code x*y} and {@code y*x} are different.
     */
    public static boolean structurallyEqual (ExpressionNode a, ExpressionNode b)
    {
        if (a == b)
            return true;
        if (a == null || b == null || a.getClass() != b.getClass())
            return false;

        if (a instanceof NumberNode)
            return Tolerance.same(((NumberNode) a).value, ((NumberNode) b).value);

        if (a instanceof VariableNode)
            return ((VariableNode) a).name == ((VariableNode) b).name;

        if (a instanceof FunctionNode) {
            FunctionNode fa = (FunctionNode) a;
            FunctionNode fb = (FunctionNode) b;
            return fa.function == fb.function && structurallyEqual(fa.operand, fb.operand);
        }

        BinaryExpressionNode ba = (BinaryExpressionNode) a;
        BinaryExpressionNode bb = (BinaryExpressionNode) b;
        return ba.operator == bb.operator
            && structurallyEqual(ba.left, bb.left)
            && structurallyEqual(ba.right, bb.right);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Adds the name of every variable occurring under {@code node} to {@code out}.
     */
    public static void collectVariables (ExpressionNode node, Set<Character> out)
    {
        if (node instanceof VariableNode)
            out.add(((VariableNode) node).name);
        else if (node instanceof FunctionNode)
            collectVariables(((FunctionNode) node).operand, out);
        else if (node instanceof BinaryExpressionNode) {
            collectVariables(((BinaryExpressionNode) node).left, out);
            collectVariables(((BinaryExpressionNode) node).right, out);
        }
    }
}
