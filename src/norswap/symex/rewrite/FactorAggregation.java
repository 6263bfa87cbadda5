package norswap.symex.rewrite;

import norswap.symex.ast.*;

import java.util.ArrayList;
import java.util.List;

import static norswap.symex.ast.Nodes.*;

/**
 * Merges the factors of a chain of multiplications: numeric factors are folded into one
 * leading coefficient and repeated factors become powers, so {@code 2*a*3*a} becomes
 * {@code 6*a^2}. A zero coefficient collapses the whole chain to {@code 0}.
 *
 * <p>Factors are compared with {@link Nodes#structurallyEqual}, in order.
 */
final class FactorAggregation
{
    // ---------------------------------------------------------------------------------------------

    private FactorAggregation () {}

    // ---------------------------------------------------------------------------------------------

    private static final class Factor
    {
        final ExpressionNode node;
        int count = 1;

        Factor (ExpressionNode node) {
            this.node = node;
        }
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the merged form of {@code product}, or null if there is nothing to merge: no two
     * numeric factors, no factor of one and no repeated factor. The returned tree is freshly
     * built and not yet simplified.
     */
    static ExpressionNode aggregate (BinaryExpressionNode product)
    {
        List<ExpressionNode> factors = new ArrayList<>();
        flatten(product, factors);

        double coefficient = 1;
        List<ExpressionNode> symbolic = new ArrayList<>();
        for (ExpressionNode factor: factors) {
            if (factor instanceof NumberNode)
                coefficient *= ((NumberNode) factor).value;
            else
                symbolic.add(factor);
        }

        if (Tolerance.isZero(coefficient))
            return number(0);

        List<Factor> groups = new ArrayList<>();
        outer: for (ExpressionNode node: symbolic) {
            for (Factor group: groups)
                if (structurallyEqual(group.node, node)) {
                    ++ group.count;
                    continue outer;
                }
            groups.add(new Factor(node));
        }

        boolean unit = Tolerance.same(coefficient, 1);
        boolean folded = factors.size() > symbolic.size() + (unit ? 0 : 1);
        boolean grouped = groups.size() < symbolic.size();

        if (!folded && !grouped)
            return null;

        ExpressionNode result = unit ? null : number(coefficient);
        for (Factor group: groups) {
            ExpressionNode factor = group.count == 1
                ? group.node.copy()
                : power(group.node.copy(), number(group.count));
            result = result == null ? factor : multiply(result, factor);
        }
        return result == null ? number(coefficient) : result;
    }

    // ---------------------------------------------------------------------------------------------

    private static void flatten (ExpressionNode node, List<ExpressionNode> out)
    {
        if (node instanceof BinaryExpressionNode
                && ((BinaryExpressionNode) node).operator == BinaryOperator.MULTIPLY) {
            flatten(((BinaryExpressionNode) node).left, out);
            flatten(((BinaryExpressionNode) node).right, out);
        } else {
            out.add(node);
        }
    }
}
