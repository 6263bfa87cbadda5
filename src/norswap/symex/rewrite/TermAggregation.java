package norswap.symex.rewrite;

import norswap.symex.ast.*;

import java.util.ArrayList;
import java.util.List;

import static norswap.symex.ast.Nodes.*;

/**
 * Merges like terms of a chain of additions: {@code a + a + a} becomes {@code a*3},
 * {@code a*4 + 2 + a*5 + 1} becomes {@code a*9 + 3}.
 *
 * <p>Each term is read as {@code (base, coefficient)}: a number {@code n} as {@code (none, n)},
 * {@code b*n} or {@code n*b} as {@code (b, n)}, anything else {@code t} as {@code (t, 1)}. Terms
 * with structurally equal bases are merged by summing their coefficients. Bases are compared in
 * order: {@code x*y} and {@code y*x} are different bases.
 */
final class TermAggregation
{
    // ---------------------------------------------------------------------------------------------

    private TermAggregation () {}

    // ---------------------------------------------------------------------------------------------

    private static final class Term
    {
        /** Null for the numeric group. */
        final ExpressionNode base;
        double coefficient;

        Term (ExpressionNode base, double coefficient) {
            this.base = base;
            this.coefficient = coefficient;
        }

        boolean sameBase (Term other) {
            return base == null
                ? other.base == null
                : other.base != null && structurallyEqual(base, other.base);
        }
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the merged form of {@code sum}, or null if merging does not reduce the number of
     * terms. The returned tree is freshly built and not yet simplified.
     */
    static ExpressionNode aggregate (BinaryExpressionNode sum)
    {
        List<ExpressionNode> terms = new ArrayList<>();
        flatten(sum, terms);

        List<Term> groups = new ArrayList<>();
        outer: for (ExpressionNode node: terms) {
            Term term = extract(node);
            for (Term group: groups)
                if (group.sameBase(term)) {
                    group.coefficient += term.coefficient;
                    continue outer;
                }
            groups.add(term);
        }

        if (groups.size() >= terms.size())
            return null;

        ExpressionNode result = null;
        for (Term group: groups) {
            if (Tolerance.isZero(group.coefficient))
                continue;
            ExpressionNode term =
                group.base == null
                    ? number(group.coefficient)
                : Tolerance.same(group.coefficient, 1)
                    ? group.base.copy()
                    : multiply(group.base.copy(), number(group.coefficient));
            result = result == null ? term : add(result, term);
        }
        return result == null ? number(0) : result;
    }

    // ---------------------------------------------------------------------------------------------

    private static void flatten (ExpressionNode node, List<ExpressionNode> out)
    {
        if (node instanceof BinaryExpressionNode
                && ((BinaryExpressionNode) node).operator == BinaryOperator.ADD) {
            flatten(((BinaryExpressionNode) node).left, out);
            flatten(((BinaryExpressionNode) node).right, out);
        } else {
            out.add(node);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private static Term extract (ExpressionNode node)
    {
        if (node instanceof NumberNode)
            return new Term(null, ((NumberNode) node).value);

        if (node instanceof BinaryExpressionNode) {
            BinaryExpressionNode product = (BinaryExpressionNode) node;
            if (product.operator == BinaryOperator.MULTIPLY) {
                boolean leftNumber  = product.left  instanceof NumberNode;
                boolean rightNumber = product.right instanceof NumberNode;
                if (rightNumber && !leftNumber)
                    return new Term(product.left, ((NumberNode) product.right).value);
                if (leftNumber && !rightNumber)
                    return new Term(product.right, ((NumberNode) product.left).value);
            }
        }

        return new Term(node, 1);
    }
}
