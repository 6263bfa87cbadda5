package norswap.symex.rewrite;

import norswap.symex.PostfixParser;
import norswap.symex.ast.*;
import norswap.symex.calculus.Differentiator;
import norswap.symex.interpreter.EvaluationException;
import norswap.symex.interpreter.Evaluator;
import norswap.symex.printing.InfixPrinter;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static norswap.symex.TreeAssertions.assertDisjoint;
import static norswap.symex.TreeAssertions.assertStructurallyEqual;
import static norswap.symex.ast.Nodes.*;
import static org.testng.Assert.*;

public class SimplifierTests
{
    // ---------------------------------------------------------------------------------------------

    private final PostfixParser parser = new PostfixParser();
    private final Simplifier simplifier = new Simplifier();

    private void check (String postfix, String expectedInfix) {
        assertEquals(simplifier.simplify(parser.parse(postfix)).infix, expectedInfix, postfix);
    }

    private void check (ExpressionNode node, String expectedInfix) {
        assertEquals(simplifier.simplify(Expression.of(node)).infix, expectedInfix);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testConstantFolding ()
    {
        check("23+", "5");
        check("23+4*", "20");
        check("34/", "0.75");
        check("23^", "8");
        check(call(UnaryFunction.SIN, number(0)), "0");
        check(call(UnaryFunction.LN, number(1)), "0");
        check(call(UnaryFunction.COS, subtract(number(1), number(1))), "1");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testUnfoldable ()
    {
        check("10/", "(1 / 0)");
        check("x11-/", "(x / 0)");
        check(call(UnaryFunction.LN, number(-1)), "ln(-1)");
        check(call(UnaryFunction.LN, number(0)), "ln(0)");
        check(call(UnaryFunction.LN, subtract(number(1), number(3))), "ln(-2)");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testIdentities ()
    {
        check("a0+", "a");
        check("0a+", "a");
        check("a0-", "a");
        check("0a-", "(0 - a)");
        check("a0*", "0");
        check("0a*", "0");
        check("a1*", "a");
        check("1a*", "a");
        check("a1/", "a");
        check("1a/", "(1 / a)");
        check("a0^", "1");
        check("a1^", "a");
        check("1a^", "(1 ^ a)");
        check("ab+0*", "0");
        check("a11-+", "a");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testTermAggregation ()
    {
        check("aa+a+", "(a * 3)");
        check("a2*a3*+", "(a * 5)");
        check("2a*a3*+", "(a * 5)");
        check("a2*2+a3*+1+", "((a * 5) + 3)");
        check("a2*a[-2]*+", "0");
        check("2a+[-2]+", "a");
        check("aa-", "(a - a)");
        // bases compare in order
        check("ab*ba*+", "((a * b) + (b * a))");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testFactorAggregation ()
    {
        check("aa*", "(a ^ 2)");
        check("2a*3*", "(6 * a)");
        check("2a*a*", "(2 * (a ^ 2))");
        check("ab+ab+*", "((a + b) ^ 2)");
        check("a[0.5]*2*", "a");
        check("ab*", "(a * b)");
        check("2a*", "(2 * a)");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testDerivativeOfSquare ()
    {
        Expression derivative = new Differentiator('x').derive(parser.parse("xx*"));
        assertEquals(simplifier.simplify(derivative).infix, "(x * 2)");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testFunctionOperandsAreSimplified () {
        check(call(UnaryFunction.SIN, add(new VariableNode('x'), number(0))), "sin(x)");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testInputUntouched ()
    {
        Expression input = parser.parse("a0+a+xx*2*+");
        String before = new InfixPrinter().print(input.root);
        Expression output = simplifier.simplify(input);
        assertEquals(new InfixPrinter().print(input.root), before);
        assertDisjoint(output.root, input.root);

        // even when the result is a subtree of the input
        Expression single = parser.parse("a1*");
        assertDisjoint(simplifier.simplify(single).root, single.root);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testEmpty () {
        assertTrue(simplifier.simplify(Expression.empty()).isEmpty());
    }

    // ---------------------------------------------------------------------------------------------

    private List<ExpressionNode> corpus ()
    {
        String[] sources = {
            "23+", "xx*", "aa+a+", "a2*2+a3*+1+", "ab+c*", "xx*3x*+", "xy/", "x3^", "xx^",
            "2a*a*", "ab*ba*+", "a0+b1*+", "ab+ab+*", "10/", "x2^1+x/", "xy*y-xy*+",
        };
        List<ExpressionNode> corpus = new ArrayList<>();
        Differentiator dx = new Differentiator('x');
        for (String source: sources) {
            ExpressionNode node = parser.parse(source).root;
            corpus.add(node);
            corpus.add(dx.derive(node));
        }
        VariableNode x = new VariableNode('x');
        ExpressionNode sin = call(UnaryFunction.SIN, multiply(x, x));
        ExpressionNode ln  = call(UnaryFunction.LN, add(power(x, number(2)), number(1)));
        ExpressionNode tan = divide(call(UnaryFunction.TAN, x), x);
        for (ExpressionNode node: new ExpressionNode[] { sin, ln, tan }) {
            corpus.add(node);
            corpus.add(dx.derive(node));
        }
        return corpus;
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testIdempotence ()
    {
        for (ExpressionNode node: corpus()) {
            ExpressionNode once = simplifier.simplify(node);
            assertStructurallyEqual(simplifier.simplify(once), once);
        }
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testPreservesValue ()
    {
        Map<Character, Double> bindings = new HashMap<>();
        bindings.put('a', 1.5);
        bindings.put('b', -0.5);
        bindings.put('c', 2.0);
        bindings.put('x', 1.2);
        bindings.put('y', 0.7);
        Evaluator evaluator = new Evaluator(Collections.unmodifiableMap(bindings));

        for (ExpressionNode node: corpus()) {
            double expected;
            try {
                expected = evaluator.evaluate(node);
            } catch (EvaluationException e) {
                continue;
            }
            double actual = evaluator.evaluate(simplifier.simplify(node));
            assertEquals(actual, expected, 1e-9 * Math.max(1, Math.abs(expected)), node.contents());
        }
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testConstantFoldMatchesEvaluation ()
    {
        Evaluator evaluator = new Evaluator(Collections.emptyMap());
        double[] values = { 0, 1, 2, 7, 0.5, -3 };

        for (BinaryOperator operator: BinaryOperator.values())
            for (double x: values)
                for (double y: values) {
                    if (operator == BinaryOperator.DIVIDE && y == 0) continue;
                    ExpressionNode node = new BinaryExpressionNode(number(x), operator, number(y));
                    ExpressionNode folded = simplifier.simplify(node);
                    assertTrue(folded instanceof NumberNode, node.contents());
                    double expected = evaluator.evaluate(node);
                    if (Double.isNaN(expected))
                        assertTrue(Double.isNaN(((NumberNode) folded).value));
                    else
                        assertEquals(((NumberNode) folded).value, expected, 1e-12, node.contents());
                }
    }
}
