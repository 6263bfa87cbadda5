package norswap.symex;

import norswap.symex.ast.*;
import org.testng.annotations.Test;

import static norswap.symex.TreeAssertions.assertStructurallyEqual;
import static norswap.symex.ast.Nodes.*;
import static org.testng.Assert.*;

public class PostfixParserTests
{
    // ---------------------------------------------------------------------------------------------

    private final PostfixParser parser = new PostfixParser();

    // ---------------------------------------------------------------------------------------------

    private static VariableNode var (char name) {
        return new VariableNode(name);
    }

    private void success (String input, ExpressionNode expected) {
        assertStructurallyEqual(parser.parse(input).root, expected);
    }

    private ParseException failure (String input, ParseException.Kind kind)
    {
        ParseException e = expectThrows(ParseException.class, () -> parser.parse(input));
        assertEquals(e.kind, kind, e.getMessage());
        return e;
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testOperands ()
    {
        success("7", number(7));
        success("0", number(0));
        success("x", var('x'));
        success("[12]", number(12));
        success("[-0.5]", number(-0.5));
        success("[2.5E3]", number(2500));
        success("[1.0E-7]", number(1e-7));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testOperators ()
    {
        success("23+", add(number(2), number(3)));
        success("23-", subtract(number(2), number(3)));
        success("ab*", multiply(var('a'), var('b')));
        success("ab/", divide(var('a'), var('b')));
        success("x2^", power(var('x'), number(2)));

        // operands are popped right first
        success("ab+c*", multiply(add(var('a'), var('b')), var('c')));
        success("abc*+", add(var('a'), multiply(var('b'), var('c'))));
        success("[12]x-", subtract(number(12), var('x')));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testDigitsAreSingleTokens () {
        success("123++", add(number(1), add(number(2), number(3))));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testWhitespace ()
    {
        success(" 2 3\t+\n", add(number(2), number(3)));
        success("a b + c *", multiply(add(var('a'), var('b')), var('c')));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testRecordedText ()
    {
        Expression expression = parser.parse("  ab+c* ");
        assertEquals(expression.postfix, "ab+c*");
        assertEquals(expression.infix, "((a + b) * c)");

        expression = parser.parse("a b +");
        assertEquals(expression.postfix, "a b +");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testInvalidToken ()
    {
        ParseException e = failure("2$3+", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, '$');
        assertEquals(e.offset, 1);

        e = failure("2A+", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, 'A');

        e = failure("2 3 + #", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, '#');
        assertEquals(e.offset, 6);

        e = failure("23%", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, '%');

        e = failure("[12", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, '[');
        assertEquals(e.offset, 0);

        e = failure("[1.]", ParseException.Kind.INVALID_TOKEN);
        assertEquals(e.token, '[');
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testInsufficientOperands ()
    {
        ParseException e = failure("+", ParseException.Kind.INSUFFICIENT_OPERANDS);
        assertEquals(e.offset, 0);

        e = failure("2+", ParseException.Kind.INSUFFICIENT_OPERANDS);
        assertEquals(e.offset, 1);

        failure("23+*", ParseException.Kind.INSUFFICIENT_OPERANDS);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testErrorsInInputOrder ()
    {
        // the stack underflow comes before the bad character
        failure("2+$", ParseException.Kind.INSUFFICIENT_OPERANDS);
        // the bad character comes before the underflow
        failure("2$+", ParseException.Kind.INVALID_TOKEN);
        // a bad character wins over a leftover stack
        failure("23$", ParseException.Kind.INVALID_TOKEN);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testMalformed ()
    {
        failure("23", ParseException.Kind.MALFORMED_EXPRESSION);
        failure("ab+c", ParseException.Kind.MALFORMED_EXPRESSION);
        failure("", ParseException.Kind.MALFORMED_EXPRESSION);
        failure("   ", ParseException.Kind.MALFORMED_EXPRESSION);
        failure(null, ParseException.Kind.MALFORMED_EXPRESSION);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testFunctionCodesReadAsVariables () {
        // "s" is output-only as a function code: on input it is a variable
        failure("xs", ParseException.Kind.MALFORMED_EXPRESSION);
        success("xs*", multiply(var('x'), var('s')));
    }
}
