package norswap.symex;

import norswap.autumn.Grammar;
import norswap.autumn.positions.Span;
import norswap.symex.ast.*;
import norswap.utils.Util;

/**
 * Token grammar of postfix expressions.
 *
 * <p>The {@link #root} rule matches as many tokens as it can and pushes them as a list: the
 * operands as {@link NumberNode} and {@link VariableNode}, the operators as {@link Operator}.
 * Assembling the tree is left to {@link PostfixParser}.
 */
@SuppressWarnings("Convert2MethodRef")
public class PostfixGrammar extends Grammar
{
    // ==== TOKENS ============================================================

    /** An operator token, with its position in the input. */
    public static final class Operator
    {
        public final BinaryOperator operator;
        public final Span span;

        public Operator (Span span, Object operator) {
            this.span = span;
            this.operator = Util.cast(operator, BinaryOperator.class);
        }
    }

    // ==== LEXICAL ===========================================================

    {
        ws = set(" \t\n\r").at_least(0);
    }

    public rule PLUS    = word("+");
    public rule MINUS   = word("-");
    public rule STAR    = word("*");
    public rule SLASH   = word("/");
    public rule CARET   = word("^");

    public rule lowercase =
        set("abcdefghijklmnopqrstuvwxyz");

    public rule exponent =
        seq(set("eE"), opt(set("+-")), digit.at_least(1));

    public rule decimal =
        seq(opt('-'), digit.at_least(1), opt(seq('.', digit.at_least(1))), opt(exponent))
        .push($ -> Double.parseDouble($.str()));

    // ==== OPERANDS ==========================================================

    public rule digit_literal =
        digit
        .push($ -> new NumberNode($.str().charAt(0) - '0'))
        .word();

    public rule bracketed_literal =
        seq('[', decimal, ']')
        .push($ -> new NumberNode(Util.cast($.$[0], Double.class)))
        .word();

    public rule variable =
        lowercase
        .push($ -> new VariableNode($.str().charAt(0)))
        .word();

    // ==== OPERATORS =========================================================

    public rule binary_op = choice(
        PLUS    .as_val(BinaryOperator.ADD),
        MINUS   .as_val(BinaryOperator.SUBTRACT),
        STAR    .as_val(BinaryOperator.MULTIPLY),
        SLASH   .as_val(BinaryOperator.DIVIDE),
        CARET   .as_val(BinaryOperator.POWER));

    public rule operator =
        binary_op
        .push($ -> new Operator($.span(), $.$[0]));

    // ==== STREAM ============================================================

    public rule token = choice(
        digit_literal,
        bracketed_literal,
        variable,
        operator);

    public rule root =
        seq(ws, token.at_least(0))
        .as_list(Object.class);

    @Override public rule root () {
        return root;
    }
}
