package norswap.symex;

import norswap.autumn.Autumn;
import norswap.autumn.ParseOptions;
import norswap.autumn.ParseResult;
import norswap.symex.ast.BinaryExpressionNode;
import norswap.symex.ast.Expression;
import norswap.symex.ast.ExpressionNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import static norswap.utils.Util.cast;

/**
 * Builds expression trees from postfix text.
 *
 * <p>The text is tokenized by {@link PostfixGrammar}; the tokens are then folded left to right
 * on an operand stack. Errors are reported in input order: an operator that finds fewer than
 * two operands is reported even if an invalid character follows it.
 *
 * <p>Accepted tokens: single digits, bracketed decimal literals such as {@code [12]} or
 * {@code [-0.5]}, lowercase letters (variables) and the operators {@code + - * / ^}. Whitespace
 * is ignored.
 */
public final class PostfixParser
{
    // ---------------------------------------------------------------------------------------------

    private final PostfixGrammar grammar = new PostfixGrammar();

    // ---------------------------------------------------------------------------------------------

    /**
     * Parses {@code text} (null is read as the empty string) into an expression recording the
     * trimmed text.
     *
     * @throws ParseException if the text is not a well-formed postfix expression; no partial
     * tree is retained
     */
    public Expression parse (String text)
    {
        String source = text == null ? "" : text;
        ParseResult result = Autumn.parse(grammar.root.getParser(), source, ParseOptions.builder().get());

        List<?> tokens = result.success
            ? cast(result.topValue(), List.class)
            : Collections.emptyList();

        Deque<ExpressionNode> stack = new ArrayDeque<>();

        for (Object token: tokens) {
            if (token instanceof ExpressionNode) {
                stack.push((ExpressionNode) token);
                continue;
            }
            PostfixGrammar.Operator operator = cast(token, PostfixGrammar.Operator.class);
            if (stack.size() < 2)
                throw ParseException.insufficientOperands(
                    operator.operator.symbol, operator.span.start);
            ExpressionNode right = stack.pop();
            ExpressionNode left  = stack.pop();
            stack.push(new BinaryExpressionNode(left, operator.operator, right));
        }

        if (!result.fullMatch) {
            int offset = result.success ? result.matchSize : 0;
            throw ParseException.invalidToken(source.charAt(offset), offset);
        }

        if (stack.size() != 1)
            throw ParseException.malformed(stack.size());

        return Expression.parsed(stack.pop(), source);
    }
}
