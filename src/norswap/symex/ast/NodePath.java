package norswap.symex.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Addresses a node of a tree by the sequence of child links followed from the root.
 *
 * <p>{@link Step#OPERAND} descends into a function node, {@link Step#LEFT} and
 * {@link Step#RIGHT} into a binary node. The empty path addresses the root.
 */
public final class NodePath
{
    // ---------------------------------------------------------------------------------------------

    public enum Step
    {
        LEFT('L'),
        RIGHT('R'),
        OPERAND('O');

        public final char letter;

        Step (char letter) {
            this.letter = letter;
        }
    }

    // ---------------------------------------------------------------------------------------------

    public static final NodePath ROOT = new NodePath(Collections.emptyList());

    public final List<Step> steps;

    // ---------------------------------------------------------------------------------------------

    private NodePath (List<Step> steps) {
        this.steps = steps;
    }

    // ---------------------------------------------------------------------------------------------

    public static NodePath of (Step... steps) {
        return steps.length == 0
            ? ROOT
            : new NodePath(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(steps))));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Parses a path written as a string of step letters, e.g. {@code "LRO"}.
     *
     * @throws IllegalArgumentException if a character is not a step letter
     */
    public static NodePath parse (String letters)
    {
        Step[] steps = new Step[letters.length()];
        outer: for (int i = 0; i < letters.length(); ++i) {
            char c = Character.toUpperCase(letters.charAt(i));
            for (Step step: Step.values())
                if (step.letter == c) {
                    steps[i] = step;
                    continue outer;
                }
            throw new IllegalArgumentException("not a path step: '" + letters.charAt(i) + "'");
        }
        return of(steps);
    }

    // ---------------------------------------------------------------------------------------------

    public boolean isRoot () {
        return steps.isEmpty();
    }

    public Step head () {
        return steps.get(0);
    }

    /** The path without its first step. */
    public NodePath tail () {
        return steps.size() <= 1 ? ROOT : new NodePath(steps.subList(1, steps.size()));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the node this path addresses under {@code root}, or null if the path leaves the
     * tree (descends into a leaf, or takes a step that does not exist for the node kind).
     */
    public ExpressionNode resolve (ExpressionNode root)
    {
        ExpressionNode node = root;
        for (Step step: steps) {
            node = child(node, step);
            if (node == null) return null;
        }
        return node;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the child of {@code node} reached by {@code step}, or null if there is none.
     */
    public static ExpressionNode child (ExpressionNode node, Step step)
    {
        if (node instanceof FunctionNode)
            return step == Step.OPERAND ? ((FunctionNode) node).operand : null;
        if (node instanceof BinaryExpressionNode) {
            BinaryExpressionNode binary = (BinaryExpressionNode) node;
            switch (step) {
                case LEFT:  return binary.left;
                case RIGHT: return binary.right;
                default:    return null;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------------

    @Override public boolean equals (Object o) {
        return o instanceof NodePath && ((NodePath) o).steps.equals(steps);
    }

    @Override public int hashCode () {
        return steps.hashCode();
    }

    @Override public String toString ()
    {
        StringBuilder b = new StringBuilder();
        for (Step step: steps) b.append(step.letter);
        return b.length() == 0 ? "<root>" : b.toString();
    }
}
