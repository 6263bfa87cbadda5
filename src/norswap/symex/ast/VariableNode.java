package norswap.symex.ast;

public final class VariableNode extends ExpressionNode
{
    public final char name;

    /**
     * @throws IllegalArgumentException if {@code name} is not an ASCII lowercase letter
     */
    public VariableNode (char name)
    {
        if (!isVariableName(name))
            throw new IllegalArgumentException("not a variable name: '" + name + "'");
        this.name = name;
    }

    public static boolean isVariableName (char c) {
        return c >= 'a' && c <= 'z';
    }

    @Override public VariableNode copy () {
        return new VariableNode(name);
    }

    @Override public String contents () {
        return String.valueOf(name);
    }
}
