package norswap.roll.tree;

import norswap.roll.interpreter.EvaluationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A node with an ordered list of children: operators and function calls.
 */
public abstract class Branch extends MathNode
{
    private final List<MathNode> children;

    protected Branch (NodeType type, String moniker, List<? extends MathNode> children) {
        super(NodeType.of(NodeType.BRANCH, type), null, moniker, null);
        this.children = new ArrayList<>(children);
    }

    @Override public List<MathNode> children () {
        return Collections.unmodifiableList(children);
    }

    void setChild (int index, MathNode child) {
        children.set(index, child);
    }

    /**
     * Returns the current (signed) values of the children, failing if one has none.
     */
    protected List<Number> childValues (String action)
    {
        List<Number> values = new ArrayList<>(children.size());
        for (MathNode child : children) {
            Number value = child.value();
            if (value == null)
                throw new EvaluationException(
                    "Cannot " + action + "; " + child + " has no value.");
            values.add(value);
        }
        return values;
    }

    /**
     * Renders a child inside this branch: branches are parenthesized, unless their sign already
     * wraps them.
     */
    protected static String operand (MathNode child, Set<FormatOption> options)
    {
        String string = child.exprStr(options);
        if (child instanceof Operator && !child.negative())
            return "(" + string + ")";
        return string;
    }

    @Override protected String prettyName () {
        return moniker();
    }

    @Override public String toString ()
    {
        StringBuilder out = new StringBuilder(getClass().getSimpleName()).append('(');
        if (negative()) out.append('-');
        out.append(moniker());
        for (MathNode child : children)
            out.append(", ").append(child);
        out.append(')');
        if (value != null)
            out.append("==").append(value());
        return out.toString();
    }
}
