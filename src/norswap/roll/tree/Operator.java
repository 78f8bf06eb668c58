package norswap.roll.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application of a binary operator to two or more children, left-folded:
 * {@code a - b - c} is {@code (a - b) - c}.
 */
public final class Operator extends Branch
{
    public final OperatorKind kind;

    public Operator (OperatorKind kind, List<? extends MathNode> children)
    {
        super(NodeType.OPERATOR, kind.display, children);
        if (children.size() < 2)
            throw new IllegalArgumentException(
                kind + " needs at least two children, got " + children.size());
        this.kind = kind;
    }

    public Operator (OperatorKind kind, MathNode left, MathNode right) {
        this(kind, Arrays.asList(left, right));
    }

    @Override protected void evaluate ()
    {
        List<Number> values = childValues(kind.verb);
        Number total = values.get(0);
        for (int i = 1; i < values.size(); ++i)
            total = kind.apply(total, values.get(i));
        value = total;
    }

    @Override public String exprStr (Set<FormatOption> options)
    {
        if (options.isEmpty()) return "";
        String body = children().stream()
            .map(child -> operand(child, options))
            .collect(Collectors.joining(" " + kind.symbol + " "));
        return negative() ? "-(" + body + ")" : body;
    }
}
