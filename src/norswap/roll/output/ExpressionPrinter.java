package norswap.roll.output;

import norswap.roll.tree.FormatOption;
import norswap.roll.tree.MathNode;
import java.util.Set;

/**
 * One-line rendering of a whole tree for chat output, e.g. {@code (3d20=[4, 11, 2]=17) + 5 = 22}.
 */
public final class ExpressionPrinter
{
    private ExpressionPrinter () {}

    /**
     * Renders the tree at the given levels of detail, followed by {@code = total} if the root has
     * been evaluated.
     */
    public static String string (MathNode root, Set<FormatOption> options)
    {
        String expression = root.exprStr(options);
        Number total = root.value();
        if (total == null)
            return expression;
        return expression.isEmpty() ? total.toString() : expression + " = " + total;
    }

    public static String string (MathNode root) {
        return string(root, FormatOption.ALL);
    }
}
