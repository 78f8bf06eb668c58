package norswap.roll.tree;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application of a {@link MathFunction} to its arguments, e.g. {@code max(2d6, 4)}.
 */
public final class FunctionCall extends Branch
{
    public final MathFunction function;

    public FunctionCall (MathFunction function, List<? extends MathNode> arguments)
    {
        super(NodeType.FUNCTION, function.string, arguments);
        if (!function.accepts(arguments.size()))
            throw new IllegalArgumentException(
                function.string + "() does not take " + arguments.size() + " arguments");
        this.function = function;
    }

    @Override protected void evaluate () {
        value = function.apply(childValues("call " + function.string + "()"));
    }

    @Override public String exprStr (Set<FormatOption> options)
    {
        if (options.isEmpty()) return "";
        return signed(children().stream()
            .map(child -> child.exprStr(options))
            .collect(Collectors.joining(", ", function.string + "(", ")")));
    }
}
