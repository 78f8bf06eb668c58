package norswap.roll.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;
import java.util.List;
import java.util.stream.Collectors;

public final class FunCallNode extends ExpressionNode
{
    public final String name;
    public final List<ExpressionNode> arguments;

    @SuppressWarnings("unchecked")
    public FunCallNode (Span span, Object name, Object arguments) {
        super(span);
        this.name = Util.cast(name, String.class);
        this.arguments = Util.cast(arguments, List.class);
    }

    @Override public String contents () {
        return arguments.stream()
            .map(ExpressionNode::contents)
            .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
