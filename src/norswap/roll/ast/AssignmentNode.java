package norswap.roll.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;

/**
 * Top-level {@code name = expression}.
 */
public final class AssignmentNode extends ExpressionNode
{
    public final String name;
    public final ExpressionNode value;

    public AssignmentNode (Span span, Object name, Object value) {
        super(span);
        this.name = Util.cast(name, String.class);
        this.value = Util.cast(value, ExpressionNode.class);
    }

    @Override public String contents () {
        return name + " = " + value.contents();
    }
}
