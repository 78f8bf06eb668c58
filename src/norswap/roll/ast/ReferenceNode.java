package norswap.roll.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;

/**
 * A variable reference: {@code $name} (strict) or {@code ${some name}} (lax).
 */
public final class ReferenceNode extends ExpressionNode
{
    public final String name;

    public ReferenceNode (Span span, Object name) {
        super(span);
        this.name = Util.cast(name, String.class);
    }

    @Override public String contents () {
        return "$" + name;
    }
}
