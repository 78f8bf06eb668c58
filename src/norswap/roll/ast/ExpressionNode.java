package norswap.roll.ast;

import norswap.autumn.positions.Span;

public abstract class ExpressionNode extends RollNode
{
    protected ExpressionNode (Span span) {
        super(span);
    }
}
