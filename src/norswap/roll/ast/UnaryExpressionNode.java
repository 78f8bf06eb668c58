package norswap.roll.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;

public final class UnaryExpressionNode extends ExpressionNode
{
    public final UnaryOperator operator;
    public final ExpressionNode operand;

    public UnaryExpressionNode (Span span, Object operator, Object operand) {
        super(span);
        this.operator = Util.cast(operator, UnaryOperator.class);
        this.operand = Util.cast(operand, ExpressionNode.class);
    }

    @Override public String contents () {
        return operator.string + operand.contents();
    }
}
