package norswap.roll.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;

/**
 * A roll such as {@code 3d20} or {@code d6}.
 *
 * <p>Count and faces are kept as the digit strings that were matched: range checks happen in
 * the transformer, which can report them as syntax errors. {@link #count} is null for the
 * {@code d<faces>} form.
 */
public final class DiceLiteralNode extends ExpressionNode
{
    public final String count;
    public final String faces;

    public DiceLiteralNode (Span span, Object count, Object faces) {
        super(span);
        this.count = count == null ? null : Util.cast(count, String.class);
        this.faces = Util.cast(faces, String.class);
    }

    @Override public String contents () {
        return (count == null ? "" : count) + "d" + faces;
    }
}
