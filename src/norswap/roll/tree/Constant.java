package norswap.roll.tree;

import java.util.Objects;
import java.util.Set;

/**
 * A number written in the expression. Its value is fixed at construction.
 */
public final class Constant extends Leaf
{
    public Constant (Number value) {
        super(NodeType.CONSTANT, Objects.requireNonNull(value, "value"), null, null);
        moniker(this.value.toString());
    }

    @Override protected void evaluate () {
        // constant: nothing to do
    }

    @Override public String exprStr (Set<FormatOption> options) {
        return options.isEmpty() ? "" : signed(value.toString());
    }

    @Override public String toString () {
        return "Constant(" + signed(value.toString()) + ")";
    }
}
