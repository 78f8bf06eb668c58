package norswap.roll.system;

import norswap.roll.tree.Arithmetic;
import java.util.Objects;

/**
 * Result of a {@link VariableFiller}: a number or an expression, and the milieu to attach to it.
 */
public final class FillResult
{
    private final Number number;
    private final String expression;
    private final String milieu;

    private FillResult (Number number, String expression, String milieu) {
        this.number = number;
        this.expression = expression;
        this.milieu = milieu;
    }

    public static FillResult number (Number number, String milieu) {
        return new FillResult(Arithmetic.normalize(Objects.requireNonNull(number, "number")), null, milieu);
    }

    public static FillResult expression (String expression, String milieu) {
        return new FillResult(null, Objects.requireNonNull(expression, "expression"), milieu);
    }

    public boolean isNumber () {
        return number != null;
    }

    /** The number, or null if this is an expression. */
    public Number number () {
        return number;
    }

    /** The expression, or null if this is a number. */
    public String expression () {
        return expression;
    }

    public String milieu () {
        return milieu;
    }

    @Override public String toString () {
        return "FillResult(" + (isNumber() ? number : "'" + expression + "'")
            + ", '" + (milieu == null ? "" : milieu) + "')";
    }
}
