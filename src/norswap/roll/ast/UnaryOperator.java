package norswap.roll.ast;

public enum UnaryOperator
{
    NEGATE("-"),
    POSITIVE("+");

    public final String string;

    UnaryOperator (String string) {
        this.string = string;
    }
}
