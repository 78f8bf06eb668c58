package norswap.roll.ast;

public enum BinaryOperator
{
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    REMAINDER("%"),
    POWER("^");

    public final String string;

    BinaryOperator (String string) {
        this.string = string;
    }
}
