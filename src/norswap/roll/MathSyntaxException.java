package norswap.roll;

/**
 * Thrown when an input string is not a valid expression, either because the grammar rejects it
 * or because the transformer does (unknown function, dice out of range).
 */
public final class MathSyntaxException extends MathException
{
    /** The full text that failed to parse. */
    public final String input;

    /** Offset of the error in {@link #input}, or -1 if the error is not tied to a position. */
    public final int offset;

    /** The part of the input that caused the failure. */
    public final String offending;

    public MathSyntaxException (String message, String input, int offset, String offending) {
        super(message);
        this.input = input;
        this.offset = offset;
        this.offending = offending;
    }
}
