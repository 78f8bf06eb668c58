package norswap.roll;

/**
 * Base class for every error raised while parsing, resolving or evaluating math expressions.
 */
public class MathException extends RuntimeException
{
    public MathException (String message) {
        super(message);
    }

    public MathException (String message, Throwable cause) {
        super(message, cause);
    }
}
