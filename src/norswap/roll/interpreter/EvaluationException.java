package norswap.roll.interpreter;

import norswap.roll.MathException;

/**
 * Thrown when a tree cannot be reduced to a finite number: an unresolved variable, a missing
 * child value, a division by zero, a non-finite result.
 *
 * <p>Inside the resolution scheduler, this signals that the resolution protocol was not honored
 * rather than bad user input.
 */
public final class EvaluationException extends MathException
{
    public EvaluationException (String message) {
        super(message);
    }

    public EvaluationException (String message, Throwable cause) {
        super(message, cause);
    }
}
