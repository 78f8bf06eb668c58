package norswap.roll.system;

import norswap.roll.MathException;

/**
 * Variable resolution failed for one entry: a callback threw, a filled-in expression did not
 * parse, or an expansion looped or went too deep. {@link #token} is the part of the input to
 * report to the user.
 */
public final class ResolutionException extends MathException
{
    public final String token;

    public ResolutionException (String message, String token) {
        super(message);
        this.token = token;
    }

    public ResolutionException (String message, String token, Throwable cause) {
        super(message, cause);
        this.token = token;
    }
}
