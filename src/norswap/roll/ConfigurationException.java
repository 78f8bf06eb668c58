package norswap.roll;

/**
 * Thrown when the configuration cannot be read or holds invalid values.
 */
public final class ConfigurationException extends MathException
{
    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }
}
