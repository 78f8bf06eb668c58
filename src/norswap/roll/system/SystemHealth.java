package norswap.roll.system;

/**
 * Health of a {@link MathSystem}. A degraded system rejects commands and skips ticks until its
 * dependencies are back.
 */
public enum SystemHealth
{
    HEALTHY,
    DEGRADED;

    public boolean ok () {
        return this == HEALTHY;
    }
}
