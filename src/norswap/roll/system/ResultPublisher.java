package norswap.roll.system;

/**
 * The event bus results are published to once a tree has been evaluated.
 */
@FunctionalInterface
public interface ResultPublisher
{
    void publish (MathEvent event);

    /**
     * Whether the bus can currently accept events. A {@link MathSystem} whose publisher is
     * unavailable is degraded.
     */
    default boolean available () {
        return true;
    }
}
