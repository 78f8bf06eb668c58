package norswap.roll.system;

/**
 * Tells whether the entity owning a command still exists.
 */
@FunctionalInterface
public interface EntityCheck
{
    EntityCheck ALWAYS = entityId -> true;

    boolean alive (long entityId);
}
