package norswap.roll.system;

/**
 * Supplies the value of a canonicalized variable for an entity: either a number, or an
 * expression to be parsed and spliced in place of the variable.
 */
@FunctionalInterface
public interface VariableFiller
{
    FillResult fill (long entityId, String canonicalName, InputContext context);
}
