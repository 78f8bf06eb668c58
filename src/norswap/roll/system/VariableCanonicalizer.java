package norswap.roll.system;

import java.util.Optional;

/**
 * Decides whether a variable belongs to some subsystem, and if so normalizes its name into the
 * key that subsystem uses, e.g. {@code str.mod} into {@code ability.strength.modifier}.
 */
@FunctionalInterface
public interface VariableCanonicalizer
{
    /**
     * Returns the canonical name of the variable, or an empty optional if it is not known here.
     */
    Optional<String> canonicalize (String name, String milieu);
}
