package norswap.roll.tree;

import java.util.Objects;
import java.util.Random;

/**
 * The process-wide source of randomness used to roll dice. Replace or reseed it to make rolls
 * deterministic.
 */
public final class Randomness
{
    private static Random source = new Random();

    private Randomness () {}

    public static Random source () {
        return source;
    }

    public static void seed (long seed) {
        source = new Random(seed);
    }

    public static void use (Random random) {
        source = Objects.requireNonNull(random, "random");
    }
}
