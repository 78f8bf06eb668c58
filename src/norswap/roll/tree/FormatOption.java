package norswap.roll.tree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Level-of-detail flags for {@link MathNode#exprStr(Set)}. Any combination may be requested; a
 * node renders every requested level it has, joined by {@code =} and parenthesized when there is
 * more than one.
 */
public enum FormatOption
{
    /** The raw form, e.g. {@code 3d20} or {@code $str.mod}. */
    INITIAL,
    /** Intermediate values, e.g. the individual rolls {@code [4, 11, 2]}. */
    INTERMEDIATE,
    /** Totals. */
    FINAL;

    public static final Set<FormatOption> RAW =
        Collections.unmodifiableSet(EnumSet.of(INITIAL));

    public static final Set<FormatOption> ALL =
        Collections.unmodifiableSet(EnumSet.allOf(FormatOption.class));
}
