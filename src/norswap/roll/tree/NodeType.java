package norswap.roll.tree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Flags describing a math tree node. A node has one of {@link #LEAF} or {@link #BRANCH} plus one
 * specific type. A node with no flags at all is invalid.
 */
public enum NodeType
{
    /** A terminal node: dice, constant or variable. */
    LEAF,
    /** A node with ordered children. */
    BRANCH,
    /** A named value filled in from outside the tree. */
    VARIABLE,
    /** Just some number. */
    CONSTANT,
    /** A node that is only a number once randomness happened, e.g. dice. */
    RANDOM,
    /** Math operator like {@code +}, {@code -}, etc. */
    OPERATOR,
    /** Math function like {@code max()}, {@code min()}, etc. */
    FUNCTION;

    // ---------------------------------------------------------------------------------------------

    /** The (empty) type of an invalid node. */
    public static final Set<NodeType> INVALID = Collections.unmodifiableSet(EnumSet.noneOf(NodeType.class));

    static Set<NodeType> of (NodeType first, NodeType... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
