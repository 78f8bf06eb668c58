package norswap.roll.tree;

import java.util.List;

/**
 * Terminal node of a math tree: dice, constants, variables.
 */
public abstract class Leaf extends MathNode
{
    protected Leaf (NodeType type, Number value, String moniker, String milieu) {
        super(NodeType.of(NodeType.LEAF, type), value, moniker, milieu);
    }

    /**
     * Joins the rendered detail levels with {@code =}, parenthesized if there is more than one.
     */
    protected static String compose (List<String> parts)
    {
        String joined = String.join("=", parts);
        return parts.size() > 1 ? "(" + joined + ")" : joined;
    }
}
