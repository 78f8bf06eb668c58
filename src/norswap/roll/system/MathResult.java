package norswap.roll.system;

import norswap.roll.tree.MathNode;

/**
 * Plain result event, for callers that only want the tree and its total.
 */
public final class MathResult extends MathEvent
{
    public MathResult (long entityId, InputContext context, MathNode root) {
        super(entityId, context, root);
    }
}
