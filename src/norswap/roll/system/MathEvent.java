package norswap.roll.system;

import norswap.roll.tree.MathNode;

/**
 * Carries the result of a math command. Created by the caller with the tree it submits, filled
 * in by {@link MathSystem} once the tree has been evaluated, then published.
 */
public abstract class MathEvent
{
    private final long entityId;
    private final InputContext context;
    private MathNode root;
    private Number total;

    protected MathEvent (long entityId, InputContext context, MathNode root) {
        this.entityId = entityId;
        this.context = context;
        this.root = root;
    }

    public long entityId () {
        return entityId;
    }

    public InputContext context () {
        return context;
    }

    /** The tree, as submitted or, once finalized, fully resolved and evaluated. */
    public MathNode root () {
        return root;
    }

    /** The evaluated total, or null before finalization. */
    public Number total () {
        return total;
    }

    public boolean finalized () {
        return total != null;
    }

    /**
     * Readies the event for publishing. Subclasses extending this must call the super method.
     */
    public void finalizeResult (MathNode root, Number total) {
        this.root = root;
        this.total = total;
    }

    @Override public String toString () {
        return getClass().getSimpleName() + "(entity " + entityId + ", " + root
            + (total == null ? "" : " = " + total) + ", " + context + ")";
    }
}
