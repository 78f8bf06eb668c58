package norswap.roll.ast;

import norswap.autumn.positions.Span;

/**
 * Base class for the nodes of the parse tree pushed by {@link norswap.roll.RollGrammar}.
 *
 * <p>These nodes mirror the syntax one for one. They are turned into a math tree by
 * {@link norswap.roll.Transformer} and never evaluated directly.
 */
public abstract class RollNode
{
    public final Span span;

    protected RollNode (Span span) {
        this.span = span;
    }

    /**
     * Returns a compact rendering of the node, used for error messages and debugging.
     */
    public abstract String contents ();

    @Override public String toString () {
        return contents();
    }
}
