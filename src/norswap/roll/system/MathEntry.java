package norswap.roll.system;

import norswap.roll.tree.MathNode;
import norswap.roll.tree.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A pending resolution job: a tree, who it belongs to, how to resolve its variables and where to
 * send the result.
 *
 * <p>The entry owns the root of the tree, so that a tree consisting of a single variable can be
 * replaced whole. It also remembers, for every variable introduced by an expansion, the chain of
 * canonical names that led to it.
 */
final class MathEntry
{
    // ---------------------------------------------------------------------------------------------

    private MathNode root;

    final InputContext context;
    final VariableCanonicalizer canonicalizer;
    final VariableFiller filler;
    final MathEvent event;

    private final Map<Variable, List<String>> chains = new IdentityHashMap<>();

    // ---------------------------------------------------------------------------------------------

    MathEntry (MathNode root, InputContext context, VariableCanonicalizer canonicalizer,
               VariableFiller filler, MathEvent event)
    {
        this.root = root;
        this.context = context;
        this.canonicalizer = canonicalizer;
        this.filler = filler;
        this.event = event;
    }

    // ---------------------------------------------------------------------------------------------

    MathNode root () {
        return root;
    }

    long entityId () {
        return event.entityId();
    }

    /**
     * Canonical names expanded to produce {@code variable}, outermost first. Empty for variables
     * that were in the submitted tree.
     */
    List<String> chain (Variable variable) {
        return chains.getOrDefault(variable, Collections.emptyList());
    }

    /**
     * Replaces {@code existing} (the root, or a node of the tree) by {@code replacement}, and
     * records that the variables of {@code replacement} come from expanding {@code canonical}.
     * Returns false if {@code existing} could not be found.
     */
    boolean expand (Variable existing, MathNode replacement, String canonical)
    {
        if (root == existing)
            root = replacement;
        else if (!root.replace(existing, replacement))
            return false;

        List<String> chain = new ArrayList<>(chain(existing));
        chain.add(canonical);
        List<String> frozen = Collections.unmodifiableList(chain);
        chains.remove(existing);
        for (Variable variable : replacement.variables())
            chains.put(variable, frozen);
        return true;
    }

    @Override public String toString () {
        return "MathEntry(" + root.exprStr() + ", " + context + ")";
    }
}
