package norswap.roll.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Base class for every node of a math tree: leaves ({@link Dice}, {@link Constant},
 * {@link Variable}) and branches ({@link Operator}, {@link FunctionCall}).
 *
 * <p>A tree is created by the parser, mutated in place by variable resolution (values assigned,
 * subtrees replaced) and by evaluation, then discarded once its result has been published.
 *
 * <p>A node's value is unset (null) until it has been evaluated, except for constants, whose
 * value is fixed at construction, and variables, whose value is assigned from outside. The value
 * returned by {@link #value()} has the node's unary sign applied.
 */
public abstract class MathNode
{
    // ---------------------------------------------------------------------------------------------

    /** Rendered in place of anything that has no value yet. */
    public static final String NULL_SIGN = "∅";

    // ---------------------------------------------------------------------------------------------

    private final Set<NodeType> type;

    /** Result of the node's own computation, before the sign is applied. */
    protected Number value;

    private String moniker;
    private String milieu;

    /** 1 or -1. */
    private int sign = 1;

    // ---------------------------------------------------------------------------------------------

    protected MathNode (Set<NodeType> type, Number value, String moniker, String milieu) {
        this.type = type;
        this.value = Arithmetic.normalize(value);
        this.moniker = moniker;
        this.milieu = milieu;
    }

    // ---------------------------------------------------------------------------------------------

    public Set<NodeType> type () {
        return type;
    }

    public boolean is (NodeType flag) {
        return type.contains(flag);
    }

    /** Variable name, operator symbol, function name, dice notation... */
    public String moniker () {
        return moniker;
    }

    protected void moniker (String moniker) {
        this.moniker = moniker;
    }

    /** Context hint for the value, see {@link Variable}. */
    public String milieu () {
        return milieu;
    }

    protected void milieu (String milieu) {
        this.milieu = milieu;
    }

    /**
     * Returns the value of this node with its sign applied, or null if it has not been
     * evaluated (or, for variables, assigned) yet.
     */
    public Number value () {
        if (value == null || sign > 0) return value;
        return Arithmetic.negate(value);
    }

    // ---------------------------------------------------------------------------------------------

    public boolean negative () {
        return sign < 0;
    }

    /** Unary minus: flips the sign of this node. */
    public void neg () {
        sign = -sign;
    }

    /** Unary plus: does nothing. */
    public void pos () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Evaluates this node (rolls dice, folds children, ...) and returns its signed value.
     *
     * <p>Branches read the current values of their children: evaluate children first, which is
     * what {@link norswap.roll.interpreter.Evaluator} does.
     */
    public final Number eval () {
        evaluate();
        return value();
    }

    /**
     * Node-specific evaluation, storing the result in {@link #value}.
     */
    protected abstract void evaluate ();

    // ---------------------------------------------------------------------------------------------

    /**
     * Renders this node (and its subtree, for branches) on one line, at the requested levels of
     * detail. Rendering with {@link FormatOption#RAW} produces text that parses back into an
     * equivalent tree.
     */
    public abstract String exprStr (Set<FormatOption> options);

    public String exprStr () {
        return exprStr(FormatOption.RAW);
    }

    /** Prefixes {@code body} with a minus sign if this node is negative. */
    protected String signed (String body) {
        return sign < 0 ? "-" + body : body;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Children of this node, in order. Empty for leaves.
     */
    public List<MathNode> children () {
        return Collections.emptyList();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns every distinct node of this tree, children before parents, left before right.
     * Nodes are deduplicated by identity.
     */
    public List<MathNode> walk () {
        return walk(node -> true);
    }

    /**
     * Like {@link #walk()}, keeping only the nodes accepted by {@code predicate}.
     */
    public List<MathNode> walk (Predicate<? super MathNode> predicate)
    {
        Set<MathNode> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<MathNode> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<MathNode> stack = new ArrayDeque<>();
        List<MathNode> nodes = new ArrayList<>();
        stack.push(this);

        while (!stack.isEmpty()) {
            MathNode node = stack.peek();
            if (emitted.contains(node)) {
                stack.pop();
                continue;
            }
            if (expanded.add(node)) {
                // leftmost child on top
                List<MathNode> children = node.children();
                for (int i = children.size() - 1; i >= 0; --i)
                    if (!emitted.contains(children.get(i)))
                        stack.push(children.get(i));
            } else {
                // every child has been emitted
                stack.pop();
                emitted.add(node);
                nodes.add(node);
            }
        }

        return nodes.stream().filter(predicate).collect(Collectors.toList());
    }

    /**
     * Returns the variable nodes of this tree, in walk order.
     */
    public List<Variable> variables () {
        return walk(node -> node.is(NodeType.VARIABLE)).stream()
            .map(Variable.class::cast)
            .collect(Collectors.toList());
    }

    /**
     * Finds {@code existing} among the children of the branches of this tree and replaces it with
     * {@code replacement}. Returns true if it was found. A root cannot be replaced this way.
     */
    public boolean replace (MathNode existing, MathNode replacement)
    {
        for (MathNode node : walk(node -> node instanceof Branch)) {
            Branch branch = (Branch) node;
            List<MathNode> children = branch.children();
            for (int i = 0; i < children.size(); ++i) {
                if (children.get(i) == existing) {
                    branch.setChild(i, replacement);
                    return true;
                }
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Multi-line, indented rendering of the tree, for debugging.
     */
    public String pretty () {
        StringBuilder out = new StringBuilder();
        pretty(out, 0, "- ");
        return out.toString();
    }

    private void pretty (StringBuilder out, int level, String indent)
    {
        for (int i = 0; i < level; ++i)
            out.append(indent);
        out.append(prettyName()).append('\n');
        for (MathNode child : children())
            child.pretty(out, level + 1, indent);
    }

    protected String prettyName () {
        return toString();
    }
}
