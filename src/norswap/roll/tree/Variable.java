package norswap.roll.tree;

import norswap.roll.interpreter.EvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A named value owned by some other part of the game, e.g. {@code $strength.mod}.
 *
 * <p>A variable has no value until one is assigned through {@link #set(Number, String)}, or
 * until the resolution scheduler replaces the whole node with a parsed subtree. Evaluating an
 * unassigned variable is an error.
 *
 * <p>The milieu is a free-form hint telling the owner which concrete value the name refers to.
 * Names containing {@code this} are shortcuts: once assigned with a milieu, they display the
 * milieu instead of the shortcut.
 */
public final class Variable extends Leaf
{
    private static final Pattern STRICT_NAME = Pattern.compile("[A-Za-z]([._]*[A-Za-z0-9])*");
    private static final String SHORTCUT = "this";

    private final String name;

    public Variable (String name, String milieu) {
        super(NodeType.VARIABLE, null, Objects.requireNonNull(name, "name"), milieu);
        this.name = name;
    }

    public Variable (String name) {
        this(name, null);
    }

    /**
     * The name the variable was written with. Unlike the moniker, this never changes.
     */
    public String name () {
        return name;
    }

    public boolean resolved () {
        return value != null;
    }

    /**
     * Whether the name contains a shortcut ({@code this}) to be replaced by the milieu.
     */
    public boolean isShortcut () {
        return name.contains(SHORTCUT);
    }

    /**
     * Assigns the value of this variable and the milieu it was resolved in.
     */
    public void set (Number value, String milieu)
    {
        this.value = Arithmetic.normalize(Objects.requireNonNull(value, "value"));
        milieu(milieu);
        if (milieu != null && !milieu.isEmpty() && isShortcut())
            moniker(milieu);
    }

    @Override protected void evaluate () {
        if (value == null)
            throw new EvaluationException("Variable " + reference(name) + " has no value.");
    }

    @Override public String exprStr (Set<FormatOption> options)
    {
        List<String> parts = new ArrayList<>();
        if (options.contains(FormatOption.INITIAL) || options.contains(FormatOption.INTERMEDIATE))
            parts.add(reference(moniker()));
        if (options.contains(FormatOption.FINAL))
            parts.add(value == null ? NULL_SIGN : value.toString());
        return parts.isEmpty() ? "" : signed(compose(parts));
    }

    /** Renders a name the way the grammar accepts it: {@code $name} or {@code ${some name}}. */
    static String reference (String name) {
        return STRICT_NAME.matcher(name).matches() ? "$" + name : "${" + name + "}";
    }

    @Override public String toString () {
        return "Variable(" + signed(moniker()) + ", '" + (milieu() == null ? "" : milieu()) + "'"
            + (value == null ? "" : "==" + value())
            + ")";
    }
}
