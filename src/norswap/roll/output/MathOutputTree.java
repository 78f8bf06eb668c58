package norswap.roll.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import norswap.roll.MathConfig;
import norswap.roll.MathException;
import norswap.roll.tree.MathNode;
import norswap.roll.tree.NodeType;
import norswap.roll.tree.Operator;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an evaluated math tree into nested records that can be sent to clients as JSON (or
 * any format that handles maps, lists, strings and numbers).
 *
 * <p>Each node becomes a record with the keys:
 * <ul>
 *     <li>{@code type}: {@code "function"}, {@code "operator"}, {@code "random"},
 *     {@code "variable"} or {@code "constant"}</li>
 *     <li>{@code moniker}: operator symbol, function or variable name, dice notation or
 *     number</li>
 *     <li>{@code value}: the (signed) value of the node, or null</li>
 *     <li>{@code children}: for branches only, the records of the children in order</li>
 * </ul>
 *
 * Nodes with an invalid type are left out.
 */
public final class MathOutputTree
{
    // ---------------------------------------------------------------------------------------------

    public static final String TYPE     = "type";
    public static final String MONIKER  = "moniker";
    public static final String VALUE    = "value";
    public static final String CHILDREN = "children";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean unicodeMonikers;

    // ---------------------------------------------------------------------------------------------

    public MathOutputTree (boolean unicodeMonikers) {
        this.unicodeMonikers = unicodeMonikers;
    }

    public MathOutputTree (MathConfig config) {
        this(config.unicodeMonikers);
    }

    public MathOutputTree () {
        this(true);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the record for the tree rooted at {@code root}, or null if the root is invalid.
     *
     * @throws MathException if the tree is malformed: a branch without valid children, or a child
     * that was not converted before its parent.
     */
    public Map<String, Object> toMap (MathNode root)
    {
        Map<MathNode, Map<String, Object>> converted = new IdentityHashMap<>();
        Map<String, Object> record = null;

        // children come before their parent
        for (MathNode node : root.walk()) {
            String type = recordType(node);
            if (type == null) continue;

            record = new LinkedHashMap<>();
            record.put(TYPE, type);
            record.put(MONIKER, moniker(node));
            record.put(VALUE, node.value());

            if (node.is(NodeType.BRANCH))
                record.put(CHILDREN, children(node, converted));

            converted.put(node, record);
        }

        return recordType(root) == null ? null : record;
    }

    private static List<Map<String, Object>> children (
            MathNode node, Map<MathNode, Map<String, Object>> converted)
    {
        List<Map<String, Object>> children = new ArrayList<>();
        for (MathNode child : node.children()) {
            if (recordType(child) == null) continue;
            Map<String, Object> record = converted.get(child);
            if (record == null)
                throw new MathException(
                    "child " + child + " of " + node + " was not converted before its parent");
            children.add(record);
        }
        if (children.isEmpty())
            throw new MathException("branch " + node + " has no children");
        return children;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the record type for the node, or null if its type is invalid.
     */
    static String recordType (MathNode node)
    {
        if (node.is(NodeType.FUNCTION)) return "function";
        if (node.is(NodeType.OPERATOR)) return "operator";
        if (node.is(NodeType.RANDOM))   return "random";
        if (node.is(NodeType.VARIABLE)) return "variable";
        if (node.is(NodeType.CONSTANT)) return "constant";
        return null;
    }

    private String moniker (MathNode node) {
        if (!unicodeMonikers && node instanceof Operator)
            return ((Operator) node).kind.symbol;
        return node.moniker();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Renders {@link #toMap} as JSON.
     */
    public String toJson (MathNode root)
    {
        try {
            return MAPPER.writeValueAsString(toMap(root));
        } catch (JsonProcessingException e) {
            throw new MathException("could not serialize " + root, e);
        }
    }
}
