package norswap.roll;

import norswap.roll.ast.*;
import norswap.roll.tree.Constant;
import norswap.roll.tree.Dice;
import norswap.roll.tree.FunctionCall;
import norswap.roll.tree.MathFunction;
import norswap.roll.tree.MathNode;
import norswap.roll.tree.Operator;
import norswap.roll.tree.OperatorKind;
import norswap.roll.tree.Variable;
import norswap.utils.visitors.ValuedVisitor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the parse tree pushed by {@link RollGrammar} into a math tree.
 *
 * <p>Consecutive applications of the same operator are flattened into a single {@link Operator}
 * node ({@code 1 + 2 + 3} has three children), unless parenthesized. Unary signs are set on the
 * transformed operand.
 *
 * <p>An assignment {@code name = sum} records the tree of {@code sum} under {@code name}: any
 * reference to {@code name} transformed afterwards in the same pass is replaced by that tree.
 * The table of bindings is reset at the start of every {@link #transform} call.
 *
 * <p>Instances are not thread-safe.
 */
public final class Transformer
{
    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<RollNode, MathNode> visitor = new ValuedVisitor<>();
    private final MathConfig config;

    private final Map<String, MathNode> bindings = new HashMap<>();
    private String input;
    private String milieu;

    // ---------------------------------------------------------------------------------------------

    public Transformer (MathConfig config)
    {
        this.config = config;

        visitor.register(IntLiteralNode.class,          this::intLiteral);
        visitor.register(FloatLiteralNode.class,        this::floatLiteral);
        visitor.register(DiceLiteralNode.class,         this::diceLiteral);
        visitor.register(ReferenceNode.class,           this::reference);
        visitor.register(ParenthesizedNode.class,       this::parenthesized);
        visitor.register(UnaryExpressionNode.class,     this::unaryExpression);
        visitor.register(BinaryExpressionNode.class,    this::binaryExpression);
        visitor.register(FunCallNode.class,             this::funCall);
        visitor.register(AssignmentNode.class,          this::assignment);

        visitor.registerFallback(node -> {
            throw error("unsupported construct: " + node.contents(), node);
        });
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Transforms {@code root}, parsed from {@code input}, stamping {@code milieu} (which may be
     * null) into every variable.
     *
     * @throws MathSyntaxException if the tree uses an unknown function, a function with the
     * wrong number of arguments, or dice out of range.
     */
    public MathNode transform (RollNode root, String input, String milieu)
    {
        this.input = input;
        this.milieu = milieu;
        bindings.clear();
        try {
            return visitor.apply(root);
        } finally {
            bindings.clear();
        }
    }

    private MathNode run (RollNode node) {
        return visitor.apply(node);
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode intLiteral (IntLiteralNode node) {
        return new Constant(node.value);
    }

    private MathNode floatLiteral (FloatLiteralNode node) {
        if (Double.isInfinite(node.value))
            throw error("number out of range: " + node.contents(), node);
        return new Constant(node.value);
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode diceLiteral (DiceLiteralNode node)
    {
        int count = node.count == null ? 1 : bounded(node.count, node);
        int faces = bounded(node.faces, node);

        if (count < 1)
            throw error("cannot roll zero dice: " + node.contents(), node);
        if (faces < 1)
            throw error("dice need at least one face: " + node.contents(), node);
        if (count > config.maxDiceCount)
            throw error("cannot roll more than " + config.maxDiceCount + " dice: "
                + node.contents(), node);

        return new Dice(count, faces);
    }

    private int bounded (String digits, DiceLiteralNode node)
    {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error("dice out of range: " + node.contents(), node);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode reference (ReferenceNode node)
    {
        MathNode bound = bindings.get(node.name);
        return bound != null ? bound : new Variable(node.name, milieu);
    }

    private MathNode assignment (AssignmentNode node)
    {
        MathNode value = run(node.value);
        bindings.put(node.name, value);
        return value;
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode parenthesized (ParenthesizedNode node) {
        return run(node.expression);
    }

    private MathNode unaryExpression (UnaryExpressionNode node)
    {
        MathNode operand = run(node.operand);
        switch (node.operator) {
            case NEGATE:    operand.neg(); break;
            case POSITIVE:  operand.pos(); break;
        }
        return operand;
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode binaryExpression (BinaryExpressionNode node)
    {
        List<MathNode> children = new ArrayList<>();
        flatten(node, node.operator, children);
        return new Operator(kind(node.operator), children);
    }

    /**
     * Collects the operands of a left-nested chain of {@code operator} applications.
     */
    private void flatten (ExpressionNode node, BinaryOperator operator, List<MathNode> out)
    {
        if (node instanceof BinaryExpressionNode && ((BinaryExpressionNode) node).operator == operator) {
            BinaryExpressionNode binary = (BinaryExpressionNode) node;
            flatten(binary.left, operator, out);
            out.add(run(binary.right));
        } else {
            out.add(run(node));
        }
    }

    private static OperatorKind kind (BinaryOperator operator)
    {
        switch (operator) {
            case ADD:           return OperatorKind.ADD;
            case SUBTRACT:      return OperatorKind.SUB;
            case MULTIPLY:      return OperatorKind.MULT;
            case DIVIDE:        return OperatorKind.DIV;
            case FLOOR_DIVIDE:  return OperatorKind.FLOOR_DIV;
            case REMAINDER:     return OperatorKind.MOD;
            case POWER:         return OperatorKind.POW;
            default:            throw new AssertionError(operator);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private MathNode funCall (FunCallNode node)
    {
        MathFunction function = MathFunction.lookup(node.name);
        if (function == null)
            throw error("unknown function: " + node.name, node);
        if (!function.accepts(node.arguments.size()))
            throw error(node.name + "() does not take " + node.arguments.size() + " argument(s): "
                + node.contents(), node);

        List<MathNode> arguments = new ArrayList<>(node.arguments.size());
        for (ExpressionNode argument : node.arguments)
            arguments.add(run(argument));
        return new FunctionCall(function, arguments);
    }

    // ---------------------------------------------------------------------------------------------

    private MathSyntaxException error (String message, RollNode node)
    {
        String offending = input != null && node.span != null
            ? input.substring(node.span.start, node.span.end)
            : node.contents();
        int offset = node.span == null ? -1 : node.span.start;
        return new MathSyntaxException(message, input, offset, offending);
    }
}
