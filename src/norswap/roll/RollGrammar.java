package norswap.roll;

import norswap.autumn.Grammar;
import norswap.autumn.positions.Span;
import norswap.roll.ast.*;

/**
 * Grammar for dice and arithmetic expressions.
 *
 * <p>Precedence, lowest first: top-level assignment, sum ({@code + -}), product
 * ({@code * / // % ^}), unary ({@code + -}), primary. Ordered choice takes the place of lexer
 * priorities: rolls are tried before numbers (so {@code 3d20} is never read as {@code 3}),
 * floating literals before integers, and {@code //} before {@code /}.
 */
@SuppressWarnings("Convert2MethodRef")
public class RollGrammar extends Grammar
{
    // ==== LEXICAL ===========================================================

    {
        ws = set(" \t").at_least(0);
        id_part = choice(alphanum, '_');
    }

    public rule STAR            = word("*");
    public rule SLASH_SLASH     = word("//");
    public rule SLASH           = word("/");
    public rule PERCENT         = word("%");
    public rule CARET           = word("^");
    public rule PLUS            = word("+");
    public rule MINUS           = word("-");
    public rule LPAREN          = word("(");
    public rule RPAREN          = word(")");
    public rule COMMA           = word(",");
    public rule EQUALS          = word("=");

    public rule digits =
        digit.at_least(1);

    public rule natural =
        digits
        .push($ -> $.str());

    public rule exponent =
        seq(set("eE"), opt(set("+-")), digits);

    public rule floating =
        seq(digits, '.', digits, opt(exponent))
        .push($ -> new FloatLiteralNode($.span(), Double.parseDouble($.str())))
        .word();

    public rule integer =
        digits
        .push($ -> intLiteral($.span(), $.str()))
        .word();

    public rule die =
        seq(set("dD"), natural, not(id_part))
        .push($ -> new DiceLiteralNode($.span(), null, $.$[0]))
        .word();

    public rule dice =
        seq(natural, set("dD"), natural, not(id_part))
        .push($ -> new DiceLiteralNode($.span(), $.$[0], $.$[1]))
        .word();

    /** Dotted names that cannot be confused with maths: {@code str.mod}, {@code skill_2}. */
    public rule strict_name =
        seq(alpha, seq(set("._").at_least(0), alphanum).at_least(0))
        .push($ -> $.str());

    /** Names that only appear inside {@code ${...}}: may hold spaces and punctuation. */
    public rule lax_name =
        seq(alpha, seq(choice(digit, set(". :(_-")).at_least(0), choice(alpha, ')')).at_least(0))
        .push($ -> $.str());

    public rule fun_name =
        seq(alpha, id_part.at_least(0))
        .push($ -> $.str())
        .word();

    // ==== SYNTACTIC =========================================================

    public rule reference =
        choice(
            seq("${", lax_name, '}'),
            seq('$', strict_name))
        .push($ -> new ReferenceNode($.span(), $.$[0]))
        .word();

    public rule roll = choice(
        dice,
        die);

    public rule paren_expression = lazy(() ->
        seq(LPAREN, this.sum, RPAREN)
        .push($ -> new ParenthesizedNode($.span(), $.$[0])));

    public rule arguments = lazy(() ->
        this.sum.sep(0, COMMA)
        .as_list(ExpressionNode.class));

    public rule fun_call =
        seq(fun_name, LPAREN, arguments, RPAREN)
        .push($ -> new FunCallNode($.span(), $.$[0], $.$[1]));

    public rule primary = choice(
        roll,
        reference,
        floating,
        integer,
        paren_expression,
        fun_call);

    public rule unary_op = choice(
        MINUS       .as_val(UnaryOperator.NEGATE),
        PLUS        .as_val(UnaryOperator.POSITIVE));

    public rule unary_expression = right_expression()
        .operand(primary)
        .prefix(unary_op,
            $ -> new UnaryExpressionNode($.span(), $.$[0], $.$[1]));

    public rule mult_op = choice(
        STAR        .as_val(BinaryOperator.MULTIPLY),
        SLASH_SLASH .as_val(BinaryOperator.FLOOR_DIVIDE),
        SLASH       .as_val(BinaryOperator.DIVIDE),
        PERCENT     .as_val(BinaryOperator.REMAINDER),
        CARET       .as_val(BinaryOperator.POWER));

    public rule add_op = choice(
        PLUS        .as_val(BinaryOperator.ADD),
        MINUS       .as_val(BinaryOperator.SUBTRACT));

    public rule product = left_expression()
        .operand(unary_expression)
        .infix(mult_op,
            $ -> new BinaryExpressionNode($.span(), $.$[0], $.$[1], $.$[2]));

    public rule sum = left_expression()
        .operand(product)
        .infix(add_op,
            $ -> new BinaryExpressionNode($.span(), $.$[0], $.$[1], $.$[2]));

    public rule assignment =
        seq(lax_name, ws, EQUALS, sum)
        .push($ -> new AssignmentNode($.span(), $.$[0], $.$[1]));

    public rule root =
        seq(ws, choice(assignment, sum));

    @Override public rule root () {
        return root;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Integer literals too large for a {@code long} become floating literals rather than failing
     * inside a parse action.
     */
    private static ExpressionNode intLiteral (Span span, String digits) {
        try {
            return new IntLiteralNode(span, Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return new FloatLiteralNode(span, Double.parseDouble(digits));
        }
    }
}
