package norswap.roll;

import norswap.autumn.Autumn;
import norswap.autumn.ParseOptions;
import norswap.autumn.ParseResult;
import norswap.roll.ast.RollNode;
import norswap.roll.tree.MathNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static norswap.utils.Util.cast;

/**
 * Entry point from text to math tree: runs {@link RollGrammar}, then {@link Transformer}.
 *
 * <p>Instances are not thread-safe, but may be reused for any number of inputs.
 */
public final class RollParser
{
    // ---------------------------------------------------------------------------------------------

    private static final Logger log = LoggerFactory.getLogger(RollParser.class);

    private final RollGrammar grammar = new RollGrammar();
    private final ParseOptions options = ParseOptions.builder().recordCallStack(true).get();
    private final Transformer transformer;

    // ---------------------------------------------------------------------------------------------

    public RollParser (MathConfig config) {
        this.transformer = new Transformer(config);
    }

    public RollParser () {
        this(MathConfig.defaults());
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Parses {@code text} into a fresh math tree.
     *
     * @throws MathSyntaxException if the text is not a valid expression
     */
    public MathNode parse (String text) {
        return parse(text, null);
    }

    /**
     * Like {@link #parse(String)}, but every variable in the tree gets {@code milieu} as milieu.
     */
    public MathNode parse (String text, String milieu)
    {
        if (text == null)
            throw new MathSyntaxException("no expression", null, -1, "");

        log.debug("parsing: {}", text);
        ParseResult result = Autumn.parse(grammar.root, text, options);

        if (!result.fullMatch) {
            int offset = errorOffset(result, text);
            String offending = offending(text, offset);
            throw new MathSyntaxException(
                "syntax error at " + offset + " near '" + offending + "' in: " + text,
                text, offset, offending);
        }

        RollNode root = cast(result.topValue());
        MathNode tree = transformer.transform(root, text, milieu);
        if (log.isDebugEnabled())
            log.debug("parsed {} into:\n{}", text, tree.pretty());
        return tree;
    }

    // ---------------------------------------------------------------------------------------------

    private static int errorOffset (ParseResult result, String text)
    {
        int offset = result.errorOffset >= 0
            ? result.errorOffset
            : result.success ? result.matchSize : 0;
        return Math.max(0, Math.min(offset, text.length()));
    }

    private static String offending (String text, int offset)
    {
        String rest = offset >= text.length() ? "" : text.substring(offset).trim();
        if (rest.isEmpty())
            return "<end of input>";
        int space = rest.indexOf(' ');
        return space < 0 ? rest : rest.substring(0, space);
    }
}
