package norswap.roll.tree;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Functions callable from expressions, e.g. {@code max(2d6, 4)}.
 *
 * <p>The table of names is built once, when the class is initialized.
 */
public enum MathFunction
{
    MIN     ("min",   1, -1, args -> extremum(args, true)),
    MAX     ("max",   1, -1, args -> extremum(args, false)),
    ABS     ("abs",   1,  1, args -> abs(args.get(0))),
    FLOOR   ("floor", 1,  1, args -> integral(Math.floor(args.get(0).doubleValue()), args.get(0))),
    CEIL    ("ceil",  1,  1, args -> integral(Math.ceil(args.get(0).doubleValue()), args.get(0))),
    ROUND   ("round", 1,  1, args -> integral(roundHalfAway(args.get(0).doubleValue()), args.get(0)));

    // ---------------------------------------------------------------------------------------------

    private static final Map<String, MathFunction> BY_NAME;

    static {
        Map<String, MathFunction> table = new HashMap<>();
        for (MathFunction function : values())
            table.put(function.string, function);
        BY_NAME = Collections.unmodifiableMap(table);
    }

    /**
     * Returns the function called {@code name}, or null if there is none.
     */
    public static MathFunction lookup (String name) {
        return BY_NAME.get(name);
    }

    // ---------------------------------------------------------------------------------------------

    public final String string;
    public final int minArity;

    /** -1 for no upper bound. */
    public final int maxArity;

    private final Function<List<Number>, Number> body;

    MathFunction (String string, int minArity, int maxArity, Function<List<Number>, Number> body) {
        this.string = string;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.body = body;
    }

    public boolean accepts (int arity) {
        return arity >= minArity && (maxArity < 0 || arity <= maxArity);
    }

    public Number apply (List<Number> arguments) {
        return body.apply(arguments);
    }

    // ---------------------------------------------------------------------------------------------

    private static Number extremum (List<Number> args, boolean min)
    {
        Number best = args.get(0);
        for (Number arg : args.subList(1, args.size())) {
            int cmp = compare(arg, best);
            if (min ? cmp < 0 : cmp > 0)
                best = arg;
        }
        return best;
    }

    private static int compare (Number a, Number b) {
        return Arithmetic.isIntegral(a) && Arithmetic.isIntegral(b)
            ? Long.compare(a.longValue(), b.longValue())
            : Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static Number abs (Number value)
    {
        if (!Arithmetic.isIntegral(value))
            return Math.abs(value.doubleValue());
        return value.longValue() < 0 ? Arithmetic.negate(value) : value;
    }

    private static double roundHalfAway (double value) {
        return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
    }

    /** Integral arguments pass through; rounded doubles become longs when they fit. */
    private static Number integral (double rounded, Number original)
    {
        if (Arithmetic.isIntegral(original))
            return original;
        if (rounded >= Long.MIN_VALUE && rounded <= Long.MAX_VALUE)
            return (long) rounded;
        return rounded;
    }
}
