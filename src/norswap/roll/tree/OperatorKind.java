package norswap.roll.tree;

import java.util.function.BiFunction;

/**
 * The binary operators of the language. Each holds a pure function over the runtime number
 * representation, the symbol the grammar reads and a display symbol.
 */
public enum OperatorKind
{
    ADD         ("+",  "+",  "add",          Arithmetic::add),
    SUB         ("-",  "−",  "subtract",     Arithmetic::subtract),
    MULT        ("*",  "×",  "multiply",     Arithmetic::multiply),
    DIV         ("/",  "÷",  "divide",       Arithmetic::divide),
    FLOOR_DIV   ("//", "÷÷", "floor-divide", Arithmetic::floorDivide),
    MOD         ("%",  "%",  "modulo",       Arithmetic::remainder),
    POW         ("^",  "^",  "power",        Arithmetic::power);

    /** The symbol as written in expressions. */
    public final String symbol;

    /** The symbol shown to users. */
    public final String display;

    /** Verb used in error messages. */
    public final String verb;

    private final BiFunction<Number, Number, Number> function;

    OperatorKind (String symbol, String display, String verb,
                  BiFunction<Number, Number, Number> function) {
        this.symbol = symbol;
        this.display = display;
        this.verb = verb;
        this.function = function;
    }

    public Number apply (Number left, Number right) {
        return function.apply(left, right);
    }
}
