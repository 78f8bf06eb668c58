package norswap.roll.tree;

import norswap.roll.interpreter.EvaluationException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric operations on tree values.
 *
 * <p>Runtime value representation: integers are {@link Long}, everything else is {@link Double}.
 * Integer operations stay integer except for true division (always floating), negative or
 * fractional powers, and overflow, which all promote to floating. Every operation in the tree
 * goes through this class, so these rules live in one place.
 */
public final class Arithmetic
{
    private Arithmetic () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Converts any {@link Number} to the runtime representation: {@link Long} for integral boxed
     * types (and {@link BigInteger} values that fit), {@link Double} otherwise.
     */
    public static Number normalize (Number number)
    {
        if (number == null)
            return null;
        if (number instanceof Long)
            return number;
        if (number instanceof Integer || number instanceof Short || number instanceof Byte)
            return number.longValue();
        if (number instanceof BigInteger) {
            BigInteger big = (BigInteger) number;
            return big.bitLength() < Long.SIZE ? (Number) big.longValue() : (Number) big.doubleValue();
        }
        if (number instanceof BigDecimal) {
            BigDecimal big = (BigDecimal) number;
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                return big.doubleValue();
            }
        }
        return number.doubleValue();
    }

    // ---------------------------------------------------------------------------------------------

    public static boolean isIntegral (Number number) {
        return number instanceof Long;
    }

    // ---------------------------------------------------------------------------------------------

    public static boolean isFinite (Number number) {
        if (number == null) return false;
        return isIntegral(number) || Double.isFinite(number.doubleValue());
    }

    // ---------------------------------------------------------------------------------------------

    public static Number negate (Number value)
    {
        if (isIntegral(value)) {
            long l = value.longValue();
            return l == Long.MIN_VALUE ? (Number) (-(double) l) : (Number) (-l);
        }
        return -value.doubleValue();
    }

    // ---------------------------------------------------------------------------------------------

    public static Number add (Number left, Number right)
    {
        if (isIntegral(left) && isIntegral(right))
            try {
                return Math.addExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return left.doubleValue() + right.doubleValue();
            }
        return left.doubleValue() + right.doubleValue();
    }

    public static Number subtract (Number left, Number right)
    {
        if (isIntegral(left) && isIntegral(right))
            try {
                return Math.subtractExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return left.doubleValue() - right.doubleValue();
            }
        return left.doubleValue() - right.doubleValue();
    }

    public static Number multiply (Number left, Number right)
    {
        if (isIntegral(left) && isIntegral(right))
            try {
                return Math.multiplyExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return left.doubleValue() * right.doubleValue();
            }
        return left.doubleValue() * right.doubleValue();
    }

    /**
     * True division: the result is always floating.
     */
    public static Number divide (Number left, Number right)
    {
        checkDivisor(right, "divide");
        return left.doubleValue() / right.doubleValue();
    }

    /**
     * Floor division: rounds towards negative infinity, stays integral for integral operands.
     */
    public static Number floorDivide (Number left, Number right)
    {
        checkDivisor(right, "floor-divide");
        if (isIntegral(left) && isIntegral(right)) {
            long l = left.longValue(), r = right.longValue();
            if (l == Long.MIN_VALUE && r == -1)
                return -(double) l;
            return Math.floorDiv(l, r);
        }
        return Math.floor(left.doubleValue() / right.doubleValue());
    }

    /**
     * Floored modulo: the result takes the sign of the divisor.
     */
    public static Number remainder (Number left, Number right)
    {
        checkDivisor(right, "modulo");
        if (isIntegral(left) && isIntegral(right))
            return Math.floorMod(left.longValue(), right.longValue());
        double l = left.doubleValue(), r = right.doubleValue();
        return l - r * Math.floor(l / r);
    }

    public static Number power (Number base, Number exponent)
    {
        if (isIntegral(base) && isIntegral(exponent) && exponent.longValue() >= 0) {
            long result = 1;
            long b = base.longValue();
            try {
                for (long e = exponent.longValue(); e > 0; --e) {
                    result = Math.multiplyExact(result, b);
                    // 0, 1 and -1 never overflow: stop early for large exponents
                    if (b == 0 || b == 1) break;
                    if (b == -1) return (e - 1) % 2 == 0 ? result : -result;
                }
                return result;
            } catch (ArithmeticException overflow) {
                return Math.pow(base.doubleValue(), exponent.doubleValue());
            }
        }
        return Math.pow(base.doubleValue(), exponent.doubleValue());
    }

    // ---------------------------------------------------------------------------------------------

    private static void checkDivisor (Number divisor, String operation)
    {
        if (divisor.doubleValue() == 0)
            throw new EvaluationException("Cannot " + operation + " by zero.");
    }
}
