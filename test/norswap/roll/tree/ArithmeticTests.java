package norswap.roll.tree;

import norswap.roll.interpreter.EvaluationException;
import org.junit.jupiter.api.Test;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticTests
{
    @Test void normalize () {
        assertEquals(3L, Arithmetic.normalize(3));
        assertEquals(3L, Arithmetic.normalize((short) 3));
        assertEquals(1.5, Arithmetic.normalize(1.5f));
        assertEquals(12L, Arithmetic.normalize(BigInteger.valueOf(12)));
        assertEquals(2.5, Arithmetic.normalize(new BigDecimal("2.5")));
        assertEquals(4L, Arithmetic.normalize(new BigDecimal("4.00")));
        assertInstanceOf(Double.class, Arithmetic.normalize(BigInteger.TEN.pow(30)));
        assertNull(Arithmetic.normalize(null));
    }

    @Test void overflowPromotes () {
        assertEquals((double) Long.MAX_VALUE + 1, Arithmetic.add(Long.MAX_VALUE, 1L));
        assertInstanceOf(Double.class, Arithmetic.multiply(Long.MAX_VALUE, 2L));
        assertInstanceOf(Double.class, Arithmetic.negate(Long.MIN_VALUE));
    }

    @Test void mixedOperandsAreFloating () {
        assertEquals(3.5, Arithmetic.add(1L, 2.5));
        assertEquals(2.0, Arithmetic.multiply(4L, 0.5));
    }

    @Test void divisionIsAlwaysFloating () {
        assertEquals(2.0, Arithmetic.divide(4L, 2L));
    }

    @Test void floorDivision () {
        assertEquals(-2L, Arithmetic.floorDivide(-3L, 2L));
        assertEquals(-2.0, Arithmetic.floorDivide(-3.0, 2L));
    }

    @Test void flooredRemainder () {
        assertEquals(1L, Arithmetic.remainder(-5L, 3L));
        assertEquals(-1L, Arithmetic.remainder(5L, -3L));
        assertEquals(0.5, Arithmetic.remainder(-2.5, 3L));
    }

    @Test void powers () {
        assertEquals(1L, Arithmetic.power(5L, 0L));
        assertEquals(0.25, Arithmetic.power(2L, -2L));
        assertEquals(3.0, Arithmetic.power(9L, 0.5));
        assertEquals(1L, Arithmetic.power(1L, 1_000_000_000_000L));
        assertEquals(-1L, Arithmetic.power(-1L, 1_000_000_000_001L));
        assertEquals(1L, Arithmetic.power(-1L, 1_000_000_000_000L));
        assertEquals(0L, Arithmetic.power(0L, 1_000_000_000_000L));
    }

    @Test void zeroDivisors () {
        assertThrows(EvaluationException.class, () -> Arithmetic.divide(1L, 0L));
        assertThrows(EvaluationException.class, () -> Arithmetic.floorDivide(1L, 0.0));
        assertThrows(EvaluationException.class, () -> Arithmetic.remainder(1.5, 0L));
    }

    @Test void finite () {
        assertTrue(Arithmetic.isFinite(1L));
        assertTrue(Arithmetic.isFinite(1.5));
        assertFalse(Arithmetic.isFinite(Double.NaN));
        assertFalse(Arithmetic.isFinite(Double.POSITIVE_INFINITY));
        assertFalse(Arithmetic.isFinite(null));
    }

    @Test void functions () {
        assertEquals(MathFunction.MAX, MathFunction.lookup("max"));
        assertNull(MathFunction.lookup("sqrt"));
        assertTrue(MathFunction.MIN.accepts(5));
        assertFalse(MathFunction.ABS.accepts(2));
        assertEquals(2.5, MathFunction.MAX.apply(Arrays.asList(1L, 2.5, 2L)));
        assertEquals(3L, MathFunction.ROUND.apply(Arrays.asList(2.5)));
        assertEquals(7L, MathFunction.FLOOR.apply(Arrays.asList(7L)));
        assertEquals(1.5, MathFunction.ABS.apply(Arrays.asList(-1.5)));
    }
}
