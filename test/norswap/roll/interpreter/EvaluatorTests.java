package norswap.roll.interpreter;

import norswap.roll.RollParser;
import norswap.roll.tree.Constant;
import norswap.roll.tree.MathNode;
import norswap.roll.tree.Operator;
import norswap.roll.tree.OperatorKind;
import norswap.roll.tree.Randomness;
import norswap.roll.tree.Variable;
import org.junit.jupiter.api.Test;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTests
{
    private final RollParser parser = new RollParser();

    @Test void evaluatesChildrenFirst () {
        MathNode tree = parser.parse("(1 + 2) * (3 + 4)");
        assertEquals(21L, Evaluator.eval(tree));
        for (MathNode node : tree.walk())
            assertNotNull(node.value(), node.toString());
    }

    @Test void sharedNodeEvaluatedOnce () {
        Constant three = new Constant(3);
        Operator add = new Operator(OperatorKind.ADD, three, three);
        assertEquals(6L, Evaluator.eval(add));
        assertEquals(2, add.walk().size());
    }

    @Test void nodeSharedByTwoParents () {
        Operator shared = new Operator(OperatorKind.ADD, new Constant(1), new Constant(2));
        Operator left = new Operator(OperatorKind.MULT, shared, new Constant(10));
        Operator root = new Operator(OperatorKind.ADD, left, shared);
        List<MathNode> walk = root.walk();
        assertEquals(6, walk.size());
        assertTrue(walk.indexOf(shared) < walk.indexOf(left), walk.toString());
        assertSame(root, walk.get(walk.size() - 1));
        assertEquals(33L, Evaluator.eval(root));
    }

    @Test void resolvedVariables () {
        MathNode tree = parser.parse("$str.mod * 2 + $dex");
        for (Variable variable : tree.variables())
            variable.set(variable.name().equals("dex") ? 1 : 3, null);
        assertEquals(7L, Evaluator.eval(tree));
    }

    @Test void unresolvedVariable () {
        EvaluationException e = assertThrows(EvaluationException.class,
            () -> Evaluator.eval(parser.parse("2 + $jeff")));
        assertTrue(e.getMessage().contains("$jeff"), e.getMessage());
    }

    @Test void infinity () {
        assertThrows(EvaluationException.class,
            () -> Evaluator.eval(parser.parse("10.0 ^ 400")));
    }

    @Test void dice () {
        Randomness.seed(7);
        Number total = Evaluator.eval(parser.parse("2d6 + 10"));
        assertTrue(total.longValue() >= 12 && total.longValue() <= 22);
    }
}
