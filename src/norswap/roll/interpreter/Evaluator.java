package norswap.roll.interpreter;

import norswap.roll.tree.Arithmetic;
import norswap.roll.tree.MathNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the total of a math tree.
 *
 * <p>Every distinct node is evaluated once, children before their parent, so that branches fold
 * freshly computed values. Dice are rolled again on every evaluation.
 */
public final class Evaluator
{
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private Evaluator () {}

    /**
     * Evaluates the tree rooted at {@code root} and returns its total.
     *
     * @throws EvaluationException if a node cannot produce a finite number (unassigned variable,
     * division by zero, overflow to infinity...)
     */
    public static Number eval (MathNode root)
    {
        Number total = null;
        for (MathNode node : root.walk()) {
            try {
                total = node.eval();
            } catch (EvaluationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EvaluationException("exception while evaluating " + node, e);
            }
            if (!Arithmetic.isFinite(total))
                throw new EvaluationException(node + " did not evaluate to a finite number.");
        }
        // the root comes last in the walk
        if (log.isDebugEnabled())
            log.debug("{} = {}", root.exprStr(), total);
        return total;
    }
}
