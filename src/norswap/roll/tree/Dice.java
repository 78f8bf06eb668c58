package norswap.roll.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * {@code count} dice with {@code faces} faces each. Every evaluation rolls them again.
 */
public final class Dice extends Leaf
{
    public final int count;
    public final int faces;

    private List<Long> rolls;

    public Dice (int count, int faces)
    {
        super(NodeType.RANDOM, null, count + "d" + faces, null);
        if (count < 1 || faces < 1)
            throw new IllegalArgumentException(
                "dice need a positive count and face count: " + count + "d" + faces);
        this.count = count;
        this.faces = faces;
    }

    /**
     * The individual results of the last roll, or null if the dice have not been rolled.
     */
    public List<Long> rolls () {
        return rolls == null ? null : Collections.unmodifiableList(rolls);
    }

    @Override protected void evaluate ()
    {
        Random random = Randomness.source();
        List<Long> rolled = new ArrayList<>(count);
        long total = 0;
        for (int i = 0; i < count; ++i) {
            long roll = 1 + random.nextInt(faces);
            rolled.add(roll);
            total += roll;
        }
        rolls = rolled;
        value = total;
    }

    @Override public String exprStr (Set<FormatOption> options)
    {
        List<String> parts = new ArrayList<>();
        if (options.contains(FormatOption.INITIAL))
            parts.add(count + "d" + faces);
        if (options.contains(FormatOption.INTERMEDIATE))
            parts.add(rolls == null ? NULL_SIGN : rolls.toString());
        if (options.contains(FormatOption.FINAL))
            parts.add(value == null ? NULL_SIGN : value.toString());
        return parts.isEmpty() ? "" : signed(compose(parts));
    }

    @Override public String toString () {
        return "Dice(" + signed(count + "d" + faces)
            + (rolls == null ? "" : "=" + rolls)
            + (value == null ? "" : "==" + value())
            + ")";
    }
}
