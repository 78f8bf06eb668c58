package norswap.roll.system;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Worklist of {@link MathEntry}. Last in, first out: callers must not rely on any ordering.
 */
final class MathQueue
{
    private final Deque<MathEntry> entries = new ArrayDeque<>();

    void push (MathEntry entry) {
        entries.push(entry);
    }

    int size () {
        return entries.size();
    }

    /**
     * Removes every entry and returns them, most recently pushed first.
     */
    List<MathEntry> drain ()
    {
        List<MathEntry> drained = new ArrayList<>(entries.size());
        while (!entries.isEmpty())
            drained.add(entries.pop());
        return drained;
    }
}
