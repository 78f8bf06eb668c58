package norswap.roll.system;

import java.util.Objects;

/**
 * Describes where a command comes from: a label for its source (a chat command, a skill check...)
 * and the text that was typed. Passed through to {@link VariableFiller}s and result events, and
 * attached to log messages.
 */
public final class InputContext
{
    public final String source;
    public final String text;

    public InputContext (String source, String text) {
        this.source = Objects.requireNonNull(source, "source");
        this.text = text;
    }

    @Override public String toString () {
        return source + ": '" + text + "'";
    }
}
