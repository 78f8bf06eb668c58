package norswap.roll.system;

/**
 * Outcome of {@link MathSystem#command}.
 */
public final class CommandStatus
{
    // ---------------------------------------------------------------------------------------------

    public enum Kind {
        SUCCESS,
        /** An expression could not be parsed. */
        PARSING,
        /** The system is degraded and ignored the command. */
        SYSTEM_HEALTH,
        /** A callback failed, an expansion looped, the entity is gone... */
        FAILURE
    }

    // ---------------------------------------------------------------------------------------------

    public final Kind kind;

    /** The offending part of the input, or null. */
    public final String token;

    /** Message for the user, or null on success. */
    public final String message;

    public final InputContext context;

    private CommandStatus (Kind kind, String token, String message, InputContext context) {
        this.kind = kind;
        this.token = token;
        this.message = message;
        this.context = context;
    }

    // ---------------------------------------------------------------------------------------------

    public static CommandStatus successful (InputContext context) {
        return new CommandStatus(Kind.SUCCESS, null, null, context);
    }

    public static CommandStatus parsing (String token, String message, InputContext context) {
        return new CommandStatus(Kind.PARSING, token, message, context);
    }

    public static CommandStatus systemHealth (InputContext context) {
        return new CommandStatus(Kind.SYSTEM_HEALTH, null,
            "The math system is unavailable, try again later.", context);
    }

    public static CommandStatus failure (String token, String message, InputContext context) {
        return new CommandStatus(Kind.FAILURE, token, message, context);
    }

    // ---------------------------------------------------------------------------------------------

    public boolean success () {
        return kind == Kind.SUCCESS;
    }

    @Override public String toString () {
        return success()
            ? "CommandStatus(SUCCESS)"
            : "CommandStatus(" + kind + ", '" + token + "', " + message + ")";
    }
}
