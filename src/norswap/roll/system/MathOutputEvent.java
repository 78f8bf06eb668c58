package norswap.roll.system;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import norswap.roll.MathException;
import norswap.roll.output.MathOutputTree;
import norswap.roll.tree.MathNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result event headed for users: on finalization, captures the output record of the tree so
 * that it can be sent as is.
 */
public final class MathOutputEvent extends MathEvent
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MathOutputTree formatter;
    private Map<String, Object> output;

    public MathOutputEvent (long entityId, InputContext context, MathNode root,
                            MathOutputTree formatter) {
        super(entityId, context, root);
        this.formatter = formatter;
    }

    public MathOutputEvent (long entityId, InputContext context, MathNode root) {
        this(entityId, context, root, new MathOutputTree());
    }

    @Override public void finalizeResult (MathNode root, Number total) {
        super.finalizeResult(root, total);
        output = formatter.toMap(root);
    }

    /** The output record, or null before finalization. */
    public Map<String, Object> output () {
        return output;
    }

    /**
     * Encodes the event as {@code {"entity": ..., "total": ..., "output": {...}}}.
     */
    public String encode ()
    {
        if (!finalized())
            throw new MathException("cannot encode unfinalized " + this);
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("entity", entityId());
        envelope.put("total", total());
        envelope.put("output", output);
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new MathException("could not encode " + this, e);
        }
    }
}
