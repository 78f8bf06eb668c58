package norswap.roll;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.io.InputStream;

/**
 * Tunables for parsing and resolution, read from the JSON classpath resource {@code /roll.json}.
 *
 * <p>Keys: {@code maxExpansionDepth}, {@code maxDiceCount}, {@code randomSeed},
 * {@code unicodeMonikers}. Missing keys take their default value, unknown keys are an error.
 */
public final class MathConfig
{
    // ---------------------------------------------------------------------------------------------

    public static final String RESOURCE = "/roll.json";

    public static final int DEFAULT_MAX_EXPANSION_DEPTH = 16;
    public static final int DEFAULT_MAX_DICE_COUNT = 1000;

    private static final Logger log = LoggerFactory.getLogger(MathConfig.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    // ---------------------------------------------------------------------------------------------

    /** Longest chain of variable expansions allowed for a single variable. */
    public final int maxExpansionDepth;

    /** Largest number of dice a single roll may ask for. */
    public final int maxDiceCount;

    /** Seed for the shared random source, or null to leave it alone. */
    public final Long randomSeed;

    /** Whether operator monikers use {@code − × ÷} rather than {@code - * /}. */
    public final boolean unicodeMonikers;

    // ---------------------------------------------------------------------------------------------

    @JsonCreator
    public MathConfig (
            @JsonProperty("maxExpansionDepth") Integer maxExpansionDepth,
            @JsonProperty("maxDiceCount") Integer maxDiceCount,
            @JsonProperty("randomSeed") Long randomSeed,
            @JsonProperty("unicodeMonikers") Boolean unicodeMonikers)
    {
        this.maxExpansionDepth = maxExpansionDepth == null
            ? DEFAULT_MAX_EXPANSION_DEPTH : maxExpansionDepth;
        this.maxDiceCount = maxDiceCount == null
            ? DEFAULT_MAX_DICE_COUNT : maxDiceCount;
        this.randomSeed = randomSeed;
        this.unicodeMonikers = unicodeMonikers == null || unicodeMonikers;
        validate();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the default configuration.
     */
    public static MathConfig defaults () {
        return new MathConfig(null, null, null, null);
    }

    /**
     * Loads {@link #RESOURCE} from the classpath, or returns the defaults if there is no such
     * resource.
     */
    public static MathConfig load ()
    {
        InputStream in = MathConfig.class.getResourceAsStream(RESOURCE);
        if (in == null) {
            log.debug("no {} on the classpath, using default configuration", RESOURCE);
            return defaults();
        }
        try (InputStream stream = in) {
            MathConfig config = read(stream);
            log.debug("loaded configuration from {}: {}", RESOURCE, config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("could not read " + RESOURCE, e);
        }
    }

    /**
     * Reads a configuration from a JSON document.
     */
    public static MathConfig read (InputStream in)
    {
        MathConfig config;
        try {
            config = MAPPER.readValue(in, MathConfig.class);
        } catch (ValueInstantiationException e) {
            if (e.getCause() instanceof ConfigurationException)
                throw (ConfigurationException) e.getCause();
            throw new ConfigurationException("invalid configuration: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("invalid configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("could not read configuration", e);
        }
        if (config == null)
            throw new ConfigurationException("invalid configuration: empty document");
        return config;
    }

    private void validate ()
    {
        if (maxExpansionDepth < 1)
            throw new ConfigurationException(
                "maxExpansionDepth must be at least 1, got " + maxExpansionDepth);
        if (maxDiceCount < 1)
            throw new ConfigurationException(
                "maxDiceCount must be at least 1, got " + maxDiceCount);
    }

    // ---------------------------------------------------------------------------------------------

    @Override public String toString () {
        return "MathConfig{maxExpansionDepth=" + maxExpansionDepth
            + ", maxDiceCount=" + maxDiceCount
            + ", randomSeed=" + randomSeed
            + ", unicodeMonikers=" + unicodeMonikers + "}";
    }
}
