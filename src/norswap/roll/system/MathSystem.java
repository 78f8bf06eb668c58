package norswap.roll.system;

import norswap.roll.MathConfig;
import norswap.roll.MathSyntaxException;
import norswap.roll.RollParser;
import norswap.roll.interpreter.EvaluationException;
import norswap.roll.interpreter.Evaluator;
import norswap.roll.tree.MathNode;
import norswap.roll.tree.Randomness;
import norswap.roll.tree.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the variables of math trees over several ticks, then evaluates them and publishes the
 * results.
 *
 * <p>A variable's value is owned by some other subsystem, which may express it as a number or as
 * another expression (which can itself hold variables). Each submitted tree becomes a
 * {@link MathEntry} that goes through two worklists:
 * <ul>
 *     <li>{@code recurse}: entries whose last sweep substituted something or left a variable
 *     unresolved.</li>
 *     <li>{@code finalize}: entries in steady state, ready to be evaluated.</li>
 * </ul>
 *
 * <p>{@link #command} performs a first sweep right away. Then each {@link #update()} performs one
 * sweep over every entry in {@code recurse} and evaluates everything in {@code finalize}. Entries
 * only move from {@code recurse} to {@code finalize}, or get dropped on failure.
 *
 * <p>An entry whose variables nobody recognizes stays in {@code recurse} forever. Expansions, on
 * the other hand, are bounded: a canonical name cannot expand into itself, directly or not, and
 * chains of expansions are limited to {@link MathConfig#maxExpansionDepth}.
 *
 * <p>Everything runs on the caller's thread; instances are not thread-safe.
 */
public final class MathSystem
{
    // ---------------------------------------------------------------------------------------------

    private static final Logger log = LoggerFactory.getLogger(MathSystem.class);

    private final MathConfig config;
    private final RollParser parser;
    private final ResultPublisher publisher;
    private final EntityCheck entities;

    private final MathQueue recurse = new MathQueue();
    private final MathQueue finalize = new MathQueue();

    // ---------------------------------------------------------------------------------------------

    public MathSystem (MathConfig config, RollParser parser, ResultPublisher publisher,
                       EntityCheck entities)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.entities = entities == null ? EntityCheck.ALWAYS : entities;

        if (config.randomSeed != null)
            Randomness.seed(config.randomSeed);
    }

    public MathSystem (MathConfig config, ResultPublisher publisher) {
        this(config, new RollParser(config), publisher, EntityCheck.ALWAYS);
    }

    // ---------------------------------------------------------------------------------------------

    public SystemHealth health () {
        return publisher.available() ? SystemHealth.HEALTHY : SystemHealth.DEGRADED;
    }

    /** Number of entries waiting for another resolution sweep. */
    public int recursing () {
        return recurse.size();
    }

    /** Number of entries waiting to be evaluated. */
    public int finalizing () {
        return finalize.size();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Submits {@code root} for resolution and evaluation. Its variables are swept once right away.
     * Once the tree is resolved and evaluated, {@code event} is finalized with it and published.
     *
     * <p>The returned status is a failure if the system is degraded, if the entity owning
     * {@code event} is gone, or if the first sweep failed. In all those cases the command is
     * dropped and nothing will be published.
     */
    public CommandStatus command (MathNode root, VariableCanonicalizer canonicalizer,
                                  VariableFiller filler, MathEvent event, InputContext context)
    {
        if (!health().ok()) {
            log.warn("command ignored, math system degraded: {}", context);
            return CommandStatus.systemHealth(context);
        }

        if (!alive(event.entityId())) {
            log.debug("command ignored, entity {} is gone: {}", event.entityId(), context);
            return CommandStatus.failure(null, "Entity " + event.entityId() + " no longer exists.",
                context);
        }

        MathEntry entry = new MathEntry(root, context, canonicalizer, filler, event);
        return resolve(entry);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Runs one tick: one sweep over the entries waiting for resolution, then evaluation and
     * publication of every entry in steady state. Safe to call with nothing to do.
     */
    public SystemHealth update ()
    {
        SystemHealth health = health();
        if (!health.ok()) {
            log.warn("tick skipped, math system degraded ({} pending)",
                recurse.size() + finalize.size());
            return health;
        }

        // entries put back during the sweep wait for the next tick
        for (MathEntry entry : recurse.drain()) {
            if (!alive(entry.entityId())) {
                log.debug("dropping {}, entity {} is gone", entry, entry.entityId());
                continue;
            }
            try {
                CommandStatus status = resolve(entry);
                if (!status.success())
                    log.warn("dropping {}: {}", entry, status);
            } catch (RuntimeException e) {
                log.warn("dropping {} after an unexpected failure", entry, e);
            }
        }

        for (MathEntry entry : finalize.drain()) {
            try {
                finish(entry);
            } catch (RuntimeException e) {
                log.warn("dropping {} after an unexpected failure", entry, e);
            }
        }

        return health();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Sweeps {@code entry} and queues it according to the outcome, or drops it on failure.
     */
    private CommandStatus resolve (MathEntry entry)
    {
        boolean steady;
        try {
            steady = sweep(entry);
        } catch (ResolutionException e) {
            log.warn("resolution failed for {}: {}", entry.context, e.getMessage());
            return e.getCause() instanceof MathSyntaxException
                ? CommandStatus.parsing(e.token, e.getMessage(), entry.context)
                : CommandStatus.failure(e.token, e.getMessage(), entry.context);
        }

        if (steady) {
            log.debug("{} is resolved", entry);
            finalize.push(entry);
        } else {
            log.debug("{} needs another sweep", entry);
            recurse.push(entry);
        }
        return CommandStatus.successful(entry.context);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Tries to resolve every unresolved variable of the tree once. Numbers are assigned in place;
     * expressions are parsed and replace their variable once all variables have been visited.
     *
     * <p>Returns true if the tree is in steady state: nothing was substituted and no variable is
     * left unresolved.
     */
    private boolean sweep (MathEntry entry)
    {
        List<Variable> expanded = new ArrayList<>();
        List<MathNode> replacements = new ArrayList<>();
        List<String> canonicals = new ArrayList<>();
        int unresolved = 0;

        for (Variable variable : entry.root().variables())
        {
            if (variable.resolved())
                continue;

            Optional<String> canonical = canonicalize(entry, variable);
            if (!canonical.isPresent()) {
                ++unresolved;
                continue;
            }

            String name = canonical.get();
            FillResult fill = fill(entry, variable, name);

            if (fill.isNumber()) {
                variable.set(fill.number(), fill.milieu());
                log.debug("{} = {}", name, fill.number());
                continue;
            }

            checkChain(entry, variable, name);
            MathNode replacement = parse(fill);
            if (variable.negative())
                replacement.neg();
            log.debug("{} expands to {}", name, fill.expression());
            expanded.add(variable);
            replacements.add(replacement);
            canonicals.add(name);
        }

        for (int i = 0; i < expanded.size(); ++i)
            if (!entry.expand(expanded.get(i), replacements.get(i), canonicals.get(i)))
                throw new ResolutionException(
                    "could not find " + expanded.get(i) + " in the tree to replace it",
                    expanded.get(i).name());

        return expanded.isEmpty() && unresolved == 0;
    }

    // ---------------------------------------------------------------------------------------------

    private static Optional<String> canonicalize (MathEntry entry, Variable variable)
    {
        Optional<String> canonical;
        try {
            canonical = entry.canonicalizer.canonicalize(variable.name(), variable.milieu());
        } catch (RuntimeException e) {
            throw new ResolutionException(
                "could not canonicalize " + variable.name() + ": " + e.getMessage(),
                variable.name(), e);
        }
        return canonical == null ? Optional.empty() : canonical;
    }

    private static FillResult fill (MathEntry entry, Variable variable, String canonical)
    {
        FillResult fill;
        try {
            fill = entry.filler.fill(entry.entityId(), canonical, entry.context);
        } catch (RuntimeException e) {
            throw new ResolutionException(
                "could not fill " + canonical + ": " + e.getMessage(), variable.name(), e);
        }
        if (fill == null)
            throw new ResolutionException("no value for " + canonical, variable.name());
        return fill;
    }

    private void checkChain (MathEntry entry, Variable variable, String canonical)
    {
        List<String> chain = entry.chain(variable);
        if (chain.contains(canonical))
            throw new ResolutionException(
                "variable " + canonical + " expands into itself: "
                    + String.join(" -> ", chain) + " -> " + canonical,
                canonical);
        if (chain.size() >= config.maxExpansionDepth)
            throw new ResolutionException(
                "variable " + canonical + " is nested more than "
                    + config.maxExpansionDepth + " expansions deep",
                canonical);
    }

    private MathNode parse (FillResult fill)
    {
        try {
            return parser.parse(fill.expression(), fill.milieu());
        } catch (MathSyntaxException e) {
            throw new ResolutionException(
                "failed parsing '" + fill.expression() + "' into a math expression",
                fill.expression(), e);
        }
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Whether the entity still exists. An entity whose check fails counts as gone.
     */
    private boolean alive (long entityId)
    {
        try {
            return entities.alive(entityId);
        } catch (RuntimeException e) {
            log.warn("liveness check failed for entity {}", entityId, e);
            return false;
        }
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Evaluates a resolved entry and publishes its event.
     */
    private void finish (MathEntry entry)
    {
        if (!alive(entry.entityId())) {
            log.debug("dropping {}, entity {} is gone", entry, entry.entityId());
            return;
        }

        Number total;
        try {
            total = Evaluator.eval(entry.root());
        } catch (EvaluationException e) {
            log.error("could not evaluate resolved {}", entry, e);
            return;
        }

        log.debug("{} = {}", entry, total);
        entry.event.finalizeResult(entry.root(), total);
        try {
            publisher.publish(entry.event);
        } catch (RuntimeException e) {
            log.warn("could not publish {}", entry.event, e);
        }
    }
}
