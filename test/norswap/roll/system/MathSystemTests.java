package norswap.roll.system;

import norswap.roll.MathConfig;
import norswap.roll.RollParser;
import norswap.roll.tree.MathNode;
import norswap.roll.tree.Randomness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MathSystemTests
{
    // ---------------------------------------------------------------------------------------------

    private static final long ENTITY = 7;
    private static final long FLAKY = 8;

    /** Collects published events; can be switched off to degrade the system. */
    private static final class Bus implements ResultPublisher
    {
        final List<MathEvent> published = new ArrayList<>();
        boolean available = true;

        @Override public void publish (MathEvent event) {
            published.add(event);
        }

        @Override public boolean available () {
            return available;
        }
    }

    private static final VariableCanonicalizer ANY = (name, milieu) -> Optional.of(name);
    private static final VariableCanonicalizer NONE = (name, milieu) -> Optional.empty();

    private final RollParser parser = new RollParser();
    private final Set<Long> alive = new HashSet<>();
    private Bus bus;
    private MathSystem system;
    private boolean flakyCheckBroken;

    @BeforeEach void setup ()
    {
        Randomness.seed(3);
        alive.add(ENTITY);
        bus = new Bus();
        system = new MathSystem(MathConfig.defaults(), parser, bus, alive::contains);
    }

    private CommandStatus command (String text, VariableCanonicalizer canonicalizer,
                                   VariableFiller filler)
    {
        return command(ENTITY, text, canonicalizer, filler);
    }

    private CommandStatus command (long entity, String text, VariableCanonicalizer canonicalizer,
                                   VariableFiller filler)
    {
        InputContext context = new InputContext("test", text);
        MathNode root = parser.parse(text);
        return system.command(root, canonicalizer, filler,
            new MathResult(entity, context, root), context);
    }

    /** Uses an entity check that throws for {@link #FLAKY} once broken. */
    private void useFlakyCheck ()
    {
        system = new MathSystem(MathConfig.defaults(), parser, bus, entity -> {
            if (entity == FLAKY && flakyCheckBroken)
                throw new IllegalStateException("registry down");
            return true;
        });
    }

    private static VariableFiller expressions (Map<String, String> values) {
        return (entity, name, context) -> FillResult.expression(values.get(name), null);
    }

    // ---------------------------------------------------------------------------------------------

    @Test void noVariablesGoesStraightToFinalize ()
    {
        CommandStatus status = command("40 + 2", ANY, (e, n, c) -> {
            throw new AssertionError("nothing to fill");
        });
        assertTrue(status.success(), status.toString());
        assertEquals(0, system.recursing());
        assertEquals(1, system.finalizing());
        assertTrue(bus.published.isEmpty());

        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(1, bus.published.size());
        assertEquals(42L, bus.published.get(0).total());
        assertEquals(0, system.finalizing());
    }

    @Test void expressionFillConvergesInOneTick ()
    {
        CommandStatus status = command("$jeff + 2", ANY,
            (entity, name, context) -> FillResult.expression("20 * 2", "jeff's milieu"));
        assertTrue(status.success(), status.toString());
        assertEquals(1, system.recursing());

        system.update();

        assertEquals(1, bus.published.size());
        MathEvent event = bus.published.get(0);
        assertEquals(42L, event.total());
        assertTrue(event.root().variables().isEmpty());
        assertEquals(0, system.recursing());
        assertEquals(0, system.finalizing());
    }

    @Test void numberFillResolvesInPlace ()
    {
        CommandStatus status = command("$str.mod + 1", ANY,
            (entity, name, context) -> FillResult.number(3, "strength"));
        assertTrue(status.success());
        assertEquals(1, system.finalizing());

        system.update();
        MathEvent event = bus.published.get(0);
        assertEquals(4L, event.total());
        assertEquals(1, event.root().variables().size());
        assertEquals("strength", event.root().variables().get(0).milieu());
    }

    @Test void nestedExpansion ()
    {
        VariableCanonicalizer canonicalizer = (name, milieu) ->
            name.equals("this.score") ? Optional.of(milieu + ".score") : Optional.of(name);
        VariableFiller filler = (entity, name, context) -> {
            switch (name) {
                case "str.mod":         return FillResult.expression("(${this.score} - 10) // 2", "strength");
                case "strength.score":  return FillResult.number(16, "strength");
                default:                throw new IllegalArgumentException(name);
            }
        };

        assertTrue(command("d20 + $str.mod", canonicalizer, filler).success());
        system.update();

        assertEquals(1, bus.published.size());
        MathEvent event = bus.published.get(0);
        long roll = event.total().longValue() - 3;
        assertTrue(roll >= 1 && roll <= 20, "total " + event.total());
        assertEquals("strength", event.root().variables().get(0).moniker());
    }

    @Test void rootVariableIsReplaced ()
    {
        assertTrue(command("$jeff", ANY, expressions(Map.of("jeff", "5 * 5"))).success());
        system.update();
        assertEquals(25L, bus.published.get(0).total());
    }

    @Test void signIsCarriedOver ()
    {
        assertTrue(command("10 - -$x", ANY, expressions(Map.of("x", "2 + 3"))).success());
        system.update();
        assertEquals(15L, bus.published.get(0).total());
    }

    @Test void unrecognizedVariablesNeverConverge ()
    {
        assertTrue(command("$jeff + 2", NONE, (e, n, c) -> {
            throw new AssertionError("nothing to fill");
        }).success());

        for (int tick = 0; tick < 10; ++tick)
            system.update();

        assertEquals(1, system.recursing());
        assertEquals(0, system.finalizing());
        assertTrue(bus.published.isEmpty());
    }

    @Test void multiTickExpansion ()
    {
        assertTrue(command("$a", ANY, expressions(Map.of(
            "a", "$b + 1",
            "b", "$c + 1",
            "c", "1"))).success());

        system.update();
        assertTrue(bus.published.isEmpty());
        system.update();
        assertTrue(bus.published.isEmpty());
        system.update();
        assertEquals(3L, bus.published.get(0).total());
    }

    @Test void expansionCycleIsDropped ()
    {
        assertTrue(command("$a + 1", ANY, expressions(Map.of(
            "a", "$b * 2",
            "b", "$a - 1"))).success());

        for (int tick = 0; tick < 5; ++tick)
            system.update();

        assertEquals(0, system.recursing());
        assertEquals(0, system.finalizing());
        assertTrue(bus.published.isEmpty());
    }

    @Test void sameNameInSeparateBranchesIsNotACycle ()
    {
        assertTrue(command("$a + $a", ANY, expressions(Map.of(
            "a", "$b",
            "b", "4"))).success());
        for (int tick = 0; tick < 3; ++tick)
            system.update();
        assertEquals(8L, bus.published.get(0).total());
    }

    @Test void expansionDepthIsBounded ()
    {
        MathConfig config = new MathConfig(3, null, null, null);
        system = new MathSystem(config, new RollParser(config), bus, alive::contains);

        VariableFiller endless = (entity, name, context) ->
            FillResult.expression("$v" + (Integer.parseInt(name.substring(1)) + 1) + " + 1", null);
        assertTrue(command("$v0", ANY, endless).success());

        for (int tick = 0; tick < 10; ++tick)
            system.update();

        assertEquals(0, system.recursing());
        assertTrue(bus.published.isEmpty());
    }

    // --- Failures ---

    @Test void unparsableFill ()
    {
        CommandStatus status = command("$jeff + 2", ANY,
            (entity, name, context) -> FillResult.expression("3d", null));
        assertEquals(CommandStatus.Kind.PARSING, status.kind);
        assertEquals("3d", status.token);
        assertEquals(0, system.recursing());
    }

    @Test void canonicalizerFailure ()
    {
        CommandStatus status = command("$jeff + 2",
            (name, milieu) -> { throw new IllegalStateException("boom"); },
            (entity, name, context) -> FillResult.number(1, null));
        assertEquals(CommandStatus.Kind.FAILURE, status.kind);
        assertEquals("jeff", status.token);
        assertEquals(0, system.recursing() + system.finalizing());
    }

    @Test void fillerFailure ()
    {
        CommandStatus status = command("$jeff + 2", ANY,
            (entity, name, context) -> { throw new IllegalStateException("boom"); });
        assertEquals(CommandStatus.Kind.FAILURE, status.kind);
        assertTrue(status.message.contains("boom"), status.message);
    }

    @Test void nullFill ()
    {
        CommandStatus status = command("$jeff", ANY, (entity, name, context) -> null);
        assertEquals(CommandStatus.Kind.FAILURE, status.kind);
    }

    @Test void evaluationFailureDropsEntry ()
    {
        assertTrue(command("1 / 0", ANY, expressions(Map.of())).success());
        assertEquals(1, system.finalizing());
        system.update();
        assertEquals(0, system.finalizing());
        assertTrue(bus.published.isEmpty());
    }

    @Test void publisherFailureDoesNotEscape ()
    {
        system = new MathSystem(MathConfig.defaults(), parser, event -> {
            throw new IllegalStateException("bus down");
        }, null);
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());
        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(0, system.finalizing());
    }

    @Test void failingEventDoesNotLoseOthers ()
    {
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());

        InputContext context = new InputContext("test", "2 + 2");
        MathNode root = parser.parse("2 + 2");
        MathEvent broken = new MathEvent(ENTITY, context, root) {
            @Override public void finalizeResult (MathNode node, Number total) {
                throw new IllegalStateException("sink broke");
            }
        };
        assertTrue(system.command(root, ANY, expressions(Map.of()), broken, context).success());
        assertEquals(2, system.finalizing());

        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(1, bus.published.size());
        assertEquals(2L, bus.published.get(0).total());
        assertEquals(0, system.finalizing());
    }

    @Test void failingEntityCheckAtCommand ()
    {
        useFlakyCheck();
        flakyCheckBroken = true;
        CommandStatus status = command(FLAKY, "1 + 1", ANY, expressions(Map.of()));
        assertEquals(CommandStatus.Kind.FAILURE, status.kind);
        assertEquals(0, system.finalizing());
    }

    @Test void failingEntityCheckDuringSweep ()
    {
        useFlakyCheck();
        assertTrue(command(FLAKY, "$nobody + 1", NONE, expressions(Map.of())).success());
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());
        assertEquals(1, system.recursing());

        flakyCheckBroken = true;
        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(0, system.recursing());
        assertEquals(1, bus.published.size());
        assertEquals(2L, bus.published.get(0).total());
    }

    @Test void failingEntityCheckAtFinalize ()
    {
        useFlakyCheck();
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());
        assertTrue(command(FLAKY, "2 + 2", ANY, expressions(Map.of())).success());

        flakyCheckBroken = true;
        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(0, system.finalizing());
        assertEquals(1, bus.published.size());
        assertEquals(ENTITY, bus.published.get(0).entityId());
    }

    // --- Health & liveness ---

    @Test void degradedSystemRejectsCommands ()
    {
        bus.available = false;
        assertEquals(SystemHealth.DEGRADED, system.health());
        CommandStatus status = command("1 + 1", ANY, expressions(Map.of()));
        assertEquals(CommandStatus.Kind.SYSTEM_HEALTH, status.kind);
        assertEquals(0, system.finalizing());
    }

    @Test void degradedSystemSkipsTicks ()
    {
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());
        bus.available = false;
        assertEquals(SystemHealth.DEGRADED, system.update());
        assertEquals(1, system.finalizing());

        bus.available = true;
        assertEquals(SystemHealth.HEALTHY, system.update());
        assertEquals(2L, bus.published.get(0).total());
    }

    @Test void deadEntityIsRejected ()
    {
        alive.clear();
        CommandStatus status = command("1 + 1", ANY, expressions(Map.of()));
        assertEquals(CommandStatus.Kind.FAILURE, status.kind);
    }

    @Test void entityDyingBeforeFinalize ()
    {
        assertTrue(command("1 + 1", ANY, expressions(Map.of())).success());
        alive.clear();
        system.update();
        assertTrue(bus.published.isEmpty());
        assertEquals(0, system.finalizing());
    }

    @Test void emptyUpdate () {
        assertEquals(SystemHealth.HEALTHY, system.update());
    }

    // --- Output event ---

    @Test void outputEvent ()
    {
        String text = "3d20 + 5";
        InputContext context = new InputContext("chat", text);
        MathNode root = parser.parse(text);
        MathOutputEvent event = new MathOutputEvent(ENTITY, context, root);
        assertThrows(RuntimeException.class, event::encode);

        assertTrue(system.command(root, ANY, expressions(Map.of()), event, context).success());
        system.update();

        assertSame(event, bus.published.get(0));
        assertEquals("operator", event.output().get("type"));
        assertEquals(event.total(), event.output().get("value"));
        String json = event.encode();
        assertTrue(json.startsWith("{\"entity\":7,\"total\":" + event.total() + ",\"output\":{"), json);
    }
}
