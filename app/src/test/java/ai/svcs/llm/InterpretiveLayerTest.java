package ai.svcs.llm;

import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.modified;
import static ai.svcs.semantic.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.config.EngineConfig;
import ai.svcs.semantic.AnalysisCancelledException;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.CancellationSignal;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.RunCounters;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InterpretiveLayerTest {
    private static final ComplexityScorer ALWAYS_INTERESTING = input -> 100.0;

    private static final String BEFORE = """
            def price(order):
                total = 0
                for line in order.lines:
                    total += line.amount
                return total
            """;
    private static final String AFTER = """
            def price(order):
                total = sum(line.amount for line in order.lines)
                if order.customer.is_member:
                    total *= 0.9
                return round(total, 2)
            """;

    private ProviderChain chain;

    @AfterEach
    void closeChain() {
        if (chain != null) {
            chain.close();
        }
    }

    private AnalysisContext context(AiProvider provider) {
        return context(provider, new CallBudget(10, 2));
    }

    private AnalysisContext context(AiProvider provider, CallBudget budget) {
        chain = new ProviderChain(List.of(provider), budget, Duration.ofMillis(200), 0, Duration.ZERO);
        return new AnalysisContext(EngineConfig.defaults(), chain, CancellationSignal.create(), new RunCounters());
    }

    private static FileDiff substantialChange() {
        return modified(tree(function("price", BEFORE)), tree(function("price", AFTER)));
    }

    @Test
    void noProviderMeansSkip() {
        var run = new InterpretiveLayer(ALWAYS_INTERESTING)
                .interpret(substantialChange(), List.of(), AnalysisContext.create(EngineConfig.defaults()));

        assertTrue(run.skipped());
        assertEquals("no provider configured", run.skipReason());
        assertEquals(List.of(GateState.IDLE, GateState.GATE_CHECK, GateState.SKIP, GateState.IDLE), run.trail());
    }

    @Test
    void trivialChangeNeverReachesProvider() {
        var provider = ScriptedProvider.replying("counting", "[]");
        var context = context(provider);
        var before = tree(function("price", BEFORE));
        var after = tree(function("price", BEFORE));

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(modified(before, after), List.of(), context);

        assertTrue(run.skipped());
        assertFalse(run.invoked());
        assertEquals(0, provider.calls());
        assertEquals(1, context.counters().gateSkips());
    }

    @Test
    void lowScoreSkipsWithStandardScorer() {
        var provider = ScriptedProvider.replying("counting", "[]");

        var run = new InterpretiveLayer().interpret(substantialChange(), List.of(), context(provider));

        assertTrue(run.skipped());
        assertTrue(run.skipReason().startsWith("complexity score"));
        assertEquals(0, provider.calls());
    }

    @Test
    void shortFilesAreSkipped() {
        var provider = ScriptedProvider.replying("counting", "[]");
        var diff = modified(tree(function("f", "def f(): return 1")), tree(function("f", "def f(): return g()")));

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(diff, List.of(), context(provider));

        assertTrue(run.skipped());
        assertEquals(0, provider.calls());
    }

    @Test
    void replyBecomesInterpretiveEvents() {
        var provider = ScriptedProvider.replying(
                "model",
                """
                Here is my analysis:
                ```json
                [{"event_type": "business_logic_change", "node_id": "func:price", "confidence": 0.9,
                  "description": "Members now get a 10% discount", "reasoning": "new branch on is_member",
                  "impact": "Lower totals for members"}]
                ```
                """);

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(substantialChange(), List.of(), context(provider));

        assertEquals(1, provider.calls());
        assertEquals(
                List.of(
                        GateState.IDLE,
                        GateState.GATE_CHECK,
                        GateState.INVOKE,
                        GateState.CALLING,
                        GateState.SUCCESS,
                        GateState.PARSE_RESPONSE,
                        GateState.EMIT,
                        GateState.IDLE),
                run.trail());
        assertEquals(1, run.events().size());
        var event = run.events().get(0);
        assertEquals(EventType.BUSINESS_LOGIC_CHANGE, event.eventType());
        assertEquals(Layer.INTERPRETIVE, event.layer());
        assertEquals("func:price", event.nodeId());
        assertEquals(0.9, event.confidence(), 1e-9);
        assertEquals("Lower totals for members", event.impact());
        assertTrue(provider.prompts().get(0).contains("pkg/module.py"));
    }

    @Test
    void unparseableReplyIsDiscarded() {
        var provider = ScriptedProvider.replying("model", "I could not find anything noteworthy.");
        var context = context(provider);

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(substantialChange(), List.of(), context);

        assertTrue(run.events().isEmpty());
        assertTrue(run.trail().contains(GateState.DISCARD));
        assertEquals(1, context.counters().discardedReplies());
    }

    @Test
    void providerErrorDegradesToNoEvents() {
        var provider = new ScriptedProvider("model", List.of(ScriptedProvider.fail(false)));

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(substantialChange(), List.of(), context(provider));

        assertTrue(run.events().isEmpty());
        assertTrue(run.trail().contains(GateState.ERROR));
    }

    @Test
    void providerTimeoutDegradesToNoEvents() {
        var provider = new ScriptedProvider("model", List.of(ScriptedProvider.hang(5_000)));

        var run = new InterpretiveLayer(ALWAYS_INTERESTING).interpret(substantialChange(), List.of(), context(provider));

        assertTrue(run.events().isEmpty());
        assertTrue(run.trail().contains(GateState.TIMEOUT));
    }

    @Test
    void cancelledRunEndsInCancelledStateWithoutCalling() {
        var provider = ScriptedProvider.replying("model", "[]");
        var base = context(provider);
        var cancelled = CancellationSignal.create();
        cancelled.cancel();
        var context = new AnalysisContext(base.config(), chain, cancelled, base.counters());
        var layer = new InterpretiveLayer(ALWAYS_INTERESTING);

        var run = layer.interpret(substantialChange(), List.of(), context);

        assertTrue(run.cancelled());
        assertEquals(
                List.of(
                        GateState.IDLE,
                        GateState.GATE_CHECK,
                        GateState.INVOKE,
                        GateState.CALLING,
                        GateState.CANCELLED,
                        GateState.IDLE),
                run.trail());
        assertEquals(0, provider.calls());
        assertThrows(
                AnalysisCancelledException.class, () -> layer.classify(substantialChange(), List.of(), context));
    }

    @Test
    void spentBudgetSkipsBeforeCalling() throws InterruptedException {
        var provider = ScriptedProvider.replying("model", "[]");
        var budget = new CallBudget(1, 1);
        budget.acquire().orElseThrow().close();

        var run = new InterpretiveLayer(ALWAYS_INTERESTING)
                .interpret(substantialChange(), List.of(), context(provider, budget));

        assertTrue(run.skipped());
        assertEquals("call budget spent", run.skipReason());
        assertEquals(0, provider.calls());
    }

    @Test
    void gateInputTakesTheLargerSide() {
        var input = InterpretiveLayer.gateInput(substantialChange(), List.of());

        assertEquals(5, input.lineCount());
        assertEquals(AFTER.length(), input.byteSize());
        assertEquals(0, input.lowerLayerEventCount());
    }

    @Test
    void standardScorerWeighsEventsAndDecorators() {
        var score = ComplexityScorer.standard().score(new GateInput(100, 2000, 3, 1, 1));

        assertEquals(10 + 2 + 6 + 1 + 2, score, 1e-9);
    }
}
