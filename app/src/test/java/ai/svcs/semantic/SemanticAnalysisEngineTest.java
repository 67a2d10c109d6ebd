package ai.svcs.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.analyzer.FileChange;
import ai.svcs.analyzer.ParseStage;
import ai.svcs.config.ConfigException;
import ai.svcs.config.ConfigLoader;
import ai.svcs.config.EngineConfig;
import ai.svcs.llm.AiProvider;
import ai.svcs.llm.InterpretiveLayer;
import ai.svcs.llm.ScriptedProvider;
import ai.svcs.semantic.layers.BehavioralLayer;
import ai.svcs.semantic.layers.SemanticLayer;
import ai.svcs.semantic.layers.StructuralLayer;
import ai.svcs.semantic.layers.SyntacticLayer;
import ai.svcs.semantic.patterns.PatternRecognizer;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticAnalysisEngineTest {
    private EngineConfig config;
    private SemanticAnalysisEngine engine;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        engine = new SemanticAnalysisEngine(config);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private FileAnalysisResult analyze(String before, String after) {
        return engine.analyzeFile(
                FileChange.modified("pkg/module.py", "python", before, after), AnalysisContext.create(config));
    }

    private static List<EventType> types(FileAnalysisResult result) {
        return result.events().stream().map(SemanticEvent::eventType).toList();
    }

    @Test
    void addedParameterWithDefaultAndNewOperator() {
        var result = analyze(
                """
                def f(a):
                    return a
                """,
                """
                def f(a, b=1):
                    return a + b
                """);

        var types = types(result);
        assertTrue(types.contains(EventType.SIGNATURE_CHANGED), types.toString());
        assertTrue(types.contains(EventType.BINARY_OPERATOR_USAGE_CHANGED), types.toString());
        assertFalse(types.contains(EventType.NODE_ADDED));
        assertFalse(types.contains(EventType.NODE_REMOVED));

        var signature = result.events().stream()
                .filter(e -> e.eventType() == EventType.SIGNATURE_CHANGED)
                .findFirst()
                .orElseThrow();
        assertEquals("func:f", signature.nodeId());
        assertEquals("pkg/module.py:1", signature.location());
        assertTrue(signature.details().contains("arity 1 -> 2"), signature.details());
        assertTrue(signature.details().contains("defaults added: b"), signature.details());
        assertEquals(ParseStage.PRIMARY, result.stageAfter());
        assertFalse(result.partial());
    }

    @Test
    void newTopLevelFunctionIsOneNodeAdded() {
        var result = analyze(
                """
                def f(a):
                    return a
                """,
                """
                def f(a):
                    return a


                def helper(x):
                    return x * 2
                """);

        var added = result.events().stream()
                .filter(e -> e.eventType() == EventType.NODE_ADDED)
                .toList();
        assertEquals(1, added.size());
        assertEquals("func:helper", added.get(0).nodeId());
        assertEquals("pkg/module.py:5", added.get(0).location());
    }

    @Test
    void removingTryExceptReportsRemovedHandling() {
        var result = analyze(
                """
                def load(path):
                    try:
                        return open(path).read()
                    except IOError:
                        return None
                """,
                """
                def load(path):
                    return open(path).read()
                """);

        var types = types(result);
        assertTrue(
                types.contains(EventType.EXCEPTION_HANDLING_REMOVED)
                        || types.contains(EventType.ERROR_HANDLING_REMOVED),
                types.toString());
        assertFalse(types.contains(EventType.EXCEPTION_HANDLING_ADDED));
    }

    @Test
    void legacyPythonFallsBackWithoutThrowing() {
        var result = analyze(
                """
                def show(x):
                    return `x`
                """,
                """
                def show(x, y):
                    return `x` + `y`
                """);

        assertNull(result.error());
        assertNotEquals(ParseStage.PRIMARY, result.stageAfter());
        assertNotEquals(ParseStage.OPAQUE, result.stageAfter());
        assertTrue(types(result).contains(EventType.SIGNATURE_CHANGED), types(result).toString());
    }

    @Test
    void unparseableSourceOnlyReportsContentChange() {
        var context = AnalysisContext.create(config);
        var result = engine.analyzeFile(
                FileChange.modified("pkg/broken.py", "python", "?$?$?$?$\n", "$?$?$?$?$?\n"), context);

        assertEquals(ParseStage.OPAQUE, result.stageBefore());
        assertEquals(ParseStage.OPAQUE, result.stageAfter());
        assertEquals(List.of(EventType.FILE_CONTENT_CHANGED), types(result));
        assertEquals("module:pkg/broken.py", result.events().get(0).nodeId());
        assertEquals(2, context.counters().opaqueParses());
        assertEquals(2, context.counters().parseFallbacks());
    }

    @Test
    void identicalSourcesProduceNoEvents() {
        var source = """
                import os


                class Cache:
                    def get(self, key):
                        if key in self.items:
                            return self.items[key]
                        return None
                """;

        assertTrue(analyze(source, source).events().isEmpty());
    }

    @Test
    void rerunningYieldsTheSameEvents() {
        var before = """
                def total(items):
                    result = 0
                    for item in items:
                        result += item.price
                    return result
                """;
        var after = """
                def total(items, tax=0):
                    return sum(item.price for item in items) * (1 + tax)
                """;

        var first = analyze(before, after);
        var second = analyze(before, after);

        assertFalse(first.events().isEmpty());
        assertEquals(first.events(), second.events());
    }

    @Test
    void deterministicLayersReportFullConfidence() {
        var result = analyze(
                """
                def f(a):
                    if a:
                        return 1
                    return 2
                """,
                """
                def f(a):
                    while a > 3:
                        a -= 1
                    return a
                """);

        for (var event : result.events()) {
            if (event.layer().isDeterministic()) {
                assertEquals(1.0, event.confidence(), event.toString());
            } else {
                assertTrue(event.confidence() >= 0.0 && event.confidence() <= 1.0, event.toString());
            }
        }
    }

    @Test
    void newFileIsReportedWithFileId() {
        var result = engine.analyzeFile(
                FileChange.added("pkg/new.py", "python", "def f():\n    return 1\n"), AnalysisContext.create(config));

        assertEquals(EventType.FILE_ADDED, result.events().get(0).eventType());
        assertEquals("file:pkg/new.py", result.events().get(0).nodeId());
        assertTrue(types(result).contains(EventType.NODE_ADDED));
    }

    @Test
    void unknownLanguageIsSkipped() {
        var result = engine.analyzeFile(
                FileChange.modified("legacy.cbl", "cobol", "MOVE A TO B.", "MOVE B TO A."),
                AnalysisContext.create(config));

        assertTrue(result.events().isEmpty());
        assertFalse(result.partial());
        assertNull(result.stageAfter());
    }

    @Test
    void cancelledContextReturnsPartialResult() {
        var context = AnalysisContext.create(config, List.of(), CancellationSignal.create());
        context.cancellation().cancel();

        var result = engine.analyzeFile(FileChange.modified("a.py", "python", "x = 1\n", "x = 2\n"), context);

        assertTrue(result.partial());
        assertTrue(result.events().isEmpty());
        assertEquals(1, context.counters().filesCancelled());
    }

    @Test
    void batchResultsKeepInputOrder() {
        var changes = List.of(
                FileChange.modified("c.py", "python", "def a():\n    pass\n", "def b():\n    pass\n"),
                FileChange.added("a.js", "javascript", "function main() { return 1; }\n"),
                FileChange.removed("b.php", "php", "<?php\nfunction gone() { return 1; }\n"));
        var context = AnalysisContext.create(config);

        var results = engine.analyze(changes, context);

        assertEquals(List.of("c.py", "a.js", "b.php"), results.stream().map(FileAnalysisResult::filePath).toList());
        assertEquals(EventType.FILE_REMOVED, results.get(2).events().get(0).eventType());
        assertEquals(3, context.counters().filesAnalyzed());
    }

    @Test
    void onlyEnabledLayersRun() {
        var structuralOnly = config.withEnabledLayers(EnumSet.of(Layer.STRUCTURAL));
        try (var narrow = new SemanticAnalysisEngine(structuralOnly)) {
            var result = narrow.analyzeFile(
                    FileChange.modified("a.py", "python", "def f(a):\n    return a\n", "def f(a, b):\n    return b\n"),
                    AnalysisContext.create(structuralOnly));

            assertEquals(List.of(Layer.STRUCTURAL), result.completedLayers());
            assertTrue(result.events().isEmpty());
        }
    }

    @Test
    void contextForAnotherConfigurationIsRejected() {
        var other = ConfigLoader.withOverrides(Map.of("svcs.behavior.tolerance", "3"));

        assertThrows(
                ConfigException.class,
                () -> engine.analyzeFile(
                        FileChange.modified("a.py", "python", "x = 1\n", "x = 2\n"), AnalysisContext.create(other)));
    }

    @Test
    void trivialChangeNeverReachesTheProvider() {
        var provider = ScriptedProvider.replying("stub", "[]");

        try (var context = AnalysisContext.create(config, List.of(provider), CancellationSignal.create())) {
            engine.analyzeFile(
                    FileChange.modified("a.py", "python", "def f(a):\n    return a\n", "def f(a):\n    return a + 1\n"),
                    context);
        }

        assertEquals(0, provider.calls());
    }

    @Test
    void cancellationDuringALayerKeepsEarlierEvents() {
        var signal = CancellationSignal.create();
        ClassificationLayer cancelling = new ClassificationLayer() {
            @Override
            public Layer layer() {
                return Layer.SEMANTIC;
            }

            @Override
            public List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
                context.cancellation().cancel();
                return List.of();
            }
        };
        try (var pipeline =
                new SemanticAnalysisEngine(config, List.of(new StructuralLayer(), cancelling, new SyntacticLayer()))) {
            var context = AnalysisContext.create(config, List.of(), signal);

            var result = pipeline.analyzeFile(
                    FileChange.modified(
                            "a.py", "python", "def f(a):\n    return a\n", "def f(a, b):\n    return a\n\n\ndef g():\n    pass\n"),
                    context);

            assertTrue(result.partial());
            assertEquals(List.of(Layer.STRUCTURAL, Layer.SEMANTIC), result.completedLayers());
            assertEquals(List.of(EventType.NODE_ADDED), types(result));
            assertEquals(1, context.counters().filesCancelled());
        }
    }

    @Test
    void cancellationDuringAProviderCallStopsRetries() {
        var signal = CancellationSignal.create();
        var calls = new AtomicInteger();
        var provider = new AiProvider() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public String complete(String prompt) {
                calls.incrementAndGet();
                signal.cancel();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "[]";
            }
        };
        var layers = List.of(
                new StructuralLayer(),
                new SyntacticLayer(),
                new SemanticLayer(),
                new BehavioralLayer(),
                new PatternRecognizer(),
                new InterpretiveLayer(input -> 100.0));
        try (var pipeline = new SemanticAnalysisEngine(config, layers);
                var context = AnalysisContext.create(config, List.of(provider), signal)) {
            long start = System.nanoTime();
            var result = pipeline.analyzeFile(
                    FileChange.modified(
                            "pkg/price.py",
                            "python",
                            """
                            def price(order):
                                total = 0
                                for line in order.lines:
                                    total += line.amount
                                return total
                            """,
                            """
                            def price(order, discount):
                                total = sum(line.amount for line in order.lines)
                                if order.customer.is_member:
                                    total *= discount
                                return round(total, 2)
                            """),
                    context);
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertTrue(result.partial());
            assertFalse(result.completedLayers().contains(Layer.INTERPRETIVE));
            assertTrue(result.completedLayers().contains(Layer.PATTERN));
            assertTrue(types(result).contains(EventType.SIGNATURE_CHANGED), types(result).toString());
            assertEquals(1, calls.get(), "no retry after cancellation");
            assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + "ms");
            assertEquals(1, context.counters().filesCancelled());
        }
    }
}
