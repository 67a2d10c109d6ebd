package ai.svcs.semantic.layers;

import static ai.svcs.semantic.TestTrees.context;
import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.modified;
import static ai.svcs.semantic.TestTrees.tree;
import static ai.svcs.semantic.TestTrees.types;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.analyzer.ControlFlowKind;
import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticLayerTest {
    private final SemanticLayer layer = new SemanticLayer();

    private List<SemanticEvent> classify(NodeFeatures before, NodeFeatures after) {
        return layer.classify(
                modified(tree(function("f", "before", before)), tree(function("f", "after", after))),
                List.of(),
                context());
    }

    @Test
    void removingTryExceptReportsOnlyRemovals() {
        var before = NodeFeatures.builder()
                .controlFlow(ControlFlowKind.TRY)
                .tryStatement()
                .caughtType("ValueError")
                .returnStatement(true)
                .build();
        var after = NodeFeatures.builder().returnStatement(true).build();

        var events = classify(before, after);

        assertEquals(
                List.of(
                        EventType.CONTROL_FLOW_CHANGED,
                        EventType.EXCEPTION_HANDLING_REMOVED,
                        EventType.ERROR_HANDLING_REMOVED),
                types(events));
        assertEquals("try count changed from 1 to 0", events.get(0).details());
        assertEquals("Exception handling completely removed", events.get(1).details());
    }

    @Test
    void addingHandlingNamesTheCaughtTypes() {
        var after = NodeFeatures.builder()
                .tryStatement()
                .caughtType("KeyError")
                .caughtType("ValueError")
                .build();

        var events = classify(NodeFeatures.none(), after);

        assertEquals(List.of(EventType.EXCEPTION_HANDLING_ADDED, EventType.ERROR_HANDLING_INTRODUCED), types(events));
        assertEquals("Exception handling added for: KeyError, ValueError", events.get(0).details());
    }

    @Test
    void changedCaughtTypes() {
        var before = NodeFeatures.builder().tryStatement().caughtType("Exception").build();
        var after = NodeFeatures.builder().tryStatement().caughtType("IOError").build();

        var events = classify(before, after);

        assertEquals(List.of(EventType.EXCEPTION_HANDLING_CHANGED), types(events));
        assertEquals("Exception handling changed, added: IOError, removed: Exception", events.get(0).details());
    }

    @Test
    void generatorTransitions() {
        var generator = NodeFeatures.builder().yieldExpression().yieldExpression().build();

        var events = classify(NodeFeatures.none(), generator);
        assertEquals(List.of(EventType.FUNCTION_MADE_GENERATOR), types(events));
        assertEquals("Function converted to generator with 2 yield statements", events.get(0).details());

        assertEquals(List.of(EventType.GENERATOR_MADE_FUNCTION), types(classify(generator, NodeFeatures.none())));
    }

    @Test
    void callsAddedAndRemoved() {
        var before = NodeFeatures.builder().call("print").call("self.helper").build();
        var after = NodeFeatures.builder().call("self.helper").call("logger.info").build();

        var events = classify(before, after);

        assertEquals(List.of(EventType.INTERNAL_CALL_ADDED, EventType.INTERNAL_CALL_REMOVED), types(events));
        assertEquals("Now calls: logger.info", events.get(0).details());
        assertEquals("No longer calls: print", events.get(1).details());
    }

    @Test
    void comprehensionLambdaAndAwaitCounts() {
        var before = NodeFeatures.builder().comprehension("list").build();
        var after = NodeFeatures.builder()
                .comprehension("generator")
                .lambda()
                .awaitExpression()
                .build();

        var events = classify(before, after);

        assertEquals(
                List.of(
                        EventType.COMPREHENSION_USAGE_CHANGED,
                        EventType.LAMBDA_USAGE_CHANGED,
                        EventType.AWAIT_USAGE_CHANGED),
                types(events));
        assertEquals("generator comprehensions: 0→1; list comprehensions: 1→0", events.get(0).details());
    }

    @Test
    void reorderedControlFlowWithSameCounts() {
        var before = NodeFeatures.builder()
                .controlFlow(ControlFlowKind.LOOP)
                .controlFlow(ControlFlowKind.CONDITIONAL)
                .build();
        var after = NodeFeatures.builder()
                .controlFlow(ControlFlowKind.CONDITIONAL)
                .controlFlow(ControlFlowKind.LOOP)
                .build();

        var events = classify(before, after);

        assertEquals(List.of(EventType.CONTROL_FLOW_CHANGED), types(events));
        assertEquals("control flow reordered", events.get(0).details());
    }

    @Test
    void globalDeclarations() {
        var events = classify(NodeFeatures.none(), NodeFeatures.builder().global("counter").build());

        assertEquals(List.of(EventType.GLOBAL_SCOPE_CHANGED), types(events));
        assertEquals("Global statements changed: [] → [counter]", events.get(0).details());
    }

    @Test
    void sameFeaturesProduceNothing() {
        var features = NodeFeatures.builder().call("print").returnStatement(true).build();
        assertTrue(classify(features, features).isEmpty());
    }
}
