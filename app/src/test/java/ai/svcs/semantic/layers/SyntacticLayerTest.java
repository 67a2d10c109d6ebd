package ai.svcs.semantic.layers;

import static ai.svcs.semantic.TestTrees.context;
import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.modified;
import static ai.svcs.semantic.TestTrees.node;
import static ai.svcs.semantic.TestTrees.tree;
import static ai.svcs.semantic.TestTrees.types;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.Parameter;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntacticLayerTest {
    private final SyntacticLayer layer = new SyntacticLayer();

    private List<SemanticEvent> classify(NodeFeatures before, NodeFeatures after) {
        return layer.classify(
                modified(
                        tree(function("f", "def f(a): return a", before)),
                        tree(function("f", "def f(a, b=1): return a + b", after))),
                List.of(),
                context());
    }

    @Test
    void optionalParameterChangesSignatureAndDefaults() {
        var before = NodeFeatures.builder().parameter(Parameter.positional("a")).build();
        var after = NodeFeatures.builder()
                .parameter(Parameter.positional("a"))
                .parameter(new Parameter("b", "1", null, Parameter.Kind.POSITIONAL))
                .build();

        var events = classify(before, after);

        assertEquals(List.of(EventType.SIGNATURE_CHANGED, EventType.DEFAULT_PARAMETERS_ADDED), types(events));
        assertEquals(
                "Signature changed from (a) to (a, b=1); arity 1 -> 2; defaults added: b",
                events.get(0).details());
        assertEquals("Default values added for: b", events.get(1).details());
        assertEquals("func:f", events.get(0).nodeId());
    }

    @Test
    void decoratorsAddedAndRemoved() {
        var before = NodeFeatures.builder().decorator("staticmethod").build();
        var after = NodeFeatures.builder().decorator("lru_cache").decorator("staticmethod").build();

        var events = classify(before, after);

        assertEquals(List.of(EventType.DECORATOR_ADDED), types(events));
        assertEquals("Added decorators: lru_cache", events.get(0).details());
    }

    @Test
    void asyncConversion() {
        var events = classify(NodeFeatures.none(), NodeFeatures.builder().async(true).build());
        assertEquals(List.of(EventType.FUNCTION_MADE_ASYNC), types(events));

        events = classify(NodeFeatures.builder().async(true).build(), NodeFeatures.none());
        assertEquals(List.of(EventType.FUNCTION_MADE_SYNC), types(events));
    }

    @Test
    void returnTypeChangeAlsoNeedsBothSidesAnnotated() {
        var events = classify(
                NodeFeatures.builder().returnType("int").build(),
                NodeFeatures.builder().returnType("str").build());
        assertEquals(List.of(EventType.RETURN_TYPE_CHANGED), types(events));
        assertEquals("Return type changed from int to str", events.get(0).details());

        events = classify(NodeFeatures.none(), NodeFeatures.builder().returnType("str").build());
        assertEquals(List.of(EventType.TYPE_ANNOTATIONS_INTRODUCED), types(events));
        assertEquals("Type annotations added for: return", events.get(0).details());
    }

    @Test
    void inheritanceOnlyForClasses() {
        var before = node(NodeKind.CLASS, "Repo", "class Repo: pass", NodeFeatures.builder().baseType("Base").build());
        var after = node(
                NodeKind.CLASS,
                "Repo",
                "class Repo(Base, Mixin): pass",
                NodeFeatures.builder().baseType("Base").baseType("Mixin").build());

        var events = layer.classify(modified(tree(before), tree(after)), List.of(), context());

        assertEquals(List.of(EventType.INHERITANCE_CHANGED), types(events));
        assertEquals("Base classes changed from [Base] to [Base, Mixin]", events.get(0).details());
        assertEquals("class:Repo", events.get(0).nodeId());
    }

    @Test
    void visibilityAndStaticModifiers() {
        var before = node(NodeKind.METHOD, "Repo.find", "function find() {}", NodeFeatures.none());
        var after = node(
                NodeKind.METHOD,
                "Repo.find",
                "private static function find() {}",
                NodeFeatures.builder().visibility("private").isStatic(true).build());

        var events = layer.classify(modified(tree(before), tree(after)), List.of(), context());

        assertEquals(List.of(EventType.VISIBILITY_CHANGED, EventType.STATIC_MODIFIER_CHANGED), types(events));
        assertEquals("Visibility changed from public to private", events.get(0).details());
        assertEquals("Member made static", events.get(1).details());
    }

    @Test
    void bodyOnlyChangeIsSilent() {
        var features = NodeFeatures.builder().parameter(Parameter.positional("a")).build();
        assertTrue(classify(features, features).isEmpty());
    }
}
