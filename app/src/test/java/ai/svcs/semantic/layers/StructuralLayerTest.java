package ai.svcs.semantic.layers;

import static ai.svcs.semantic.TestTrees.PATH;
import static ai.svcs.semantic.TestTrees.absent;
import static ai.svcs.semantic.TestTrees.context;
import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.modified;
import static ai.svcs.semantic.TestTrees.opaque;
import static ai.svcs.semantic.TestTrees.tree;
import static ai.svcs.semantic.TestTrees.types;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StructuralLayerTest {
    private final StructuralLayer layer = new StructuralLayer();

    @Test
    void newFunctionIsTheOnlyEvent() {
        var before = tree(function("load", "def load(): pass"));
        var after = tree(function("load", "def load(): pass"), function("save", "def save(): pass"));

        var events = layer.classify(modified(before, after), List.of(), context());

        assertEquals(1, events.size());
        var event = events.get(0);
        assertEquals(EventType.NODE_ADDED, event.eventType());
        assertEquals("func:save", event.nodeId());
        assertEquals(PATH + ":1", event.location());
        assertEquals("New func added", event.details());
        assertEquals(Layer.STRUCTURAL, event.layer());
        assertEquals(1.0, event.confidence());
    }

    @Test
    void removedNodesAreReported() {
        var before = tree(function("a", "def a(): pass"), function("b", "def b(): pass"));
        var after = tree(function("a", "def a(): pass"));

        var events = layer.classify(modified(before, after), List.of(), context());

        assertEquals(List.of(EventType.NODE_REMOVED), types(events));
        assertEquals("func:b", events.get(0).nodeId());
        assertEquals("func removed", events.get(0).details());
    }

    @Test
    void addedFileEmitsFileAddedAndItsNodes() {
        var after = tree(Set.of("os"), function("main", "def main(): pass"));

        var events = layer.classify(FileDiff.of(absent(), after, false, true), List.of(), context());

        assertEquals(
                List.of(EventType.FILE_ADDED, EventType.DEPENDENCY_ADDED, EventType.NODE_ADDED), types(events));
        assertEquals("file:" + PATH, events.get(0).nodeId());
        assertEquals("New file created", events.get(0).details());
        assertEquals("module:" + PATH, events.get(1).nodeId());
        assertEquals("Added dependencies: os", events.get(1).details());
    }

    @Test
    void deletedFileEmitsFileRemoved() {
        var before = tree(function("main", "def main(): pass"));

        var events = layer.classify(FileDiff.of(before, absent(), true, false), List.of(), context());

        assertEquals(List.of(EventType.FILE_REMOVED, EventType.NODE_REMOVED), types(events));
        assertEquals("File deleted", events.get(0).details());
    }

    @Test
    void dependencyChangesAreSortedAndSplit() {
        var before = tree(Set.of("os", "sys"));
        var after = tree(Set.of("sys", "json", "asyncio"));

        var events = layer.classify(modified(before, after), List.of(), context());

        assertEquals(List.of(EventType.DEPENDENCY_ADDED, EventType.DEPENDENCY_REMOVED), types(events));
        assertEquals("Added dependencies: asyncio, json", events.get(0).details());
        assertEquals("Removed dependencies: os", events.get(1).details());
    }

    @Test
    void opaqueSideReportsWholeFileContentChange() {
        var before = tree(function("a", "def a(): pass"));
        var after = opaque("def a(: broken");

        var events = layer.classify(modified(before, after), List.of(), context());

        assertEquals(List.of(EventType.FILE_CONTENT_CHANGED), types(events));
        assertEquals("module:" + PATH, events.get(0).nodeId());
        assertEquals("File content changed (before: primary, after: opaque)", events.get(0).details());
    }

    @Test
    void identicalOpaqueContentIsSilent() {
        var events = layer.classify(modified(opaque("x = `1`"), opaque("x = `1`")), List.of(), context());

        assertTrue(events.isEmpty());
    }
}
