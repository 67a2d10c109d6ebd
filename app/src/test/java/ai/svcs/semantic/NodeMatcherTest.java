package ai.svcs.semantic;

import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class NodeMatcherTest {

    @Test
    void partitionsIdsIntoAddedRemovedAndCommon() {
        var before = tree(function("keep", "def keep(): pass"), function("gone", "def gone(): pass"));
        var after = tree(function("keep", "def keep(): return 1"), function("fresh", "def fresh(): pass"));

        var changes = NodeMatcher.diff(before, after);

        assertEquals(List.of("func:fresh"), List.copyOf(changes.added()));
        assertEquals(List.of("func:gone"), List.copyOf(changes.removed()));
        assertEquals(List.of("func:keep"), List.copyOf(changes.common().keySet()));
        changes.verifyPartition(before.ids(), after.ids());
    }

    @Test
    void unchangedPairsAreNotCandidates() {
        var before = tree(function("a", "def a(): pass"), function("b", "def b(): pass"));
        var after = tree(function("a", "def a(): pass"), function("b", "def b(): return 2"));

        var candidates = NodeMatcher.diff(before, after).candidates();

        assertEquals(1, candidates.size());
        assertEquals("func:b", candidates.get(0).id());
    }

    @Test
    void identicalTreesGiveEmptyChangeSet() {
        var before = tree(function("a", "def a(): pass"));
        var after = tree(function("a", "def a(): pass"));

        assertTrue(NodeMatcher.diff(before, after).isEmpty());
    }

    @Test
    void candidatesComeOutInIdOrder() {
        var before = tree(function("z", "def z(): pass"), function("m", "def m(): pass"), function("a", "def a(): pass"));
        var after = tree(function("a", "def a(): 1"), function("z", "def z(): 1"), function("m", "def m(): 1"));

        var ids = NodeMatcher.diff(before, after).candidates().stream()
                .map(NodePair::id)
                .toList();

        assertEquals(List.of("func:a", "func:m", "func:z"), ids);
    }

    @Test
    void verifyPartitionRejectsOverlap() {
        var a = function("a", "def a(): pass");
        var changes = new ChangeSet(
                new TreeSet<>(List.of("func:a")),
                new TreeSet<>(),
                new TreeMap<>(Map.of("func:a", new NodePair(a, a))));

        var ids = new TreeSet<>(List.of("func:a"));
        assertThrows(IllegalStateException.class, () -> changes.verifyPartition(ids, ids));
    }

    @Test
    void verifyPartitionRejectsMissingIds() {
        var changes = ChangeSet.empty();

        assertThrows(
                IllegalStateException.class,
                () -> changes.verifyPartition(new TreeSet<>(List.of("func:a")), new TreeSet<>()));
    }

    @Test
    void pairRejectsMismatchedIds() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new NodePair(function("a", "def a(): pass"), function("b", "def b(): pass")));
    }
}
