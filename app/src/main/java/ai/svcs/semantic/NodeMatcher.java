package ai.svcs.semantic;

import ai.svcs.analyzer.NodeTree;
import java.util.TreeMap;
import java.util.TreeSet;

/** Pairs the nodes of two versions of a file by id. */
public final class NodeMatcher {

    private NodeMatcher() {}

    public static ChangeSet diff(NodeTree before, NodeTree after) {
        var beforeIds = before.ids();
        var afterIds = after.ids();

        var added = new TreeSet<>(afterIds);
        added.removeAll(beforeIds);
        var removed = new TreeSet<>(beforeIds);
        removed.removeAll(afterIds);

        var common = new TreeMap<String, NodePair>();
        for (var id : beforeIds) {
            if (afterIds.contains(id)) {
                common.put(id, new NodePair(before.nodes().get(id), after.nodes().get(id)));
            }
        }
        return new ChangeSet(added, removed, common);
    }
}
