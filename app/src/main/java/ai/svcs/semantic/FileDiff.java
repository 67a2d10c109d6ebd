package ai.svcs.semantic;

import ai.svcs.analyzer.NodeTree;
import ai.svcs.analyzer.SemanticNode;
import java.util.List;
import java.util.Optional;

/**
 * Everything the classification layers see for one file: both parsed versions and their node partition.
 *
 * @param existedBefore false when the file is new in this change
 * @param existsAfter false when the file is deleted in this change
 */
public record FileDiff(
        String path, NodeTree before, NodeTree after, ChangeSet changes, boolean existedBefore, boolean existsAfter) {

    public static FileDiff of(NodeTree before, NodeTree after, boolean existedBefore, boolean existsAfter) {
        return new FileDiff(
                after.path(), before, after, NodeMatcher.diff(before, after), existedBefore, existsAfter);
    }

    /** Either version fell back to the whole-file blob, so node-level comparison is meaningless. */
    public boolean isOpaque() {
        return before.isOpaque() || after.isOpaque();
    }

    /** Pairs for layers 2-4; none when either side is opaque. */
    public List<NodePair> candidates() {
        return isOpaque() ? List.of() : changes.candidates();
    }

    public Optional<SemanticNode> nodeBefore(String id) {
        return before.node(id);
    }

    public Optional<SemanticNode> nodeAfter(String id) {
        return after.node(id);
    }

    public String location(SemanticNode node) {
        return node.span().location(path);
    }
}
