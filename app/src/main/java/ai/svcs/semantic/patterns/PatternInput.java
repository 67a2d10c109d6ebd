package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.NodeTree;
import ai.svcs.analyzer.SemanticNode;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.NodePair;
import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import java.util.regex.Pattern;

/** What a pattern rule may look at: the file diff and the events of layers 1-4. */
public record PatternInput(FileDiff diff, List<SemanticEvent> prior) {

    public PatternInput {
        prior = List.copyOf(prior);
    }

    public String path() {
        return diff.path();
    }

    public String moduleId() {
        return "module:" + diff.path();
    }

    public NodeTree before() {
        return diff.before();
    }

    public NodeTree after() {
        return diff.after();
    }

    public List<SemanticEvent> events(EventType type) {
        return prior.stream().filter(e -> e.eventType() == type).toList();
    }

    public boolean has(EventType type, String nodeId) {
        return prior.stream().anyMatch(e -> e.eventType() == type && e.nodeId().equals(nodeId));
    }

    public List<NodePair> candidates() {
        return diff.candidates();
    }

    /** Nodes present only in the new version, in id order. */
    public List<SemanticNode> addedNodes() {
        return diff.isOpaque()
                ? List.of()
                : diff.changes().added().stream().map(id -> after().nodes().get(id)).toList();
    }

    public List<SemanticNode> removedNodes() {
        return diff.isOpaque()
                ? List.of()
                : diff.changes().removed().stream().map(id -> before().nodes().get(id)).toList();
    }

    public String location(SemanticNode node) {
        return diff.location(node);
    }

    /** Whether any call target ends with {@code name} as its last member segment. */
    static boolean calls(SemanticNode node, String name) {
        return node.features().calls().stream().anyMatch(target -> simpleName(target).equals(name));
    }

    static String simpleName(String target) {
        int start = Math.max(target.lastIndexOf('.') + 1, 0);
        int arrow = target.lastIndexOf("->");
        if (arrow >= 0) {
            start = Math.max(start, arrow + 2);
        }
        int scope = target.lastIndexOf("::");
        if (scope >= 0) {
            start = Math.max(start, scope + 2);
        }
        return target.substring(start);
    }

    static int count(Pattern pattern, String text) {
        var m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    static long countKind(NodeTree tree, NodeKind kind) {
        return tree.nodes().values().stream().filter(n -> n.kind() == kind).count();
    }
}
