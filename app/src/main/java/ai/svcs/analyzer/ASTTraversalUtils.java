package ai.svcs.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers shared by the tree-sitter adapters. */
public final class ASTTraversalUtils {
    public static final String ERROR_NODE = "ERROR";

    private ASTTraversalUtils() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Direct children, skipping null handles. */
    public static List<TSNode> children(TSNode node) {
        var result = new ArrayList<TSNode>(node.getChildCount());
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** First named child whose type is in {@code types}, or null. */
    public static @Nullable TSNode firstNamedChildOfType(TSNode node, Set<String> types) {
        for (var child : namedChildren(node)) {
            if (types.contains(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Recursively finds all nodes matching the predicate, not descending below a match. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllInternal(@Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }
        if (predicate.test(node)) {
            results.add(node);
            return;
        }
        for (var child : children(node)) {
            findAllInternal(child, predicate, results);
        }
    }

    /** Text of a node, trimmed. Absent nodes give the empty string. */
    public static String extractNodeText(@Nullable TSNode node, SourceContent sourceContent) {
        if (!isPresent(node)) {
            return "";
        }
        return sourceContent.substringFromBytes(node.getStartByte(), node.getEndByte()).trim();
    }

    /** Text of a node with every whitespace run collapsed to one space. */
    public static String compactText(@Nullable TSNode node, SourceContent sourceContent) {
        return extractNodeText(node, sourceContent).replaceAll("\\s+", " ");
    }

    /** Number of source bytes covered by ERROR or missing nodes. Missing nodes count as one byte. */
    public static int errorBytes(TSNode node) {
        if (ERROR_NODE.equals(node.getType())) {
            return Math.max(1, node.getEndByte() - node.getStartByte());
        }
        if (node.isMissing()) {
            return 1;
        }
        if (!node.hasError()) {
            return 0;
        }
        int total = 0;
        for (var child : children(node)) {
            total += errorBytes(child);
        }
        return total;
    }

    public static SourceSpan span(TSNode node) {
        int startLine = node.getStartPoint().getRow() + 1;
        int endLine = Math.max(startLine, node.getEndPoint().getRow() + 1);
        return new SourceSpan(startLine, endLine, node.getStartByte(), node.getEndByte());
    }
}
