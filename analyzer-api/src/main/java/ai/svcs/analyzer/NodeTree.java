package ai.svcs.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Parse result for one snapshot of a file. Nodes are kept in source order; {@link #ids()} gives the sorted view
 * used wherever output order matters.
 *
 * @param shapeText canonical text with every literal replaced by a placeholder, used to recognize literal-only edits
 * @param failedAttempts the rejections of the stages tried before {@code stage}
 */
public record NodeTree(
        String path,
        SourceLanguage language,
        ParseStage stage,
        Map<String, SemanticNode> nodes,
        SortedSet<String> dependencies,
        int importCount,
        int decoratorCount,
        int lineCount,
        int byteSize,
        String sourceText,
        String canonicalText,
        String shapeText,
        List<ParseError> failedAttempts) {

    public NodeTree {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
        failedAttempts = List.copyOf(failedAttempts);
    }

    /** The tree of a version in which the file does not exist. */
    public static NodeTree absent(String path, SourceLanguage language) {
        return new NodeTree(
                path, language, ParseStage.PRIMARY, Map.of(), new TreeSet<>(), 0, 0, 0, 0, "", "", "", List.of());
    }

    public NodeTree withFailedAttempts(List<ParseError> earlier) {
        var all = new ArrayList<>(earlier);
        all.addAll(failedAttempts);
        return new NodeTree(
                path,
                language,
                stage,
                nodes,
                dependencies,
                importCount,
                decoratorCount,
                lineCount,
                byteSize,
                sourceText,
                canonicalText,
                shapeText,
                all);
    }

    public Optional<SemanticNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public SortedSet<String> ids() {
        return new TreeSet<>(nodes.keySet());
    }

    public boolean isOpaque() {
        return stage.isOpaque();
    }

    public boolean isBlank() {
        return sourceText.isBlank();
    }

    /** Number of lines in a text, counting a trailing partial line; zero for empty text. */
    public static int countLines(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i < text.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
