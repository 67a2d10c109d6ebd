package ai.svcs.analyzer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeSet;

/** Last-resort stage: the whole file as a single {@code module:<path>} node. */
public final class OpaqueStrategy implements ParseStrategy {
    private final SourceLanguage language;

    public OpaqueStrategy(SourceLanguage language) {
        this.language = language;
    }

    @Override
    public ParseStage stage() {
        return ParseStage.OPAQUE;
    }

    @Override
    public ParseOutcome attempt(String path, SourceContent source) {
        return ParseOutcome.parsed(build(path, source));
    }

    NodeTree build(String path, SourceContent source) {
        var text = source.text();
        var canonical = TokenText.collapseWhitespace(text);
        int lines = Math.max(1, source.lineCount());
        var node = new SemanticNode(
                NodeKind.MODULE.idFor(path),
                NodeKind.MODULE,
                path,
                canonical,
                new SourceSpan(1, lines, 0, source.byteLength()),
                null,
                NodeFeatures.none());
        var nodes = new LinkedHashMap<String, SemanticNode>();
        nodes.put(node.id(), node);
        return new NodeTree(
                path,
                language,
                ParseStage.OPAQUE,
                nodes,
                new TreeSet<>(),
                0,
                0,
                source.lineCount(),
                source.byteLength(),
                text,
                canonical,
                canonical,
                List.of());
    }
}
