package ai.svcs.semantic.layers;

import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.ClassificationLayer;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/** Layer 1: file existence, node set arithmetic and file-scope dependencies. */
public final class StructuralLayer implements ClassificationLayer {

    @Override
    public Layer layer() {
        return Layer.STRUCTURAL;
    }

    @Override
    public List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
        var path = diff.path();
        var events = new ArrayList<SemanticEvent>();
        var fileId = "file:" + path;
        var moduleId = "module:" + path;

        if (!diff.existedBefore() && diff.existsAfter()) {
            events.add(SemanticEvent.rule(EventType.FILE_ADDED, fileId, path, "New file created"));
        } else if (diff.existedBefore() && !diff.existsAfter()) {
            events.add(SemanticEvent.rule(EventType.FILE_REMOVED, fileId, path, "File deleted"));
        }

        var added = new TreeSet<>(diff.after().dependencies());
        added.removeAll(diff.before().dependencies());
        var removed = new TreeSet<>(diff.before().dependencies());
        removed.removeAll(diff.after().dependencies());
        if (!added.isEmpty()) {
            events.add(SemanticEvent.rule(
                    EventType.DEPENDENCY_ADDED, moduleId, path, "Added dependencies: " + String.join(", ", added)));
        }
        if (!removed.isEmpty()) {
            events.add(SemanticEvent.rule(
                    EventType.DEPENDENCY_REMOVED,
                    moduleId,
                    path,
                    "Removed dependencies: " + String.join(", ", removed)));
        }

        if (diff.isOpaque()) {
            // node sets of a blob are not comparable; only whole-file content is
            if (diff.existedBefore()
                    && diff.existsAfter()
                    && !diff.before().canonicalText().equals(diff.after().canonicalText())) {
                var stages = "before: " + diff.before().stage().name().toLowerCase(Locale.ROOT)
                        + ", after: " + diff.after().stage().name().toLowerCase(Locale.ROOT);
                events.add(SemanticEvent.rule(
                        EventType.FILE_CONTENT_CHANGED, moduleId, path, "File content changed (" + stages + ")"));
            }
            return events;
        }

        var changes = diff.changes();
        for (var id : changes.added()) {
            var node = diff.after().nodes().get(id);
            events.add(SemanticEvent.rule(
                    EventType.NODE_ADDED, id, diff.location(node), "New " + node.kind().prefix() + " added"));
        }
        for (var id : changes.removed()) {
            var node = diff.before().nodes().get(id);
            events.add(SemanticEvent.rule(
                    EventType.NODE_REMOVED, id, diff.location(node), node.kind().prefix() + " removed"));
        }
        return events;
    }
}
