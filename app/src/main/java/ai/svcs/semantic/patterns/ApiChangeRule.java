package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.Parameter;
import ai.svcs.analyzer.SemanticNode;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.NodePair;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Breaking and additive changes to public functions, methods and classes. */
final class ApiChangeRule implements PatternRule {

    @Override
    public String name() {
        return "api";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        var addedNames = input.addedNodes().stream().map(SemanticNode::name).toList();

        for (var removed : input.removedNodes()) {
            if (!isApi(removed) || !removed.isPublic()) {
                continue;
            }
            matches.add(new PatternMatch(
                    EventType.API_BREAKING_CHANGE,
                    removed.id(),
                    input.location(removed),
                    "Public " + removed.kind().prefix() + " " + removed.qualifiedName() + " removed",
                    "Callers of " + removed.name() + " will break",
                    List.of(
                            Signal.of("public declaration removed", 2, true),
                            Signal.of("no replacement with the same name", 1, !addedNames.contains(removed.name())))));
        }

        for (var pair : input.candidates()) {
            var node = pair.after();
            if (!node.kind().isCallable()
                    || !node.isPublic()
                    || !input.has(EventType.SIGNATURE_CHANGED, pair.id())) {
                continue;
            }
            var incompatibility = incompatibility(pair);
            if (incompatibility != null) {
                matches.add(new PatternMatch(
                        EventType.API_BREAKING_CHANGE,
                        pair.id(),
                        input.location(node),
                        "Function " + node.name() + " " + incompatibility,
                        "Potential breaking change for callers",
                        List.of(
                                Signal.of("signature changed", 1, true),
                                Signal.of(incompatibility, 2, true))));
            } else {
                matches.add(new PatternMatch(
                        EventType.API_ENHANCEMENT,
                        pair.id(),
                        input.location(node),
                        "Function " + node.name() + " gained optional parameters",
                        "Backward-compatible extension",
                        List.of(
                                Signal.of("existing parameters preserved", 2, true),
                                Signal.of(
                                        "optional parameters added",
                                        2,
                                        pair.featuresAfter().parameters().size()
                                                > pair.featuresBefore().parameters().size()))));
            }
        }

        for (var added : input.addedNodes()) {
            if (!isApi(added) || !added.isPublic() || !parentExisted(input, added)) {
                continue;
            }
            matches.add(new PatternMatch(
                    EventType.API_ENHANCEMENT,
                    added.id(),
                    input.location(added),
                    "Public " + added.kind().prefix() + " " + added.qualifiedName() + " added",
                    "New capability for callers",
                    List.of(
                            Signal.of("public declaration added", 1, true),
                            Signal.of("added to an existing file", 2, input.diff().existedBefore()))));
        }
        return matches;
    }

    /** Members of a brand-new class are reported once, through the class itself. */
    private static boolean parentExisted(PatternInput input, SemanticNode node) {
        var parent = node.parentId();
        return parent == null || input.diff().changes().common().containsKey(parent);
    }

    private static boolean isApi(SemanticNode node) {
        return node.kind().isCallable() || node.kind() == NodeKind.CLASS;
    }

    /**
     * Describes why old call sites no longer fit the new parameter list, or returns null when every old call still
     * binds: same leading names in order and every new parameter optional.
     */
    static @Nullable String incompatibility(NodePair pair) {
        var before = pair.featuresBefore().parameters();
        var after = pair.featuresAfter().parameters();
        for (int i = 0; i < before.size(); i++) {
            var old = before.get(i);
            if (i >= after.size()) {
                return "parameter " + old.name() + " removed";
            }
            var now = after.get(i);
            if (!old.name().equals(now.name()) || old.kind() != now.kind()) {
                return "parameter " + old.name() + " renamed or reordered";
            }
            if (old.hasDefault() && !now.hasDefault()) {
                return "parameter " + old.name() + " became required";
            }
        }
        for (int i = before.size(); i < after.size(); i++) {
            var added = after.get(i);
            if (!added.hasDefault() && added.kind() != Parameter.Kind.VARIADIC
                    && added.kind() != Parameter.Kind.VARIADIC_KEYWORD) {
                return "required parameter " + added.name() + " added";
            }
        }
        return null;
    }
}
