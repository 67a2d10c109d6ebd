package ai.svcs.semantic.layers;

import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.Parameter;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.NodePair;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** Layer 2: declaration-level changes of a node that exists in both versions. */
public final class SyntacticLayer extends PairRuleLayer {

    private static final List<PairRule.Named> RULES = List.of(
            PairRule.named("signature", SyntacticLayer::signature),
            PairRule.named("decorators", SyntacticLayer::decorators),
            PairRule.named("async", SyntacticLayer::async),
            PairRule.named("inheritance", SyntacticLayer::inheritance),
            PairRule.named("defaults", SyntacticLayer::defaults),
            PairRule.named("return-type", SyntacticLayer::returnType),
            PairRule.named("annotations", SyntacticLayer::annotations),
            PairRule.named("visibility", SyntacticLayer::visibility),
            PairRule.named("static", SyntacticLayer::staticModifier));

    @Override
    public Layer layer() {
        return Layer.SYNTACTIC;
    }

    @Override
    protected List<PairRule.Named> rules(AnalysisContext context) {
        return RULES;
    }

    static void signature(NodePair pair, EventCollector out) {
        if (!pair.after().kind().isCallable()) {
            return;
        }
        var before = pair.featuresBefore().parameters();
        var after = pair.featuresAfter().parameters();
        if (before.equals(after)) {
            return;
        }
        var details = new StringBuilder("Signature changed from ")
                .append(render(before))
                .append(" to ")
                .append(render(after));
        if (before.size() != after.size()) {
            details.append("; arity ").append(before.size()).append(" -> ").append(after.size());
        }
        var defaultsBefore = pair.featuresBefore().defaultedParameterNames();
        var defaultsAfter = pair.featuresAfter().defaultedParameterNames();
        var addedDefaults = new TreeSet<>(defaultsAfter);
        addedDefaults.removeAll(defaultsBefore);
        var removedDefaults = new TreeSet<>(defaultsBefore);
        removedDefaults.removeAll(defaultsAfter);
        if (!addedDefaults.isEmpty()) {
            details.append("; defaults added: ").append(join(addedDefaults));
        }
        if (!removedDefaults.isEmpty()) {
            details.append("; defaults removed: ").append(join(removedDefaults));
        }
        out.emit(EventType.SIGNATURE_CHANGED, details.toString());
    }

    static void decorators(NodePair pair, EventCollector out) {
        var before = new TreeSet<>(pair.featuresBefore().decorators());
        var after = new TreeSet<>(pair.featuresAfter().decorators());
        var added = new TreeSet<>(after);
        added.removeAll(before);
        var removed = new TreeSet<>(before);
        removed.removeAll(after);
        if (!added.isEmpty()) {
            out.emit(EventType.DECORATOR_ADDED, "Added decorators: " + join(added));
        }
        if (!removed.isEmpty()) {
            out.emit(EventType.DECORATOR_REMOVED, "Removed decorators: " + join(removed));
        }
    }

    static void async(NodePair pair, EventCollector out) {
        boolean before = pair.featuresBefore().async();
        boolean after = pair.featuresAfter().async();
        if (!before && after) {
            out.emit(EventType.FUNCTION_MADE_ASYNC, "Function converted to async");
        } else if (before && !after) {
            out.emit(EventType.FUNCTION_MADE_SYNC, "Function converted from async to sync");
        }
    }

    static void inheritance(NodePair pair, EventCollector out) {
        if (pair.after().kind() != NodeKind.CLASS) {
            return;
        }
        var before = pair.featuresBefore().baseTypes();
        var after = pair.featuresAfter().baseTypes();
        if (!before.equals(after)) {
            out.emit(EventType.INHERITANCE_CHANGED, "Base classes changed from " + before + " to " + after);
        }
    }

    static void defaults(NodePair pair, EventCollector out) {
        if (!pair.after().kind().isCallable()) {
            return;
        }
        var before = pair.featuresBefore().defaultedParameterNames();
        var after = pair.featuresAfter().defaultedParameterNames();
        var added = new TreeSet<>(after);
        added.removeAll(before);
        var removed = new TreeSet<>(before);
        removed.removeAll(after);
        if (!added.isEmpty()) {
            out.emit(EventType.DEFAULT_PARAMETERS_ADDED, "Default values added for: " + join(added));
        }
        if (!removed.isEmpty()) {
            out.emit(EventType.DEFAULT_PARAMETERS_REMOVED, "Default values removed for: " + join(removed));
        }
    }

    static void returnType(NodePair pair, EventCollector out) {
        var before = pair.featuresBefore().returnType();
        var after = pair.featuresAfter().returnType();
        if (before != null && after != null && !before.equals(after)) {
            out.emit(EventType.RETURN_TYPE_CHANGED, "Return type changed from " + before + " to " + after);
        }
    }

    static void annotations(NodePair pair, EventCollector out) {
        var before = annotated(pair.featuresBefore());
        var after = annotated(pair.featuresAfter());
        var added = new ArrayList<String>();
        var removed = new ArrayList<String>();
        for (var name : after) {
            if (!before.contains(name)) {
                added.add(name);
            }
        }
        for (var name : before) {
            if (!after.contains(name)) {
                removed.add(name);
            }
        }
        if (!added.isEmpty()) {
            out.emit(EventType.TYPE_ANNOTATIONS_INTRODUCED, "Type annotations added for: " + join(added));
        }
        if (!removed.isEmpty()) {
            out.emit(EventType.TYPE_ANNOTATIONS_REMOVED, "Type annotations removed for: " + join(removed));
        }
    }

    /** Names of annotated parameters, plus {@code return} for an annotated return type. */
    private static TreeSet<String> annotated(NodeFeatures features) {
        var names = features.parameters().stream()
                .filter(Parameter::isAnnotated)
                .map(Parameter::name)
                .collect(Collectors.toCollection(TreeSet::new));
        if (features.returnType() != null) {
            names.add("return");
        }
        return names;
    }

    static void visibility(NodePair pair, EventCollector out) {
        var before = effectiveVisibility(pair.featuresBefore().visibility());
        var after = effectiveVisibility(pair.featuresAfter().visibility());
        if (!before.equals(after)) {
            out.emit(EventType.VISIBILITY_CHANGED, "Visibility changed from " + before + " to " + after);
        }
    }

    private static String effectiveVisibility(@Nullable String visibility) {
        return Objects.requireNonNullElse(visibility, "public");
    }

    static void staticModifier(NodePair pair, EventCollector out) {
        boolean before = pair.featuresBefore().isStatic();
        boolean after = pair.featuresAfter().isStatic();
        if (before != after) {
            out.emit(EventType.STATIC_MODIFIER_CHANGED, after ? "Member made static" : "Member no longer static");
        }
    }

    private static String render(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::render).collect(Collectors.joining(", ", "(", ")"));
    }
}
