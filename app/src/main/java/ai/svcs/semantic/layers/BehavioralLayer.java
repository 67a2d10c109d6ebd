package ai.svcs.semantic.layers;

import ai.svcs.analyzer.Histogram;
import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.NodeTree;
import ai.svcs.analyzer.UsageKind;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.NodePair;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Layer 4: usage histograms, counts, complexity and functional style of a changed node. Histogram changes are
 * reported only when their L1 distance exceeds the configured tolerance.
 */
public final class BehavioralLayer extends PairRuleLayer {

    private static final Map<UsageKind, EventType> USAGE_EVENTS = new EnumMap<>(UsageKind.class);

    static {
        USAGE_EVENTS.put(UsageKind.BINARY_OPERATOR, EventType.BINARY_OPERATOR_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.UNARY_OPERATOR, EventType.UNARY_OPERATOR_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.COMPARISON_OPERATOR, EventType.COMPARISON_OPERATOR_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.LOGICAL_OPERATOR, EventType.LOGICAL_OPERATOR_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.STRING_LITERAL, EventType.STRING_LITERAL_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.NUMERIC_LITERAL, EventType.NUMERIC_LITERAL_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.BOOLEAN_LITERAL, EventType.BOOLEAN_LITERAL_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.NONE_LITERAL, EventType.NONE_LITERAL_USAGE_CHANGED);
        USAGE_EVENTS.put(UsageKind.ATTRIBUTE_ACCESS, EventType.ATTRIBUTE_ACCESS_CHANGED);
        USAGE_EVENTS.put(UsageKind.SUBSCRIPT_ACCESS, EventType.SUBSCRIPT_ACCESS_CHANGED);
        USAGE_EVENTS.put(UsageKind.ASSIGNMENT, EventType.ASSIGNMENT_PATTERN_CHANGED);
        USAGE_EVENTS.put(UsageKind.AUGMENTED_ASSIGNMENT, EventType.AUGMENTED_ASSIGNMENT_CHANGED);
    }

    @Override
    public Layer layer() {
        return Layer.BEHAVIORAL;
    }

    @Override
    protected List<PairRule.Named> rules(AnalysisContext context) {
        int tolerance = context.config().behaviorTolerance();
        int threshold = context.config().complexityThreshold();
        var rules = new ArrayList<PairRule.Named>();
        rules.add(PairRule.named("complexity", (pair, out) -> complexity(pair, out, threshold)));
        rules.add(PairRule.named("functional", BehavioralLayer::functional));
        for (var kind : UsageKind.values()) {
            rules.add(PairRule.named(
                    "usage-" + kind.name().toLowerCase(Locale.ROOT),
                    (pair, out) -> usage(pair, out, kind, tolerance)));
        }
        rules.add(PairRule.named("counts", BehavioralLayer::counts));
        rules.add(PairRule.named("class-members", BehavioralLayer::classMembers));
        return rules;
    }

    static void complexity(NodePair pair, EventCollector out, int threshold) {
        int before = pair.featuresBefore().complexity();
        int after = pair.featuresAfter().complexity();
        if (Math.abs(after - before) > threshold) {
            var direction = after > before ? "increased" : "decreased";
            out.emit(
                    EventType.FUNCTION_COMPLEXITY_CHANGED,
                    "Function complexity " + direction + " from " + before + " to " + after);
        }
    }

    static void functional(NodePair pair, EventCollector out) {
        int before = pair.featuresBefore().functionalScore();
        int after = pair.featuresAfter().functionalScore();
        functionalTransition(before, after, "").ifPresent(e -> out.emit(e.type(), e.details()));
    }

    static void usage(NodePair pair, EventCollector out, UsageKind kind, int tolerance) {
        var before = pair.featuresBefore().usage(kind);
        var after = pair.featuresAfter().usage(kind);
        if (before.distance(after) <= tolerance) {
            return;
        }
        out.emit(USAGE_EVENTS.get(kind), describe(kind, before, after));
    }

    static String describe(UsageKind kind, Histogram before, Histogram after) {
        var keys = new TreeSet<>(before.counts().keySet());
        keys.addAll(after.counts().keySet());
        var added = new ArrayList<String>();
        var removed = new ArrayList<String>();
        var changed = new ArrayList<String>();
        for (var key : keys) {
            int b = before.count(key);
            int a = after.count(key);
            if (b == 0) {
                added.add(key);
            } else if (a == 0) {
                removed.add(key);
            } else if (a != b) {
                changed.add(key + " " + b + "→" + a);
            }
        }
        var parts = new ArrayList<String>();
        switch (kind) {
            case STRING_LITERAL, NUMERIC_LITERAL -> {
                if (!added.isEmpty()) {
                    parts.add("added " + added.size() + " new literals");
                }
                if (!removed.isEmpty()) {
                    parts.add("removed " + removed.size() + " literals");
                }
                if (!changed.isEmpty()) {
                    parts.add("changed usage of " + changed.size() + " literals");
                }
            }
            case BOOLEAN_LITERAL, NONE_LITERAL -> {
                for (var key : keys) {
                    int delta = after.count(key) - before.count(key);
                    if (delta > 0) {
                        parts.add("added " + delta + " " + key);
                    } else if (delta < 0) {
                        parts.add("removed " + (-delta) + " " + key);
                    }
                }
            }
            default -> {
                if (!added.isEmpty()) {
                    parts.add("added " + join(added));
                }
                if (!removed.isEmpty()) {
                    parts.add("removed " + join(removed));
                }
                if (!changed.isEmpty()) {
                    parts.add("count changed " + join(changed));
                }
            }
        }
        return String.join("; ", parts);
    }

    static void counts(NodePair pair, EventCollector out) {
        var fb = pair.featuresBefore();
        var fa = pair.featuresAfter();
        if (fb.assertCount() != fa.assertCount()) {
            out.emit(
                    EventType.ASSERTION_USAGE_CHANGED,
                    "Assert statements changed from " + fb.assertCount() + " to " + fa.assertCount());
        }
        if (fb.starredCount() != fa.starredCount()) {
            out.emit(
                    EventType.STARRED_EXPRESSION_USAGE_CHANGED,
                    "Starred expressions changed from " + fb.starredCount() + " to " + fa.starredCount());
        }
        if (fb.sliceCount() != fa.sliceCount()) {
            out.emit(
                    EventType.SLICE_USAGE_CHANGED,
                    "Slice expressions changed from " + fb.sliceCount() + " to " + fa.sliceCount());
        }
    }

    static void classMembers(NodePair pair, EventCollector out) {
        if (pair.after().kind() != NodeKind.CLASS) {
            return;
        }
        var fb = pair.featuresBefore();
        var fa = pair.featuresAfter();
        var addedMethods = SemanticLayer.minus(fa.classMethods(), fb.classMethods());
        var removedMethods = SemanticLayer.minus(fb.classMethods(), fa.classMethods());
        var changes = new ArrayList<String>();
        if (!addedMethods.isEmpty()) {
            changes.add("added methods: " + join(addedMethods));
        }
        if (!removedMethods.isEmpty()) {
            changes.add("removed methods: " + join(removedMethods));
        }
        if (!changes.isEmpty()) {
            out.emit(EventType.CLASS_METHODS_CHANGED, String.join("; ", changes));
        }

        var addedAttributes = SemanticLayer.minus(fa.classAttributes(), fb.classAttributes());
        var removedAttributes = SemanticLayer.minus(fb.classAttributes(), fa.classAttributes());
        changes.clear();
        if (!addedAttributes.isEmpty()) {
            changes.add("added attributes: " + join(addedAttributes));
        }
        if (!removedAttributes.isEmpty()) {
            changes.add("removed attributes: " + join(removedAttributes));
        }
        if (!changes.isEmpty()) {
            out.emit(EventType.CLASS_ATTRIBUTES_CHANGED, String.join("; ", changes));
        }
    }

    @Override
    protected List<SemanticEvent> fileEvents(FileDiff diff, AnalysisContext context) {
        int before = fileFunctionalScore(diff.before());
        int after = fileFunctionalScore(diff.after());
        var moduleId = "module:" + diff.path();
        return functionalTransition(before, after, " at file level")
                .map(e -> List.of(SemanticEvent.rule(e.type(), moduleId, diff.path(), e.details())))
                .orElse(List.of());
    }

    private static int fileFunctionalScore(NodeTree tree) {
        return tree.nodes().values().stream()
                .filter(n -> n.kind().isCallable())
                .mapToInt(n -> n.features().functionalScore())
                .sum();
    }

    private record Transition(EventType type, String details) {}

    private static Optional<Transition> functionalTransition(int before, int after, String suffix) {
        if (before == after) {
            return Optional.empty();
        }
        if (before == 0) {
            return Optional.of(new Transition(
                    EventType.FUNCTIONAL_PROGRAMMING_ADOPTED, "Functional programming patterns introduced" + suffix));
        }
        if (after == 0) {
            return Optional.of(new Transition(
                    EventType.FUNCTIONAL_PROGRAMMING_REMOVED, "Functional programming patterns removed" + suffix));
        }
        var change = after > before ? "increased" : "decreased";
        return Optional.of(new Transition(
                EventType.FUNCTIONAL_PROGRAMMING_CHANGED,
                "Functional programming usage " + change + " from " + before + " to " + after + suffix));
    }
}
