package ai.svcs.semantic.layers;

import ai.svcs.analyzer.ControlFlowKind;
import ai.svcs.analyzer.Histogram;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.NodePair;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/** Layer 3: control flow, generators, returns, exception handling, calls and scope of a changed node. */
public final class SemanticLayer extends PairRuleLayer {

    private static final List<PairRule.Named> RULES = List.of(
            PairRule.named("control-flow", SemanticLayer::controlFlow),
            PairRule.named("yield", SemanticLayer::yields),
            PairRule.named("return", SemanticLayer::returns),
            PairRule.named("exceptions", SemanticLayer::exceptionHandling),
            PairRule.named("calls", SemanticLayer::calls),
            PairRule.named("comprehensions", SemanticLayer::comprehensions),
            PairRule.named("lambdas", SemanticLayer::lambdas),
            PairRule.named("scope", SemanticLayer::scope),
            PairRule.named("await", SemanticLayer::awaits));

    @Override
    public Layer layer() {
        return Layer.SEMANTIC;
    }

    @Override
    protected List<PairRule.Named> rules(AnalysisContext context) {
        return RULES;
    }

    static void controlFlow(NodePair pair, EventCollector out) {
        var before = pair.featuresBefore().controlFlow();
        var after = pair.featuresAfter().controlFlow();
        if (before.equals(after)) {
            return;
        }
        var countsBefore = countByKind(before);
        var countsAfter = countByKind(after);
        var changes = new ArrayList<String>();
        for (var kind : ControlFlowKind.values()) {
            int b = countsBefore.getOrDefault(kind, 0);
            int a = countsAfter.getOrDefault(kind, 0);
            if (a != b) {
                changes.add(kind.name().toLowerCase(Locale.ROOT) + " count changed from " + b + " to " + a);
            }
        }
        if (changes.isEmpty()) {
            changes.add("control flow reordered");
        }
        out.emit(EventType.CONTROL_FLOW_CHANGED, String.join("; ", changes));
    }

    private static Map<ControlFlowKind, Integer> countByKind(List<ControlFlowKind> kinds) {
        var counts = new EnumMap<ControlFlowKind, Integer>(ControlFlowKind.class);
        kinds.forEach(k -> counts.merge(k, 1, Integer::sum));
        return counts;
    }

    static void yields(NodePair pair, EventCollector out) {
        int before = pair.featuresBefore().yieldCount();
        int after = pair.featuresAfter().yieldCount();
        if (before == after) {
            return;
        }
        if (before == 0) {
            out.emit(
                    EventType.FUNCTION_MADE_GENERATOR,
                    "Function converted to generator with " + after + " yield statements");
        } else if (after == 0) {
            out.emit(EventType.GENERATOR_MADE_FUNCTION, "Generator converted to regular function");
        } else {
            out.emit(EventType.YIELD_PATTERN_CHANGED, "Yield statements changed from " + before + " to " + after);
        }
    }

    static void returns(NodePair pair, EventCollector out) {
        int before = pair.featuresBefore().returnCount();
        int after = pair.featuresAfter().returnCount();
        if (before != after) {
            out.emit(EventType.RETURN_PATTERN_CHANGED, "Return statements changed from " + before + " to " + after);
        }
    }

    static void exceptionHandling(NodePair pair, EventCollector out) {
        var fb = pair.featuresBefore();
        var fa = pair.featuresAfter();
        boolean handledBefore = fb.hasExceptionHandling();
        boolean handledAfter = fa.hasExceptionHandling();
        var added = minus(fa.caughtTypes(), fb.caughtTypes());
        var removed = minus(fb.caughtTypes(), fa.caughtTypes());

        if (!handledBefore && handledAfter) {
            var suffix = added.isEmpty() ? "" : " for: " + join(added);
            out.emit(EventType.EXCEPTION_HANDLING_ADDED, "Exception handling added" + suffix);
            out.emit(EventType.ERROR_HANDLING_INTRODUCED, "Error handling introduced" + suffix);
        } else if (handledBefore && !handledAfter) {
            out.emit(EventType.EXCEPTION_HANDLING_REMOVED, "Exception handling completely removed");
            out.emit(EventType.ERROR_HANDLING_REMOVED, "Error handling completely removed");
        } else if (!added.isEmpty() || !removed.isEmpty()) {
            var details = new StringBuilder("Exception handling changed");
            if (!added.isEmpty()) {
                details.append(", added: ").append(join(added));
            }
            if (!removed.isEmpty()) {
                details.append(", removed: ").append(join(removed));
            }
            out.emit(EventType.EXCEPTION_HANDLING_CHANGED, details.toString());
        } else if (handledAfter && fb.tryCount() != fa.tryCount()) {
            out.emit(
                    EventType.EXCEPTION_HANDLING_CHANGED,
                    "Exception handling changed, try blocks " + fb.tryCount() + " -> " + fa.tryCount());
        }
    }

    static void calls(NodePair pair, EventCollector out) {
        var before = pair.featuresBefore().calls();
        var after = pair.featuresAfter().calls();
        var added = minus(after, before);
        var removed = minus(before, after);
        if (!added.isEmpty()) {
            out.emit(EventType.INTERNAL_CALL_ADDED, "Now calls: " + join(added));
        }
        if (!removed.isEmpty()) {
            out.emit(EventType.INTERNAL_CALL_REMOVED, "No longer calls: " + join(removed));
        }
    }

    static void comprehensions(NodePair pair, EventCollector out) {
        Histogram before = pair.featuresBefore().comprehensions();
        Histogram after = pair.featuresAfter().comprehensions();
        if (before.equals(after)) {
            return;
        }
        var kinds = new TreeSet<>(before.counts().keySet());
        kinds.addAll(after.counts().keySet());
        var changes = new ArrayList<String>();
        for (var kind : kinds) {
            int b = before.count(kind);
            int a = after.count(kind);
            if (a != b) {
                changes.add(kind + " comprehensions: " + b + "→" + a);
            }
        }
        out.emit(EventType.COMPREHENSION_USAGE_CHANGED, String.join("; ", changes));
    }

    static void lambdas(NodePair pair, EventCollector out) {
        int before = pair.featuresBefore().lambdaCount();
        int after = pair.featuresAfter().lambdaCount();
        if (before != after) {
            out.emit(EventType.LAMBDA_USAGE_CHANGED, "Lambda functions changed from " + before + " to " + after);
        }
    }

    static void scope(NodePair pair, EventCollector out) {
        var globalsBefore = pair.featuresBefore().globals();
        var globalsAfter = pair.featuresAfter().globals();
        if (!globalsBefore.equals(globalsAfter)) {
            out.emit(
                    EventType.GLOBAL_SCOPE_CHANGED,
                    "Global statements changed: " + globalsBefore + " → " + globalsAfter);
        }
        var nonlocalsBefore = pair.featuresBefore().nonlocals();
        var nonlocalsAfter = pair.featuresAfter().nonlocals();
        if (!nonlocalsBefore.equals(nonlocalsAfter)) {
            out.emit(
                    EventType.NONLOCAL_SCOPE_CHANGED,
                    "Nonlocal statements changed: " + nonlocalsBefore + " → " + nonlocalsAfter);
        }
    }

    static void awaits(NodePair pair, EventCollector out) {
        int before = pair.featuresBefore().awaitCount();
        int after = pair.featuresAfter().awaitCount();
        if (before != after) {
            out.emit(EventType.AWAIT_USAGE_CHANGED, "Await expressions changed from " + before + " to " + after);
        }
    }

    static SortedSet<String> minus(SortedSet<String> left, SortedSet<String> right) {
        var result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }
}
