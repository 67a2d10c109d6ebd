package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.ControlFlowKind;
import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Loops rewritten as comprehensions or functional calls, and list membership tests replaced by sets or maps. */
final class OptimizationRule implements PatternRule {
    private static final Pattern LIST_MEMBERSHIP = Pattern.compile("\\bin\\s*\\[");
    private static final Pattern HASHED_MEMBERSHIP = Pattern.compile("\\bin\\s*(\\{|set\\(|frozenset\\()");
    private static final Pattern SET_CONSTRUCTION = Pattern.compile("\\b(set|frozenset|dict|Set|Map)\\s*\\(|new\\s+(Set|Map)\\b");

    @Override
    public String name() {
        return "optimization";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        for (var pair : input.candidates()) {
            var fb = pair.featuresBefore();
            var fa = pair.featuresAfter();
            int loopsBefore = loops(fb);
            int loopsAfter = loops(fa);
            if (loopsAfter < loopsBefore) {
                matches.add(new PatternMatch(
                        EventType.OPTIMIZATION_ALGORITHM,
                        pair.id(),
                        input.location(pair.after()),
                        "Loop converted to comprehension or functional call",
                        "Performance and readability improvement",
                        List.of(
                                Signal.of("loops " + loopsBefore + " -> " + loopsAfter, 2, true),
                                Signal.of(
                                        "comprehensions increased",
                                        2,
                                        fa.comprehensions().total() > fb.comprehensions().total()
                                                || fa.functionalCalls() > fb.functionalCalls()),
                                Signal.of("same return behaviour", 1, fa.returnCount() == fb.returnCount()))));
            }

            var textBefore = pair.textBefore();
            var textAfter = pair.textAfter();
            int listBefore = PatternInput.count(LIST_MEMBERSHIP, textBefore);
            int listAfter = PatternInput.count(LIST_MEMBERSHIP, textAfter);
            if (listAfter < listBefore) {
                matches.add(new PatternMatch(
                        EventType.OPTIMIZATION_DATA_STRUCTURE,
                        pair.id(),
                        input.location(pair.after()),
                        "List membership check replaced with set/dict",
                        "Constant-time lookup instead of a linear scan",
                        List.of(
                                Signal.of("list membership tests removed", 2, true),
                                Signal.of(
                                        "hashed membership tests added",
                                        2,
                                        PatternInput.count(HASHED_MEMBERSHIP, textAfter)
                                                > PatternInput.count(HASHED_MEMBERSHIP, textBefore)),
                                Signal.of(
                                        "set or map constructed",
                                        1,
                                        PatternInput.count(SET_CONSTRUCTION, textAfter)
                                                > PatternInput.count(SET_CONSTRUCTION, textBefore)))));
            }
        }
        return matches;
    }

    private static int loops(NodeFeatures features) {
        return (int) features.controlFlow().stream().filter(k -> k == ControlFlowKind.LOOP).count();
    }
}
