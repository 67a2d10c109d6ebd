package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeTree;
import ai.svcs.semantic.EventType;
import java.util.List;

/** File-wide complexity moving by at least a fifth in either direction. */
final class ComplexityRule implements PatternRule {
    private static final double SIGNIFICANT = 0.2;
    private static final int MIN_DELTA = 2;

    @Override
    public String name() {
        return "complexity";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        if (input.diff().isOpaque() || !input.diff().existedBefore() || !input.diff().existsAfter()) {
            return List.of();
        }
        int before = estimate(input.before());
        int after = estimate(input.after());
        int linesBefore = input.before().lineCount();
        int linesAfter = input.after().lineCount();
        if (before - after >= MIN_DELTA && after < before * (1 - SIGNIFICANT)) {
            return List.of(new PatternMatch(
                    EventType.CODE_SIMPLIFICATION,
                    input.moduleId(),
                    input.path(),
                    "Code complexity significantly reduced from " + before + " to " + after,
                    "Maintainability improvement",
                    List.of(
                            Signal.of("complexity reduced by more than 20%", 2, true),
                            Signal.of("fewer lines", 1, linesAfter < linesBefore))));
        }
        if (after - before >= MIN_DELTA && after > before * (1 + SIGNIFICANT)) {
            return List.of(new PatternMatch(
                    EventType.CODE_COMPLICATION,
                    input.moduleId(),
                    input.path(),
                    "Code complexity significantly increased from " + before + " to " + after,
                    "Potential maintainability concern",
                    List.of(
                            Signal.of("complexity increased by more than 20%", 2, true),
                            Signal.of("more lines", 1, linesAfter > linesBefore))));
        }
        return List.of();
    }

    /** Decision points, control-flow constructs, lambdas and declarations across the whole file. */
    static int estimate(NodeTree tree) {
        int total = 0;
        for (var node : tree.nodes().values()) {
            var f = node.features();
            total += f.decisionPoints() + f.controlFlow().size() + f.lambdaCount() + 1;
        }
        return total;
    }
}
