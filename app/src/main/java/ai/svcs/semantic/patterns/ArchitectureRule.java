package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeKind;
import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/** Broad structural churn: inheritance rewired, many dependencies swapped, classes added or removed. */
final class ArchitectureRule implements PatternRule {
    private static final int DEPENDENCY_CHURN = 3;
    private static final int CLASS_CHURN = 2;

    @Override
    public String name() {
        return "architecture";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        if (!input.diff().existedBefore() || !input.diff().existsAfter()) {
            return List.of();
        }
        int inheritance = input.events(EventType.INHERITANCE_CHANGED).size();

        var deps = new TreeSet<>(input.after().dependencies());
        deps.removeAll(input.before().dependencies());
        int dependencyChurn = deps.size();
        var dropped = new TreeSet<>(input.before().dependencies());
        dropped.removeAll(input.after().dependencies());
        dependencyChurn += dropped.size();

        long classChurn = input.addedNodes().stream().filter(n -> n.kind() == NodeKind.CLASS).count()
                + input.removedNodes().stream().filter(n -> n.kind() == NodeKind.CLASS).count();

        var signals = List.of(
                Signal.of("inheritance changed on " + inheritance + " classes", 1, inheritance > 0),
                Signal.of(dependencyChurn + " dependencies changed", 1, dependencyChurn >= DEPENDENCY_CHURN),
                Signal.of(classChurn + " classes added or removed", 1, classChurn >= CLASS_CHURN));
        if (signals.stream().noneMatch(Signal::present)) {
            return List.of();
        }
        var details = new ArrayList<String>();
        signals.stream().filter(Signal::present).forEach(s -> details.add(s.description()));
        return List.of(new PatternMatch(
                EventType.ARCHITECTURE_CHANGE,
                input.moduleId(),
                input.path(),
                "Architecture changed: " + String.join(", ", details),
                "Module structure and coupling changed",
                signals));
    }
}
