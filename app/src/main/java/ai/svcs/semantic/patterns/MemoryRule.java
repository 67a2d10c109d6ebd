package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeKind;
import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Generators replacing materialized lists, and {@code __slots__} declarations. */
final class MemoryRule implements PatternRule {
    private static final Set<String> AGGREGATES = Set.of("sum", "any", "all", "max", "min", "join", "sorted", "tuple");

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        for (var pair : input.candidates()) {
            var fb = pair.featuresBefore();
            var fa = pair.featuresAfter();
            var location = input.location(pair.after());

            if (!fb.isGenerator() && fa.isGenerator()) {
                boolean listDropped = fa.comprehensions().count("list") < fb.comprehensions().count("list")
                        || PatternInput.calls(pair.before(), "append") && !PatternInput.calls(pair.after(), "append");
                matches.add(new PatternMatch(
                        EventType.MEMORY_OPTIMIZATION,
                        pair.id(),
                        location,
                        "Function converted to a lazy generator",
                        "Results are produced on demand instead of held in memory",
                        List.of(
                                Signal.of("function now yields", 2, true),
                                Signal.of("no longer builds a list", 1, listDropped))));
            }

            if (fa.comprehensions().count("generator") > fb.comprehensions().count("generator")
                    && fa.comprehensions().count("list") < fb.comprehensions().count("list")) {
                boolean aggregated = fa.calls().stream().map(PatternInput::simpleName).anyMatch(AGGREGATES::contains);
                matches.add(new PatternMatch(
                        EventType.MEMORY_OPTIMIZATION,
                        pair.id(),
                        location,
                        "List comprehension replaced with generator expression",
                        "Intermediate list no longer materialized",
                        List.of(
                                Signal.of("generator expression replaces list comprehension", 2, true),
                                Signal.of("consumed by an aggregate call", 1, aggregated))));
            }

            if (pair.after().kind() == NodeKind.CLASS
                    && fa.classAttributes().contains("__slots__")
                    && !fb.classAttributes().contains("__slots__")) {
                matches.add(new PatternMatch(
                        EventType.MEMORY_OPTIMIZATION,
                        pair.id(),
                        location,
                        "__slots__ declared on " + pair.after().name(),
                        "Smaller instances without a per-object dict",
                        List.of(Signal.of("__slots__ added", 2, true))));
            }
        }
        return matches;
    }
}
