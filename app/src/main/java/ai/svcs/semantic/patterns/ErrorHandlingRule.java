package ai.svcs.semantic.patterns;

import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Exception handling that was added or extended with specific exception types. */
final class ErrorHandlingRule implements PatternRule {
    private static final Set<String> GENERIC_TYPES =
            Set.of("*", "Exception", "BaseException", "Throwable", "Error", "\\Exception", "\\Throwable");

    @Override
    public String name() {
        return "error-handling";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        var nodes = new TreeSet<String>();
        input.events(EventType.EXCEPTION_HANDLING_ADDED).forEach(e -> nodes.add(e.nodeId()));
        input.events(EventType.EXCEPTION_HANDLING_CHANGED).forEach(e -> nodes.add(e.nodeId()));
        for (var id : nodes) {
            var pair = input.diff().changes().common().get(id);
            if (pair == null) {
                continue;
            }
            var fb = pair.featuresBefore();
            var fa = pair.featuresAfter();
            var newTypes = new TreeSet<>(fa.caughtTypes());
            newTypes.removeAll(fb.caughtTypes());
            boolean extended = !newTypes.isEmpty() || fa.tryCount() > fb.tryCount();
            if (!extended) {
                continue;
            }
            boolean specific = newTypes.stream().anyMatch(t -> !GENERIC_TYPES.contains(t));
            boolean reported = fa.raiseCount() > fb.raiseCount()
                    || fa.calls().stream()
                            .map(PatternInput::simpleName)
                            .anyMatch(c -> c.matches("(?i)(log\\w*|warn\\w*|error|exception|critical)"));
            matches.add(new PatternMatch(
                    EventType.ERROR_HANDLING_IMPROVEMENT,
                    id,
                    input.location(pair.after()),
                    newTypes.isEmpty()
                            ? "Error handling extended"
                            : "Error handling improved for: " + String.join(", ", newTypes),
                    "Failures are handled instead of propagating unchecked",
                    List.of(
                            Signal.of("exception handling added or extended", 2, true),
                            Signal.of("specific exception types caught", 1, specific),
                            Signal.of("errors logged or re-raised", 1, reported))));
        }
        return matches;
    }
}
