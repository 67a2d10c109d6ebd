package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.NodeKind;
import ai.svcs.analyzer.NodeTree;
import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Singleton and observer implementations appearing in, or disappearing from, the file's classes. */
final class DesignPatternRule implements PatternRule {
    private static final Set<String> SINGLETON_METHODS = Set.of("__new__", "getinstance", "get_instance", "instance");
    private static final Pattern INSTANCE_FIELD = Pattern.compile("^_{0,2}instance$|^shared$|^default$");
    private static final Pattern OBSERVER_METHOD =
            Pattern.compile("^(notify\\w*|subscribe|unsubscribe|attach|detach|observe|add_?listener|remove_?listener|on)$");
    private static final Pattern OBSERVER_FIELD = Pattern.compile("^_{0,2}(observers|listeners|subscribers|handlers)$");

    @Override
    public String name() {
        return "design-pattern";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        var before = Members.of(input.before());
        var after = Members.of(input.after());
        long functionsBefore = input.before().nodes().values().stream()
                .filter(n -> n.kind().isCallable())
                .count();
        long functionsAfter = input.after().nodes().values().stream()
                .filter(n -> n.kind().isCallable())
                .count();

        boolean singletonBefore = before.hasMethod(SINGLETON_METHODS);
        boolean singletonAfter = after.hasMethod(SINGLETON_METHODS);
        if (singletonBefore != singletonAfter) {
            var current = singletonAfter ? after : before;
            matches.add(new PatternMatch(
                    singletonAfter ? EventType.DESIGN_PATTERN_IMPLEMENTATION : EventType.DESIGN_PATTERN_REMOVAL,
                    input.moduleId(),
                    input.path(),
                    singletonAfter
                            ? "Singleton pattern implementation detected"
                            : "Singleton pattern removed",
                    singletonAfter ? "Instance creation is now controlled" : "Instances are created freely again",
                    List.of(
                            Signal.of("instance-control method " + (singletonAfter ? "added" : "removed"), 2, true),
                            Signal.of("instance field", 1, current.hasAttribute(INSTANCE_FIELD)))));
        }

        boolean observerBefore = before.hasMethod(OBSERVER_METHOD);
        boolean observerAfter = after.hasMethod(OBSERVER_METHOD);
        if (observerBefore != observerAfter) {
            var current = observerAfter ? after : before;
            matches.add(new PatternMatch(
                    observerAfter ? EventType.DESIGN_PATTERN_IMPLEMENTATION : EventType.DESIGN_PATTERN_REMOVAL,
                    input.moduleId(),
                    input.path(),
                    observerAfter ? "Observer pattern implementation detected" : "Observer pattern removed",
                    observerAfter ? "Improved decoupling and event handling" : "Event dispatch removed",
                    List.of(
                            Signal.of("notify/subscribe methods " + (observerAfter ? "added" : "removed"), 2, true),
                            Signal.of("listener collection field", 1, current.hasAttribute(OBSERVER_FIELD)),
                            Signal.of(
                                    "function count " + (observerAfter ? "increased" : "decreased"),
                                    1,
                                    observerAfter ? functionsAfter > functionsBefore : functionsAfter < functionsBefore))));
        }
        return matches;
    }

    /** Lower-cased member names of every class in a tree. */
    private record Members(Set<String> methods, Set<String> attributes) {

        static Members of(NodeTree tree) {
            var methods = new TreeSet<String>();
            var attributes = new TreeSet<String>();
            for (var node : tree.nodes().values()) {
                if (node.kind() == NodeKind.CLASS) {
                    node.features().classMethods().forEach(m -> methods.add(m.toLowerCase(Locale.ROOT)));
                    node.features().classAttributes().forEach(a -> attributes.add(a.toLowerCase(Locale.ROOT)));
                }
            }
            return new Members(methods, attributes);
        }

        boolean hasMethod(Set<String> names) {
            return methods.stream().anyMatch(names::contains);
        }

        boolean hasMethod(Pattern pattern) {
            return methods.stream().anyMatch(m -> pattern.matcher(m).matches());
        }

        boolean hasAttribute(Pattern pattern) {
            return attributes.stream().anyMatch(a -> pattern.matcher(a).matches());
        }
    }
}
