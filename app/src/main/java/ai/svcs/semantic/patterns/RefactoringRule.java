package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.SemanticNode;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.NodePair;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Extract-method and inline-method refactorings, inferred from new or vanished callees of changed callers. */
final class RefactoringRule implements PatternRule {

    @Override
    public String name() {
        return "refactoring";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        for (var added : input.addedNodes()) {
            if (!added.kind().isCallable()) {
                continue;
            }
            var caller = firstCaller(input, added, true);
            matches.add(new PatternMatch(
                    EventType.REFACTORING_EXTRACT_METHOD,
                    added.id(),
                    input.location(added),
                    "Possible method extraction: " + added.name(),
                    "Code organization improvement",
                    List.of(
                            Signal.of("new function " + added.name(), 1, true),
                            Signal.of(
                                    caller.map(c -> c.id() + " now calls it").orElse("an existing function now calls it"),
                                    2,
                                    caller.isPresent()),
                            Signal.of(
                                    "caller body shrank",
                                    1,
                                    caller.filter(RefactoringRule::shrank).isPresent()))));
        }
        for (var removed : input.removedNodes()) {
            if (!removed.kind().isCallable()) {
                continue;
            }
            var caller = firstCaller(input, removed, false);
            matches.add(new PatternMatch(
                    EventType.REFACTORING_INLINE_METHOD,
                    removed.id(),
                    input.location(removed),
                    "Possible method inlining: " + removed.name(),
                    "Code simplification",
                    List.of(
                            Signal.of("function " + removed.name() + " removed", 1, true),
                            Signal.of(
                                    caller.map(c -> c.id() + " no longer calls it")
                                            .orElse("a former caller no longer calls it"),
                                    2,
                                    caller.isPresent()),
                            Signal.of("caller body grew", 1, caller.filter(RefactoringRule::grew).isPresent()))));
        }
        return matches;
    }

    /** A changed node that starts calling (or stops calling) {@code callee}. */
    private static Optional<NodePair> firstCaller(PatternInput input, SemanticNode callee, boolean starts) {
        for (var pair : input.candidates()) {
            boolean before = PatternInput.calls(pair.before(), callee.name());
            boolean after = PatternInput.calls(pair.after(), callee.name());
            if (starts ? (!before && after) : (before && !after)) {
                return Optional.of(pair);
            }
        }
        return Optional.empty();
    }

    private static boolean shrank(NodePair pair) {
        return pair.after().span().lineCount() < pair.before().span().lineCount()
                || pair.textAfter().length() < pair.textBefore().length();
    }

    private static boolean grew(NodePair pair) {
        return pair.after().span().lineCount() > pair.before().span().lineCount()
                || pair.textAfter().length() > pair.textBefore().length();
    }
}
