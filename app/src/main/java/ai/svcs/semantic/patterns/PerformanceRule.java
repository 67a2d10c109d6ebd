package ai.svcs.semantic.patterns;

import ai.svcs.analyzer.ControlFlowKind;
import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.analyzer.UsageKind;
import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Caching decorators and loop nesting depth changes. */
final class PerformanceRule implements PatternRule {
    private static final Pattern CACHE_DECORATOR =
            Pattern.compile("(?i).*(lru_cache|\\bcache\\b|cached_property|cached|memoize|memoized|Cacheable).*");
    private static final Pattern CACHE_NAME = Pattern.compile("(?i)\\b\\w*(cache|memo)\\w*\\b");

    @Override
    public String name() {
        return "performance";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        for (var pair : input.candidates()) {
            var fb = pair.featuresBefore();
            var fa = pair.featuresAfter();

            boolean cacheBefore = fb.decorators().stream().anyMatch(d -> CACHE_DECORATOR.matcher(d).matches());
            boolean cacheAfter = fa.decorators().stream().anyMatch(d -> CACHE_DECORATOR.matcher(d).matches());
            boolean cacheNamesAdded = PatternInput.count(CACHE_NAME, pair.textAfter().toLowerCase(Locale.ROOT))
                    > PatternInput.count(CACHE_NAME, pair.textBefore().toLowerCase(Locale.ROOT));
            if (cacheAfter && !cacheBefore) {
                matches.add(new PatternMatch(
                        EventType.PERFORMANCE_IMPROVEMENT,
                        pair.id(),
                        input.location(pair.after()),
                        "Caching mechanism implemented",
                        "Repeated calls are served from a cache",
                        List.of(
                                Signal.of("cache decorator added", 2, true),
                                Signal.of("cache identifiers introduced", 1, cacheNamesAdded))));
            }

            int depthBefore = fb.maxLoopDepth();
            int depthAfter = fa.maxLoopDepth();
            if (depthAfter < depthBefore) {
                matches.add(new PatternMatch(
                        EventType.PERFORMANCE_IMPROVEMENT,
                        pair.id(),
                        input.location(pair.after()),
                        "Loop nesting reduced from depth " + depthBefore + " to " + depthAfter,
                        "Lower asymptotic cost",
                        List.of(
                                Signal.of("loop nesting depth decreased", 2, true),
                                Signal.of("fewer loops", 1, loops(fa) < loops(fb)),
                                Signal.of("lookup structure introduced", 1, lookups(fa) > lookups(fb)))));
            } else if (depthAfter > depthBefore && depthAfter >= 2) {
                matches.add(new PatternMatch(
                        EventType.PERFORMANCE_REGRESSION,
                        pair.id(),
                        input.location(pair.after()),
                        "Loop nesting increased from depth " + depthBefore + " to " + depthAfter,
                        "Higher asymptotic cost",
                        List.of(
                                Signal.of("loop nesting depth increased", 2, true),
                                Signal.of("more loops", 1, loops(fa) > loops(fb)),
                                Signal.of("complexity increased", 1, fa.complexity() > fb.complexity()))));
            }
        }
        return matches;
    }

    /** Subscript accesses plus set and dict comprehensions. */
    private static int lookups(NodeFeatures features) {
        return features.usage(UsageKind.SUBSCRIPT_ACCESS).total()
                + features.comprehensions().count("set")
                + features.comprehensions().count("dict");
    }

    private static long loops(NodeFeatures features) {
        return features.controlFlow().stream().filter(k -> k == ControlFlowKind.LOOP).count();
    }
}
