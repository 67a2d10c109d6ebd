package ai.svcs.semantic.patterns;

import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Async conversion of functions and newly imported threading or async libraries. */
final class ConcurrencyRule implements PatternRule {
    private static final Pattern CONCURRENCY_MODULE = Pattern.compile(
            "(?i).*(thread|asyncio|concurrent|multiprocessing|worker_threads|trio|gevent|parallel|swoole|amphp|reactphp).*");
    private static final Pattern CONCURRENT_CODE = Pattern.compile(
            "\\b(async|await|Thread|ThreadPoolExecutor|ProcessPoolExecutor|Promise\\.all|gather|create_task|Worker|Lock)\\b");

    @Override
    public String name() {
        return "concurrency";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        for (var event : input.events(EventType.FUNCTION_MADE_ASYNC)) {
            var node = input.diff().nodeAfter(event.nodeId());
            if (node.isEmpty()) {
                continue;
            }
            var pair = input.diff().changes().common().get(event.nodeId());
            boolean awaits = pair != null && pair.featuresAfter().awaitCount() > pair.featuresBefore().awaitCount();
            matches.add(new PatternMatch(
                    EventType.CONCURRENCY_INTRODUCTION,
                    event.nodeId(),
                    event.location(),
                    "Asynchronous programming introduced in " + node.get().name(),
                    "Concurrency and responsiveness improvement",
                    List.of(Signal.of("function made async", 2, true), Signal.of("await expressions added", 1, awaits))));
        }

        var modules = new TreeSet<String>();
        for (var dependency : input.after().dependencies()) {
            if (!input.before().dependencies().contains(dependency)
                    && CONCURRENCY_MODULE.matcher(dependency).matches()) {
                modules.add(dependency);
            }
        }
        if (!modules.isEmpty()) {
            boolean used = PatternInput.count(CONCURRENT_CODE, input.after().canonicalText())
                    > PatternInput.count(CONCURRENT_CODE, input.before().canonicalText());
            matches.add(new PatternMatch(
                    EventType.CONCURRENCY_INTRODUCTION,
                    input.moduleId(),
                    input.path(),
                    "Concurrency library imported: " + String.join(", ", modules),
                    "Parallel or asynchronous processing capability added",
                    List.of(
                            Signal.of("concurrency module imported", 2, true),
                            Signal.of("concurrent constructs used", 1, used))));
        }
        return matches;
    }
}
