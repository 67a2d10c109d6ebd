package ai.svcs.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Declaration and body facts extracted from one node by a language adapter. Layers 2-4 compare these between the
 * two versions of a node; they never look at syntax trees directly.
 */
public record NodeFeatures(
        List<Parameter> parameters,
        @Nullable String returnType,
        List<String> decorators,
        boolean async,
        List<String> baseTypes,
        @Nullable String visibility,
        boolean isStatic,
        List<ControlFlowKind> controlFlow,
        int returnCount,
        int valueReturnCount,
        int yieldCount,
        int awaitCount,
        int tryCount,
        int raiseCount,
        SortedSet<String> caughtTypes,
        SortedSet<String> calls,
        Histogram comprehensions,
        int lambdaCount,
        SortedSet<String> globals,
        SortedSet<String> nonlocals,
        int assertCount,
        int starredCount,
        int sliceCount,
        int decisionPoints,
        int maxLoopDepth,
        int nestedClassCount,
        Map<UsageKind, Histogram> usage,
        int functionalCalls,
        SortedSet<String> classMethods,
        SortedSet<String> classAttributes) {

    private static final NodeFeatures NONE = builder().build();

    public NodeFeatures {
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
        baseTypes = List.copyOf(baseTypes);
        controlFlow = List.copyOf(controlFlow);
        caughtTypes = sorted(caughtTypes);
        calls = sorted(calls);
        globals = sorted(globals);
        nonlocals = sorted(nonlocals);
        classMethods = sorted(classMethods);
        classAttributes = sorted(classAttributes);
        var usageCopy = new EnumMap<UsageKind, Histogram>(UsageKind.class);
        for (var kind : UsageKind.values()) {
            usageCopy.put(kind, usage.getOrDefault(kind, Histogram.empty()));
        }
        usage = Collections.unmodifiableMap(usageCopy);
    }

    /** Features of a node with no declaration or body facts (opaque modules, regex-only properties). */
    public static NodeFeatures none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isGenerator() {
        return yieldCount > 0;
    }

    public boolean hasExceptionHandling() {
        return tryCount > 0 || !caughtTypes.isEmpty();
    }

    public Histogram usage(UsageKind kind) {
        return usage.get(kind);
    }

    /** Lambdas, comprehensions and functional calls such as map/filter/reduce. */
    public int functionalScore() {
        return lambdaCount + comprehensions.total() + functionalCalls;
    }

    /** Cyclomatic complexity: one plus the number of decision points. */
    public int complexity() {
        return decisionPoints + 1;
    }

    public SortedSet<String> defaultedParameterNames() {
        var names = new TreeSet<String>();
        parameters.stream().filter(Parameter::hasDefault).forEach(p -> names.add(p.name()));
        return names;
    }

    public boolean hasTypeAnnotations() {
        return returnType != null || parameters.stream().anyMatch(Parameter::isAnnotated);
    }

    private static SortedSet<String> sorted(Collection<String> values) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    /** Mutable accumulator used while walking a node. */
    public static final class Builder {
        private final List<Parameter> parameters = new ArrayList<>();
        private @Nullable String returnType;
        private final List<String> decorators = new ArrayList<>();
        private boolean async;
        private final List<String> baseTypes = new ArrayList<>();
        private @Nullable String visibility;
        private boolean isStatic;
        private final List<ControlFlowKind> controlFlow = new ArrayList<>();
        private int returnCount;
        private int valueReturnCount;
        private int yieldCount;
        private int awaitCount;
        private int tryCount;
        private int raiseCount;
        private final SortedSet<String> caughtTypes = new TreeSet<>();
        private final SortedSet<String> calls = new TreeSet<>();
        private final Map<String, Integer> comprehensions = new TreeMap<>();
        private int lambdaCount;
        private final SortedSet<String> globals = new TreeSet<>();
        private final SortedSet<String> nonlocals = new TreeSet<>();
        private int assertCount;
        private int starredCount;
        private int sliceCount;
        private int decisionPoints;
        private int maxLoopDepth;
        private int nestedClassCount;
        private final Map<UsageKind, Map<String, Integer>> usage = new EnumMap<>(UsageKind.class);
        private int functionalCalls;
        private final SortedSet<String> classMethods = new TreeSet<>();
        private final SortedSet<String> classAttributes = new TreeSet<>();

        private Builder() {}

        public Builder parameter(Parameter parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder returnType(@Nullable String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder decorator(String decorator) {
            decorators.add(decorator);
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder baseType(String baseType) {
            baseTypes.add(baseType);
            return this;
        }

        public Builder visibility(@Nullable String visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder isStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder controlFlow(ControlFlowKind kind) {
            controlFlow.add(kind);
            return this;
        }

        public Builder returnStatement(boolean withValue) {
            returnCount++;
            if (withValue) {
                valueReturnCount++;
            }
            return this;
        }

        public Builder yieldExpression() {
            yieldCount++;
            return this;
        }

        public Builder awaitExpression() {
            awaitCount++;
            return this;
        }

        public Builder tryStatement() {
            tryCount++;
            return this;
        }

        public Builder raiseStatement() {
            raiseCount++;
            return this;
        }

        public Builder caughtType(String type) {
            caughtTypes.add(type);
            return this;
        }

        public Builder call(String target) {
            calls.add(target);
            return this;
        }

        public Builder comprehension(String kind) {
            comprehensions.merge(kind, 1, Integer::sum);
            return this;
        }

        public Builder lambda() {
            lambdaCount++;
            return this;
        }

        public Builder global(String name) {
            globals.add(name);
            return this;
        }

        public Builder nonlocal(String name) {
            nonlocals.add(name);
            return this;
        }

        public Builder assertion() {
            assertCount++;
            return this;
        }

        public Builder starred() {
            starredCount++;
            return this;
        }

        public Builder slice() {
            sliceCount++;
            return this;
        }

        public Builder decisionPoint() {
            decisionPoints++;
            return this;
        }

        public Builder loopDepth(int depth) {
            maxLoopDepth = Math.max(maxLoopDepth, depth);
            return this;
        }

        public Builder nestedClass() {
            nestedClassCount++;
            return this;
        }

        public Builder usage(UsageKind kind, String key) {
            usage.computeIfAbsent(kind, k -> new TreeMap<>()).merge(key, 1, Integer::sum);
            return this;
        }

        public Builder functionalCall() {
            functionalCalls++;
            return this;
        }

        public Builder classMethod(String name) {
            classMethods.add(name);
            return this;
        }

        public Builder classAttribute(String name) {
            classAttributes.add(name);
            return this;
        }

        public NodeFeatures build() {
            var histograms = new EnumMap<UsageKind, Histogram>(UsageKind.class);
            usage.forEach((kind, counts) -> histograms.put(kind, Histogram.of(counts)));
            return new NodeFeatures(
                    parameters,
                    returnType,
                    decorators,
                    async,
                    baseTypes,
                    visibility,
                    isStatic,
                    controlFlow,
                    returnCount,
                    valueReturnCount,
                    yieldCount,
                    awaitCount,
                    tryCount,
                    raiseCount,
                    caughtTypes,
                    calls,
                    Histogram.of(comprehensions),
                    lambdaCount,
                    globals,
                    nonlocals,
                    assertCount,
                    starredCount,
                    sliceCount,
                    decisionPoints,
                    maxLoopDepth,
                    nestedClassCount,
                    histograms,
                    functionalCalls,
                    classMethods,
                    classAttributes);
        }
    }
}
