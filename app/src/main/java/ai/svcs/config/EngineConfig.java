package ai.svcs.config;

import ai.svcs.semantic.Layer;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable engine settings. Every value is validated on construction so a bad configuration fails before any file
 * is processed. Build instances with {@link ConfigLoader}.
 *
 * @param behaviorTolerance histogram distance at or below which layer 4 stays silent
 * @param complexityThreshold decision-point delta at or below which no complexity event is emitted
 * @param maxErrorRatio fraction of the source that error nodes may cover before the legacy parse is rejected
 * @param gateThreshold minimum complexity score for the interpretive layer to call a provider
 * @param gateMinLines files shorter than this on both sides are never sent to a provider
 */
public record EngineConfig(
        Set<Layer> enabledLayers,
        int behaviorTolerance,
        int complexityThreshold,
        double patternMinConfidence,
        double maxErrorRatio,
        double gateThreshold,
        int gateMinLines,
        List<ProviderSettings> providers,
        Duration aiTimeout,
        int aiMaxRetries,
        Duration aiBackoff,
        int aiCallBudget,
        int aiMaxConcurrentCalls,
        double aiMinConfidence,
        int aiMaxPromptChars,
        int engineThreads) {

    public EngineConfig {
        enabledLayers = enabledLayers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Layer.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledLayers));
        providers = List.copyOf(providers);
        requireNonNegative("svcs.behavior.tolerance", behaviorTolerance);
        requireNonNegative("svcs.complexity.threshold", complexityThreshold);
        requireUnit("svcs.patterns.minConfidence", patternMinConfidence);
        requireUnit("svcs.parse.maxErrorRatio", maxErrorRatio);
        requireUnit("svcs.ai.minConfidence", aiMinConfidence);
        if (Double.isNaN(gateThreshold) || gateThreshold < 0) {
            throw new ConfigException("svcs.gate.threshold must be >= 0, was " + gateThreshold);
        }
        requireNonNegative("svcs.gate.minLines", gateMinLines);
        if (aiTimeout.isNegative() || aiTimeout.isZero()) {
            throw new ConfigException("svcs.ai.timeoutSeconds must be positive, was " + aiTimeout.toSeconds());
        }
        requireNonNegative("svcs.ai.maxRetries", aiMaxRetries);
        if (aiBackoff.isNegative()) {
            throw new ConfigException("svcs.ai.backoffMillis must be >= 0, was " + aiBackoff.toMillis());
        }
        requirePositive("svcs.ai.callBudget", aiCallBudget);
        requirePositive("svcs.ai.maxConcurrentCalls", aiMaxConcurrentCalls);
        requirePositive("svcs.ai.maxPromptChars", aiMaxPromptChars);
        requirePositive("svcs.engine.threads", engineThreads);
        var names = new HashSet<String>();
        for (var p : providers) {
            if (!names.add(p.name())) {
                throw new ConfigException("Duplicate provider " + p.name());
            }
        }
    }

    /** The bundled defaults with no user overrides. */
    public static EngineConfig defaults() {
        return ConfigLoader.defaults();
    }

    public boolean isEnabled(Layer layer) {
        return enabledLayers.contains(layer);
    }

    public EngineConfig withEnabledLayers(Set<Layer> layers) {
        return new EngineConfig(
                layers,
                behaviorTolerance,
                complexityThreshold,
                patternMinConfidence,
                maxErrorRatio,
                gateThreshold,
                gateMinLines,
                providers,
                aiTimeout,
                aiMaxRetries,
                aiBackoff,
                aiCallBudget,
                aiMaxConcurrentCalls,
                aiMinConfidence,
                aiMaxPromptChars,
                engineThreads);
    }

    private static void requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new ConfigException(key + " must be >= 0, was " + value);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigException(key + " must be positive, was " + value);
        }
    }

    private static void requireUnit(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigException(key + " must be within [0, 1], was " + value);
        }
    }
}
