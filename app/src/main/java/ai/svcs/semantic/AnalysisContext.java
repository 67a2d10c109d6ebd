package ai.svcs.semantic;

import ai.svcs.config.ConfigException;
import ai.svcs.config.EngineConfig;
import ai.svcs.llm.AiProvider;
import ai.svcs.llm.CallBudget;
import ai.svcs.llm.ProviderChain;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Per-run state passed explicitly through every layer: settings, the provider chain and its shared call budget,
 * the cancellation signal and the run counters. Nothing here is process-wide. Closing the context shuts down the
 * provider chain's call pool.
 */
public record AnalysisContext(
        EngineConfig config,
        @Nullable ProviderChain providers,
        CancellationSignal cancellation,
        RunCounters counters)
        implements AutoCloseable {

    /** A context with no AI provider; layer 5b always skips. */
    public static AnalysisContext create(EngineConfig config) {
        return new AnalysisContext(config, null, CancellationSignal.create(), new RunCounters());
    }

    /** A context whose providers share one call budget sized from {@code config}. */
    public static AnalysisContext create(
            EngineConfig config, List<? extends AiProvider> providers, CancellationSignal cancellation) {
        if (providers.isEmpty()) {
            return new AnalysisContext(config, null, cancellation, new RunCounters());
        }
        var names = new HashSet<String>();
        for (var provider : providers) {
            if (!names.add(provider.name())) {
                throw new ConfigException("Duplicate provider name " + provider.name());
            }
        }
        var chain = new ProviderChain(
                List.copyOf(providers),
                new CallBudget(config.aiCallBudget(), config.aiMaxConcurrentCalls()),
                config.aiTimeout(),
                config.aiMaxRetries(),
                config.aiBackoff());
        return new AnalysisContext(config, chain, cancellation, new RunCounters());
    }

    public Optional<ProviderChain> providerChain() {
        return Optional.ofNullable(providers);
    }

    @Override
    public void close() {
        if (providers != null) {
            providers.close();
        }
    }
}
