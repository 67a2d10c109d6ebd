package ai.svcs.semantic;

import ai.svcs.analyzer.FileChange;
import ai.svcs.analyzer.LanguageAdapter;
import ai.svcs.analyzer.NodeTree;
import ai.svcs.analyzer.ParseStage;
import ai.svcs.analyzer.SourceLanguage;
import ai.svcs.config.ConfigException;
import ai.svcs.config.EngineConfig;
import ai.svcs.llm.InterpretiveLayer;
import ai.svcs.semantic.layers.BehavioralLayer;
import ai.svcs.semantic.layers.SemanticLayer;
import ai.svcs.semantic.layers.StructuralLayer;
import ai.svcs.semantic.layers.SyntacticLayer;
import ai.svcs.semantic.patterns.PatternRecognizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the layered classification pipeline over a batch of file changes. Files are analyzed independently on a
 * bounded pool and returned in input order; one file failing never aborts the batch.
 */
public final class SemanticAnalysisEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SemanticAnalysisEngine.class);

    private final EngineConfig config;
    private final Map<SourceLanguage, LanguageAdapter> adapters = new EnumMap<>(SourceLanguage.class);
    private final List<ClassificationLayer> layers;
    private final ExecutorService executor;

    public SemanticAnalysisEngine(EngineConfig config) {
        this(config, defaultLayers());
    }

    public SemanticAnalysisEngine(EngineConfig config, List<ClassificationLayer> layers) {
        this.config = config;
        this.layers = List.copyOf(layers);
        var seen = new LinkedHashSet<Layer>();
        for (var layer : this.layers) {
            if (!seen.add(layer.layer())) {
                throw new ConfigException("Layer " + layer.layer().label() + " registered twice");
            }
        }
        for (var language : SourceLanguage.values()) {
            adapters.put(language, LanguageAdapter.forLanguage(language, config.maxErrorRatio()));
        }
        this.executor = Executors.newFixedThreadPool(config.engineThreads(), new EngineThreadFactory());
    }

    public static List<ClassificationLayer> defaultLayers() {
        return List.of(
                new StructuralLayer(),
                new SyntacticLayer(),
                new SemanticLayer(),
                new BehavioralLayer(),
                new PatternRecognizer(),
                new InterpretiveLayer());
    }

    public EngineConfig config() {
        return config;
    }

    /** Analyzes every change; results are in input order. */
    public List<FileAnalysisResult> analyze(List<FileChange> changes, AnalysisContext context) {
        checkContext(context);
        var futures = new ArrayList<Future<FileAnalysisResult>>(changes.size());
        for (var change : changes) {
            futures.add(executor.submit(() -> analyzeFile(change, context)));
        }
        var results = new ArrayList<FileAnalysisResult>(changes.size());
        for (int i = 0; i < futures.size(); i++) {
            var change = changes.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellation().cancel();
                results.add(failed(change, "interrupted"));
            } catch (ExecutionException | CancellationException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                logger.error("Analysis of {} failed", change.filePath(), cause);
                context.counters().fileFailed();
                results.add(failed(change, String.valueOf(cause.getMessage())));
            }
        }
        return results;
    }

    /** Analyzes one change on the calling thread. Never throws for bad input. */
    public FileAnalysisResult analyzeFile(FileChange change, AnalysisContext context) {
        checkContext(context);
        var language = SourceLanguage.fromTag(change.languageTag());
        if (language.isEmpty()) {
            logger.debug("Unsupported language '{}' for {}", change.languageTag(), change.filePath());
            return FileAnalysisResult.unsupported(change.filePath());
        }

        var events = new LinkedHashSet<SemanticEvent>();
        var completed = new ArrayList<Layer>();
        ParseStage stageBefore = null;
        ParseStage stageAfter = null;
        try {
            if (context.cancellation().isCancelled()) {
                context.counters().fileCancelled();
                return new FileAnalysisResult(change.filePath(), List.of(), null, null, List.of(), true, null);
            }
            var adapter = adapters.get(language.get());
            var before = parse(adapter, change.filePath(), language.get(), change.sourceBefore(), context);
            var after = parse(adapter, change.filePath(), language.get(), change.sourceAfter(), context);
            stageBefore = before.stage();
            stageAfter = after.stage();
            var diff = FileDiff.of(before, after, change.existsBefore(), change.existsAfter());

            for (var layer : layers) {
                if (!config.isEnabled(layer.layer())) {
                    continue;
                }
                if (context.cancellation().isCancelled()) {
                    context.counters().fileCancelled();
                    logger.debug("Cancelled {} before layer {}", change.filePath(), layer.layer().label());
                    return new FileAnalysisResult(
                            change.filePath(), List.copyOf(events), stageBefore, stageAfter, completed, true, null);
                }
                events.addAll(layer.classify(diff, List.copyOf(events), context));
                completed.add(layer.layer());
            }
            context.counters().fileAnalyzed();
            return new FileAnalysisResult(
                    change.filePath(), List.copyOf(events), stageBefore, stageAfter, completed, false, null);
        } catch (AnalysisCancelledException e) {
            context.counters().fileCancelled();
            logger.debug("{}; keeping layers {}", e.getMessage(), completed);
            return new FileAnalysisResult(
                    change.filePath(), List.copyOf(events), stageBefore, stageAfter, completed, true, null);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure analyzing {}", change.filePath(), e);
            context.counters().fileFailed();
            return new FileAnalysisResult(
                    change.filePath(),
                    List.copyOf(events),
                    stageBefore,
                    stageAfter,
                    completed,
                    true,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private NodeTree parse(
            LanguageAdapter adapter,
            String path,
            SourceLanguage language,
            @Nullable String source,
            AnalysisContext context) {
        if (source == null || source.isBlank()) {
            return NodeTree.absent(path, language);
        }
        var tree = adapter.parse(path, source);
        if (tree.stage() != ParseStage.PRIMARY) {
            context.counters().parseFallback();
            logger.debug("{} parsed at stage {} after {}", path, tree.stage(), tree.failedAttempts());
        }
        if (tree.isOpaque()) {
            context.counters().opaqueParse();
        }
        return tree;
    }

    private void checkContext(AnalysisContext context) {
        if (!context.config().equals(config)) {
            throw new ConfigException("AnalysisContext was created for a different configuration");
        }
    }

    private static FileAnalysisResult failed(FileChange change, String message) {
        return new FileAnalysisResult(change.filePath(), List.of(), null, null, List.of(), true, message);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        logger.debug("Engine closed");
    }

    private static final class EngineThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var thread = new Thread(r, "svcs-engine-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
