package ai.svcs.cli;

import ai.svcs.analyzer.FileChange;
import ai.svcs.analyzer.SourceLanguage;
import ai.svcs.config.ConfigException;
import ai.svcs.config.ConfigLoader;
import ai.svcs.config.EngineConfig;
import ai.svcs.llm.ProviderFactory;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.CancellationSignal;
import ai.svcs.semantic.EventJson;
import ai.svcs.semantic.SemanticAnalysisEngine;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "svcs-analyze",
        mixinStandardHelpOptions = true,
        version = "svcs-analyze 0.9.0",
        description = "Classifies the semantic changes between two versions of a source file and prints them as JSON.")
public final class SvcsCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(SvcsCli.class);

    @CommandLine.Option(names = "--before", description = "Old version of the file. Omit for a newly added file.")
    @Nullable
    private Path before;

    @CommandLine.Option(names = "--after", description = "New version of the file. Omit for a deleted file.")
    @Nullable
    private Path after;

    @CommandLine.Option(names = "--path", description = "Repository path reported on events. Defaults to --after.")
    @Nullable
    private String path;

    @CommandLine.Option(
            names = "--language",
            description = "Language tag or extension (python, php, javascript, typescript, py, ts, ...). "
                    + "Defaults to the file extension.")
    @Nullable
    private String language;

    @CommandLine.Option(names = "--config", description = "Properties file overriding the bundled defaults.")
    @Nullable
    private Path configFile;

    @CommandLine.Option(
            names = "--layers",
            description = "Comma-separated layers to run, e.g. 1,2,3,4,5a. Overrides svcs.layers.enabled.")
    @Nullable
    private String layers;

    @CommandLine.Option(names = "--timeout", description = "Overall deadline in seconds; 0 for none.")
    private long timeoutSeconds = 0;

    @CommandLine.Option(names = "--pretty", description = "Indent the JSON output.")
    private boolean pretty;

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SvcsCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var err = spec == null ? new PrintWriter(System.err, true) : spec.commandLine().getErr();
        var out = spec == null ? new PrintWriter(System.out, true) : spec.commandLine().getOut();
        if (before == null && after == null) {
            err.println("At least one of --before and --after is required.");
            return 1;
        }

        EngineConfig config;
        try {
            config = ConfigLoader.load(configFile);
            if (layers != null) {
                config = config.withEnabledLayers(ConfigLoader.parseLayers(layers));
            }
        } catch (ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        var reportedPath = path != null ? path : String.valueOf(after != null ? after : before);
        var tag = language != null ? language : extension(reportedPath);
        if (SourceLanguage.fromTag(tag).isEmpty()) {
            logger.info("Unsupported language '{}' for {}; no events", tag, reportedPath);
        }

        FileChange change;
        try {
            change = new FileChange(reportedPath, tag, read(before), read(after));
        } catch (IOException e) {
            err.println("Unable to read input: " + e.getMessage());
            return 1;
        }

        var cancellation = timeoutSeconds > 0
                ? CancellationSignal.withTimeout(Duration.ofSeconds(timeoutSeconds))
                : CancellationSignal.create();
        final AnalysisContext context;
        try {
            context = AnalysisContext.create(config, new ProviderFactory().create(config), cancellation);
        } catch (ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        try (context;
                var engine = new SemanticAnalysisEngine(config)) {
            var result = engine.analyze(List.of(change), context).get(0);
            out.println(EventJson.toJson(result.events(), pretty));
            result.errorMessage().ifPresent(message -> err.println("Analysis incomplete: " + message));
            logger.debug("Run counters: {}", context.counters());
            return 0;
        }
    }

    private static @Nullable String read(@Nullable Path file) throws IOException {
        return file == null ? null : Files.readString(file, StandardCharsets.UTF_8);
    }

    private static String extension(String path) {
        int dot = path.lastIndexOf('.');
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return dot > slash ? path.substring(dot + 1) : "";
    }
}
