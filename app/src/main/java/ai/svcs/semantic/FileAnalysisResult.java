package ai.svcs.semantic;

import ai.svcs.analyzer.ParseStage;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Events for one file plus how they were obtained.
 *
 * @param partial true when cancellation or an unexpected failure stopped the pipeline before every layer ran
 * @param error message of the unexpected failure, if any
 */
public record FileAnalysisResult(
        String filePath,
        List<SemanticEvent> events,
        @Nullable ParseStage stageBefore,
        @Nullable ParseStage stageAfter,
        List<Layer> completedLayers,
        boolean partial,
        @Nullable String error) {

    public FileAnalysisResult {
        events = List.copyOf(events);
        completedLayers = List.copyOf(completedLayers);
    }

    /** Result for a file whose language is not supported. */
    public static FileAnalysisResult unsupported(String filePath) {
        return new FileAnalysisResult(filePath, List.of(), null, null, List.of(), false, null);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }
}
