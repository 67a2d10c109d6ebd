package ai.svcs.llm;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.SemanticEvent;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Builds the interpretive-layer prompt for one file change. */
public final class PromptBuilder {
    static final String TRUNCATION_MARKER = "\n... [truncated]";
    private static final int MAX_LISTED_EVENTS = 60;

    private final int maxChars;

    public PromptBuilder(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        this.maxChars = maxChars;
    }

    public static String allowedTypes() {
        return Arrays.stream(EventType.values())
                .filter(EventType::isInterpretable)
                .map(EventType::wireName)
                .collect(Collectors.joining(", "));
    }

    public String build(FileDiff diff, List<SemanticEvent> prior) {
        // each version gets half of the budget
        int perSide = Math.max(1, maxChars / 2);
        var detected = prior.stream()
                .limit(MAX_LISTED_EVENTS)
                .map(e -> "- " + e.eventType().wireName() + " " + e.nodeId() + ": " + e.details())
                .collect(Collectors.joining("\n"));
        if (prior.size() > MAX_LISTED_EVENTS) {
            detected += "\n- ... " + (prior.size() - MAX_LISTED_EVENTS) + " more";
        }
        if (detected.isEmpty()) {
            detected = "(none)";
        }

        return """
                You are an expert code reviewer. Identify the high-level semantic changes between two versions of
                the file %s (language: %s).

                <before>
                %s
                </before>

                <after>
                %s
                </after>

                Changes already detected by static analysis (do not repeat them):
                %s

                Report only what static analysis cannot see: intent, algorithm or approach changes, business logic,
                design patterns, error-handling strategy, API shape, security and refactoring.

                Allowed event_type values: %s

                Respond with a JSON array only. Each element:
                {"event_type": "...", "node_id": "func:name or class:Name or module:<path>", "confidence": 0.0-1.0,
                 "description": "what changed", "reasoning": "why you think so", "impact": "consequence"}
                Return [] when nothing significant changed.
                """
                .formatted(
                        diff.path(),
                        diff.after().language().tag(),
                        truncate(diff.before().sourceText(), perSide),
                        truncate(diff.after().sourceText(), perSide),
                        detected,
                        allowedTypes());
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + TRUNCATION_MARKER;
    }
}
